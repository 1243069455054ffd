package com.di.indexer.config;

import com.di.indexer.bundle.BundleFetcher;
import com.di.indexer.contentstore.ContentStore;
import com.di.indexer.contentstore.IpfsContentStore;
import com.di.indexer.ledger.JsonRpcLedgerClient;
import com.di.indexer.ledger.LedgerClient;
import com.di.indexer.ledger.decode.AttestationDecoder;
import com.di.indexer.ledger.decode.AttestationDecoderRegistry;
import com.di.indexer.ledger.decode.ScanSubmissionDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the ledger and content-store bindings and the bundle verifier.
 * Every endpoint and limit comes from {@link IndexerProperties}.
 */
@Slf4j
@Configuration
public class IndexerClientConfig {

    @Bean
    public LedgerClient ledgerClient(RestClient.Builder builder, IndexerProperties props) {
        IndexerProperties.Ledger ledger = props.getLedger();
        log.info("[CONFIG] ledger rpc={} attestor={}", ledger.getRpcUrl(), ledger.getAttestorAddress());
        RestClient client = builder.clone()
                .requestFactory(requestFactory(props.getFetch().getTimeout()))
                .build();
        return new JsonRpcLedgerClient(client, ledger);
    }

    @Bean
    public ContentStore contentStore(RestClient.Builder builder, ObjectMapper objectMapper, IndexerProperties props) {
        String apiUrl = props.getContentStore().getApiUrl();
        log.info("[CONFIG] content store api={}", apiUrl);
        RestClient client = builder.clone()
                .baseUrl(apiUrl)
                .requestFactory(requestFactory(props.getFetch().getTimeout()))
                .build();
        return new IpfsContentStore(client, objectMapper);
    }

    @Bean
    public ScanSubmissionDecoder scanSubmissionDecoder(IndexerProperties props) {
        return new ScanSubmissionDecoder(props.getLedger().getScanSubmissionSchemaUid());
    }

    @Bean
    public AttestationDecoderRegistry attestationDecoderRegistry(List<AttestationDecoder<?>> decoders) {
        return new AttestationDecoderRegistry(decoders);
    }

    @Bean
    public BundleFetcher bundleFetcher(ContentStore contentStore, ObjectMapper objectMapper, IndexerProperties props) {
        return new BundleFetcher(contentStore, objectMapper, props.getFetch(), props.getRetry());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        factory.setConnectTimeout(millis);
        factory.setReadTimeout(millis);
        return factory;
    }
}
