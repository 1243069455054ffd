package com.di.indexer.ledger;

import com.di.indexer.config.IndexerProperties;
import com.di.indexer.util.Hex;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link LedgerClient} over Ethereum JSON-RPC.
 *
 * <pre>
 *   currentHead        → eth_blockNumber
 *   pollFilter         → eth_newFilter + eth_getFilterLogs + eth_uninstallFilter
 *   queryEvents        → eth_getLogs
 *   resolveAttestation → eth_call getAttestation(bytes32)
 * </pre>
 *
 * <p>{@code getAttestation} returns
 * {@code (bytes32 uid, address attester, address subject, bytes32 schema,
 * uint64 timestamp, uint64 expirationTime, bool revoked, bytes data)}.
 */
@Slf4j
public class JsonRpcLedgerClient implements LedgerClient {

    private static final int GET_ATTESTATION_HEAD_WORDS = 8;

    private final RestClient              restClient;
    private final IndexerProperties.Ledger config;
    private final AtomicLong              requestIds = new AtomicLong();

    public JsonRpcLedgerClient(RestClient restClient, IndexerProperties.Ledger config) {
        this.restClient = restClient;
        this.config     = config;
    }

    @Override
    public long currentHead() {
        return Hex.parseQuantity(call("eth_blockNumber", List.of()).asText());
    }

    @Override
    public List<AttestationEvent> pollFilter(long fromPos, long toPos) {
        String filterId = call("eth_newFilter", List.of(logFilter(fromPos, toPos))).asText();
        try {
            return toEvents(call("eth_getFilterLogs", List.of(filterId)));
        } finally {
            try {
                call("eth_uninstallFilter", List.of(filterId));
            } catch (LedgerException e) {
                // the node expires idle filters on its own
                log.debug("[LEDGER] uninstall of filter {} failed: {}", filterId, e.getMessage());
            }
        }
    }

    @Override
    public List<AttestationEvent> queryEvents(long fromPos, long toPos) {
        return toEvents(call("eth_getLogs", List.of(logFilter(fromPos, toPos))));
    }

    @Override
    public Optional<Attestation> resolveAttestation(String uid) {
        String selector = Hex.strip0x(config.getGetAttestationSelector());
        String data = "0x" + selector + leftPad64(Hex.strip0x(uid));

        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("to", config.getAttestorAddress());
        tx.put("data", data);

        byte[] out = Hex.decode(call("eth_call", List.of(tx, "latest")).asText("0x"));
        if (out.length == 0) {
            return Optional.empty();
        }
        AbiReader abi = new AbiReader(out);
        if (abi.wordCount() < GET_ATTESTATION_HEAD_WORDS) {
            throw new AbiDecodingException("getAttestation returned " + out.length + " bytes");
        }
        if (abi.bytes32OrEmpty(0).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Attestation(
                abi.bytes32(0),
                abi.bytes32(3),
                abi.address(1),
                abi.address(2),
                abi.uint64(4),
                abi.uint64(5),
                abi.bool(6),
                abi.dynamicBytes(7)));
    }

    // ------------------------------------------------------------------
    // JSON-RPC plumbing
    // ------------------------------------------------------------------

    private JsonNode call(String method, List<?> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.put("params", params);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(config.getRpcUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new LedgerException(method + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new LedgerException(method + " returned an empty response");
        }

        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            int    code    = error.path("code").asInt();
            String message = error.path("message").asText("");
            if (isRangeUnavailable(message)) {
                throw new LedgerRangeUnavailableException(method + ": " + message);
            }
            throw new LedgerException(method + " error " + code + ": " + message);
        }
        return response.path("result");
    }

    private Map<String, Object> logFilter(long fromPos, long toPos) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("address", config.getAttestorAddress());
        filter.put("fromBlock", Hex.quantity(fromPos));
        filter.put("toBlock", Hex.quantity(toPos));
        filter.put("topics", List.of(config.getAttestationEventTopic()));
        return filter;
    }

    private List<AttestationEvent> toEvents(JsonNode logs) {
        List<AttestationEvent> events = new ArrayList<>();
        if (logs == null || !logs.isArray()) {
            return events;
        }
        for (JsonNode entry : logs) {
            if (entry.path("removed").asBoolean(false)) {
                continue;
            }
            JsonNode topics = entry.path("topics");
            if (!topics.isArray() || topics.size() < 4) {
                log.warn("[LEDGER] skipping log without indexed uid/attester/subject: tx={}",
                         entry.path("transactionHash").asText());
                continue;
            }
            events.add(new AttestationEvent(
                    topics.get(1).asText().toLowerCase(Locale.ROOT),
                    topicAddress(topics.get(2).asText()),
                    topicAddress(topics.get(3).asText()),
                    Hex.parseQuantity(entry.path("blockNumber").asText()),
                    entry.hasNonNull("logIndex") ? Hex.parseQuantity(entry.get("logIndex").asText()) : 0L));
        }
        return events;
    }

    private static String topicAddress(String topic) {
        String hex = Hex.strip0x(topic);
        return "0x" + hex.substring(Math.max(0, hex.length() - 40)).toLowerCase(Locale.ROOT);
    }

    private static String leftPad64(String hex) {
        if (hex.length() > 64) {
            throw new IllegalArgumentException("uid longer than 32 bytes: " + hex);
        }
        return "0".repeat(64 - hex.length()) + hex;
    }

    static boolean isRangeUnavailable(String message) {
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        return m.contains("header not found")
                || m.contains("block not found")
                || m.contains("unknown block")
                || m.contains("not available");
    }
}
