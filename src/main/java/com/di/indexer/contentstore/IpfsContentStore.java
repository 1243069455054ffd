package com.di.indexer.contentstore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * {@link ContentStore} backed by the Kubo (go-ipfs) HTTP RPC API.
 *
 * <pre>
 *   stat    → POST /api/v0/object/stat?arg=
 *   fetch   → POST /api/v0/cat?arg=&amp;length=
 *   pin     → POST /api/v0/pin/add?arg=
 *   version → POST /api/v0/version
 * </pre>
 *
 * <p>Reads are capped at {@code maxBytes}: {@code length} is sent as
 * {@code maxBytes + 1} and the body is consumed only up to that bound, so an
 * oversized object is detected without buffering it.
 */
@Slf4j
public class IpfsContentStore implements ContentStore {

    private static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 429, 502, 503, 504);
    private static final int          BUFFER = 8192;
    private static final long         UNBOUNDED = Long.MAX_VALUE - 1;

    private final RestClient   restClient;
    private final ObjectMapper om;

    public IpfsContentStore(RestClient restClient, ObjectMapper om) {
        this.restClient = restClient;
        this.om         = om;
    }

    @Override
    public ContentStat stat(String address) {
        byte[] body = post("object/stat", address, UNBOUNDED, "/api/v0/object/stat?arg={arg}", address);
        JsonNode node;
        try {
            node = om.readTree(body);
        } catch (IOException e) {
            throw new ContentStoreException("object/stat " + address + " returned invalid JSON", e, false);
        }
        return new ContentStat(
                node.path("Hash").asText(address),
                node.path("NumLinks").asInt(0),
                node.path("CumulativeSize").asLong(0));
    }

    @Override
    public byte[] fetch(String address, long maxBytes) {
        return post("cat", address, maxBytes, "/api/v0/cat?arg={arg}&length={length}", address, maxBytes + 1);
    }

    @Override
    public void pin(String address) {
        post("pin/add", address, UNBOUNDED, "/api/v0/pin/add?arg={arg}", address);
        log.info("[CONTENT] pinned {}", address);
    }

    @Override
    public String version() {
        byte[] body = post("version", "", UNBOUNDED, "/api/v0/version");
        try {
            return om.readTree(body).path("Version").asText("");
        } catch (IOException e) {
            throw new ContentStoreException("version returned invalid JSON", e, false);
        }
    }

    // ------------------------------------------------------------------
    // Transport
    // ------------------------------------------------------------------

    private byte[] post(String op, String address, long maxBytes, String uriTemplate, Object... uriVariables) {
        try {
            return restClient.post()
                    .uri(uriTemplate, uriVariables)
                    .exchange((request, response) -> {
                        checkStatus(op, address, response.getStatusCode(), response.getBody());
                        return readBounded(response.getBody(), address, maxBytes);
                    });
        } catch (ResourceAccessException e) {
            throw new ContentStoreException(op + " " + address + " unreachable: " + e.getMessage(), e, true);
        } catch (RestClientException e) {
            throw new ContentStoreException(op + " " + address + " failed: " + e.getMessage(), e, true);
        }
    }

    private static void checkStatus(String op, String address, HttpStatusCode status, InputStream body)
            throws IOException {
        if (status.is2xxSuccessful()) {
            return;
        }
        String message = new String(body.readNBytes(2048), StandardCharsets.UTF_8);
        boolean retryable = RETRYABLE_STATUS.contains(status.value());
        throw new ContentStoreException(op + " " + address + " returned HTTP " + status.value()
                                        + ": " + message.trim(), retryable);
    }

    static byte[] readBounded(InputStream in, String address, long maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[BUFFER];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            total += n;
            if (total > maxBytes) {
                throw new ContentTooLargeException(address, maxBytes);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }
}
