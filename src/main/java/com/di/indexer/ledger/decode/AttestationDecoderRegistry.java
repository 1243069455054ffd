package com.di.indexer.ledger.decode;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schema-keyed lookup of {@link AttestationDecoder}s.
 *
 * <p>Schema ids are compared case-insensitively. Decoders with a blank
 * schema id (unconfigured) are skipped, so no attestation matches them.
 */
@Slf4j
public class AttestationDecoderRegistry {

    private final Map<String, AttestationDecoder<?>> decoders = new ConcurrentHashMap<>();

    public AttestationDecoderRegistry(List<AttestationDecoder<?>> decoders) {
        for (AttestationDecoder<?> decoder : decoders) {
            register(decoder);
        }
    }

    public void register(AttestationDecoder<?> decoder) {
        String key = normalize(decoder.schemaId());
        if (key.isEmpty()) {
            log.warn("[DECODE] {} has no schema id configured; not registered",
                     decoder.getClass().getSimpleName());
            return;
        }
        AttestationDecoder<?> previous = decoders.put(key, decoder);
        if (previous != null && previous != decoder) {
            log.warn("[DECODE] schema {} decoder replaced: {} -> {}", key,
                     previous.getClass().getSimpleName(), decoder.getClass().getSimpleName());
        }
        log.info("[DECODE] registered {} for schema {}", decoder.getClass().getSimpleName(), key);
    }

    public Optional<AttestationDecoder<?>> find(String schemaId) {
        return Optional.ofNullable(decoders.get(normalize(schemaId)));
    }

    public boolean isRecognized(String schemaId) {
        return decoders.containsKey(normalize(schemaId));
    }

    private static String normalize(String schemaId) {
        return schemaId == null ? "" : schemaId.trim().toLowerCase(Locale.ROOT);
    }
}
