package fr.lapetina.rpcpool.domain.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Content fingerprint used to compare responses from different endpoints.
 *
 * The value is serialized with object keys sorted at every level, then hashed with
 * 64-bit FNV-1a. Not a cryptographic hash: it only needs to tell unequal responses apart.
 */
public final class ResponseFingerprint {

    private static final Logger log = LoggerFactory.getLogger(ResponseFingerprint.class);

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ResponseFingerprint() {
        // Utility class
    }

    /**
     * Computes the fingerprint of a JSON value. A null value is fingerprinted as JSON {@code null}.
     */
    public static String of(JsonNode value) {
        return Long.toHexString(fnv1a64(canonicalize(value).getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Serializes the value with object keys in natural order.
     */
    static String canonicalize(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "null";
        }
        try {
            // Trees keep insertion order, plain maps honour ORDER_MAP_ENTRIES_BY_KEYS
            Object plain = CANONICAL_MAPPER.treeToValue(value, Object.class);
            return CANONICAL_MAPPER.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            log.warn("Failed to canonicalize response, using raw form: error={}", e.getOriginalMessage());
            return value.toString();
        }
    }

    static long fnv1a64(byte[] bytes) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : bytes) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
