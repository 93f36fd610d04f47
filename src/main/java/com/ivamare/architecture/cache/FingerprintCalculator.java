package com.ivamare.architecture.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.architecture.exception.SerializationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives fingerprints from (request type, canonicalized payload).
 *
 * <p>The payload is encoded as JSON with properties and map entries sorted by
 * key, so equal payloads give equal fingerprints regardless of declaration or
 * insertion order.
 */
public class FingerprintCalculator {

    private final ObjectMapper canonicalMapper;

    @SuppressWarnings("deprecation")
    public FingerprintCalculator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * @param request The request payload
     * @return its fingerprint
     * @throws SerializationException if the payload cannot be encoded
     */
    public Fingerprint fingerprint(Object request) {
        return new Fingerprint(request.getClass().getName(), sha256(canonicalize(request)));
    }

    /**
     * @param request The request payload
     * @return canonical JSON form
     */
    public String canonicalize(Object request) {
        try {
            return canonicalMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to canonicalize " + request.getClass().getSimpleName(), e);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
