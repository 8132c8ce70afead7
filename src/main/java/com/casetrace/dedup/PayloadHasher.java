package com.casetrace.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short SHA-256 digests of canonical JSON. Map keys are serialized in sorted
 * order at every level, so field order never changes the digest.
 */
public class PayloadHasher {

    static final int HASH_LENGTH = 16;

    private final ObjectMapper canonicalMapper;

    public PayloadHasher() {
        this.canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * @throws JsonProcessingException when the value cannot be serialized
     */
    public String hashJson(Object value) throws JsonProcessingException {
        return hashText(canonicalMapper.writeValueAsString(value));
    }

    public String hashText(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
