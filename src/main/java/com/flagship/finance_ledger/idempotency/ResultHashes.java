package com.flagship.finance_ledger.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Fingerprints operation results for {@code markKeyUsed}.
 *
 * The hash is the first 16 hex characters of the SHA-256 of the result's JSON form,
 * so equal results always produce equal hashes. A null result hashes to "null".
 */
@Component
public class ResultHashes {

    private static final int HASH_LENGTH = 16;

    private final ObjectMapper objectMapper;

    public ResultHashes(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String compute(Object result) {
        if (result == null) {
            return "null";
        }
        try {
            byte[] json = objectMapper.writeValueAsBytes(result);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Result cannot be serialized for hashing: " + result.getClass().getName(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
