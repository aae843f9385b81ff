package com.nayem.tessera.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.BatchCodec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over the canonical JSON of a batch, ignoring the idempotency key.
 */
public class PayloadFingerprinter {

    private final ObjectMapper canonicalMapper;

    public PayloadFingerprinter() {
        this(BatchCodec.canonicalMapper());
    }

    public PayloadFingerprinter(ObjectMapper canonicalMapper) {
        this.canonicalMapper = canonicalMapper;
    }

    public String fingerprint(Batch batch) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsBytes(batch.normalizedForFingerprint());
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize batch for fingerprinting", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Same as {@link #fingerprint} but returns the canonical form, for logs and
     * tests.
     */
    String canonicalJson(Batch batch) {
        try {
            return new String(canonicalMapper.writeValueAsBytes(batch.normalizedForFingerprint()),
                    StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize batch for fingerprinting", e);
        }
    }
}
