package com.eventrelay.common.idempotency;

import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class IdempotencyKeys {
    private IdempotencyKeys() {}

    public static final int MAX_LENGTH = 255;

    private static final int DIGEST_HEX_LENGTH = 64;

    public static String validate(String key) {
        if (!StringUtils.hasText(key)) {
            throw new IdempotencyKeyResolveException("Idempotency key is empty");
        }
        return key;
    }

    public static String join(String namespace, String key) {
        return StringUtils.hasText(namespace) ? namespace + ":" + key : key;
    }

    /**
     * Keys over {@link #MAX_LENGTH} keep a readable prefix followed by {@code #} and the
     * SHA-256 of the whole key, so distinct long keys stay distinct.
     */
    public static String compact(String key) {
        if (key.length() <= MAX_LENGTH) {
            return key;
        }
        String prefix = key.substring(0, MAX_LENGTH - DIGEST_HEX_LENGTH - 1);
        return prefix + "#" + sha256(key);
    }

    /**
     * Log-safe form of a key: first and last four characters only.
     */
    public static String mask(String key) {
        if (key == null || key.length() <= 8) {
            return "***";
        }
        return key.substring(0, 4) + "***" + key.substring(key.length() - 4);
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
