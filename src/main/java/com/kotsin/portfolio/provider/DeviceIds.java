package com.kotsin.portfolio.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * The provider binds tokens to an {@code x-udid} header: 16 hex characters.
 * A seeded id stays stable across restarts so existing tokens keep working.
 */
public final class DeviceIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private DeviceIds() {
    }

    public static String generate(String seed) {
        byte[] bytes = new byte[8];
        if (seed == null || seed.isBlank()) {
            RANDOM.nextBytes(bytes);
        } else {
            try {
                byte[] digest = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
                System.arraycopy(digest, 0, bytes, 0, bytes.length);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 not available", e);
            }
        }
        return HexFormat.of().formatHex(bytes);
    }
}
