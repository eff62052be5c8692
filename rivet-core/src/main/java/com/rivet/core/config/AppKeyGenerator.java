package com.rivet.core.config;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates application keys: 32 random bytes, Base64 encoded, prefixed {@code base64:}.
 */
public class AppKeyGenerator {

    public static final String PREFIX = "base64:";
    private static final int KEY_BYTES = 32;

    private final SecureRandom random;

    public AppKeyGenerator() {
        this(new SecureRandom());
    }

    public AppKeyGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate() {
        byte[] bytes = new byte[KEY_BYTES];
        random.nextBytes(bytes);
        return PREFIX + Base64.getEncoder().encodeToString(bytes);
    }
}
