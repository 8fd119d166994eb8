package com.RetailCore.pos_backend.util;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Short human-readable receipt numbers such as {@code TRX-7K3MQ9ZD}.
 */
public final class PublicIdGenerator {

    // 0, O, 1, I and L are left out so ids can be read back over the phone
    private static final String ALPHABET = "23456789ABCDEFGHJKMNPQRSTUVWXYZ";
    private static final int MAX_ATTEMPTS = 50;
    private static final SecureRandom RANDOM = new SecureRandom();

    private PublicIdGenerator() {
        // Utility class, no instantiation
    }

    public static String generate(String prefix, int size) {
        StringBuilder sb = new StringBuilder(prefix);
        for (int i = 0; i < size; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static String generateUnique(String prefix, int size, Predicate<String> exists) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = generate(prefix, size);
            if (!exists.test(candidate)) {
                return candidate;
            }
        }
        return prefix + Long.toString(System.currentTimeMillis(), 36).toUpperCase();
    }
}
