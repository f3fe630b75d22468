package com.moldstudio.common.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Opaque identifiers of the form {@code <prefix><epochMillis>_<6 base-36 chars>}.
 */
public final class IdGenerator {

    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int SUFFIX_LENGTH = 6;

    private IdGenerator() {
    }

    public static String newId(String prefix) {
        return newId(prefix, System.currentTimeMillis());
    }

    static String newId(String prefix, long epochMillis) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder(prefix).append(epochMillis).append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return id.toString();
    }
}
