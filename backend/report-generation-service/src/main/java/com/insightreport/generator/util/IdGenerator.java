package com.insightreport.generator.util;

import java.security.SecureRandom;

/**
 * URL-safe random identifiers
 */
public final class IdGenerator {

    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789_-".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    public static final int REPORT_ID_LENGTH = 12;
    public static final int CHART_ID_LENGTH = 10;

    private IdGenerator() {
    }

    public static String randomId(int length) {
        char[] id = new char[length];
        for (int i = 0; i < length; i++) {
            id[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
        }
        return new String(id);
    }

    public static String reportId() {
        return randomId(REPORT_ID_LENGTH);
    }

    public static String chartId() {
        return randomId(CHART_ID_LENGTH);
    }
}
