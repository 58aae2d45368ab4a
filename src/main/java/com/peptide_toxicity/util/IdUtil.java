package com.peptide_toxicity.util;

import java.util.concurrent.ThreadLocalRandom;

public class IdUtil {

    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private IdUtil() {
    }

    /**
     * Batch ids look like {@code pred_1718000000000_k3j9x0a1b}.
     */
    public static String generateBatchId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(BASE36[random.nextInt(BASE36.length)]);
        }
        return "pred_" + System.currentTimeMillis() + "_" + suffix;
    }
}
