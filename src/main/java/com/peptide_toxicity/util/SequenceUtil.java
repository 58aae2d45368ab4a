package com.peptide_toxicity.util;

import java.util.Locale;
import java.util.regex.Pattern;

public class SequenceUtil {

    public static final String AMINO_ACIDS = "ACDEFGHIKLMNPQRSTVWY";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SequenceUtil() {
    }

    /**
     * Trims, upper-cases and strips every whitespace character. {@code null} becomes the empty string.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw.trim().toUpperCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * True when the sequence is non-empty and made only of the 20 standard amino-acid letters.
     * Expects an already normalized sequence.
     */
    public static boolean isValid(String sequence) {
        if (sequence == null || sequence.isEmpty()) {
            return false;
        }
        for (int i = 0; i < sequence.length(); i++) {
            if (AMINO_ACIDS.indexOf(sequence.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
