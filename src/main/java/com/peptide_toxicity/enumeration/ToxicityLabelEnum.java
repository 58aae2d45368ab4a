package com.peptide_toxicity.enumeration;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ToxicityLabelEnum {
    TOXIC("Toxic"),
    NON_TOXIC("Non-Toxic");

    private final String label;

    /**
     * Exact, case-sensitive comparison against the label emitted by the predictor.
     */
    public boolean matches(String prediction) {
        return label.equals(prediction);
    }

    public static boolean isKnown(String prediction) {
        for (ToxicityLabelEnum value : values()) {
            if (value.matches(prediction)) {
                return true;
            }
        }
        return false;
    }
}
