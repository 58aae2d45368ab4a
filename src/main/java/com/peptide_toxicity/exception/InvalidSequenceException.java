package com.peptide_toxicity.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when one or more submitted sequences contain characters outside the standard amino-acid alphabet.
 */
@Getter
public class InvalidSequenceException extends RuntimeException {

    private final List<String> invalidSequences;

    public InvalidSequenceException(List<String> invalidSequences) {
        super(buildMessage(invalidSequences));
        this.invalidSequences = List.copyOf(invalidSequences);
    }

    private static String buildMessage(List<String> invalidSequences) {
        if (invalidSequences.size() == 1) {
            return "Invalid peptide sequence: " + invalidSequences.get(0)
                    + ". Only standard amino acids are allowed.";
        }
        return "Invalid sequences found: " + String.join(", ", invalidSequences);
    }
}
