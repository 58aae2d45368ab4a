package com.peptide_toxicity.exception;

import lombok.Getter;

/**
 * The external predictor process could not produce a result.
 */
@Getter
public class PredictorFailureException extends RuntimeException {

    // stderr of the failed process, empty when not available
    private final String diagnostics;

    public PredictorFailureException(String message) {
        this(message, "", null);
    }

    public PredictorFailureException(String message, String diagnostics) {
        this(message, diagnostics, null);
    }

    public PredictorFailureException(String message, Throwable cause) {
        this(message, "", cause);
    }

    public PredictorFailureException(String message, String diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }
}
