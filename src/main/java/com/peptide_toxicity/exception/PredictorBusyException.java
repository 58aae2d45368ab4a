package com.peptide_toxicity.exception;

/**
 * No predictor process slot became free within the configured wait.
 */
public class PredictorBusyException extends RuntimeException {

    public PredictorBusyException(String message) {
        super(message);
    }
}
