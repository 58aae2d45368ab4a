package com.peptide_toxicity.exception;

public class PredictorTimeoutException extends PredictorFailureException {

    public PredictorTimeoutException(String message) {
        super(message);
    }
}
