package com.peptide_toxicity.exception;

public class PredictorOutputParseException extends PredictorFailureException {

    public PredictorOutputParseException(String message) {
        super(message);
    }

    public PredictorOutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
