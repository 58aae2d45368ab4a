package com.peptide_toxicity.exception;

import lombok.Getter;

/**
 * Persisting a prediction failed. When the predictor had already answered, the computed
 * result travels with the exception so the caller still receives it.
 */
@Getter
public class StoreWriteException extends RuntimeException {

    private final transient Object computedResult;

    public StoreWriteException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public StoreWriteException(String message, Throwable cause, Object computedResult) {
        super(message, cause);
        this.computedResult = computedResult;
    }

    public StoreWriteException withComputedResult(Object result) {
        return new StoreWriteException(getMessage(), getCause(), result);
    }
}
