package com.peptide_toxicity.exception;

public class BatchNotFoundException extends RuntimeException {

    public BatchNotFoundException(String batchId) {
        super("Prediction not found: " + batchId);
    }
}
