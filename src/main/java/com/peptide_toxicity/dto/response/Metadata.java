package com.peptide_toxicity.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-response tracing data. A fresh instance is stamped with the current instant and a random transaction id.
 */
@Getter
@AllArgsConstructor
public class Metadata {

    private final Instant timestamp;
    private final String transactionId;

    public Metadata() {
        this(Instant.now(), UUID.randomUUID().toString());
    }
}
