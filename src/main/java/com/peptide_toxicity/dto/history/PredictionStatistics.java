package com.peptide_toxicity.dto.history;

import java.util.Map;

/**
 * Aggregates read from the prediction store.
 */
public record PredictionStatistics(
        long total,
        long toxicCount,
        long nonToxicCount,
        Map<String, Long> modelUsageCounts
) {}
