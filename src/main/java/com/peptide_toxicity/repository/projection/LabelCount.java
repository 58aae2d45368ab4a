package com.peptide_toxicity.repository.projection;

/**
 * Row of a {@code GROUP BY} count query.
 */
public interface LabelCount {
    String getLabel();

    Long getTotal();
}
