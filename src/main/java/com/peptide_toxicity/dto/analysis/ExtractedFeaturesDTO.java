package com.peptide_toxicity.dto.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output of the feature extraction script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractedFeaturesDTO {
    private List<Double> features;
    private ExtractedPropertiesDTO properties;

    @JsonProperty("amino_acid_composition")
    private List<Double> aminoAcidComposition;

    private int length;
}
