package com.peptide_toxicity.dto.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureAnalysisDTO {
    private String sequence;
    private int length;
    private Map<String, Double> aminoAcidComposition;
    private PhysicochemicalPropertiesDTO physicochemicalProperties;
}
