package com.peptide_toxicity.dto.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractedPropertiesDTO {

    @JsonProperty("molecular_weight")
    private double molecularWeight;

    @JsonProperty("net_charge_pH7")
    private double netChargePh7;

    @JsonProperty("isoelectric_point")
    private double isoelectricPoint;

    private double aromaticity;

    @JsonProperty("instability_index")
    private double instabilityIndex;

    private double gravy;
}
