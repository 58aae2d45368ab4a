package com.peptide_toxicity.dto.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProbabilityDTO {
    private Double toxic;

    @JsonProperty("non_toxic")
    private Double nonToxic;
}
