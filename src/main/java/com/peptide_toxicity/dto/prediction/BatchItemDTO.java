package com.peptide_toxicity.dto.prediction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchItemDTO {
    private String sequence;
    private PredictorResult result;
}
