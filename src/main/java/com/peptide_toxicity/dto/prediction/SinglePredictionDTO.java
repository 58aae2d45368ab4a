package com.peptide_toxicity.dto.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SinglePredictionDTO {
    private Long id;
    private String sequence;
    private String model;
    private PredictorResult result;
    private LocalDateTime timestamp;
}
