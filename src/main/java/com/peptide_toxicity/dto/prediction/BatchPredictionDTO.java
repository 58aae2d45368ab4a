package com.peptide_toxicity.dto.prediction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPredictionDTO {
    private String id;
    private String model;
    private List<BatchItemDTO> predictions;
    private int total;
    private int toxic;
    private int nonToxic;
    private LocalDateTime timestamp;
}
