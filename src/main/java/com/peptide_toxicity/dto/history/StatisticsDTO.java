package com.peptide_toxicity.dto.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticsDTO {
    private long totalPredictions;
    private long toxicPredictions;
    private long nonToxicPredictions;
    private Map<String, Long> modelsUsed;
}
