package com.peptide_toxicity.dto.history;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class SearchResultDTO {
    private Long id;
    private String sequence;
    private String model;
    private String prediction;
    private Double confidence;
    private LocalDateTime timestamp;
}
