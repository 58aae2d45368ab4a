package com.peptide_toxicity.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Header of a batch request. The per-sequence results are the {@link Prediction} rows sharing its {@code batchId}.
 */
@Entity
@Table(name = "batch_predictions")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPrediction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false, unique = true, updatable = false)
    private String batchId;

    @Column(nullable = false, updatable = false)
    private String model;

    @Column(name = "total_sequences", nullable = false, updatable = false)
    private Integer totalSequences;

    @Column(name = "toxic_count", nullable = false, updatable = false)
    private Integer toxicCount;

    @Column(name = "non_toxic_count", nullable = false, updatable = false)
    private Integer nonToxicCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(length = 5000)
    private String metadata;
}
