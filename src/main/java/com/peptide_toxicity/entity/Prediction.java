package com.peptide_toxicity.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * One scored sequence. Rows are written once and never updated or deleted.
 */
@Entity
@Table(name = "predictions", indexes = {
        @Index(name = "idx_predictions_batch_id", columnList = "batch_id"),
        @Index(name = "idx_predictions_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Prediction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 5000)
    private String sequence;

    @Column(nullable = false, updatable = false)
    private String model;

    @Column(nullable = false, updatable = false)
    private String prediction;

    @Column(nullable = false, updatable = false)
    private Double confidence;

    @Column(name = "toxic_probability", nullable = false, updatable = false)
    private Double toxicProbability;

    @Column(name = "non_toxic_probability", nullable = false, updatable = false)
    private Double nonToxicProbability;

    // null for single predictions
    @Column(name = "batch_id", updatable = false)
    private String batchId;

    @Column(length = 5000)
    private String metadata;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
