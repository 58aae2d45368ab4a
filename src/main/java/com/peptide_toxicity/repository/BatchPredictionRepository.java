package com.peptide_toxicity.repository;

import com.peptide_toxicity.entity.BatchPrediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BatchPredictionRepository extends JpaRepository<BatchPrediction, Long> {
    Optional<BatchPrediction> findByBatchId(String batchId);
}
