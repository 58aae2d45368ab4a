package com.peptide_toxicity.repository;

import com.peptide_toxicity.entity.Prediction;
import com.peptide_toxicity.repository.projection.LabelCount;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PredictionRepository extends JpaRepository<Prediction, Long> {

    List<Prediction> findAllByOrderByIdDesc(Pageable pageable);

    List<Prediction> findBySequenceContainingOrderByCreatedAtDescIdDesc(String fragment, Pageable pageable);

    List<Prediction> findByBatchIdOrderByIdAsc(String batchId);

    @Query("SELECT p.prediction AS label, COUNT(p.id) AS total FROM Prediction p GROUP BY p.prediction")
    List<LabelCount> countGroupedByPrediction();

    @Query("SELECT p.model AS label, COUNT(p.id) AS total FROM Prediction p GROUP BY p.model ORDER BY p.model")
    List<LabelCount> countGroupedByModel();
}
