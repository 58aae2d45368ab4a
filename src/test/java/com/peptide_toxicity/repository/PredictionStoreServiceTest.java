package com.peptide_toxicity.repository;

import com.peptide_toxicity.dto.history.PredictionStatistics;
import com.peptide_toxicity.dto.prediction.BatchItemDTO;
import com.peptide_toxicity.dto.prediction.BatchPredictionDTO;
import com.peptide_toxicity.dto.prediction.PredictorResult;
import com.peptide_toxicity.dto.prediction.ProbabilityDTO;
import com.peptide_toxicity.entity.Prediction;
import com.peptide_toxicity.exception.StoreWriteException;
import com.peptide_toxicity.service.PredictionStoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Runs each store call in its own transaction, the way the web layer calls it.
 */
@DataJpaTest
@Import(PredictionStoreService.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class PredictionStoreServiceTest {

    @Autowired private PredictionStoreService predictionStoreService;
    @Autowired private PredictionRepository predictionRepository;
    @Autowired private BatchPredictionRepository batchPredictionRepository;

    @BeforeEach
    void cleanStore() {
        predictionRepository.deleteAll();
        batchPredictionRepository.deleteAll();
    }

    private static PredictorResult result(String label, double toxic) {
        return PredictorResult.builder()
                .prediction(label)
                .confidence(Math.max(toxic, 1 - toxic))
                .probability(new ProbabilityDTO(toxic, 1 - toxic))
                .build();
    }

    private static BatchPredictionDTO batch(String batchId, List<BatchItemDTO> items) {
        return BatchPredictionDTO.builder()
                .id(batchId)
                .model("ensemble")
                .predictions(items)
                .total(items.size())
                .timestamp(LocalDateTime.now())
                .build();
    }

    @Test
    void addPrediction_AssignsIncreasingIds() {
        Long first = predictionStoreService.addPrediction("ACD", "ensemble", result("Toxic", 0.9));
        Long second = predictionStoreService.addPrediction("KLM", "svm", result("Non-Toxic", 0.2));

        assertThat(second).isGreaterThan(first);
        Prediction stored = predictionRepository.findById(first).orElseThrow();
        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(stored.getNonToxicProbability()).isCloseTo(0.1, within(1e-9));
        assertThat(stored.getBatchId()).isNull();
    }

    @Test
    void getRecentPredictions_NewestFirstAndLimited() {
        predictionStoreService.addPrediction("AAA", "ensemble", result("Toxic", 0.9));
        predictionStoreService.addPrediction("CCC", "ensemble", result("Toxic", 0.9));
        predictionStoreService.addPrediction("DDD", "ensemble", result("Toxic", 0.9));

        List<Prediction> recent = predictionStoreService.getRecentPredictions(2);

        assertThat(recent).extracting(Prediction::getSequence).containsExactly("DDD", "CCC");
    }

    @Test
    void getStatistics_CountsExactLabelsAndModels() {
        PredictionStatistics before = predictionStoreService.getStatistics();

        predictionStoreService.addPrediction("AAA", "ensemble", result("Toxic", 0.9));
        predictionStoreService.addPrediction("CCC", "ensemble", result("Non-Toxic", 0.1));
        predictionStoreService.addPrediction("DDD", "svm", result("Toxic", 0.8));
        predictionStoreService.addPrediction("EEE", "svm", result("toxic", 0.8));

        PredictionStatistics after = predictionStoreService.getStatistics();

        assertThat(after.total() - before.total()).isEqualTo(4);
        assertThat(after.toxicCount() - before.toxicCount()).isEqualTo(2);
        assertThat(after.nonToxicCount() - before.nonToxicCount()).isEqualTo(1);
        assertThat(after.modelUsageCounts()).containsEntry("ensemble", 2L).containsEntry("svm", 2L);
    }

    @Test
    void searchPredictions_MatchesSubstringCaseExactly() {
        predictionStoreService.addPrediction("ACDEFGHIK", "ensemble", result("Toxic", 0.9));
        predictionStoreService.addPrediction("KLMNPQ", "ensemble", result("Non-Toxic", 0.1));

        assertThat(predictionStoreService.searchPredictions("DEF", 50))
                .extracting(Prediction::getSequence).containsExactly("ACDEFGHIK");
        assertThat(predictionStoreService.searchPredictions("def", 50)).isEmpty();
        assertThat(predictionStoreService.searchPredictions("", 50)).hasSize(2);
        assertThat(predictionStoreService.searchPredictions("", 1)).hasSize(1);
    }

    @Test
    void addBatch_StoresHeaderAndItemsInOrder() {
        BatchPredictionDTO dto = batch("pred_1_aaaaaaaaa", List.of(
                new BatchItemDTO("ACD", result("Toxic", 0.9)),
                new BatchItemDTO("KLM", result("Non-Toxic", 0.3))));
        dto.setToxic(1);
        dto.setNonToxic(1);

        List<Long> ids = predictionStoreService.addBatch(dto);

        assertThat(ids).hasSize(2);
        assertThat(predictionStoreService.findBatch("pred_1_aaaaaaaaa")).hasValueSatisfying(header -> {
            assertThat(header.getTotalSequences()).isEqualTo(2);
            assertThat(header.getToxicCount()).isEqualTo(1);
        });
        assertThat(predictionStoreService.findBatchItems("pred_1_aaaaaaaaa"))
                .extracting(Prediction::getSequence).containsExactly("ACD", "KLM");
    }

    @Test
    void addBatch_FailingItemLeavesNothingBehind() {
        PredictorResult broken = PredictorResult.builder()
                .prediction(null)
                .confidence(0.5)
                .probability(new ProbabilityDTO(0.5, 0.5))
                .build();
        BatchPredictionDTO dto = batch("pred_2_bbbbbbbbb", List.of(
                new BatchItemDTO("ACD", result("Toxic", 0.9)),
                new BatchItemDTO("KLM", broken)));

        long before = predictionRepository.count();

        assertThatThrownBy(() -> predictionStoreService.addBatch(dto))
                .isInstanceOf(StoreWriteException.class);

        assertThat(predictionRepository.count()).isEqualTo(before);
        assertThat(predictionStoreService.findBatch("pred_2_bbbbbbbbb")).isEmpty();
    }

    @Test
    void addBatch_DuplicateIdIsRejected() {
        predictionStoreService.addBatch(batch("pred_3_ccccccccc", List.of(new BatchItemDTO("ACD", result("Toxic", 0.9)))));

        assertThatThrownBy(() -> predictionStoreService.addBatch(
                batch("pred_3_ccccccccc", List.of(new BatchItemDTO("KLM", result("Toxic", 0.9))))))
                .isInstanceOf(StoreWriteException.class);

        assertThat(predictionStoreService.findBatchItems("pred_3_ccccccccc"))
                .extracting(Prediction::getSequence).containsExactly("ACD");
    }
}
