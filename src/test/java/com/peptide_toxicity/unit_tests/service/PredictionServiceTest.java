package com.peptide_toxicity.unit_tests.service;

import com.peptide_toxicity.dto.prediction.BatchPredictionDTO;
import com.peptide_toxicity.dto.prediction.ModelCatalogDTO;
import com.peptide_toxicity.dto.prediction.ModelInfoDTO;
import com.peptide_toxicity.dto.prediction.PredictorResult;
import com.peptide_toxicity.dto.prediction.ProbabilityDTO;
import com.peptide_toxicity.dto.prediction.SinglePredictionDTO;
import com.peptide_toxicity.dto.request.prediction.BatchPredictRequest;
import com.peptide_toxicity.dto.request.prediction.SinglePredictRequest;
import com.peptide_toxicity.entity.BatchPrediction;
import com.peptide_toxicity.entity.Prediction;
import com.peptide_toxicity.exception.BatchNotFoundException;
import com.peptide_toxicity.exception.InvalidSequenceException;
import com.peptide_toxicity.exception.PredictorFailureException;
import com.peptide_toxicity.exception.PredictorOutputParseException;
import com.peptide_toxicity.exception.StoreWriteException;
import com.peptide_toxicity.predictor.ToxicityPredictor;
import com.peptide_toxicity.service.PredictionService;
import com.peptide_toxicity.service.PredictionStoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PredictionServiceTest {

    @Mock private ToxicityPredictor toxicityPredictor;
    @Mock private PredictionStoreService predictionStoreService;

    @InjectMocks private PredictionService predictionService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private static PredictorResult result(String label, double toxic) {
        return PredictorResult.builder()
                .prediction(label)
                .confidence(Math.max(toxic, 1 - toxic))
                .probability(new ProbabilityDTO(toxic, 1 - toxic))
                .build();
    }

    @Nested
    @DisplayName("Single prediction")
    class Single {

        @Test
        void shouldNormalizeScoreAndStore() {
            PredictorResult toxic = result("Toxic", 0.87);
            when(toxicityPredictor.predict(List.of("ACDEFGHIK"), "ensemble")).thenReturn(List.of(toxic));
            when(predictionStoreService.addPrediction("ACDEFGHIK", "ensemble", toxic)).thenReturn(42L);

            SinglePredictionDTO prediction = predictionService.predictSingle(new SinglePredictRequest("acdefghik", null));

            assertThat(prediction.getId()).isEqualTo(42L);
            assertThat(prediction.getSequence()).isEqualTo("ACDEFGHIK");
            assertThat(prediction.getModel()).isEqualTo("ensemble");
            assertThat(prediction.getResult().getPrediction()).isEqualTo("Toxic");
            assertThat(prediction.getResult().getConfidence()).isEqualTo(0.87);
            assertThat(prediction.getTimestamp()).isNotNull();
        }

        @Test
        void shouldUseRequestedModel() {
            when(toxicityPredictor.predict(anyList(), eq("svm"))).thenReturn(List.of(result("Non-Toxic", 0.2)));
            when(predictionStoreService.addPrediction(anyString(), eq("svm"), any())).thenReturn(1L);

            SinglePredictionDTO prediction = predictionService.predictSingle(new SinglePredictRequest("KLM", "svm"));

            assertThat(prediction.getModel()).isEqualTo("svm");
        }

        @Test
        void shouldRejectInvalidSequenceWithoutCallingPredictor() {
            assertThatThrownBy(() -> predictionService.predictSingle(new SinglePredictRequest("ACDXFGHIK", null)))
                    .isInstanceOf(InvalidSequenceException.class)
                    .hasMessageContaining("ACDXFGHIK");

            verifyNoInteractions(toxicityPredictor, predictionStoreService);
        }

        @Test
        void shouldRejectWhitespaceOnlySequence() {
            assertThatThrownBy(() -> predictionService.predictSingle(new SinglePredictRequest("   ", null)))
                    .isInstanceOf(InvalidSequenceException.class);
        }

        @Test
        void shouldNotStoreWhenPredictorFails() {
            when(toxicityPredictor.predict(anyList(), anyString()))
                    .thenThrow(new PredictorFailureException("Python script failed: boom", "boom"));

            assertThatThrownBy(() -> predictionService.predictSingle(new SinglePredictRequest("ACDEFGHIK", null)))
                    .isInstanceOf(PredictorFailureException.class);

            verify(predictionStoreService, never()).addPrediction(anyString(), anyString(), any());
        }

        @Test
        void shouldCarryComputedResultWhenStoreFails() {
            PredictorResult toxic = result("Toxic", 0.9);
            when(toxicityPredictor.predict(anyList(), anyString())).thenReturn(List.of(toxic));
            when(predictionStoreService.addPrediction(anyString(), anyString(), any()))
                    .thenThrow(new DataAccessResourceFailureException("disk full"));

            assertThatThrownBy(() -> predictionService.predictSingle(new SinglePredictRequest("ACDEFGHIK", null)))
                    .isInstanceOf(StoreWriteException.class)
                    .satisfies(ex -> {
                        Object computed = ((StoreWriteException) ex).getComputedResult();
                        assertThat(computed).isInstanceOf(SinglePredictionDTO.class);
                        assertThat(((SinglePredictionDTO) computed).getResult()).isEqualTo(toxic);
                        assertThat(((SinglePredictionDTO) computed).getId()).isNull();
                    });
        }
    }

    @Nested
    @DisplayName("Batch prediction")
    class Batch {

        @Test
        void shouldScoreAllSequencesInOneCallAndCountLabels() {
            when(toxicityPredictor.predict(List.of("ACD", "KLM", "WYV"), "ensemble"))
                    .thenReturn(List.of(result("Toxic", 0.9), result("Non-Toxic", 0.1), result("Toxic", 0.7)));

            BatchPredictionDTO batch = predictionService.predictBatch(
                    new BatchPredictRequest(List.of("acd", " KLM ", "wyv"), null));

            assertThat(batch.getId()).startsWith("pred_");
            assertThat(batch.getTotal()).isEqualTo(3);
            assertThat(batch.getToxic()).isEqualTo(2);
            assertThat(batch.getNonToxic()).isEqualTo(1);
            assertThat(batch.getPredictions()).extracting("sequence").containsExactly("ACD", "KLM", "WYV");

            ArgumentCaptor<BatchPredictionDTO> stored = ArgumentCaptor.forClass(BatchPredictionDTO.class);
            verify(predictionStoreService).addBatch(stored.capture());
            assertThat(stored.getValue().getId()).isEqualTo(batch.getId());
        }

        @Test
        void shouldRejectWholeBatchAndNameEveryInvalidInput() {
            BatchPredictRequest request = new BatchPredictRequest(List.of("ACDEFGHIK", "ACDXFGHIK", "ZZZ"), null);

            assertThatThrownBy(() -> predictionService.predictBatch(request))
                    .isInstanceOf(InvalidSequenceException.class)
                    .satisfies(ex -> assertThat(((InvalidSequenceException) ex).getInvalidSequences())
                            .containsExactly("ACDXFGHIK", "ZZZ"));

            verifyNoInteractions(toxicityPredictor, predictionStoreService);
        }

        @Test
        void shouldPropagateRejectedPredictorOutputWithoutStoring() {
            when(toxicityPredictor.predict(anyList(), anyString()))
                    .thenThrow(new PredictorOutputParseException("Predictor returned an unknown label: toxic"));

            assertThatThrownBy(() -> predictionService.predictBatch(new BatchPredictRequest(List.of("ACD", "KLM"), "svm")))
                    .isInstanceOf(PredictorOutputParseException.class);

            verify(predictionStoreService, never()).addBatch(any());
        }

        @Test
        void shouldCarryBatchWhenStoreFails() {
            when(toxicityPredictor.predict(anyList(), anyString())).thenReturn(List.of(result("Toxic", 0.9)));
            when(predictionStoreService.addBatch(any()))
                    .thenThrow(new StoreWriteException("Could not store batch", new RuntimeException("locked")));

            assertThatThrownBy(() -> predictionService.predictBatch(new BatchPredictRequest(List.of("ACD"), null)))
                    .isInstanceOf(StoreWriteException.class)
                    .satisfies(ex -> assertThat(((StoreWriteException) ex).getComputedResult())
                            .isInstanceOf(BatchPredictionDTO.class));
        }
    }

    @Nested
    @DisplayName("Lookup and catalog")
    class Lookup {

        @Test
        void shouldListFourModelsWithEnsembleRecommended() {
            ModelCatalogDTO catalog = predictionService.getAvailableModels();

            assertThat(catalog.models()).extracting(ModelInfoDTO::id)
                    .containsExactly("logistic_regression", "random_forest", "svm", "ensemble");
            assertThat(catalog.models()).filteredOn(ModelInfoDTO::recommended)
                    .extracting(ModelInfoDTO::id).containsExactly("ensemble");
        }

        @Test
        void shouldRebuildStoredBatch() {
            LocalDateTime createdAt = LocalDateTime.of(2024, 6, 1, 12, 0);
            when(predictionStoreService.findBatch("pred_1_abc")).thenReturn(Optional.of(BatchPrediction.builder()
                    .batchId("pred_1_abc").model("svm").totalSequences(2).toxicCount(1).nonToxicCount(1)
                    .createdAt(createdAt).build()));
            when(predictionStoreService.findBatchItems("pred_1_abc")).thenReturn(List.of(
                    Prediction.builder().sequence("ACD").model("svm").prediction("Toxic").confidence(0.8)
                            .toxicProbability(0.8).nonToxicProbability(0.2).batchId("pred_1_abc").build(),
                    Prediction.builder().sequence("KLM").model("svm").prediction("Non-Toxic").confidence(0.6)
                            .toxicProbability(0.4).nonToxicProbability(0.6).batchId("pred_1_abc").build()));

            BatchPredictionDTO batch = predictionService.getPredictionById("pred_1_abc");

            assertThat(batch.getModel()).isEqualTo("svm");
            assertThat(batch.getTimestamp()).isEqualTo(createdAt);
            assertThat(batch.getToxic()).isEqualTo(1);
            assertThat(batch.getNonToxic()).isEqualTo(1);
            assertThat(batch.getPredictions().get(1).getResult().getProbability().getNonToxic()).isEqualTo(0.6);
        }

        @Test
        void shouldThrowWhenBatchUnknown() {
            when(predictionStoreService.findBatch("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> predictionService.getPredictionById("nope"))
                    .isInstanceOf(BatchNotFoundException.class)
                    .hasMessage("Prediction not found: nope");
        }
    }
}
