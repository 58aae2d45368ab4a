package com.peptide_toxicity.service;

import com.peptide_toxicity.dto.prediction.BatchItemDTO;
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
import com.peptide_toxicity.enumeration.PredictorModelEnum;
import com.peptide_toxicity.enumeration.ToxicityLabelEnum;
import com.peptide_toxicity.exception.BatchNotFoundException;
import com.peptide_toxicity.exception.InvalidSequenceException;
import com.peptide_toxicity.exception.StoreWriteException;
import com.peptide_toxicity.predictor.ToxicityPredictor;
import com.peptide_toxicity.util.IdUtil;
import com.peptide_toxicity.util.SequenceUtil;
import com.peptide_toxicity.util.ValidationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private static final ModelCatalogDTO MODEL_CATALOG = new ModelCatalogDTO(
            Arrays.stream(PredictorModelEnum.values()).map(ModelInfoDTO::from).toList());

    private final ToxicityPredictor toxicityPredictor;
    private final PredictionStoreService predictionStoreService;

    public SinglePredictionDTO predictSingle(SinglePredictRequest request) {
        String sequence = SequenceUtil.normalize(request.getSequence());
        if (!SequenceUtil.isValid(sequence)) {
            throw new InvalidSequenceException(List.of(String.valueOf(request.getSequence())));
        }
        String model = resolveModel(request.getModel());

        log.info("Single prediction requested [model={}, length={}]", model, sequence.length());
        PredictorResult result = toxicityPredictor.predict(List.of(sequence), model).get(0);

        SinglePredictionDTO prediction = SinglePredictionDTO.builder()
                .sequence(sequence)
                .model(model)
                .result(result)
                .timestamp(LocalDateTime.now())
                .build();

        try {
            prediction.setId(predictionStoreService.addPrediction(sequence, model, result));
        } catch (StoreWriteException e) {
            throw e.withComputedResult(prediction);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreWriteException("Could not store prediction", e, prediction);
        }

        log.info("Single prediction stored [id={}, prediction={}]", prediction.getId(), result.getPrediction());
        return prediction;
    }

    public BatchPredictionDTO predictBatch(BatchPredictRequest request) {
        List<String> rawSequences = request.getSequences();
        List<String> sequences = new ArrayList<>(rawSequences.size());
        List<String> invalid = new ArrayList<>();

        for (String raw : rawSequences) {
            String normalized = SequenceUtil.normalize(raw);
            if (!SequenceUtil.isValid(normalized)) {
                invalid.add(String.valueOf(raw));
            }
            sequences.add(normalized);
        }
        if (!invalid.isEmpty()) {
            throw new InvalidSequenceException(invalid);
        }

        String model = resolveModel(request.getModel());
        log.info("Batch prediction requested [model={}, sequences={}]", model, sequences.size());

        List<PredictorResult> results = toxicityPredictor.predict(sequences, model);

        List<BatchItemDTO> items = new ArrayList<>(sequences.size());
        for (int i = 0; i < sequences.size(); i++) {
            items.add(new BatchItemDTO(sequences.get(i), results.get(i)));
        }

        BatchPredictionDTO batch = buildBatch(IdUtil.generateBatchId(), model, items, LocalDateTime.now());

        try {
            predictionStoreService.addBatch(batch);
        } catch (StoreWriteException e) {
            throw e.withComputedResult(batch);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreWriteException("Could not store batch " + batch.getId(), e, batch);
        }

        log.info("Batch prediction stored [batchId={}, toxic={}, nonToxic={}]",
                batch.getId(), batch.getToxic(), batch.getNonToxic());
        return batch;
    }

    public ModelCatalogDTO getAvailableModels() {
        return MODEL_CATALOG;
    }

    public BatchPredictionDTO getPredictionById(String batchId) {
        BatchPrediction header = predictionStoreService.findBatch(batchId)
                .orElseThrow(() -> new BatchNotFoundException(batchId));

        List<BatchItemDTO> items = predictionStoreService.findBatchItems(batchId).stream()
                .map(this::toBatchItem)
                .toList();

        return buildBatch(header.getBatchId(), header.getModel(), items, header.getCreatedAt());
    }

    private BatchPredictionDTO buildBatch(String batchId, String model, List<BatchItemDTO> items, LocalDateTime timestamp) {
        int toxic = (int) items.stream()
                .filter(item -> ToxicityLabelEnum.TOXIC.matches(item.getResult().getPrediction()))
                .count();
        int nonToxic = (int) items.stream()
                .filter(item -> ToxicityLabelEnum.NON_TOXIC.matches(item.getResult().getPrediction()))
                .count();

        return BatchPredictionDTO.builder()
                .id(batchId)
                .model(model)
                .predictions(items)
                .total(items.size())
                .toxic(toxic)
                .nonToxic(nonToxic)
                .timestamp(timestamp)
                .build();
    }

    private BatchItemDTO toBatchItem(Prediction prediction) {
        return new BatchItemDTO(prediction.getSequence(), PredictorResult.builder()
                .prediction(prediction.getPrediction())
                .confidence(prediction.getConfidence())
                .probability(new ProbabilityDTO(prediction.getToxicProbability(), prediction.getNonToxicProbability()))
                .build());
    }

    private String resolveModel(String model) {
        return ValidationUtil.stringExists(model) ? model.trim() : PredictorModelEnum.DEFAULT_MODEL_ID;
    }
}
