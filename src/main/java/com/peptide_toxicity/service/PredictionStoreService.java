package com.peptide_toxicity.service;

import com.peptide_toxicity.dto.history.PredictionStatistics;
import com.peptide_toxicity.dto.prediction.BatchPredictionDTO;
import com.peptide_toxicity.dto.prediction.PredictorResult;
import com.peptide_toxicity.entity.BatchPrediction;
import com.peptide_toxicity.entity.Prediction;
import com.peptide_toxicity.enumeration.ToxicityLabelEnum;
import com.peptide_toxicity.exception.StoreWriteException;
import com.peptide_toxicity.repository.BatchPredictionRepository;
import com.peptide_toxicity.repository.PredictionRepository;
import com.peptide_toxicity.repository.projection.LabelCount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only store of predictions. Nothing here updates or deletes a row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionStoreService {

    private final PredictionRepository predictionRepository;
    private final BatchPredictionRepository batchPredictionRepository;

    /**
     * Inserts one prediction and returns the id assigned by the store.
     */
    @Transactional
    public Long addPrediction(String sequence, String model, PredictorResult result) {
        try {
            Prediction saved = predictionRepository.saveAndFlush(toEntity(sequence, model, result, null));
            log.debug("Stored prediction [id={}, model={}]", saved.getId(), model);
            return saved.getId();
        } catch (DataAccessException e) {
            throw new StoreWriteException("Could not store prediction", e);
        }
    }

    /**
     * Writes the batch header and every item in one transaction: either the whole batch is stored or none of it.
     *
     * @return ids of the item rows, in input order
     */
    @Transactional
    public List<Long> addBatch(BatchPredictionDTO batch) {
        try {
            batchPredictionRepository.save(BatchPrediction.builder()
                    .batchId(batch.getId())
                    .model(batch.getModel())
                    .totalSequences(batch.getTotal())
                    .toxicCount(batch.getToxic())
                    .nonToxicCount(batch.getNonToxic())
                    .createdAt(batch.getTimestamp())
                    .build());

            List<Prediction> items = batch.getPredictions().stream()
                    .map(item -> toEntity(item.getSequence(), batch.getModel(), item.getResult(), batch.getId()))
                    .toList();

            List<Long> ids = predictionRepository.saveAllAndFlush(items).stream()
                    .map(Prediction::getId)
                    .toList();
            log.debug("Stored batch [batchId={}, items={}]", batch.getId(), ids.size());
            return ids;
        } catch (DataAccessException e) {
            throw new StoreWriteException("Could not store batch " + batch.getId(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<Prediction> getRecentPredictions(int limit) {
        return predictionRepository.findAllByOrderByIdDesc(PageRequest.of(0, limit));
    }

    /**
     * Three aggregate reads run inside one read-only transaction. On SQLite a read transaction sees a single
     * snapshot, so the numbers agree with each other; other engines may show small drift under concurrent writes.
     */
    @Transactional(readOnly = true)
    public PredictionStatistics getStatistics() {
        long total = predictionRepository.count();

        long toxic = 0;
        long nonToxic = 0;
        for (LabelCount row : predictionRepository.countGroupedByPrediction()) {
            if (ToxicityLabelEnum.TOXIC.matches(row.getLabel())) {
                toxic = row.getTotal();
            } else if (ToxicityLabelEnum.NON_TOXIC.matches(row.getLabel())) {
                nonToxic = row.getTotal();
            }
        }

        Map<String, Long> modelUsage = new LinkedHashMap<>();
        for (LabelCount row : predictionRepository.countGroupedByModel()) {
            modelUsage.put(row.getLabel(), row.getTotal());
        }

        return new PredictionStatistics(total, toxic, nonToxic, modelUsage);
    }

    @Transactional(readOnly = true)
    public List<Prediction> searchPredictions(String fragment, int limit) {
        return predictionRepository.findBySequenceContainingOrderByCreatedAtDescIdDesc(fragment, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Optional<BatchPrediction> findBatch(String batchId) {
        return batchPredictionRepository.findByBatchId(batchId);
    }

    @Transactional(readOnly = true)
    public List<Prediction> findBatchItems(String batchId) {
        return predictionRepository.findByBatchIdOrderByIdAsc(batchId);
    }

    private Prediction toEntity(String sequence, String model, PredictorResult result, String batchId) {
        return Prediction.builder()
                .sequence(sequence)
                .model(model)
                .prediction(result.getPrediction())
                .confidence(result.getConfidence())
                .toxicProbability(result.getProbability().getToxic())
                .nonToxicProbability(result.getProbability().getNonToxic())
                .batchId(batchId)
                .build();
    }
}
