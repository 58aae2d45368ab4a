package com.peptide_toxicity.service;

import com.peptide_toxicity.dto.history.HistoryDTO;
import com.peptide_toxicity.dto.history.HistoryEntryDTO;
import com.peptide_toxicity.dto.history.PredictionStatistics;
import com.peptide_toxicity.dto.history.SearchResultDTO;
import com.peptide_toxicity.dto.history.SearchResultsDTO;
import com.peptide_toxicity.dto.history.StatisticsDTO;
import com.peptide_toxicity.dto.prediction.PredictorResult;
import com.peptide_toxicity.dto.prediction.ProbabilityDTO;
import com.peptide_toxicity.entity.Prediction;
import com.peptide_toxicity.util.SequenceUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryService {

    public static final int DEFAULT_HISTORY_LIMIT = 20;
    public static final int DEFAULT_SEARCH_LIMIT = 50;

    private final PredictionStoreService predictionStoreService;
    private final ModelMapper modelMapper;

    public HistoryDTO getHistory(int limit) {
        List<HistoryEntryDTO> entries = predictionStoreService.getRecentPredictions(limit).stream()
                .map(this::toHistoryEntry)
                .toList();
        return new HistoryDTO(entries, entries.size());
    }

    public StatisticsDTO getStatistics() {
        PredictionStatistics stats = predictionStoreService.getStatistics();
        return StatisticsDTO.builder()
                .totalPredictions(stats.total())
                .toxicPredictions(stats.toxicCount())
                .nonToxicPredictions(stats.nonToxicCount())
                .modelsUsed(stats.modelUsageCounts())
                .build();
    }

    /**
     * Substring search over stored sequences. The query is normalized like a submitted sequence,
     * so {@code "acd e"} finds {@code ACDE...}.
     */
    public SearchResultsDTO search(String query, int limit) {
        String fragment = SequenceUtil.normalize(query);
        log.debug("Searching history [fragment={}, limit={}]", fragment, limit);

        List<SearchResultDTO> results = predictionStoreService.searchPredictions(fragment, limit).stream()
                .map(prediction -> modelMapper.map(prediction, SearchResultDTO.class))
                .toList();
        return new SearchResultsDTO(results, results.size());
    }

    private HistoryEntryDTO toHistoryEntry(Prediction prediction) {
        return HistoryEntryDTO.builder()
                .id(prediction.getId())
                .sequence(prediction.getSequence())
                .model(prediction.getModel())
                .result(PredictorResult.builder()
                        .prediction(prediction.getPrediction())
                        .confidence(prediction.getConfidence())
                        .probability(new ProbabilityDTO(prediction.getToxicProbability(), prediction.getNonToxicProbability()))
                        .build())
                .timestamp(prediction.getCreatedAt())
                .build();
    }
}
