package com.peptide_toxicity.controller;

import com.peptide_toxicity.dto.history.HistoryDTO;
import com.peptide_toxicity.dto.history.SearchResultsDTO;
import com.peptide_toxicity.dto.history.StatisticsDTO;
import com.peptide_toxicity.dto.response.GenericResponse;
import com.peptide_toxicity.service.HistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
@Tag(name = "History", description = "Browse stored predictions")
public class HistoryController {

    private static final int MAX_LIMIT = 1000;

    private final HistoryService historyService;

    @GetMapping
    @Operation(summary = "Get prediction history")
    public ResponseEntity<GenericResponse<HistoryDTO>> getHistory(
            @RequestParam(defaultValue = "" + HistoryService.DEFAULT_HISTORY_LIMIT) @Min(1) @Max(MAX_LIMIT) int limit) {
        return ResponseEntity.ok(GenericResponse.success(historyService.getHistory(limit)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get statistics from prediction history")
    public ResponseEntity<GenericResponse<StatisticsDTO>> getStats() {
        return ResponseEntity.ok(GenericResponse.success(historyService.getStatistics()));
    }

    @GetMapping("/search")
    @Operation(summary = "Search prediction history")
    public ResponseEntity<GenericResponse<SearchResultsDTO>> search(
            @RequestParam(name = "q", defaultValue = "") String query,
            @RequestParam(defaultValue = "" + HistoryService.DEFAULT_SEARCH_LIMIT) @Min(1) @Max(MAX_LIMIT) int limit) {
        return ResponseEntity.ok(GenericResponse.success(historyService.search(query, limit)));
    }
}
