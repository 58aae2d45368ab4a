package com.peptide_toxicity.controller;

import com.peptide_toxicity.dto.prediction.BatchPredictionDTO;
import com.peptide_toxicity.dto.prediction.ModelCatalogDTO;
import com.peptide_toxicity.dto.prediction.SinglePredictionDTO;
import com.peptide_toxicity.dto.request.prediction.BatchPredictRequest;
import com.peptide_toxicity.dto.request.prediction.SinglePredictRequest;
import com.peptide_toxicity.dto.response.GenericResponse;
import com.peptide_toxicity.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/predictions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Predictions", description = "Predict peptide toxicity")
public class PredictionController {

    private final PredictionService predictionService;

    @PostMapping("/single")
    @Operation(summary = "Predict toxicity for a single peptide sequence")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Prediction completed successfully"),
            @ApiResponse(responseCode = "400", description = "Invalid peptide sequence"),
            @ApiResponse(responseCode = "502", description = "Predictor failed"),
            @ApiResponse(responseCode = "503", description = "Predictor busy")
    })
    public ResponseEntity<GenericResponse<SinglePredictionDTO>> predictSingle(@Valid @RequestBody SinglePredictRequest request) {
        SinglePredictionDTO prediction = predictionService.predictSingle(request);
        return ResponseEntity.ok(GenericResponse.success(prediction));
    }

    @PostMapping("/batch")
    @Operation(summary = "Predict toxicity for multiple peptide sequences",
            description = "The whole batch is rejected if any sequence is invalid.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch prediction completed"),
            @ApiResponse(responseCode = "400", description = "One or more invalid peptide sequences"),
            @ApiResponse(responseCode = "502", description = "Predictor failed")
    })
    public ResponseEntity<GenericResponse<BatchPredictionDTO>> predictBatch(@Valid @RequestBody BatchPredictRequest request) {
        BatchPredictionDTO batch = predictionService.predictBatch(request);
        return ResponseEntity.ok(GenericResponse.success(batch));
    }

    @GetMapping("/models")
    @Operation(summary = "Get available ML models")
    public ResponseEntity<GenericResponse<ModelCatalogDTO>> getModels() {
        return ResponseEntity.ok(GenericResponse.success(predictionService.getAvailableModels()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get batch prediction result by ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch found"),
            @ApiResponse(responseCode = "404", description = "Prediction not found")
    })
    public ResponseEntity<GenericResponse<BatchPredictionDTO>> getPrediction(@PathVariable String id) {
        return ResponseEntity.ok(GenericResponse.success(predictionService.getPredictionById(id)));
    }
}
