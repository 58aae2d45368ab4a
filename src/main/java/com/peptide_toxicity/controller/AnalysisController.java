package com.peptide_toxicity.controller;

import com.peptide_toxicity.dto.analysis.ExtractedFeaturesDTO;
import com.peptide_toxicity.dto.analysis.FeatureAnalysisDTO;
import com.peptide_toxicity.dto.analysis.PhysicochemicalPropertiesDTO;
import com.peptide_toxicity.dto.request.analysis.AnalyzeSequenceRequest;
import com.peptide_toxicity.dto.response.GenericResponse;
import com.peptide_toxicity.service.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Tag(name = "Analysis", description = "Sequence features and physicochemical properties")
public class AnalysisController {

    private final AnalysisService analysisService;

    @PostMapping("/features")
    @Operation(summary = "Extract and analyze features from a peptide sequence")
    public ResponseEntity<GenericResponse<FeatureAnalysisDTO>> analyzeFeatures(@Valid @RequestBody AnalyzeSequenceRequest request) {
        return ResponseEntity.ok(GenericResponse.success(analysisService.analyzeFeatures(request.getSequence())));
    }

    @PostMapping("/physicochemical")
    @Operation(summary = "Calculate physicochemical properties")
    public ResponseEntity<GenericResponse<PhysicochemicalPropertiesDTO>> analyzeProperties(@Valid @RequestBody AnalyzeSequenceRequest request) {
        return ResponseEntity.ok(GenericResponse.success(analysisService.analyzePhysicochemical(request.getSequence())));
    }

    @PostMapping("/features/extracted")
    @Operation(summary = "Run the external feature extractor on a peptide sequence")
    public ResponseEntity<GenericResponse<ExtractedFeaturesDTO>> extractFeatures(@Valid @RequestBody AnalyzeSequenceRequest request) {
        return ResponseEntity.ok(GenericResponse.success(analysisService.extractFeatures(request.getSequence())));
    }
}
