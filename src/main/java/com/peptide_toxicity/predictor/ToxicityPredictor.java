package com.peptide_toxicity.predictor;

import com.peptide_toxicity.dto.analysis.ExtractedFeaturesDTO;
import com.peptide_toxicity.dto.prediction.PredictorResult;

import java.util.List;

/**
 * Capability interface of the machine-learning predictor.
 * Implementations:
 * - PythonProcessPredictor: spawns the Python scripts as child processes
 */
public interface ToxicityPredictor {

    /**
     * Score every sequence with the given model. Returns one result per input, in input order.
     */
    List<PredictorResult> predict(List<String> sequences, String modelName);

    /**
     * Extract the numeric feature vector and physicochemical properties of one sequence.
     */
    ExtractedFeaturesDTO extractFeatures(String sequence);
}
