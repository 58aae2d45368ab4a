package com.peptide_toxicity.enumeration;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Predictor variants the external script knows how to run.
 */
@Getter
@RequiredArgsConstructor
public enum PredictorModelEnum {
    LOGISTIC_REGRESSION("logistic_regression", "Logistic Regression",
            "Fast linear classifier, good for interpretability", "linear", false),
    RANDOM_FOREST("random_forest", "Random Forest",
            "Ensemble of decision trees, handles non-linear patterns", "ensemble", false),
    SVM("svm", "Support Vector Machine",
            "Powerful classifier with kernel trick", "kernel", false),
    ENSEMBLE("ensemble", "Ensemble (Recommended)",
            "Combines all models for best accuracy", "ensemble", true);

    public static final String DEFAULT_MODEL_ID = ENSEMBLE.getId();

    private final String id;
    private final String displayName;
    private final String description;
    private final String type;
    private final boolean recommended;
}
