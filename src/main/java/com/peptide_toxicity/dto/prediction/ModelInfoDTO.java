package com.peptide_toxicity.dto.prediction;

import com.peptide_toxicity.enumeration.PredictorModelEnum;

public record ModelInfoDTO(
        String id,
        String name,
        String description,
        String type,
        boolean recommended
) {
    public static ModelInfoDTO from(PredictorModelEnum model) {
        return new ModelInfoDTO(model.getId(), model.getDisplayName(), model.getDescription(),
                model.getType(), model.isRecommended());
    }
}
