package com.peptide_toxicity.dto.request.prediction;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Schema(description = "Toxicity prediction request for a single peptide")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SinglePredictRequest {

    @Schema(description = "Peptide sequence using standard amino acid letters", example = "ACDEFGHIKLMNPQRSTVWY",
            requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "sequence must not be blank")
    private String sequence;

    @Schema(description = "ML model to use for prediction", example = "ensemble",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED)
    private String model;
}
