package com.peptide_toxicity.dto.request.prediction;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Schema(description = "Toxicity prediction request for several peptides")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchPredictRequest {

    @ArraySchema(arraySchema = @Schema(description = "Array of peptide sequences", example = "[\"ACDEFGHIK\", \"MKLPQRSTVWY\"]"),
            minItems = 1)
    @NotEmpty(message = "sequences must contain at least one sequence")
    private List<@NotNull(message = "sequences must not contain null") String> sequences;

    @Schema(description = "ML model to use for prediction", example = "ensemble",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED)
    private String model;
}
