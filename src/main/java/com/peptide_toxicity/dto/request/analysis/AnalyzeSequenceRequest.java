package com.peptide_toxicity.dto.request.analysis;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeSequenceRequest {

    @Schema(description = "Peptide sequence to analyze", example = "ACDEFGHIKLMNPQRSTVWY",
            requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "sequence must not be blank")
    private String sequence;
}
