package com.peptide_toxicity.dto.prediction;

import java.util.List;

public record ModelCatalogDTO(List<ModelInfoDTO> models) {}
