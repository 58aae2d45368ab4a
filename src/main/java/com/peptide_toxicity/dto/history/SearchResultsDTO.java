package com.peptide_toxicity.dto.history;

import java.util.List;

public record SearchResultsDTO(List<SearchResultDTO> results, int total) {}
