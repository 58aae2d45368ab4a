package com.peptide_toxicity.dto.history;

import java.util.List;

public record HistoryDTO(List<HistoryEntryDTO> predictions, int total) {}
