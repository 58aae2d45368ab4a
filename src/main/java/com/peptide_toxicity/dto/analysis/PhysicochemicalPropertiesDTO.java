package com.peptide_toxicity.dto.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhysicochemicalPropertiesDTO {
    // mean Kyte-Doolittle value per residue
    private double hydrophobicity;
    private double netCharge;
    // percentage of F, W and Y residues
    private double aromaticContent;
    private int length;
}
