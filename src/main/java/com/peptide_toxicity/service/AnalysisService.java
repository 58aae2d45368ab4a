package com.peptide_toxicity.service;

import com.peptide_toxicity.dto.analysis.ExtractedFeaturesDTO;
import com.peptide_toxicity.dto.analysis.FeatureAnalysisDTO;
import com.peptide_toxicity.dto.analysis.PhysicochemicalPropertiesDTO;
import com.peptide_toxicity.exception.InvalidSequenceException;
import com.peptide_toxicity.predictor.ToxicityPredictor;
import com.peptide_toxicity.util.SequenceUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sequence descriptors computed in-process, plus a pass-through to the external feature extractor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisService {

    // Kyte-Doolittle
    private static final Map<Character, Double> HYDROPHOBICITY = Map.ofEntries(
            Map.entry('A', 1.8), Map.entry('C', 2.5), Map.entry('D', -3.5), Map.entry('E', -3.5),
            Map.entry('F', 2.8), Map.entry('G', -0.4), Map.entry('H', -3.2), Map.entry('I', 4.5),
            Map.entry('K', -3.9), Map.entry('L', 3.8), Map.entry('M', 1.9), Map.entry('N', -3.5),
            Map.entry('P', -1.6), Map.entry('Q', -3.5), Map.entry('R', -4.5), Map.entry('S', -0.8),
            Map.entry('T', -0.7), Map.entry('V', 4.2), Map.entry('W', -0.9), Map.entry('Y', -1.3));

    // side-chain charge at neutral pH
    private static final Map<Character, Double> CHARGE = Map.of(
            'D', -1.0, 'E', -1.0, 'H', 0.5, 'K', 1.0, 'R', 1.0);

    private static final String AROMATIC = "FWY";

    private final ToxicityPredictor toxicityPredictor;

    public FeatureAnalysisDTO analyzeFeatures(String rawSequence) {
        String sequence = requireValid(rawSequence);
        return FeatureAnalysisDTO.builder()
                .sequence(sequence)
                .length(sequence.length())
                .aminoAcidComposition(aminoAcidComposition(sequence))
                .physicochemicalProperties(physicochemicalProperties(sequence))
                .build();
    }

    public PhysicochemicalPropertiesDTO analyzePhysicochemical(String rawSequence) {
        return physicochemicalProperties(requireValid(rawSequence));
    }

    public ExtractedFeaturesDTO extractFeatures(String rawSequence) {
        String sequence = requireValid(rawSequence);
        log.info("External feature extraction requested [length={}]", sequence.length());
        return toxicityPredictor.extractFeatures(sequence);
    }

    /**
     * Percentage of each of the 20 standard residues, keyed in alphabet order.
     */
    Map<String, Double> aminoAcidComposition(String sequence) {
        int[] counts = new int[SequenceUtil.AMINO_ACIDS.length()];
        for (int i = 0; i < sequence.length(); i++) {
            counts[SequenceUtil.AMINO_ACIDS.indexOf(sequence.charAt(i))]++;
        }

        Map<String, Double> composition = new LinkedHashMap<>();
        for (int i = 0; i < counts.length; i++) {
            composition.put(String.valueOf(SequenceUtil.AMINO_ACIDS.charAt(i)),
                    counts[i] * 100.0 / sequence.length());
        }
        return composition;
    }

    PhysicochemicalPropertiesDTO physicochemicalProperties(String sequence) {
        double hydrophobicity = 0;
        double charge = 0;
        int aromatic = 0;

        for (int i = 0; i < sequence.length(); i++) {
            char residue = sequence.charAt(i);
            hydrophobicity += HYDROPHOBICITY.getOrDefault(residue, 0.0);
            charge += CHARGE.getOrDefault(residue, 0.0);
            if (AROMATIC.indexOf(residue) >= 0) {
                aromatic++;
            }
        }

        return PhysicochemicalPropertiesDTO.builder()
                .hydrophobicity(hydrophobicity / sequence.length())
                .netCharge(charge)
                .aromaticContent(aromatic * 100.0 / sequence.length())
                .length(sequence.length())
                .build();
    }

    private String requireValid(String rawSequence) {
        String sequence = SequenceUtil.normalize(rawSequence);
        if (!SequenceUtil.isValid(sequence)) {
            throw new InvalidSequenceException(List.of(String.valueOf(rawSequence)));
        }
        return sequence;
    }
}
