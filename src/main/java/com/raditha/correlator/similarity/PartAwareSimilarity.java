package com.raditha.correlator.similarity;

import com.raditha.correlator.normalization.IdentifierTokenizer;

import java.util.List;

/**
 * Similarity that gives credit for shared tokens regardless of their order or
 * of the naming convention around them, so that {@code axi_lite} and
 * {@code liteAxi} still score as close.
 */
public class PartAwareSimilarity {

    static final double PART_MATCH_THRESHOLD = 0.7;
    static final double MATCH_RATIO_WEIGHT = 0.7;
    static final double PART_SIMILARITY_WEIGHT = 0.3;

    private final IdentifierTokenizer tokenizer;
    private final LevenshteinSimilarity similarity;

    public PartAwareSimilarity() {
        this(new IdentifierTokenizer(), new LevenshteinSimilarity());
    }

    public PartAwareSimilarity(IdentifierTokenizer tokenizer, LevenshteinSimilarity similarity) {
        this.tokenizer = tokenizer;
        this.similarity = similarity;
    }

    /**
     * Score how well {@code reference} is covered by {@code candidate}.
     * Each token of {@code reference} is paired with its closest token in
     * {@code candidate}; the share of tokens paired above 0.7 and their mean
     * similarity are blended 70/30. The whole-string similarity is returned
     * instead when it is higher or when either side has a single token.
     *
     * @param reference String whose tokens must be found
     * @param candidate String searched for those tokens
     * @return Score between 0.0 and 1.0
     */
    public double score(String reference, String candidate) {
        double direct = similarity.similarity(
                IdentifierTokenizer.toLowerCase(reference),
                IdentifierTokenizer.toLowerCase(candidate));

        List<String> referenceParts = tokenizer.tokenize(reference);
        List<String> candidateParts = tokenizer.tokenize(candidate);
        if (referenceParts.size() <= 1 || candidateParts.size() <= 1) {
            return direct;
        }

        int matchedParts = 0;
        double totalPartSim = 0.0;
        for (String part : referenceParts) {
            double bestPartSim = 0.0;
            for (String other : candidateParts) {
                bestPartSim = Math.max(bestPartSim, similarity.similarity(part, other));
            }
            if (bestPartSim > PART_MATCH_THRESHOLD) {
                matchedParts++;
                totalPartSim += bestPartSim;
            }
        }

        double matchRatio = (double) matchedParts / referenceParts.size();
        double avgPartSim = matchedParts > 0 ? totalPartSim / matchedParts : 0.0;
        double partScore = matchRatio * MATCH_RATIO_WEIGHT + avgPartSim * PART_SIMILARITY_WEIGHT;

        return Math.max(direct, partScore);
    }
}
