package com.raditha.correlator.model;

/**
 * One pairing chosen by the optimal matcher.
 *
 * @param bIndex     Position of the identifier in group B
 * @param b          Identifier from group B
 * @param aIndex     Position of the matched identifier in group A
 * @param a          Matched identifier from group A
 * @param similarity Best trimmed similarity over the hint variants (0.0-1.0)
 * @param cost       Length-weighted cost used by the solver
 */
public record MatchedPair(
        int bIndex,
        String b,
        int aIndex,
        String a,
        double similarity,
        double cost) {

    /**
     * Check if the pair is at least as similar as a threshold.
     */
    public boolean exceedsThreshold(double threshold) {
        return similarity >= threshold;
    }
}
