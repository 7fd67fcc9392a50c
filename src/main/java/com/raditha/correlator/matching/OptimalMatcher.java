package com.raditha.correlator.matching;

import com.raditha.correlator.model.MatchedPair;
import com.raditha.correlator.normalization.IdentifierTokenizer;
import com.raditha.correlator.normalization.NameVariants;
import com.raditha.correlator.similarity.LevenshteinSimilarity;
import com.raditha.correlator.similarity.TrimmedSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pairs the identifiers of two groups one-to-one so that the total mismatch
 * is minimal.
 *
 * <p>The cost of pairing {@code b} with {@code a} is
 * {@code (1 - s) * maxLenB / len(b)}, where {@code s} is the best
 * {@link TrimmedSimilarity} over all variant spellings of the hint. The weight
 * makes short B identifiers pay more for a mismatch, since they match
 * anything fairly well by chance.
 */
public class OptimalMatcher {

    private static final Logger logger = LoggerFactory.getLogger(OptimalMatcher.class);

    private final NameVariants variants;
    private final TrimmedSimilarity trimmedSimilarity;
    private final LevenshteinSimilarity similarity;
    private final HungarianSolver solver;

    public OptimalMatcher() {
        this(new IdentifierTokenizer(), new LevenshteinSimilarity());
    }

    public OptimalMatcher(IdentifierTokenizer tokenizer, LevenshteinSimilarity similarity) {
        this(new NameVariants(tokenizer), new TrimmedSimilarity(tokenizer, similarity), similarity,
                new HungarianSolver());
    }

    public OptimalMatcher(NameVariants variants, TrimmedSimilarity trimmedSimilarity,
            LevenshteinSimilarity similarity, HungarianSolver solver) {
        this.variants = variants;
        this.trimmedSimilarity = trimmedSimilarity;
        this.similarity = similarity;
        this.solver = solver;
    }

    /**
     * Find the optimal one-to-one matching of group B onto group A.
     *
     * @param groupA Identifiers to match against (e.g. module ports)
     * @param groupB Identifiers to match (e.g. bus signals)
     * @param hint   Name shared by both sides, trimmed before comparing; null
     *               or empty to compare identifiers as they are
     * @return B identifier to its A counterpart, in group B order. B
     *         identifiers left on padding are omitted, and a B identifier that
     *         occurs twice keeps its last pairing.
     */
    public Map<String, String> findOptimalMatching(List<String> groupA, List<String> groupB, String hint) {
        Map<String, String> matching = new LinkedHashMap<>();
        for (MatchedPair pair : findOptimalPairs(groupA, groupB, hint)) {
            matching.put(pair.b(), pair.a());
        }
        return matching;
    }

    /**
     * Same as {@link #findOptimalMatching} but keeps every pairing, including
     * those of duplicate identifiers, together with its score.
     */
    public List<MatchedPair> findOptimalPairs(List<String> groupA, List<String> groupB, String hint) {
        if (groupA == null || groupB == null) {
            throw new IllegalArgumentException("groups cannot be null");
        }
        if (groupA.isEmpty() || groupB.isEmpty()) {
            return List.of();
        }

        Set<String> hintVariants = variants.variantsOf(hint == null ? "" : hint);
        int size = Math.max(groupA.size(), groupB.size());
        int maxLenB = groupB.stream().mapToInt(String::length).max().orElse(0);

        CostMatrix costs = new CostMatrix(size);
        double[][] similarities = new double[groupB.size()][groupA.size()];

        for (int i = 0; i < groupB.size(); i++) {
            String b = groupB.get(i);
            double weight = (double) maxLenB / Math.max(1, b.length());

            for (int j = 0; j < groupA.size(); j++) {
                double bestSim = 0.0;
                for (String variant : hintVariants) {
                    bestSim = Math.max(bestSim, trimmedSimilarity.calculate(b, groupA.get(j), variant));
                }
                similarities[i][j] = bestSim;
                costs.set(i, j, (1.0 - bestSim) * weight);
            }
        }

        int[] assignment = solver.solve(costs);

        List<MatchedPair> pairs = new ArrayList<>();
        for (int i = 0; i < groupB.size(); i++) {
            int j = assignment[i];
            if (j < groupA.size()) {
                pairs.add(new MatchedPair(i, groupB.get(i), j, groupA.get(j), similarities[i][j], costs.get(i, j)));
                logger.debug("Matched {} -> {} (similarity {})", groupB.get(i), groupA.get(j), similarities[i][j]);
            } else {
                logger.debug("No counterpart left for {}", groupB.get(i));
            }
        }
        return pairs;
    }

    /**
     * Find the candidate most similar to a target.
     *
     * @param target     String to look up
     * @param candidates Strings to choose from
     * @param threshold  Similarity a candidate must strictly exceed
     * @return Most similar candidate (first one on ties), or empty if none
     *         exceeds the threshold
     */
    public Optional<String> findBestMatchingString(String target, Collection<String> candidates, double threshold) {
        double bestSimilarity = threshold;
        String bestMatch = null;
        for (String candidate : candidates) {
            double current = similarity.similarity(candidate, target);
            if (current > bestSimilarity) {
                bestSimilarity = current;
                bestMatch = candidate;
            }
        }
        return Optional.ofNullable(bestMatch);
    }
}
