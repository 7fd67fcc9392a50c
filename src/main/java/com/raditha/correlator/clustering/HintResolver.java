package com.raditha.correlator.clustering;

import com.raditha.correlator.normalization.IdentifierTokenizer;
import com.raditha.correlator.normalization.NameVariants;
import com.raditha.correlator.similarity.LevenshteinSimilarity;
import com.raditha.correlator.similarity.PartAwareSimilarity;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Classifies a free-form hint, such as a bus interface name, against a set of
 * known candidate markers.
 */
public class HintResolver {

    static final double MIN_VARIANT_SCORE = 0.4;

    private final NameVariants variants;
    private final PartAwareSimilarity partAwareSimilarity;
    private final LevenshteinSimilarity similarity;

    public HintResolver() {
        this(new IdentifierTokenizer(), new LevenshteinSimilarity());
    }

    public HintResolver(IdentifierTokenizer tokenizer, LevenshteinSimilarity similarity) {
        this.variants = new NameVariants(tokenizer);
        this.partAwareSimilarity = new PartAwareSimilarity(tokenizer, similarity);
        this.similarity = similarity;
    }

    /**
     * Pick the marker that best matches a hint.
     *
     * <p>Every variant spelling of the hint is scored against every marker
     * with {@link PartAwareSimilarity}. When even the best of those scores is
     * below 0.4, the markers are ranked again by plain similarity to the hint
     * as written. Ties go to the longer marker, then to the earlier one.
     *
     * @param hint    Free-form hint
     * @param markers Candidate markers
     * @return Best marker, empty only when there are no markers
     */
    public Optional<String> bestMarkerForHint(String hint, List<String> markers) {
        if (markers.isEmpty()) {
            return Optional.empty();
        }

        Set<String> hintVariants = variants.variantsOf(hint);
        Candidate best = Candidate.NONE;
        for (String hintVariant : hintVariants) {
            best = best(best, markers, marker -> partAwareSimilarity.score(marker, hintVariant));
        }

        if (best.score() < MIN_VARIANT_SCORE) {
            String hintLower = IdentifierTokenizer.toLowerCase(hint);
            best = best(Candidate.NONE, markers,
                    marker -> similarity.similarity(IdentifierTokenizer.toLowerCase(marker), hintLower));
        }

        return Optional.ofNullable(best.marker());
    }

    private static Candidate best(Candidate current, List<String> markers, ToDoubleFunction<String> scorer) {
        Candidate best = current;
        for (String marker : markers) {
            double score = scorer.applyAsDouble(marker);
            if (score > best.score() || (score == best.score() && marker.length() > best.length())) {
                best = new Candidate(marker, score);
            }
        }
        return best;
    }

    private record Candidate(String marker, double score) {
        static final Candidate NONE = new Candidate(null, 0.0);

        int length() {
            return marker == null ? 0 : marker.length();
        }
    }
}
