package com.raditha.correlator.normalization;

import com.raditha.correlator.similarity.LevenshteinSimilarity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Strips a shared "common" name (an interface or bus name, say) from an
 * identifier so that the remaining part can be compared on its own.
 *
 * <p>Three strategies are tried in order and the first that finds a region
 * wins:
 * <ol>
 * <li>an exact, case-insensitive occurrence of any variant spelling of the
 * common name, preferring occurrences near the start and flush against the
 * identifier's ends;</li>
 * <li>a sliding window whose content covers the common name's tokens, exactly
 * or fuzzily, in either token order;</li>
 * <li>the substring most similar to the whole common name.</li>
 * </ol>
 * When none of them clears its threshold the identifier is returned unchanged.
 */
public class CommonSubstringRemover {

    private static final int CONTEXT_WINDOW = 5;
    private static final int BOUNDARY_BONUS = 5;
    private static final int MIN_LENGTH_FOR_PART_SEARCH = 6;
    private static final int MIN_WINDOW = 3;
    private static final int MIN_SIGNIFICANT_PART = 2;
    private static final double FUZZY_PART_THRESHOLD = 0.5;
    private static final double FUZZY_PART_CREDIT = 0.8;
    private static final double PART_MATCH_WEIGHT = 0.7;
    private static final double LENGTH_WEIGHT = 0.3;
    private static final double PART_SCORE_THRESHOLD = 0.5;
    private static final double WHOLE_MATCH_THRESHOLD = 0.75;
    private static final int WHOLE_MATCH_SLACK = 5;

    private final IdentifierTokenizer tokenizer;
    private final NameVariants variants;
    private final LevenshteinSimilarity similarity;

    public CommonSubstringRemover() {
        this(new IdentifierTokenizer(), new LevenshteinSimilarity());
    }

    public CommonSubstringRemover(IdentifierTokenizer tokenizer, LevenshteinSimilarity similarity) {
        this.tokenizer = tokenizer;
        this.variants = new NameVariants(tokenizer);
        this.similarity = similarity;
    }

    /**
     * Remove the best occurrence of {@code common} from {@code s}.
     *
     * @param s      Identifier to trim
     * @param common Shared name to remove
     * @return {@code s} without the matched region, or {@code s} itself when
     *         nothing matched
     */
    public String removeCommon(String s, String common) {
        if (common.isEmpty() || s.isEmpty()) {
            return s;
        }

        String lower = IdentifierTokenizer.toLowerCase(s);
        List<String> tokens = tokenizer.tokenize(common);

        Region region = findExactVariant(lower, common, tokens);
        if (region == null && s.length() >= MIN_LENGTH_FOR_PART_SEARCH) {
            region = findPartWindow(lower, common.length(), tokens);
        }
        if (region == null) {
            region = findSimilarSubstring(lower, IdentifierTokenizer.toLowerCase(common));
        }

        return region == null ? s : region.cut(s);
    }

    /**
     * Remove the first case-insensitive occurrence of {@code substring}.
     */
    public String removeSubstring(String s, String substring) {
        if (substring.isEmpty()) {
            return s;
        }
        int index = IdentifierTokenizer.toLowerCase(s).indexOf(IdentifierTokenizer.toLowerCase(substring));
        if (index < 0) {
            return s;
        }
        return new Region(index, index + substring.length()).cut(s);
    }

    /**
     * Remove {@code prefix} from the start of {@code s}, ignoring case.
     */
    public String removeCommonPrefix(String s, String prefix) {
        if (s.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return s.substring(prefix.length());
        }
        return s;
    }

    private Region findExactVariant(String lower, String common, List<String> tokens) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String variant : variants.variantsOf(common, tokens)) {
            if (!variant.isEmpty()) {
                candidates.add(IdentifierTokenizer.toLowerCase(variant));
            }
        }

        Region best = null;
        int bestScore = Integer.MAX_VALUE;
        for (String variant : candidates) {
            int pos = lower.indexOf(variant);
            while (pos != -1) {
                int score = positionScore(pos, lower.length() - (pos + variant.length()));
                if (score < bestScore) {
                    bestScore = score;
                    best = new Region(pos, pos + variant.length());
                }
                pos = lower.indexOf(variant, pos + 1);
            }
        }
        return best;
    }

    /**
     * Lower is better: occurrences close to the start, with little text on
     * either side, and touching an end of the identifier.
     */
    static int positionScore(int charsBefore, int charsAfter) {
        int prefixLen = Math.min(charsBefore, CONTEXT_WINDOW);
        int suffixLen = Math.min(charsAfter, CONTEXT_WINDOW);

        int score = charsBefore;
        score -= prefixLen == 0 ? BOUNDARY_BONUS : 0;
        score -= suffixLen == 0 ? BOUNDARY_BONUS : 0;
        score += prefixLen + suffixLen;
        return score;
    }

    private Region findPartWindow(String lower, int commonLength, List<String> tokens) {
        List<List<String>> orders = variants.tokenOrders(tokens);
        double bestScore = 0.0;
        Region best = null;

        for (int start = 0; start < lower.length(); start++) {
            int maxWindow = Math.min(lower.length() - start, commonLength * 2);
            for (int len = MIN_WINDOW; len <= maxWindow; len++) {
                String window = lower.substring(start, start + len);

                for (List<String> order : orders) {
                    double matchRatio = matchedParts(window, order) / order.size();
                    double lengthRatio = 1.0
                            - (double) Math.abs(len - commonLength) / Math.max(len, commonLength);
                    double score = matchRatio * PART_MATCH_WEIGHT + lengthRatio * LENGTH_WEIGHT;

                    if (score > bestScore && score > PART_SCORE_THRESHOLD) {
                        bestScore = score;
                        best = new Region(start, start + len);
                    }
                }
            }
        }
        return best;
    }

    /**
     * Count the tokens found in the window, in order. A token absent verbatim
     * earns partial credit for its best fuzzy look-alike.
     */
    private double matchedParts(String window, List<String> parts) {
        double matched = 0.0;
        int lastMatchEnd = 0;

        for (String part : parts) {
            if (part.length() < MIN_SIGNIFICANT_PART) {
                continue;
            }
            int partPos = window.indexOf(part, lastMatchEnd);
            if (partPos != -1) {
                matched += 1.0;
                lastMatchEnd = partPos + part.length();
                continue;
            }

            double bestPartSim = FUZZY_PART_THRESHOLD;
            for (int wpos = 0; wpos < window.length() - 1; wpos++) {
                int maxPartLen = Math.min(part.length() + 2, window.length() - wpos);
                for (int plen = Math.max(MIN_SIGNIFICANT_PART, part.length() - 1); plen <= maxPartLen; plen++) {
                    double sim = similarity.similarity(window.substring(wpos, wpos + plen), part);
                    if (sim > bestPartSim) {
                        bestPartSim = sim;
                        lastMatchEnd = wpos + plen;
                    }
                }
            }
            if (bestPartSim > FUZZY_PART_THRESHOLD) {
                matched += bestPartSim * FUZZY_PART_CREDIT;
            }
        }
        return matched;
    }

    private Region findSimilarSubstring(String lower, String commonLower) {
        double maxSim = WHOLE_MATCH_THRESHOLD;
        Region best = null;

        for (int start = 0; start < lower.length() - 2; start++) {
            int maxLen = Math.min(commonLower.length() + WHOLE_MATCH_SLACK, lower.length() - start);
            for (int len = MIN_WINDOW; len <= maxLen; len++) {
                double sim = similarity.similarity(lower.substring(start, start + len), commonLower);
                if (sim > maxSim) {
                    maxSim = sim;
                    best = new Region(start, start + len);
                }
            }
        }
        return best;
    }

    /**
     * Half-open character range {@code [start, end)} of an identifier.
     */
    private record Region(int start, int end) {
        String cut(String s) {
            return s.substring(0, start) + s.substring(end);
        }
    }
}
