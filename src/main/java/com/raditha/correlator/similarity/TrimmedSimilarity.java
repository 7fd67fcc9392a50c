package com.raditha.correlator.similarity;

import com.raditha.correlator.normalization.CommonSubstringRemover;
import com.raditha.correlator.normalization.IdentifierTokenizer;

import java.util.List;

/**
 * Compares two identifiers after the name they share (for example the bus
 * interface prefix) has been taken out of both.
 */
public class TrimmedSimilarity {

    private static final int MASKING_MIN_TOKENS = 3;
    private static final int MIN_MASKED_PART = 2;

    private final IdentifierTokenizer tokenizer;
    private final LevenshteinSimilarity similarity;
    private final CommonSubstringRemover remover;

    public TrimmedSimilarity() {
        this(new IdentifierTokenizer(), new LevenshteinSimilarity());
    }

    public TrimmedSimilarity(IdentifierTokenizer tokenizer, LevenshteinSimilarity similarity) {
        this(tokenizer, similarity, new CommonSubstringRemover(tokenizer, similarity));
    }

    public TrimmedSimilarity(IdentifierTokenizer tokenizer, LevenshteinSimilarity similarity,
            CommonSubstringRemover remover) {
        this.tokenizer = tokenizer;
        this.similarity = similarity;
        this.remover = remover;
    }

    /**
     * Calculate similarity of {@code s1} and {@code s2} with {@code common}
     * removed from both.
     *
     * <p>For a common name of three or more tokens, every occurrence of each
     * of its tokens is also masked out of both strings and the remnants are
     * compared; the better of the two scores is returned.
     *
     * @return Similarity score (0.0 to 1.0)
     */
    public double calculate(String s1, String s2, String common) {
        double basic = similarity.similarity(
                remover.removeCommon(s1, common),
                remover.removeCommon(s2, common));

        List<String> commonParts = tokenizer.tokenize(common);
        if (commonParts.size() < MASKING_MIN_TOKENS) {
            return basic;
        }

        String remnant1 = unmasked(s1, maskParts(s1, commonParts));
        String remnant2 = unmasked(s2, maskParts(s2, commonParts));
        return Math.max(basic, similarity.similarity(remnant1, remnant2));
    }

    /**
     * Flag every character covered by a case-insensitive occurrence of one of
     * the parts. Occurrences of one part do not overlap each other.
     */
    static boolean[] maskParts(String s, List<String> parts) {
        String lower = IdentifierTokenizer.toLowerCase(s);
        boolean[] mask = new boolean[s.length()];

        for (String part : parts) {
            if (part.length() < MIN_MASKED_PART) {
                continue;
            }
            int pos = lower.indexOf(part);
            while (pos != -1) {
                for (int i = pos; i < pos + part.length(); i++) {
                    mask[i] = true;
                }
                pos = lower.indexOf(part, pos + part.length());
            }
        }
        return mask;
    }

    static String unmasked(String s, boolean[] mask) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            if (!mask[i]) {
                sb.append(s.charAt(i));
            }
        }
        return sb.toString();
    }
}
