package com.raditha.correlator.similarity;

/**
 * Calculates similarity between two identifiers using Levenshtein edit distance.
 * Characters are compared ordinally, without case folding or normalization.
 */
public class LevenshteinSimilarity {

    /**
     * Compute the edit distance between two strings.
     * Insertion, deletion and substitution each cost 1.
     *
     * @param s1 First string
     * @param s2 Second string
     * @return Minimum number of edits turning {@code s1} into {@code s2}
     */
    public int distance(String s1, String s2) {
        int m = s1.length();
        int n = s2.length();
        if (m == 0) {
            return n;
        }
        if (n == 0) {
            return m;
        }

        int[][] matrix = new int[m + 1][n + 1];
        for (int i = 0; i <= m; i++) {
            matrix[i][0] = i;
        }
        for (int j = 0; j <= n; j++) {
            matrix[0][j] = j;
        }

        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                int editCost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                matrix[i][j] = Math.min(
                        Math.min(matrix[i - 1][j] + 1, matrix[i][j - 1] + 1), // delete or insert
                        matrix[i - 1][j - 1] + editCost); // replace
            }
        }

        return matrix[m][n];
    }

    /**
     * Calculate normalized similarity between two strings.
     *
     * @param s1 First string
     * @param s2 Second string
     * @return Similarity score (0.0 to 1.0), 1.0 when both strings are empty
     */
    public double similarity(String s1, String s2) {
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) {
            return 1.0;
        }

        // Convert distance to similarity: similarity = 1 - (distance / maxLength)
        return 1.0 - ((double) distance(s1, s2) / maxLength);
    }
}
