package com.raditha.correlator.clustering;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds substrings that recur across a collection of identifiers. Such
 * candidate markers (a shared {@code s_axi_} prefix, an instance name) are
 * later used to group the identifiers.
 */
public class MarkerExtractor {

    /**
     * Extract candidate markers.
     * A substring is counted at most once per identifier, however many times
     * it occurs in it.
     *
     * @param identifiers   Identifiers to scan
     * @param minLen        Minimum marker length, at least 1
     * @param freqThreshold Minimum number of identifiers containing the marker,
     *                      at least 1
     * @return Marker to number of identifiers containing it, sorted by marker
     */
    public Map<String, Integer> extractMarkers(Collection<String> identifiers, int minLen, int freqThreshold) {
        if (identifiers == null) {
            throw new IllegalArgumentException("identifiers cannot be null");
        }
        if (minLen < 1) {
            throw new IllegalArgumentException("minLen must be >= 1");
        }
        if (freqThreshold < 1) {
            throw new IllegalArgumentException("freqThreshold must be >= 1");
        }

        Map<String, Integer> frequencies = new TreeMap<>();
        for (String identifier : identifiers) {
            Set<String> seen = new HashSet<>();
            int length = identifier.length();
            for (int subLen = minLen; subLen <= length; subLen++) {
                for (int i = 0; i <= length - subLen; i++) {
                    String substring = identifier.substring(i, i + subLen);
                    if (seen.add(substring)) {
                        frequencies.merge(substring, 1, Integer::sum);
                    }
                }
            }
        }

        frequencies.values().removeIf(count -> count < freqThreshold);
        return frequencies;
    }
}
