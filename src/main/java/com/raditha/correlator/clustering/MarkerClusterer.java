package com.raditha.correlator.clustering;

import com.raditha.correlator.model.MarkerGroups;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups identifiers by the candidate marker they start with.
 * Longer markers are tried first because they are more specific.
 */
public class MarkerClusterer {

    /**
     * Cluster identifiers by marker prefix.
     * Every identifier ends up in exactly one group; those starting with no
     * marker go to {@link MarkerGroups#UNKNOWN}.
     *
     * @param identifiers Identifiers to group, duplicates allowed
     * @param markers     Candidate markers, for instance the keys returned by
     *                    {@link MarkerExtractor#extractMarkers}
     * @return Groups keyed by marker
     */
    public MarkerGroups cluster(Collection<String> identifiers, Collection<String> markers) {
        if (identifiers == null || markers == null) {
            throw new IllegalArgumentException("identifiers and markers cannot be null");
        }

        List<String> sortedMarkers = sortByLength(markers);
        Map<String, List<String>> groups = new LinkedHashMap<>();

        for (String identifier : identifiers) {
            String marker = sortedMarkers.stream()
                    .filter(identifier::startsWith)
                    .findFirst()
                    .orElse(MarkerGroups.UNKNOWN);
            groups.computeIfAbsent(marker, k -> new ArrayList<>()).add(identifier);
        }

        return new MarkerGroups(groups);
    }

    /**
     * Find the group of an identifier by substring rather than prefix.
     *
     * @param identifier    Identifier or free-form hint
     * @param sortedMarkers Markers, most specific first
     * @return First marker contained in {@code identifier}, or
     *         {@link MarkerGroups#UNKNOWN}
     */
    public String findGroup(String identifier, List<String> sortedMarkers) {
        for (String marker : sortedMarkers) {
            if (identifier.contains(marker)) {
                return marker;
            }
        }
        return MarkerGroups.UNKNOWN;
    }

    /**
     * Order markers longest first. The sort is stable, so markers of equal
     * length keep the order they were given in.
     */
    public static List<String> sortByLength(Collection<String> markers) {
        List<String> sorted = new ArrayList<>(markers);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }
}
