package com.raditha.correlator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Identifiers partitioned by the candidate marker they were assigned to.
 * Identifiers matching no marker are kept under {@link #UNKNOWN}.
 *
 * @param groups Marker to identifiers, sorted by marker
 */
public record MarkerGroups(Map<String, List<String>> groups) {

    public static final String UNKNOWN = "<unknown>";

    public MarkerGroups {
        if (groups == null) {
            throw new IllegalArgumentException("groups cannot be null");
        }
        Map<String, List<String>> copy = new TreeMap<>();
        groups.forEach((marker, members) -> copy.put(marker, List.copyOf(members)));
        groups = Collections.unmodifiableMap(copy);
    }

    public static MarkerGroups empty() {
        return new MarkerGroups(Map.of());
    }

    /**
     * Identifiers assigned to a marker, empty when the marker has no group.
     */
    public List<String> get(String marker) {
        return groups.getOrDefault(marker, List.of());
    }

    public List<String> unknown() {
        return get(UNKNOWN);
    }

    /**
     * Markers that received at least one identifier, without {@link #UNKNOWN}.
     */
    public List<String> markers() {
        return groups.keySet().stream()
                .filter(marker -> !UNKNOWN.equals(marker))
                .toList();
    }

    /**
     * Every grouped identifier, group by group.
     */
    public List<String> allIdentifiers() {
        List<String> all = new ArrayList<>();
        groups.values().forEach(all::addAll);
        return all;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /**
     * Groups whose marker contains {@code fragment}, ignoring case.
     */
    public Map<String, List<String>> groupsContaining(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        Map<String, List<String>> matching = new LinkedHashMap<>();
        groups.forEach((marker, members) -> {
            if (marker.toLowerCase(Locale.ROOT).contains(needle)) {
                matching.put(marker, members);
            }
        });
        return matching;
    }
}
