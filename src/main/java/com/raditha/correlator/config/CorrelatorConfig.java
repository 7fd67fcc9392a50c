package com.raditha.correlator.config;

/**
 * Configuration for bus/port correlation.
 *
 * @param minMarkerLength     Minimum length of a candidate marker
 * @param markerFrequency     Minimum number of ports a marker must occur in
 * @param restrictToHintGroup If true, only ports grouped under the marker
 *                            chosen for the hint take part in matching
 */
public record CorrelatorConfig(
        int minMarkerLength,
        int markerFrequency,
        boolean restrictToHintGroup) {
    /**
     * Validate configuration.
     */
    public CorrelatorConfig {
        if (minMarkerLength < 1) {
            throw new IllegalArgumentException("minMarkerLength must be >= 1");
        }
        if (markerFrequency < 1) {
            throw new IllegalArgumentException("markerFrequency must be >= 1");
        }
    }

    /**
     * Default preset: markers of 3+ characters shared by 2+ ports, matching
     * restricted to the hint's group.
     */
    public static CorrelatorConfig defaults() {
        return new CorrelatorConfig(
                3, // minMarkerLength
                2, // markerFrequency
                true); // restrictToHintGroup
    }

    /**
     * Unrestricted preset: every port is a matching candidate. Useful for
     * modules exposing a single interface.
     */
    public static CorrelatorConfig unrestricted() {
        return new CorrelatorConfig(3, 2, false);
    }
}
