package com.raditha.correlator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of correlating a bus interface with a module's ports.
 *
 * @param hintMarker     Marker chosen for the bus interface hint, empty if none
 * @param candidatePorts Ports that took part in matching
 * @param mapping        Bus signal to module port
 */
public record CorrelationResult(
        String hintMarker,
        List<String> candidatePorts,
        Map<String, String> mapping) {

    public CorrelationResult {
        if (hintMarker == null) {
            hintMarker = "";
        }
        candidatePorts = candidatePorts == null ? List.of() : List.copyOf(candidatePorts);
        mapping = mapping == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }

    public static CorrelationResult empty() {
        return new CorrelationResult("", List.of(), Map.of());
    }

    /**
     * Bus signals left without a module port.
     */
    public List<String> unmatchedSignals(List<String> busSignals) {
        return busSignals.stream()
                .filter(signal -> !mapping.containsKey(signal))
                .toList();
    }
}
