package com.raditha.correlator.workflow;

import com.raditha.correlator.clustering.HintResolver;
import com.raditha.correlator.clustering.MarkerClusterer;
import com.raditha.correlator.clustering.MarkerExtractor;
import com.raditha.correlator.config.CorrelatorConfig;
import com.raditha.correlator.matching.OptimalMatcher;
import com.raditha.correlator.model.CorrelationResult;
import com.raditha.correlator.model.MarkerGroups;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the signals of a bus interface onto the ports of a module.
 *
 * <p>The module's ports are clustered by recurring markers, the bus
 * interface name is resolved to the closest marker, and only the ports of
 * that marker's groups are matched against the bus signals, with the marker
 * trimmed from both sides. A module exposing several interfaces thus keeps
 * its other interfaces out of the matching.
 */
public class BusPortCorrelator {

    private static final Logger logger = LoggerFactory.getLogger(BusPortCorrelator.class);

    private final CorrelatorConfig config;
    private final MarkerExtractor extractor;
    private final MarkerClusterer clusterer;
    private final HintResolver hintResolver;
    private final OptimalMatcher matcher;

    public BusPortCorrelator() {
        this(CorrelatorConfig.defaults());
    }

    public BusPortCorrelator(CorrelatorConfig config) {
        this(config, new MarkerExtractor(), new MarkerClusterer(), new HintResolver(), new OptimalMatcher());
    }

    public BusPortCorrelator(CorrelatorConfig config, MarkerExtractor extractor, MarkerClusterer clusterer,
            HintResolver hintResolver, OptimalMatcher matcher) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.extractor = extractor;
        this.clusterer = clusterer;
        this.hintResolver = hintResolver;
        this.matcher = matcher;
    }

    /**
     * Correlate bus signals with module ports.
     *
     * @param modulePorts  Port names of the module
     * @param busSignals   Signal names of the bus definition
     * @param busInterface Name of the interface being attached, used as hint
     * @return Chosen marker, the ports considered and the signal to port
     *         mapping; empty when either list is empty
     */
    public CorrelationResult correlate(List<String> modulePorts, List<String> busSignals, String busInterface) {
        if (modulePorts == null || busSignals == null) {
            throw new IllegalArgumentException("modulePorts and busSignals cannot be null");
        }
        if (modulePorts.isEmpty() || busSignals.isEmpty()) {
            logger.debug("Nothing to correlate: {} ports, {} signals", modulePorts.size(), busSignals.size());
            return CorrelationResult.empty();
        }

        Map<String, Integer> markers = extractor.extractMarkers(
                modulePorts, config.minMarkerLength(), config.markerFrequency());
        MarkerGroups groups = clusterer.cluster(modulePorts, markers.keySet());

        List<String> sortedMarkers = MarkerClusterer.sortByLength(markers.keySet());
        String hintMarker = hintResolver.bestMarkerForHint(busInterface == null ? "" : busInterface, sortedMarkers)
                .orElse("");
        if (hintMarker.isEmpty()) {
            logger.debug("No suitable group marker found for hint '{}'", busInterface);
        } else {
            logger.debug("Best matching marker: {} for hint: {}", hintMarker, busInterface);
        }

        List<String> candidatePorts = selectCandidatePorts(modulePorts, groups, hintMarker);
        Map<String, String> mapping = matcher.findOptimalMatching(candidatePorts, busSignals, hintMarker);

        mapping.forEach((signal, port) -> logger.debug("Bus signal: {} matched with module port: {}", signal, port));
        if (mapping.size() < busSignals.size()) {
            logger.info("{} of {} bus signals of '{}' have no matching port",
                    busSignals.size() - mapping.size(), busSignals.size(), busInterface);
        }
        return new CorrelationResult(hintMarker, candidatePorts, mapping);
    }

    /**
     * Ports grouped under a marker containing the hint marker; all ports when
     * restriction is off or nothing qualifies.
     */
    List<String> selectCandidatePorts(List<String> modulePorts, MarkerGroups groups, String hintMarker) {
        if (!config.restrictToHintGroup() || hintMarker.isEmpty()) {
            return modulePorts;
        }

        List<String> filtered = new ArrayList<>();
        groups.groupsContaining(hintMarker).forEach((marker, ports) -> {
            if (!MarkerGroups.UNKNOWN.equals(marker)) {
                logger.debug("Including ports from group: {}", marker);
                filtered.addAll(ports);
            }
        });

        if (filtered.isEmpty()) {
            logger.debug("No ports found in matching groups, using all ports");
            return modulePorts;
        }
        return filtered;
    }
}
