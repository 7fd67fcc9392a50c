package com.raditha.correlator.clustering;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkerExtractorTest {

    private MarkerExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new MarkerExtractor();
    }

    @Test
    void testSharedPrefixIsExtracted() {
        Map<String, Integer> markers = extractor.extractMarkers(List.of("u_uart0", "u_uart1", "u_spi0"), 2, 2);

        assertEquals(3, markers.get("u_"));
        assertEquals(2, markers.get("u_uart"));
        assertFalse(markers.containsKey("spi"), "Marker below frequency threshold must be dropped");
        assertFalse(markers.containsKey("u"), "Marker below minimum length must be dropped");
    }

    @Test
    void testRepeatsWithinOneIdentifierCountOnce() {
        Map<String, Integer> markers = extractor.extractMarkers(List.of("axi_axi_x"), 3, 1);
        assertEquals(1, markers.get("axi"));

        assertTrue(extractor.extractMarkers(List.of("axi_axi_x"), 3, 2).isEmpty());
    }

    @Test
    void testMarkersAreSorted() {
        Map<String, Integer> markers = extractor.extractMarkers(List.of("s_axi_wdata", "s_axi_wvalid"), 3, 2);
        List<String> keys = List.copyOf(markers.keySet());
        assertEquals(keys.stream().sorted().toList(), keys);
        assertTrue(keys.contains("s_axi_w"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(extractor.extractMarkers(List.of(), 3, 2).isEmpty());
        assertTrue(extractor.extractMarkers(List.of("ab", "ab"), 3, 1).isEmpty());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extractMarkers(null, 3, 2));
        assertThrows(IllegalArgumentException.class, () -> extractor.extractMarkers(List.of("a"), 0, 2));
        assertThrows(IllegalArgumentException.class, () -> extractor.extractMarkers(List.of("a"), 3, 0));
    }
}
