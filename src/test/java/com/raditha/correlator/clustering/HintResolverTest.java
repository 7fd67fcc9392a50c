package com.raditha.correlator.clustering;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HintResolverTest {

    private HintResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new HintResolver();
    }

    @Test
    void testReorderedCamelHintFindsSnakeMarker() {
        assertEquals(Optional.of("lite_axi_"),
                resolver.bestMarkerForHint("AxiLite", List.of("lite_axi_", "apb_", "axi_l")));
    }

    @Test
    void testHintContainedInMarker() {
        assertEquals(Optional.of("u_uart"), resolver.bestMarkerForHint("uart", List.of("u_uart", "spi_")));
    }

    @Test
    void testFallsBackToDirectSimilarityForWeakHints() {
        assertEquals(Optional.of("zz_q"), resolver.bestMarkerForHint("zzz", List.of("abc", "zz_q", "qqqq")));
    }

    @Test
    void testExactMarkerWins() {
        assertEquals(Optional.of("s_axi"),
                resolver.bestMarkerForHint("s_axi", List.of("s_axi", "s_apb", "s_axi_aw")));
    }

    @Test
    void testNoMarkers() {
        assertTrue(resolver.bestMarkerForHint("axi", List.of()).isEmpty());
    }

    @Test
    void testEmptyHintStillPicksAMarker() {
        assertTrue(resolver.bestMarkerForHint("", List.of("abc", "de")).isPresent());
    }
}
