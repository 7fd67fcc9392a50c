package com.raditha.correlator.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrimmedSimilarityTest {

    private TrimmedSimilarity trimmed;
    private LevenshteinSimilarity plain;

    @BeforeEach
    void setUp() {
        plain = new LevenshteinSimilarity();
        trimmed = new TrimmedSimilarity();
    }

    @Test
    void testHintRemovedFromBothSides() {
        // "m__araddr" vs "_araddr"
        double expected = plain.similarity("m__araddr", "_araddr");
        assertEquals(expected, trimmed.calculate("m_axi_araddr", "axi_araddr", "axi"), 0.0001);
        assertEquals(0.778, expected, 0.001);
    }

    @Test
    void testTrimmingRaisesSimilarity() {
        double raw = plain.similarity("s_axi_awaddr", "awaddr");
        double afterTrim = trimmed.calculate("s_axi_awaddr", "awaddr", "s_axi");
        assertTrue(afterTrim > raw, "Trimming should expose the shared residual");
    }

    @Test
    void testEmptyCommonComparesAsIs() {
        assertEquals(plain.similarity("wdata", "wvalid"), trimmed.calculate("wdata", "wvalid", ""), 0.0001);
    }

    @Test
    void testReorderedMultiTokenCommon() {
        assertEquals(1.0, trimmed.calculate("pcie_rx_data", "rx_pcie_data", "pcie_rx_lane"), 0.0001);
    }

    @Test
    void testTokenMaskingBeatsRemovalForScatteredTokens() {
        // Removal leaves "_addr" and "dr" (0.4); masking leaves "__src_addr" and "SrcAddr" (0.5)
        double score = trimmed.calculate("dma_ch0_src_addr", "ch0DmaSrcAddr", "dma_ch0_ctl");
        assertEquals(0.5, score, 0.0001);
    }

    @Test
    void testMaskMarksEveryOccurrenceIgnoringCase() {
        boolean[] mask = TrimmedSimilarity.maskParts("AxiFooAXI", List.of("axi", "x"));
        String remnant = TrimmedSimilarity.unmasked("AxiFooAXI", mask);
        // "x" is too short to mask
        assertEquals("Foo", remnant);
    }
}
