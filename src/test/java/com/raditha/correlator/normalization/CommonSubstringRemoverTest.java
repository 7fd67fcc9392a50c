package com.raditha.correlator.normalization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CommonSubstringRemover.
 */
class CommonSubstringRemoverTest {

    private CommonSubstringRemover remover;

    @BeforeEach
    void setUp() {
        remover = new CommonSubstringRemover();
    }

    @ParameterizedTest
    @CsvSource({
            "axi_araddr, axi, _araddr",
            "apb_pready, apb_, pready",
            "uart0_tx, uart0, _tx",
            "AXI_awaddr, axi, _awaddr"
    })
    void testExactPrefixIsRemoved(String s, String common, String expected) {
        assertEquals(expected, remover.removeCommon(s, common));
    }

    @Test
    void testOccurrenceInsideIdentifier() {
        assertEquals("m__araddr", remover.removeCommon("m_axi_araddr", "axi"));
        assertEquals("awaddr_", remover.removeCommon("awaddr_axi", "axi"));
    }

    @Test
    void testEarliestOccurrenceWins() {
        assertEquals("s__axi_x", remover.removeCommon("s_axi_axi_x", "axi"));
    }

    @Test
    void testVariantSpellingsAreRecognized() {
        // "axi_slv" is written as reversed UpperCamel in the identifier
        assertEquals("Awaddr", remover.removeCommon("slvAxiAwaddr", "axi_slv"));
        assertEquals("Haddr", remover.removeCommon("ahbLiteHaddr", "ahb_lite"));
        assertEquals("_haddr", remover.removeCommon("lite_ahb_haddr", "ahbLite"));
    }

    @Test
    void testFuzzyWholeMatchOnShortIdentifier() {
        // Too short for the token window; "mastr" is 0.83 similar to "master"
        assertEquals("", remover.removeCommon("mastr", "master"));
    }

    @Test
    void testNoMatchLeavesIdentifierUnchanged() {
        assertEquals("apb_psel", remover.removeCommon("apb_psel", "axi"));
    }

    @Test
    void testEmptyInputs() {
        assertEquals("abc", remover.removeCommon("abc", ""));
        assertEquals("", remover.removeCommon("", "abc"));
    }

    @Test
    void testRemoveSubstring() {
        assertEquals("s__awaddr", remover.removeSubstring("s_AXI_awaddr", "axi"));
        assertEquals("clk", remover.removeSubstring("clk", "axi"));
        assertEquals("clk", remover.removeSubstring("clk", ""));
    }

    @Test
    void testRemoveCommonPrefix() {
        assertEquals("awaddr", remover.removeCommonPrefix("S_AXI_awaddr", "s_axi_"));
        assertEquals("m_axi_awaddr", remover.removeCommonPrefix("m_axi_awaddr", "axi_"));
    }

    @Test
    void testPositionScorePrefersBoundaries() {
        int atStart = CommonSubstringRemover.positionScore(0, 7);
        int inMiddle = CommonSubstringRemover.positionScore(2, 7);
        int atEnd = CommonSubstringRemover.positionScore(7, 0);
        assertTrue(atStart < inMiddle);
        assertTrue(atStart < atEnd);
    }
}
