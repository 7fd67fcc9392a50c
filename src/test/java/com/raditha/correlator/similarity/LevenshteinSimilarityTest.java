package com.raditha.correlator.similarity;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LevenshteinSimilarity.
 */
class LevenshteinSimilarityTest {

    // Plain field initialization: jqwik properties do not run JUnit's @BeforeEach
    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @Test
    void testIdenticalStrings() {
        assertEquals(0, similarity.distance("awaddr", "awaddr"));
        assertEquals(1.0, similarity.similarity("awaddr", "awaddr"), 0.001);
    }

    @Test
    void testBothEmpty() {
        assertEquals(0, similarity.distance("", ""));
        assertEquals(1.0, similarity.similarity("", ""), 0.001);
    }

    @Test
    void testOneEmpty() {
        assertEquals(5, similarity.distance("", "wdata"));
        assertEquals(5, similarity.distance("wdata", ""));
        assertEquals(0.0, similarity.similarity("", "wdata"), 0.001);
    }

    @Test
    void testOneSubstitution() {
        // Distance = 1, max length = 6, similarity = 1 - 1/6
        assertEquals(1, similarity.distance("araddr", "awaddr"));
        assertEquals(0.833, similarity.similarity("araddr", "awaddr"), 0.001);
    }

    @Test
    void testInsertionAndDeletion() {
        assertEquals(2, similarity.distance("m_axi_araddr", "axi_araddr"));
        assertEquals(3, similarity.distance("kitten", "sitting"));
    }

    @Test
    void testCaseSensitive() {
        assertEquals(3, similarity.distance("CLK", "clk"));
        assertEquals(0.0, similarity.similarity("CLK", "clk"), 0.001);
    }

    @Test
    void testCompletelyDifferent() {
        assertEquals(0.0, similarity.similarity("abc", "xyz"), 0.001);
    }

    @Property(tries = 200)
    void distanceIsSymmetric(@ForAll("identifiers") String a, @ForAll("identifiers") String b) {
        assertEquals(similarity.distance(a, b), similarity.distance(b, a));
    }

    @Property(tries = 200)
    void distanceSatisfiesTriangleInequality(
            @ForAll("identifiers") String a,
            @ForAll("identifiers") String b,
            @ForAll("identifiers") String c) {
        assertTrue(similarity.distance(a, b) <= similarity.distance(a, c) + similarity.distance(c, b));
    }

    @Property(tries = 200)
    void selfSimilarityIsOne(@ForAll("identifiers") String s) {
        assertEquals(1.0, similarity.similarity(s, s), 0.0);
    }

    @Property(tries = 200)
    void similarityStaysInUnitRange(@ForAll("identifiers") String a, @ForAll("identifiers") String b) {
        double score = similarity.similarity(a, b);
        assertTrue(score >= 0.0 && score <= 1.0, "Score out of range: " + score);
    }

    @Property(tries = 100)
    void similarityToEmptyIsZero(@ForAll("nonEmptyIdentifiers") String s) {
        assertEquals(0.0, similarity.similarity("", s), 0.0);
    }

    @Provide
    Arbitrary<String> identifiers() {
        return Arbitraries.strings()
                .withCharRange('a', 'e')
                .withCharRange('A', 'C')
                .withChars('_')
                .ofMaxLength(10);
    }

    @Provide
    Arbitrary<String> nonEmptyIdentifiers() {
        return identifiers().filter(s -> !s.isEmpty());
    }
}
