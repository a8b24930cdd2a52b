package com.dealflow.dedup.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class StringSimilarityTest {

    private LevenshteinRatio ratio;
    private PartialRatio partialRatio;
    private TokenSortRatio tokenSortRatio;
    private TokenSetRatio tokenSetRatio;
    private DiceCoefficient dice;
    private FuzzyStringMatcher fuzzy;

    @BeforeEach
    void setUp() {
        ratio = new LevenshteinRatio();
        partialRatio = new PartialRatio();
        tokenSortRatio = new TokenSortRatio();
        tokenSetRatio = new TokenSetRatio();
        dice = new DiceCoefficient();
        fuzzy = new FuzzyStringMatcher();
    }

    // ============ Ratio Tests ============

    @Test
    @DisplayName("Ratio: identical strings should return 100")
    void testRatioIdentical() {
        assertEquals(100.0, ratio.compute("acme", "acme"));
    }

    @Test
    @DisplayName("Ratio: null or empty strings return 0")
    void testRatioNullEmpty() {
        assertEquals(0.0, ratio.compute(null, "acme"));
        assertEquals(0.0, ratio.compute("acme", ""));
    }

    @Test
    @DisplayName("Ratio: substitution counts as delete plus insert")
    void testRatioIndel() {
        // 13 chars, distance 5
        assertEquals(62.0, ratio.compute("kitten", "sitting"));
        assertEquals(5, LevenshteinRatio.indelDistance("kitten", "sitting"));
    }

    @Test
    @DisplayName("Ratio: scores are whole numbers")
    void testRatioRounded() {
        double score = ratio.compute("enterprise renewal", "enterprize renewals");
        assertEquals(Math.rint(score), score);
    }

    // ============ Partial Ratio Tests ============

    @Test
    @DisplayName("PartialRatio: contained string scores 100")
    void testPartialContained() {
        assertEquals(100.0, partialRatio.compute("acme", "acme corporation"));
        assertEquals(100.0, partialRatio.compute("acme corporation", "acme"));
    }

    @Test
    @DisplayName("PartialRatio: best window of the longer string")
    void testPartialWindow() {
        assertEquals(75.0, partialRatio.compute("abcd", "xxabce"));
    }

    // ============ Token Tests ============

    @Test
    @DisplayName("TokenSortRatio: word order does not matter")
    void testTokenSort() {
        assertEquals(100.0, tokenSortRatio.compute("deal alpha", "alpha deal"));
        assertEquals("alpha beta gamma", TokenSortRatio.sortTokens(" gamma alpha  beta"));
    }

    @Test
    @DisplayName("TokenSetRatio: extra words on one side are tolerated")
    void testTokenSet() {
        assertEquals(100.0, tokenSetRatio.compute("acme cloud migration", "cloud migration"));
        assertEquals(0.0, tokenSetRatio.compute("   ", "cloud"));
    }

    // ============ Dice Tests ============

    @Test
    @DisplayName("Dice: shared bigrams over total bigrams")
    void testDice() {
        assertEquals(25.0, dice.compute("night", "nacht"), 1e-9);
    }

    @Test
    @DisplayName("Dice: whitespace is ignored")
    void testDiceWhitespace() {
        assertEquals(100.0, dice.compute("a b", "ab"));
    }

    @Test
    @DisplayName("Dice: strings shorter than a bigram score 0")
    void testDiceShort() {
        assertEquals(0.0, dice.compute("a", "ab"));
        assertEquals(0.0, dice.compute("", ""));
    }

    @Test
    @DisplayName("Dice: repeated bigrams count with multiplicity")
    void testDiceMultiset() {
        // aaaa -> aa x3, aa -> aa x1: 2*1 / (3+1)
        assertEquals(50.0, dice.compute("aaaa", "aa"), 1e-9);
    }

    // ============ Fuzzy Matcher Tests ============

    @Test
    @DisplayName("Fuzzy: equal after normalization scores 100")
    void testFuzzyNormalizedEqual() {
        assertEquals(100.0, fuzzy.similarity("Acme Inc.", "  acme   inc"));
    }

    @Test
    @DisplayName("Fuzzy: missing input scores 0")
    void testFuzzyMissing() {
        assertEquals(0.0, fuzzy.similarity(null, "acme"));
        assertEquals(0.0, fuzzy.similarity("acme", ""));
        assertEquals(0.0, fuzzy.similarity("!!!", "acme"));
    }

    @ParameterizedTest
    @DisplayName("Fuzzy: symmetric and bounded")
    @CsvSource({
            "Enterprise License Renewal,Enterprise Licence Renewal",
            "Acme Corp,Acme Corporation",
            "Cloud Migration Phase 2,Phase 2 Cloud Migration",
            "alpha,omega",
            "Data Platform,Data Warehouse Platform"
    })
    void testFuzzySymmetricBounded(String a, String b) {
        double forward = fuzzy.similarity(a, b);
        double backward = fuzzy.similarity(b, a);
        assertEquals(forward, backward, 1e-9);
        assertTrue(forward >= 0.0 && forward <= 100.0, "Out of range: " + forward);
    }

    @Test
    @DisplayName("Fuzzy: best of all components")
    void testFuzzyBest() {
        FuzzyStringMatcher.FuzzyBreakdown breakdown =
                fuzzy.computeWithBreakdown("phase 2 cloud migration", "cloud migration phase 2");
        assertEquals(100.0, breakdown.tokenSortRatio());
        assertEquals(100.0, breakdown.best());
        assertEquals(5, fuzzy.getAlgorithms().size());
    }

    @Test
    @DisplayName("Fuzzy: unrelated names score low")
    void testFuzzyUnrelated() {
        double score = fuzzy.similarity("Globex", "Initech");
        assertTrue(score < 50.0, "Expected < 50, got " + score);
    }
}
