package com.example.f30.application.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityTest {

    @Test
    void selfComparisonIsOne() {
        assertThat(TextSimilarity.tokenSetRatio("SOC COMERCIAL GAS MACUL LIMITADA", "SOC COMERCIAL GAS MACUL LIMITADA"))
                .isEqualTo(1.0);
    }

    @Test
    void similarityIsSymmetric() {
        String left = "Ruth Marina Aguayo Saez";
        String right = "AGUAYO SAEZ RUTH M.";

        assertThat(TextSimilarity.tokenSetRatio(left, right))
                .isEqualTo(TextSimilarity.tokenSetRatio(right, left));
    }

    @Test
    void ignoresCaseAccentsPunctuationAndWordOrder() {
        assertThat(TextSimilarity.tokenSetRatio("Razón Social Ñandú Ltda.", "ltda razon social nandu"))
                .isEqualTo(1.0);
    }

    @Test
    void subsetOfTokensScoresHigh() {
        assertThat(TextSimilarity.tokenSetRatio("SOC COMERCIAL GAS MACUL LIMITADA", "Soc Comercial Gas Macul Limitad"))
                .isGreaterThan(0.95);
    }

    @Test
    void tokenSubsetScoresAsFullMatch() {
        assertThat(TextSimilarity.tokenSetRatio("GAS LIMITADA", "SOC COMERCIAL GAS MACUL LIMITADA")).isEqualTo(1.0);
        assertThat(TextSimilarity.tokenSetRatio("SOC COMERCIAL GAS MACUL LIMITADA", "GAS LIMITADA")).isEqualTo(1.0);
    }

    @Test
    void unrelatedNamesScoreLow() {
        assertThat(TextSimilarity.tokenSetRatio("SOC COMERCIAL GAS MACUL LIMITADA", "Inversiones Pacifico Norte SpA"))
                .isLessThan(0.85);
    }

    @Test
    void emptyInputs() {
        assertThat(TextSimilarity.tokenSetRatio("", "  ")).isEqualTo(1.0);
        assertThat(TextSimilarity.tokenSetRatio("name", null)).isEqualTo(0.0);
    }

    @Test
    void ratioIsLongestCommonSubsequenceBased() {
        assertThat(TextSimilarity.ratio("abcd", "abed")).isCloseTo(0.75, within(1e-9));
    }
}
