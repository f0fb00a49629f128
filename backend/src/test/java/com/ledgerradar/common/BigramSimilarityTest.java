package com.ledgerradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BigramSimilarityTest {

    @Test
    @DisplayName("identical strings score 100, case-insensitively")
    void identical() {
        assertThat(BigramSimilarity.similarity("Uplata INV-0042", "Uplata INV-0042")).isEqualTo(100.0);
        assertThat(BigramSimilarity.similarity("ACME d.o.o.", "acme D.O.O.")).isEqualTo(100.0);
    }

    @Test
    @DisplayName("similarity is symmetric")
    void symmetric() {
        String a = "Payment for invoice 42 ACME";
        String b = "ACME invoice 42 payment";
        assertThat(BigramSimilarity.similarity(a, b)).isEqualTo(BigramSimilarity.similarity(b, a));
    }

    @Test
    @DisplayName("Jaccard over bigram sets: night vs nacht share only 'ht'")
    void jaccardValue() {
        // night: ni ig gh ht; nacht: na ac ch ht; union 7, intersection 1
        assertThat(BigramSimilarity.similarity("night", "nacht")).isCloseTo(100.0 / 7, within(1e-9));
    }

    @Test
    @DisplayName("strings without bigrams: equal -> 100, different -> 0")
    void shortStrings() {
        assertThat(BigramSimilarity.similarity("a", "A")).isEqualTo(100.0);
        assertThat(BigramSimilarity.similarity("a", "b")).isEqualTo(0.0);
        assertThat(BigramSimilarity.similarity("", null)).isEqualTo(100.0);
        assertThat(BigramSimilarity.similarity("ab", "")).isEqualTo(0.0);
    }
}
