package com.ledgerradar.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceNormalizerTest {

    @Test
    void key_trimsAndLowercases() {
        assertThat(ReferenceNormalizer.key("  INV-0042 ")).isEqualTo("inv-0042");
        assertThat(ReferenceNormalizer.key("   ")).isNull();
        assertThat(ReferenceNormalizer.key(null)).isNull();
    }

    @Test
    void alphanumeric_dropsSeparators() {
        assertThat(ReferenceNormalizer.alphanumeric("HR01 INV/2025-007")).isEqualTo("hr01inv2025007");
        assertThat(ReferenceNormalizer.alphanumeric("--/ ")).isNull();
    }

    @Test
    void contentChecksum_isStableLowercaseHex() {
        String a = ContentChecksum.sha256Hex("statement".getBytes());
        assertThat(a).hasSize(64).matches("[0-9a-f]+");
        assertThat(ContentChecksum.sha256Hex("statement".getBytes())).isEqualTo(a);
        assertThat(ContentChecksum.sha256Hex("statement ".getBytes())).isNotEqualTo(a);
    }
}
