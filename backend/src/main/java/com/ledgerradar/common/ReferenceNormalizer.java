package com.ledgerradar.common;

import java.util.Locale;

/**
 * Normalizes free-text keys (bank references, invoice numbers, counterparty names) for comparison.
 */
public final class ReferenceNormalizer {

    private ReferenceNormalizer() {
    }

    /** Trimmed, lowercased; null or blank becomes null. */
    public static String key(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip().toLowerCase(Locale.ROOT);
    }

    /** Lowercase letters and digits only; null or nothing left becomes null. */
    public static String alphanumeric(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        return normalized.isEmpty() ? null : normalized;
    }
}
