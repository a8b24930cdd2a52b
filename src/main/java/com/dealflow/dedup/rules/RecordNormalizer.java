package com.dealflow.dedup.rules;

/**
 * Static entry points for the two normalizations every comparison relies on.
 * Both are pure and total.
 */
public final class RecordNormalizer {

    private static final NormalizationEngine ENGINE = DefaultNormalizationRules.createDefaultEngine();

    private RecordNormalizer() {
        // Utility class
    }

    /**
     * Lowercases, trims, removes characters that are neither word characters
     * nor whitespace, and collapses whitespace runs to a single space.
     */
    public static String normalizeString(String value) {
        return ENGINE.normalize(value, FieldKind.TEXT);
    }

    /**
     * {@link #normalizeString(String)} followed by repeated removal of
     * trailing legal-entity suffixes such as "inc" or "llc".
     */
    public static String normalizeCompanyName(String value) {
        return ENGINE.normalize(value, FieldKind.COMPANY_NAME);
    }
}
