package com.dealflow.dedup.similarity;

import com.dealflow.dedup.core.model.ContactRecord;
import com.dealflow.dedup.rules.RecordNormalizer;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Per-field similarity functions. Every function returns a value in [0,1]
 * and treats missing input as "no evidence" (0) rather than an error.
 */
public class FieldSimilarity {

    public static final double DEFAULT_VALUE_TOLERANCE_PERCENT = 10.0;
    public static final int DEFAULT_DATE_TOLERANCE_DAYS = 7;

    private static final double NEAR_BAND_DROP = 0.3;
    private static final double FAR_BAND_START = 0.7;
    private static final int VALUE_FAR_MULTIPLIER = 3;
    private static final int DATE_FAR_MULTIPLIER = 4;

    private final FuzzyStringMatcher fuzzyMatcher;
    private final double valueTolerancePercent;
    private final int dateToleranceDays;

    public FieldSimilarity() {
        this(new FuzzyStringMatcher(), DEFAULT_VALUE_TOLERANCE_PERCENT, DEFAULT_DATE_TOLERANCE_DAYS);
    }

    public FieldSimilarity(FuzzyStringMatcher fuzzyMatcher, double valueTolerancePercent, int dateToleranceDays) {
        if (valueTolerancePercent <= 0) {
            throw new IllegalArgumentException("Value tolerance must be positive, got " + valueTolerancePercent);
        }
        if (dateToleranceDays <= 0) {
            throw new IllegalArgumentException("Date tolerance must be positive, got " + dateToleranceDays);
        }
        this.fuzzyMatcher = fuzzyMatcher;
        this.valueTolerancePercent = valueTolerancePercent;
        this.dateToleranceDays = dateToleranceDays;
    }

    /**
     * Fuzzy similarity of two deal names, scaled to [0,1].
     */
    public double dealNameSimilarity(String name1, String name2) {
        if (isBlank(name1) || isBlank(name2)) {
            return 0.0;
        }
        return fuzzyMatcher.similarity(name1, name2) / 100.0;
    }

    /**
     * Fuzzy similarity of two company names after legal suffixes are removed.
     */
    public double customerNameSimilarity(String name1, String name2) {
        if (isBlank(name1) || isBlank(name2)) {
            return 0.0;
        }
        return fuzzyMatcher.compute(
                RecordNormalizer.normalizeCompanyName(name1),
                RecordNormalizer.normalizeCompanyName(name2)) / 100.0;
    }

    /**
     * Compares two amounts by their percentage difference relative to their average.
     * Within the tolerance the score falls linearly from 1.0 to 0.7, then to 0
     * at three times the tolerance. Missing or zero amounts score 0.
     */
    public double valueSimilarity(Double value1, Double value2) {
        if (!isUsable(value1) || !isUsable(value2)) {
            return 0.0;
        }
        if (value1.doubleValue() == value2.doubleValue()) {
            return 1.0;
        }

        double average = Math.abs((value1 + value2) / 2.0);
        if (average == 0.0) {
            return 0.0;
        }
        double percentDiff = Math.abs(value1 - value2) / average * 100.0;
        return banded(percentDiff, valueTolerancePercent, VALUE_FAR_MULTIPLIER);
    }

    /**
     * Compares two dates by their distance in days. Same shape as
     * {@link #valueSimilarity(Double, Double)} with the far band ending at
     * four times the tolerance.
     */
    public double dateSimilarity(LocalDate date1, LocalDate date2) {
        if (date1 == null || date2 == null) {
            return 0.0;
        }
        long dayDiff = Math.abs(ChronoUnit.DAYS.between(date1, date2));
        if (dayDiff == 0) {
            return 1.0;
        }
        return banded(dayDiff, dateToleranceDays, DATE_FAR_MULTIPLIER);
    }

    /**
     * Jaccard similarity of the normalized product names.
     */
    public double productSimilarity(Collection<String> products1, Collection<String> products2) {
        if (products1 == null || products2 == null || products1.isEmpty() || products2.isEmpty()) {
            return 0.0;
        }
        return SetSimilarity.jaccard(normalizeAll(products1), normalizeAll(products2));
    }

    /**
     * Jaccard similarity of the lower-cased contact email addresses.
     * Contacts without an email are ignored.
     */
    public double contactSimilarity(Collection<ContactRecord> contacts1, Collection<ContactRecord> contacts2) {
        if (contacts1 == null || contacts2 == null) {
            return 0.0;
        }
        return SetSimilarity.jaccard(emails(contacts1), emails(contacts2));
    }

    public double getValueTolerancePercent() {
        return valueTolerancePercent;
    }

    public int getDateToleranceDays() {
        return dateToleranceDays;
    }

    private static double banded(double difference, double tolerance, int farMultiplier) {
        if (difference <= tolerance) {
            return 1.0 - (difference / tolerance) * NEAR_BAND_DROP;
        }
        double maxDifference = tolerance * farMultiplier;
        if (difference > maxDifference) {
            return 0.0;
        }
        return FAR_BAND_START - ((difference - tolerance) / (maxDifference - tolerance)) * FAR_BAND_START;
    }

    private static boolean isUsable(Double value) {
        return value != null && value != 0.0 && !value.isNaN() && !value.isInfinite();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    private static List<String> normalizeAll(Collection<String> values) {
        List<String> normalized = new ArrayList<>(values.size());
        for (String value : values) {
            normalized.add(RecordNormalizer.normalizeString(value));
        }
        return normalized;
    }

    private static List<String> emails(Collection<ContactRecord> contacts) {
        List<String> emails = new ArrayList<>();
        for (ContactRecord contact : contacts) {
            if (contact != null && contact.hasEmail()) {
                emails.add(contact.email().toLowerCase(Locale.ROOT));
            }
        }
        return emails;
    }
}
