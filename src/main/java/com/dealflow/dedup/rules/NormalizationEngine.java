package com.dealflow.dedup.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules to field values.
 *
 * <p>Values are lowercased and trimmed first. Single-pass rules then run in
 * priority order (lower number first). Repeatable rules run last, as a group,
 * until the value reaches a fixed point.</p>
 *
 * <p>The engine is immutable once built and safe to share between threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final int MAX_REPEAT_PASSES = 32;

    private final List<NormalizationRule> singlePassRules;
    private final List<NormalizationRule> repeatableRules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.singlePassRules = sorted.stream().filter(r -> !r.repeatable()).toList();
        this.repeatableRules = sorted.stream().filter(NormalizationRule::repeatable).toList();
    }

    /**
     * Gets all rules, single-pass rules first.
     */
    public List<NormalizationRule> getRules() {
        List<NormalizationRule> all = new ArrayList<>(singlePassRules);
        all.addAll(repeatableRules);
        return List.copyOf(all);
    }

    /**
     * Normalizes the given value for a field kind. Never fails; null or empty
     * input yields an empty string.
     */
    public String normalize(String value, FieldKind kind) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        String result = value.toLowerCase(Locale.ROOT).trim();

        for (NormalizationRule rule : singlePassRules) {
            if (rule.appliesTo(kind)) {
                result = rule.apply(result);
            }
        }

        for (int pass = 0; pass < MAX_REPEAT_PASSES; pass++) {
            String before = result;
            for (NormalizationRule rule : repeatableRules) {
                if (rule.appliesTo(kind)) {
                    result = rule.apply(result);
                }
            }
            if (before.equals(result)) {
                break;
            }
            log.trace("Repeatable rules transformed '{}' -> '{}'", before, result);
        }

        return result;
    }

    /**
     * Checks if two values are equal after normalization.
     */
    public boolean areEquivalent(String value1, String value2, FieldKind kind) {
        return normalize(value1, kind).equals(normalize(value2, kind));
    }
}
