package com.dealflow.dedup.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules used for deal, customer and product comparisons.
 */
public final class DefaultNormalizationRules {

    /**
     * Legal-entity suffixes stripped from the end of company names.
     */
    public static final List<String> LEGAL_SUFFIXES =
            List.of("inc", "corp", "corporation", "llc", "ltd", "limited", "co", "company");

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>(getCommonRules());
        rules.addAll(getCompanyRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Rules that apply to every field kind.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Anything that is not a word character or whitespace
                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^\\w\\s]")
                        .replacement("")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    /**
     * Trailing legal suffix rules for company names, one per suffix, in the
     * order of {@link #LEGAL_SUFFIXES}.
     */
    public static List<NormalizationRule> getCompanyRules() {
        List<NormalizationRule> rules = new ArrayList<>();
        int priority = 300;
        for (String suffix : LEGAL_SUFFIXES) {
            rules.add(NormalizationRule.builder()
                    .name("company-" + suffix)
                    .pattern("\\b" + suffix + "\\b$")
                    .replacement("")
                    .applicableKinds(FieldKind.COMPANY_NAME)
                    .priority(priority++)
                    .repeatable(true)
                    .trimAfter(true)
                    .build());
        }
        return List.copyOf(rules);
    }
}
