package com.dealflow.dedup.strategy;

import com.dealflow.dedup.api.DetectionConfig;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.similarity.FieldSimilarity;
import com.dealflow.dedup.similarity.FuzzyStringMatcher;
import com.dealflow.dedup.similarity.WeightedSimilarityScorer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds one instance of each strategy, in canonical order.
 */
public class StrategyRegistry {

    private final Map<StrategyType, DuplicateStrategy> strategies;

    public StrategyRegistry(List<DuplicateStrategy> strategies) {
        Map<StrategyType, DuplicateStrategy> byType = new EnumMap<>(StrategyType.class);
        for (DuplicateStrategy strategy : strategies) {
            if (byType.put(strategy.type(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate strategy registered for " + strategy.type());
            }
        }
        this.strategies = Collections.unmodifiableMap(byType);
    }

    /**
     * Creates the six built-in strategies wired to the given configuration.
     */
    public static StrategyRegistry createDefault(DetectionConfig config) {
        FuzzyStringMatcher fuzzyMatcher = new FuzzyStringMatcher();
        FieldSimilarity fieldSimilarity = new FieldSimilarity(
                fuzzyMatcher, config.getValueTolerancePercent(), config.getDateToleranceDays());
        WeightedSimilarityScorer scorer = new WeightedSimilarityScorer(fieldSimilarity);

        return new StrategyRegistry(List.of(
                new ExactMatchStrategy(),
                new FuzzyNameStrategy(fuzzyMatcher, config),
                new CustomerValueStrategy(fieldSimilarity, config),
                new CustomerDateStrategy(fieldSimilarity, config),
                new VendorCustomerStrategy(fieldSimilarity),
                new MultiFactorStrategy(scorer, config)
        ));
    }

    /**
     * All registered strategies in {@link StrategyType} order.
     */
    public List<DuplicateStrategy> all() {
        return List.copyOf(strategies.values());
    }

    /**
     * The registered strategies whose type is in {@code enabled}, in canonical order.
     * A null set selects every strategy.
     */
    public List<DuplicateStrategy> select(Set<StrategyType> enabled) {
        if (enabled == null) {
            return all();
        }
        List<DuplicateStrategy> selected = new ArrayList<>();
        for (Map.Entry<StrategyType, DuplicateStrategy> entry : strategies.entrySet()) {
            if (enabled.contains(entry.getKey())) {
                selected.add(entry.getValue());
            }
        }
        return selected;
    }

    public DuplicateStrategy get(StrategyType type) {
        DuplicateStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("No strategy registered for " + type);
        }
        return strategy;
    }
}
