package com.dealflow.dedup.api;

import com.dealflow.dedup.cluster.ClusterScoring;
import com.dealflow.dedup.similarity.FieldWeights;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Immutable configuration for duplicate detection.
 * Thresholds, tolerances and weights are bound once into a detector when it is built.
 *
 * <p>Confidence thresholds are on the [0,1] scale and must be ordered
 * auto-merge &ge; high &ge; medium &ge; low. Fuzzy thresholds are on the
 * [0,100] scale used by the fuzzy string matcher.</p>
 *
 * <p>{@link #load()} reads the {@code duplicate.*} keys through MicroProfile Config, so
 * each key can be set in {@code META-INF/microprofile-config.properties}, as a system
 * property, or as an environment variable ({@code duplicate.batch-size} becomes
 * {@code DUPLICATE_BATCH_SIZE}). Unset keys keep the built-in defaults.</p>
 */
public class DetectionConfig {
    private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

    public static final String KEY_AUTO_MERGE_THRESHOLD = "duplicate.auto-merge-threshold";
    public static final String KEY_HIGH_CONFIDENCE_THRESHOLD = "duplicate.high-confidence-threshold";
    public static final String KEY_MEDIUM_CONFIDENCE_THRESHOLD = "duplicate.medium-confidence-threshold";
    public static final String KEY_LOW_CONFIDENCE_THRESHOLD = "duplicate.low-confidence-threshold";
    public static final String KEY_DETECTION_THRESHOLD = "duplicate.detection-threshold";
    public static final String KEY_FUZZY_EXACT_THRESHOLD = "duplicate.fuzzy.exact-threshold";
    public static final String KEY_FUZZY_HIGH_THRESHOLD = "duplicate.fuzzy.high-threshold";
    public static final String KEY_FUZZY_MEDIUM_THRESHOLD = "duplicate.fuzzy.medium-threshold";
    public static final String KEY_FUZZY_LOW_THRESHOLD = "duplicate.fuzzy.low-threshold";
    public static final String KEY_VALUE_TOLERANCE_PERCENT = "duplicate.value-tolerance-percent";
    public static final String KEY_DATE_TOLERANCE_DAYS = "duplicate.date-tolerance-days";
    public static final String KEY_BATCH_SIZE = "duplicate.batch-size";
    public static final String KEY_CANDIDATE_LIMIT = "duplicate.candidate-limit";
    public static final String KEY_ASYNC_TIMEOUT_SECONDS = "duplicate.async-timeout-seconds";
    public static final String KEY_CLUSTER_SCORING = "duplicate.cluster.scoring";
    public static final String KEY_CLUSTER_PLACEHOLDER_CONFIDENCE = "duplicate.cluster.placeholder-confidence";
    public static final String WEIGHT_KEY_PREFIX = "duplicate.weight.";

    private static final double DEFAULT_AUTO_MERGE_THRESHOLD = 0.95;
    private static final double DEFAULT_HIGH_CONFIDENCE_THRESHOLD = 0.85;
    private static final double DEFAULT_MEDIUM_CONFIDENCE_THRESHOLD = 0.70;
    private static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.50;
    private static final double DEFAULT_MINIMUM_MATCH_THRESHOLD = 0.85;
    private static final double DEFAULT_FUZZY_EXACT_THRESHOLD = 95;
    private static final double DEFAULT_FUZZY_HIGH_THRESHOLD = 85;
    private static final double DEFAULT_FUZZY_MEDIUM_THRESHOLD = 70;
    private static final double DEFAULT_FUZZY_LOW_THRESHOLD = 50;
    private static final double DEFAULT_VALUE_TOLERANCE_PERCENT = 10;
    private static final int DEFAULT_DATE_TOLERANCE_DAYS = 7;
    private static final int DEFAULT_BATCH_SIZE = 100;
    private static final int DEFAULT_CANDIDATE_LIMIT = 200;
    private static final double DEFAULT_CLUSTER_PLACEHOLDER_CONFIDENCE = 0.85;
    private static final Duration DEFAULT_ASYNC_TIMEOUT = Duration.ofSeconds(30);

    private final double autoMergeThreshold;
    private final double highConfidenceThreshold;
    private final double mediumConfidenceThreshold;
    private final double lowConfidenceThreshold;
    private final double minimumMatchThreshold;
    private final double fuzzyExactThreshold;
    private final double fuzzyHighThreshold;
    private final double fuzzyMediumThreshold;
    private final double fuzzyLowThreshold;
    private final double valueTolerancePercent;
    private final int dateToleranceDays;
    private final int batchSize;
    private final int candidateLimit;
    private final FieldWeights defaultWeights;
    private final double clusterPlaceholderConfidence;
    private final ClusterScoring clusterScoring;
    private final Duration asyncTimeout;

    private DetectionConfig(Builder builder) {
        this.autoMergeThreshold = builder.autoMergeThreshold;
        this.highConfidenceThreshold = builder.highConfidenceThreshold;
        this.mediumConfidenceThreshold = builder.mediumConfidenceThreshold;
        this.lowConfidenceThreshold = builder.lowConfidenceThreshold;
        this.minimumMatchThreshold = builder.minimumMatchThreshold;
        this.fuzzyExactThreshold = builder.fuzzyExactThreshold;
        this.fuzzyHighThreshold = builder.fuzzyHighThreshold;
        this.fuzzyMediumThreshold = builder.fuzzyMediumThreshold;
        this.fuzzyLowThreshold = builder.fuzzyLowThreshold;
        this.valueTolerancePercent = builder.valueTolerancePercent;
        this.dateToleranceDays = builder.dateToleranceDays;
        this.batchSize = builder.batchSize;
        this.candidateLimit = builder.candidateLimit;
        this.defaultWeights = builder.defaultWeights;
        this.clusterPlaceholderConfidence = builder.clusterPlaceholderConfidence;
        this.clusterScoring = builder.clusterScoring;
        this.asyncTimeout = builder.asyncTimeout;
    }

    public double getAutoMergeThreshold() {
        return autoMergeThreshold;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public double getMediumConfidenceThreshold() {
        return mediumConfidenceThreshold;
    }

    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    /**
     * Minimum confidence a match needs to be reported when the caller gives no threshold.
     */
    public double getMinimumMatchThreshold() {
        return minimumMatchThreshold;
    }

    public double getFuzzyExactThreshold() {
        return fuzzyExactThreshold;
    }

    public double getFuzzyHighThreshold() {
        return fuzzyHighThreshold;
    }

    public double getFuzzyMediumThreshold() {
        return fuzzyMediumThreshold;
    }

    public double getFuzzyLowThreshold() {
        return fuzzyLowThreshold;
    }

    public double getValueTolerancePercent() {
        return valueTolerancePercent;
    }

    public int getDateToleranceDays() {
        return dateToleranceDays;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getCandidateLimit() {
        return candidateLimit;
    }

    public FieldWeights getDefaultWeights() {
        return defaultWeights;
    }

    public double getClusterPlaceholderConfidence() {
        return clusterPlaceholderConfidence;
    }

    public ClusterScoring getClusterScoring() {
        return clusterScoring;
    }

    public Duration getAsyncTimeout() {
        return asyncTimeout;
    }

    /**
     * Creates the default configuration.
     */
    public static DetectionConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from the application's MicroProfile {@link Config}.
     */
    public static DetectionConfig load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    /**
     * Builds a configuration from the {@code duplicate.*} keys of the given config.
     * Unset keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be converted or is out of range
     */
    public static DetectionConfig fromConfig(Config config) {
        Builder builder = builder();
        FieldWeights weights = FieldWeights.defaultWeights();

        config.getOptionalValue(KEY_AUTO_MERGE_THRESHOLD, Double.class).ifPresent(builder::autoMergeThreshold);
        config.getOptionalValue(KEY_HIGH_CONFIDENCE_THRESHOLD, Double.class).ifPresent(builder::highConfidenceThreshold);
        config.getOptionalValue(KEY_MEDIUM_CONFIDENCE_THRESHOLD, Double.class)
                .ifPresent(builder::mediumConfidenceThreshold);
        config.getOptionalValue(KEY_LOW_CONFIDENCE_THRESHOLD, Double.class).ifPresent(builder::lowConfidenceThreshold);
        config.getOptionalValue(KEY_DETECTION_THRESHOLD, Double.class).ifPresent(builder::minimumMatchThreshold);
        config.getOptionalValue(KEY_FUZZY_EXACT_THRESHOLD, Double.class).ifPresent(builder::fuzzyExactThreshold);
        config.getOptionalValue(KEY_FUZZY_HIGH_THRESHOLD, Double.class).ifPresent(builder::fuzzyHighThreshold);
        config.getOptionalValue(KEY_FUZZY_MEDIUM_THRESHOLD, Double.class).ifPresent(builder::fuzzyMediumThreshold);
        config.getOptionalValue(KEY_FUZZY_LOW_THRESHOLD, Double.class).ifPresent(builder::fuzzyLowThreshold);
        config.getOptionalValue(KEY_VALUE_TOLERANCE_PERCENT, Double.class).ifPresent(builder::valueTolerancePercent);
        config.getOptionalValue(KEY_DATE_TOLERANCE_DAYS, Integer.class).ifPresent(builder::dateToleranceDays);
        config.getOptionalValue(KEY_BATCH_SIZE, Integer.class).ifPresent(builder::batchSize);
        config.getOptionalValue(KEY_CANDIDATE_LIMIT, Integer.class).ifPresent(builder::candidateLimit);
        config.getOptionalValue(KEY_CLUSTER_PLACEHOLDER_CONFIDENCE, Double.class)
                .ifPresent(builder::clusterPlaceholderConfidence);
        config.getOptionalValue(KEY_ASYNC_TIMEOUT_SECONDS, Double.class)
                .ifPresent(seconds -> builder.asyncTimeout(Duration.ofMillis(Math.round(seconds * 1000))));
        config.getOptionalValue(KEY_CLUSTER_SCORING, String.class)
                .map(DetectionConfig::parseScoring)
                .ifPresent(builder::clusterScoring);

        builder.defaultWeights(new FieldWeights(
                weight(config, "deal-name", weights.dealName()),
                weight(config, "customer-name", weights.customerName()),
                weight(config, "vendor-match", weights.vendorMatch()),
                weight(config, "deal-value", weights.dealValue()),
                weight(config, "close-date", weights.closeDate()),
                weight(config, "products", weights.products()),
                weight(config, "contacts", weights.contacts())));

        DetectionConfig loaded = builder.build();
        log.debug("Detection configuration loaded: {}", loaded);
        return loaded;
    }

    public Builder toBuilder() {
        return new Builder()
                .autoMergeThreshold(autoMergeThreshold)
                .highConfidenceThreshold(highConfidenceThreshold)
                .mediumConfidenceThreshold(mediumConfidenceThreshold)
                .lowConfidenceThreshold(lowConfidenceThreshold)
                .minimumMatchThreshold(minimumMatchThreshold)
                .fuzzyExactThreshold(fuzzyExactThreshold)
                .fuzzyHighThreshold(fuzzyHighThreshold)
                .fuzzyMediumThreshold(fuzzyMediumThreshold)
                .fuzzyLowThreshold(fuzzyLowThreshold)
                .valueTolerancePercent(valueTolerancePercent)
                .dateToleranceDays(dateToleranceDays)
                .batchSize(batchSize)
                .candidateLimit(candidateLimit)
                .defaultWeights(defaultWeights)
                .clusterPlaceholderConfidence(clusterPlaceholderConfidence)
                .clusterScoring(clusterScoring)
                .asyncTimeout(asyncTimeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "DetectionConfig{autoMerge=" + autoMergeThreshold
                + ", high=" + highConfidenceThreshold
                + ", medium=" + mediumConfidenceThreshold
                + ", low=" + lowConfidenceThreshold
                + ", minimumMatch=" + minimumMatchThreshold
                + ", valueTolerance=" + valueTolerancePercent + "%"
                + ", dateTolerance=" + dateToleranceDays + "d"
                + ", batchSize=" + batchSize
                + ", weights=" + defaultWeights + "}";
    }

    private static double weight(Config config, String field, double fallback) {
        return config.getOptionalValue(WEIGHT_KEY_PREFIX + field, Double.class).orElse(fallback);
    }

    private static ClusterScoring parseScoring(String value) {
        try {
            return ClusterScoring.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cluster scoring: " + value, e);
        }
    }

    public static class Builder {
        private double autoMergeThreshold = DEFAULT_AUTO_MERGE_THRESHOLD;
        private double highConfidenceThreshold = DEFAULT_HIGH_CONFIDENCE_THRESHOLD;
        private double mediumConfidenceThreshold = DEFAULT_MEDIUM_CONFIDENCE_THRESHOLD;
        private double lowConfidenceThreshold = DEFAULT_LOW_CONFIDENCE_THRESHOLD;
        private double minimumMatchThreshold = DEFAULT_MINIMUM_MATCH_THRESHOLD;
        private double fuzzyExactThreshold = DEFAULT_FUZZY_EXACT_THRESHOLD;
        private double fuzzyHighThreshold = DEFAULT_FUZZY_HIGH_THRESHOLD;
        private double fuzzyMediumThreshold = DEFAULT_FUZZY_MEDIUM_THRESHOLD;
        private double fuzzyLowThreshold = DEFAULT_FUZZY_LOW_THRESHOLD;
        private double valueTolerancePercent = DEFAULT_VALUE_TOLERANCE_PERCENT;
        private int dateToleranceDays = DEFAULT_DATE_TOLERANCE_DAYS;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int candidateLimit = DEFAULT_CANDIDATE_LIMIT;
        private FieldWeights defaultWeights = FieldWeights.defaultWeights();
        private double clusterPlaceholderConfidence = DEFAULT_CLUSTER_PLACEHOLDER_CONFIDENCE;
        private ClusterScoring clusterScoring = ClusterScoring.PLACEHOLDER;
        private Duration asyncTimeout = DEFAULT_ASYNC_TIMEOUT;

        public Builder autoMergeThreshold(double autoMergeThreshold) {
            validateThreshold(autoMergeThreshold, "autoMergeThreshold");
            this.autoMergeThreshold = autoMergeThreshold;
            return this;
        }

        public Builder highConfidenceThreshold(double highConfidenceThreshold) {
            validateThreshold(highConfidenceThreshold, "highConfidenceThreshold");
            this.highConfidenceThreshold = highConfidenceThreshold;
            return this;
        }

        public Builder mediumConfidenceThreshold(double mediumConfidenceThreshold) {
            validateThreshold(mediumConfidenceThreshold, "mediumConfidenceThreshold");
            this.mediumConfidenceThreshold = mediumConfidenceThreshold;
            return this;
        }

        public Builder lowConfidenceThreshold(double lowConfidenceThreshold) {
            validateThreshold(lowConfidenceThreshold, "lowConfidenceThreshold");
            this.lowConfidenceThreshold = lowConfidenceThreshold;
            return this;
        }

        public Builder minimumMatchThreshold(double minimumMatchThreshold) {
            validateThreshold(minimumMatchThreshold, "minimumMatchThreshold");
            this.minimumMatchThreshold = minimumMatchThreshold;
            return this;
        }

        public Builder fuzzyExactThreshold(double fuzzyExactThreshold) {
            validateFuzzyThreshold(fuzzyExactThreshold, "fuzzyExactThreshold");
            this.fuzzyExactThreshold = fuzzyExactThreshold;
            return this;
        }

        public Builder fuzzyHighThreshold(double fuzzyHighThreshold) {
            validateFuzzyThreshold(fuzzyHighThreshold, "fuzzyHighThreshold");
            this.fuzzyHighThreshold = fuzzyHighThreshold;
            return this;
        }

        public Builder fuzzyMediumThreshold(double fuzzyMediumThreshold) {
            validateFuzzyThreshold(fuzzyMediumThreshold, "fuzzyMediumThreshold");
            this.fuzzyMediumThreshold = fuzzyMediumThreshold;
            return this;
        }

        public Builder fuzzyLowThreshold(double fuzzyLowThreshold) {
            validateFuzzyThreshold(fuzzyLowThreshold, "fuzzyLowThreshold");
            this.fuzzyLowThreshold = fuzzyLowThreshold;
            return this;
        }

        public Builder valueTolerancePercent(double valueTolerancePercent) {
            if (!(valueTolerancePercent > 0)) {
                throw new IllegalArgumentException("valueTolerancePercent must be positive");
            }
            this.valueTolerancePercent = valueTolerancePercent;
            return this;
        }

        public Builder dateToleranceDays(int dateToleranceDays) {
            if (dateToleranceDays <= 0) {
                throw new IllegalArgumentException("dateToleranceDays must be positive");
            }
            this.dateToleranceDays = dateToleranceDays;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder candidateLimit(int candidateLimit) {
            if (candidateLimit <= 0) {
                throw new IllegalArgumentException("candidateLimit must be positive");
            }
            this.candidateLimit = candidateLimit;
            return this;
        }

        public Builder defaultWeights(FieldWeights defaultWeights) {
            if (defaultWeights == null) {
                throw new IllegalArgumentException("defaultWeights is required");
            }
            this.defaultWeights = defaultWeights;
            return this;
        }

        public Builder clusterPlaceholderConfidence(double clusterPlaceholderConfidence) {
            validateThreshold(clusterPlaceholderConfidence, "clusterPlaceholderConfidence");
            this.clusterPlaceholderConfidence = clusterPlaceholderConfidence;
            return this;
        }

        public Builder clusterScoring(ClusterScoring clusterScoring) {
            if (clusterScoring == null) {
                throw new IllegalArgumentException("clusterScoring is required");
            }
            this.clusterScoring = clusterScoring;
            return this;
        }

        public Builder asyncTimeout(Duration asyncTimeout) {
            if (asyncTimeout == null || asyncTimeout.isNegative() || asyncTimeout.isZero()) {
                throw new IllegalArgumentException("asyncTimeout must be positive");
            }
            this.asyncTimeout = asyncTimeout;
            return this;
        }

        public DetectionConfig build() {
            // Validate threshold ordering
            if (autoMergeThreshold < highConfidenceThreshold) {
                throw new IllegalArgumentException(
                        "autoMergeThreshold must be >= highConfidenceThreshold");
            }
            if (highConfidenceThreshold < mediumConfidenceThreshold) {
                throw new IllegalArgumentException(
                        "highConfidenceThreshold must be >= mediumConfidenceThreshold");
            }
            if (mediumConfidenceThreshold < lowConfidenceThreshold) {
                throw new IllegalArgumentException(
                        "mediumConfidenceThreshold must be >= lowConfidenceThreshold");
            }
            return new DetectionConfig(this);
        }

        private void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private void validateFuzzyThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
                throw new IllegalArgumentException(name + " must be between 0 and 100");
            }
        }
    }
}
