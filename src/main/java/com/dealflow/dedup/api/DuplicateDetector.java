package com.dealflow.dedup.api;

import com.dealflow.dedup.audit.DetectionLogRepository;
import com.dealflow.dedup.audit.DetectionLogService;
import com.dealflow.dedup.audit.InMemoryDetectionLogRepository;
import com.dealflow.dedup.bulk.BatchDetector;
import com.dealflow.dedup.bulk.CrossSourceDuplicate;
import com.dealflow.dedup.bulk.ProgressCallback;
import com.dealflow.dedup.cluster.ClusterBuilder;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.DuplicateCluster;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.SimilarityScore;
import com.dealflow.dedup.decision.ConfidenceLevel;
import com.dealflow.dedup.decision.DecisionPolicy;
import com.dealflow.dedup.decision.MatchAggregator;
import com.dealflow.dedup.metrics.MetricsService;
import com.dealflow.dedup.metrics.NoOpMetricsService;
import com.dealflow.dedup.notification.DuplicateNotifier;
import com.dealflow.dedup.notification.NoOpDuplicateNotifier;
import com.dealflow.dedup.repository.InMemoryRecordRepository;
import com.dealflow.dedup.repository.RecordRepository;
import com.dealflow.dedup.similarity.FieldSimilarity;
import com.dealflow.dedup.similarity.FieldWeights;
import com.dealflow.dedup.similarity.FuzzyStringMatcher;
import com.dealflow.dedup.similarity.WeightedSimilarityScorer;
import com.dealflow.dedup.strategy.StrategyRegistry;
import com.dealflow.dedup.tracing.NoOpTracingService;
import com.dealflow.dedup.tracing.TracingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Main entry point for duplicate detection.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * DuplicateDetector detector = DuplicateDetector.builder()
 *     .config(DetectionConfig.load())
 *     .recordRepository(repository)
 *     .notifier(new LoggingDuplicateNotifier())
 *     .build();
 *
 * // Single record against the stored candidates
 * DetectionResult result = detector.detect(deal);
 *
 * // Many records against all stored records
 * Map&lt;String, DetectionResult&gt; results = detector.detectBatch(deals);
 *
 * // Transitive groups
 * List&lt;DuplicateCluster&gt; clusters = detector.cluster(deals);
 * </pre>
 *
 * <p>The configuration is bound once at build time. A detector is thread-safe.</p>
 */
public class DuplicateDetector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final DetectionConfig config;
    private final DuplicateDetectionService service;
    private final BatchDetector batchDetector;
    private final ClusterBuilder clusterBuilder;
    private final WeightedSimilarityScorer scorer;
    private final DecisionPolicy decisionPolicy;
    private final DetectionLogService detectionLogService;
    private final int asyncThreads;
    private AsyncDuplicateDetectorImpl asyncDetector;

    private DuplicateDetector(Builder builder) {
        this.config = builder.config;
        this.asyncThreads = builder.asyncThreads;

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        RecordRepository recordRepository = builder.recordRepository != null
                ? builder.recordRepository : new InMemoryRecordRepository(config.getCandidateLimit());
        DetectionLogRepository logRepository = builder.detectionLogRepository != null
                ? builder.detectionLogRepository : new InMemoryDetectionLogRepository();
        DuplicateNotifier notifier = builder.notifier != null
                ? builder.notifier : new NoOpDuplicateNotifier();
        ObjectMapper objectMapper = builder.objectMapper != null
                ? builder.objectMapper : new ObjectMapper();
        StrategyRegistry strategyRegistry = builder.strategyRegistry != null
                ? builder.strategyRegistry : StrategyRegistry.createDefault(config);

        this.scorer = new WeightedSimilarityScorer(new FieldSimilarity(
                new FuzzyStringMatcher(), config.getValueTolerancePercent(), config.getDateToleranceDays()));
        this.decisionPolicy = new DecisionPolicy(config);
        this.detectionLogService = new DetectionLogService(logRepository, objectMapper, metricsService);

        this.service = new DuplicateDetectionService(
                config, strategyRegistry, new MatchAggregator(), decisionPolicy, recordRepository,
                detectionLogService, notifier, metricsService, tracingService);
        this.batchDetector = new BatchDetector(service, metricsService, tracingService);
        this.clusterBuilder = new ClusterBuilder(service, metricsService, tracingService);

        log.info("DuplicateDetector initialized: {}", config);
    }

    // ========== Detection API ==========

    /**
     * Detects duplicates of the record among the stored candidates.
     */
    public DetectionResult detect(ComparableRecord record) {
        return service.detect(record);
    }

    public DetectionResult detect(ComparableRecord record, DetectionOptions options) {
        return service.detect(record, options);
    }

    public Map<String, DetectionResult> detectBatch(List<ComparableRecord> records) {
        return batchDetector.detectBatch(records);
    }

    public Map<String, DetectionResult> detectBatch(List<ComparableRecord> records, ProgressCallback progress) {
        return batchDetector.detectBatch(records, progress);
    }

    public List<CrossSourceDuplicate> detectCrossSource(List<ComparableRecord> records) {
        return batchDetector.detectCrossSource(records);
    }

    public List<MatchCandidate> findSimilar(ComparableRecord record, double minSimilarity, int limit) {
        return batchDetector.findSimilar(record, minSimilarity, limit);
    }

    // ========== Clustering API ==========

    public List<DuplicateCluster> cluster(List<ComparableRecord> records) {
        return clusterBuilder.cluster(records);
    }

    public List<DuplicateCluster> cluster(List<ComparableRecord> records, EntityKind kind) {
        return clusterBuilder.cluster(records, kind);
    }

    // ========== Scoring API ==========

    /**
     * Weighted similarity of two records with the configured default weights.
     */
    public SimilarityScore score(ComparableRecord a, ComparableRecord b) {
        return scorer.score(a, b, config.getDefaultWeights());
    }

    public SimilarityScore score(ComparableRecord a, ComparableRecord b, FieldWeights weights) {
        return scorer.score(a, b, weights);
    }

    public ConfidenceLevel classify(double confidence) {
        return decisionPolicy.classify(confidence);
    }

    // ========== Accessors ==========

    /**
     * Returns the asynchronous view of this detector. Its thread pool is created on
     * first use and shut down when this detector is closed.
     */
    public synchronized AsyncDuplicateDetector async() {
        if (asyncDetector == null) {
            asyncDetector = new AsyncDuplicateDetectorImpl(service, clusterBuilder, asyncThreads);
        }
        return asyncDetector;
    }

    public DetectionConfig getConfig() {
        return config;
    }

    public DetectionLogService getDetectionLogService() {
        return detectionLogService;
    }

    @Override
    public synchronized void close() {
        if (asyncDetector != null) {
            asyncDetector.close();
            asyncDetector = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DetectionConfig config = DetectionConfig.defaults();
        private RecordRepository recordRepository;
        private DetectionLogRepository detectionLogRepository;
        private DuplicateNotifier notifier;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ObjectMapper objectMapper;
        private StrategyRegistry strategyRegistry;
        private int asyncThreads = Runtime.getRuntime().availableProcessors();

        public Builder config(DetectionConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config is required");
            }
            this.config = config;
            return this;
        }

        public Builder recordRepository(RecordRepository recordRepository) {
            this.recordRepository = recordRepository;
            return this;
        }

        public Builder detectionLogRepository(DetectionLogRepository detectionLogRepository) {
            this.detectionLogRepository = detectionLogRepository;
            return this;
        }

        public Builder notifier(DuplicateNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Replaces the built-in strategies. Mostly useful in tests.
         */
        public Builder strategyRegistry(StrategyRegistry strategyRegistry) {
            this.strategyRegistry = strategyRegistry;
            return this;
        }

        public Builder asyncThreads(int asyncThreads) {
            if (asyncThreads <= 0) {
                throw new IllegalArgumentException("asyncThreads must be positive");
            }
            this.asyncThreads = asyncThreads;
            return this;
        }

        public DuplicateDetector build() {
            return new DuplicateDetector(this);
        }
    }
}
