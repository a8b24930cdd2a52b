package com.dealflow.dedup.api;

import com.dealflow.dedup.audit.DetectionLogService;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.SuggestedAction;
import com.dealflow.dedup.decision.DecisionPolicy;
import com.dealflow.dedup.decision.MatchAggregator;
import com.dealflow.dedup.logging.LogContext;
import com.dealflow.dedup.metrics.MetricsService;
import com.dealflow.dedup.notification.DuplicateDetectedEvent;
import com.dealflow.dedup.notification.DuplicateNotifier;
import com.dealflow.dedup.repository.CandidateLookupException;
import com.dealflow.dedup.repository.RecordRepository;
import com.dealflow.dedup.strategy.DuplicateStrategy;
import com.dealflow.dedup.strategy.StrategyRegistry;
import com.dealflow.dedup.tracing.Span;
import com.dealflow.dedup.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-record duplicate detection.
 *
 * <p>Builds the candidate pool, runs the enabled strategies, aggregates their matches
 * and suggests an action. When the pool came from the repository and the record has
 * an id, the top match is logged and a notification is sent; both are best effort.</p>
 */
public class DuplicateDetectionService {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetectionService.class);

    static final String NOTIFICATION_SIDE_EFFECT = "notification";

    private final DetectionConfig config;
    private final StrategyRegistry strategyRegistry;
    private final MatchAggregator aggregator;
    private final DecisionPolicy decisionPolicy;
    private final RecordRepository recordRepository;
    private final DetectionLogService detectionLogService;
    private final DuplicateNotifier notifier;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public DuplicateDetectionService(DetectionConfig config,
                                     StrategyRegistry strategyRegistry,
                                     MatchAggregator aggregator,
                                     DecisionPolicy decisionPolicy,
                                     RecordRepository recordRepository,
                                     DetectionLogService detectionLogService,
                                     DuplicateNotifier notifier,
                                     MetricsService metricsService,
                                     TracingService tracingService) {
        this.config = config;
        this.strategyRegistry = strategyRegistry;
        this.aggregator = aggregator;
        this.decisionPolicy = decisionPolicy;
        this.recordRepository = recordRepository;
        this.detectionLogService = detectionLogService;
        this.notifier = notifier;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public DetectionResult detect(ComparableRecord record) {
        return detect(record, DetectionOptions.defaults());
    }

    /**
     * Detects duplicates of one record.
     *
     * @throws CandidateLookupException if the candidate pool cannot be loaded
     */
    public DetectionResult detect(ComparableRecord record, DetectionOptions options) {
        long start = System.nanoTime();
        EntityKind kind = options.getEntityKind();

        try (LogContext ctx = LogContext.forDetection(LogContext.currentOrNewCorrelationId(), kind, record.getId());
             Span span = tracingService.startSpan(DetectionOperation.DETECT, kind)) {
            try {
                List<ComparableRecord> pool = options.hasCandidates()
                        ? options.getCandidates()
                        : fetchCandidates(record);
                pool = eligibleCandidates(record, pool);
                span.setAttribute("candidates", pool.size());

                if (pool.isEmpty()) {
                    log.debug("No candidates for '{}', nothing to compare", record.getDealName());
                    recordMetrics(DetectionResult.empty(), start);
                    span.succeed();
                    return DetectionResult.empty();
                }

                List<MatchCandidate> rawMatches = new ArrayList<>();
                for (DuplicateStrategy strategy : strategyRegistry.select(options.getStrategies())) {
                    List<MatchCandidate> found = strategy.findMatches(record, pool);
                    log.debug("Strategy {} found {} matches", strategy.type().getTag(), found.size());
                    metricsService.incrementStrategyMatches(strategy.type(), found.size());
                    rawMatches.addAll(found);
                }

                double threshold = options.getThreshold() != null
                        ? options.getThreshold()
                        : config.getMinimumMatchThreshold();
                List<MatchCandidate> matches = aggregator.aggregate(rawMatches, threshold);
                double maxConfidence = matches.isEmpty() ? 0.0 : matches.get(0).confidence();
                SuggestedAction action = decisionPolicy.decide(maxConfidence);
                DetectionResult result = new DetectionResult(!matches.isEmpty(), matches, action, maxConfidence);

                if (!options.hasCandidates() && record.hasId() && result.isDuplicate()) {
                    runSideEffects(kind, record, result);
                }

                log.info("Duplicate detection completed: dealId={} dealName='{}' matches={} topConfidence={} action={}",
                        record.getId(), record.getDealName(), matches.size(), maxConfidence, action.getTag());

                recordMetrics(result, start);
                span.recordVerdict(matches.size(), maxConfidence, action);
                span.succeed();
                return result;
            } catch (RuntimeException e) {
                log.error("Duplicate detection failed for dealId={} dealName='{}': {}",
                        record.getId(), record.getDealName(), e.getMessage(), e);
                span.fail(e);
                throw e;
            }
        }
    }

    /**
     * Loads the bounded candidate pool for the record from the repository.
     *
     * @throws CandidateLookupException if the repository fails
     */
    public List<ComparableRecord> fetchCandidates(ComparableRecord record) {
        try {
            return recordRepository.findCandidates(record);
        } catch (CandidateLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CandidateLookupException("Failed to load candidates for " + describe(record), e);
        }
    }

    /**
     * Loads every stored record.
     *
     * @throws CandidateLookupException if the repository fails
     */
    public List<ComparableRecord> fetchAll() {
        try {
            return recordRepository.findAll();
        } catch (CandidateLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CandidateLookupException("Failed to load existing records", e);
        }
    }

    public DetectionConfig getConfig() {
        return config;
    }

    /**
     * Drops candidates without an id and the record itself.
     */
    static List<ComparableRecord> eligibleCandidates(ComparableRecord record, List<ComparableRecord> pool) {
        List<ComparableRecord> eligible = new ArrayList<>(pool.size());
        for (ComparableRecord candidate : pool) {
            if (candidate == null || !candidate.hasId()) {
                continue;
            }
            if (record.hasId() && record.getId().equals(candidate.getId())) {
                continue;
            }
            eligible.add(candidate);
        }
        return eligible;
    }

    private void runSideEffects(EntityKind kind, ComparableRecord record, DetectionResult result) {
        result.topMatch().ifPresent(top -> detectionLogService.record(kind, record.getId(), top));

        try {
            notifier.notifyDuplicate(DuplicateDetectedEvent.from(record, result));
        } catch (RuntimeException e) {
            log.warn("Failed to send duplicate notification for dealId={}: {}", record.getId(), e.getMessage());
            metricsService.incrementSideEffectFailure(NOTIFICATION_SIDE_EFFECT);
        }
    }

    private void recordMetrics(DetectionResult result, long startNanos) {
        metricsService.recordDetectionDuration(result.suggestedAction(), Duration.ofNanos(System.nanoTime() - startNanos));
        metricsService.recordMatchCount(result.matchCount());
        if (result.isDuplicate()) {
            metricsService.recordTopConfidence(result.confidence());
        }
    }

    private static String describe(ComparableRecord record) {
        return record.hasId() ? "record " + record.getId() : "record '" + record.getDealName() + "'";
    }
}
