package com.dealflow.dedup.bulk;

import com.dealflow.dedup.api.DetectionOptions;
import com.dealflow.dedup.api.DuplicateDetectionService;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.logging.LogContext;
import com.dealflow.dedup.metrics.MetricsService;
import com.dealflow.dedup.tracing.Span;
import com.dealflow.dedup.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detection over many records at once.
 *
 * <p>The existing records are fetched once and every input record is compared
 * against that shared pool, in chunks of the configured batch size. Because the pool
 * is supplied explicitly, batch runs never write detection logs or send notifications.</p>
 */
public class BatchDetector {
    private static final Logger log = LoggerFactory.getLogger(BatchDetector.class);

    static final String REJECTED_STATUS = "rejected";

    private final DuplicateDetectionService detectionService;
    private final int batchSize;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public BatchDetector(DuplicateDetectionService detectionService, MetricsService metricsService,
                         TracingService tracingService) {
        this.detectionService = detectionService;
        this.batchSize = detectionService.getConfig().getBatchSize();
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public Map<String, DetectionResult> detectBatch(List<ComparableRecord> records) {
        return detectBatch(records, ProgressCallback.NOOP);
    }

    /**
     * Detects duplicates for every record against all stored records.
     * Records without an id are compared but left out of the result.
     *
     * @return results keyed by record id, in input order
     */
    public Map<String, DetectionResult> detectBatch(List<ComparableRecord> records, ProgressCallback progress) {
        try (LogContext ctx = LogContext.forBatch(LogContext.currentOrNewCorrelationId(), EntityKind.DEAL);
             Span span = tracingService.startSpan(DetectionOperation.BATCH, EntityKind.DEAL)) {
            span.setAttribute("records", records.size());
            log.info("Starting batch duplicate detection for {} records", records.size());

            List<ComparableRecord> pool = detectionService.fetchAll();
            Map<String, DetectionResult> results = detectAgainst(records, pool, progress);

            metricsService.recordBatchSize(records.size());
            long duplicates = results.values().stream().filter(DetectionResult::isDuplicate).count();
            log.info("Batch duplicate detection completed: records={} withId={} duplicates={}",
                    records.size(), results.size(), duplicates);
            span.setAttribute("duplicates", duplicates);
            span.succeed();
            return results;
        }
    }

    /**
     * Finds duplicates that span sources. Each record is compared against the other
     * supplied records, and only matches from a different source are kept.
     * Rejected records take no part.
     *
     * @throws IllegalArgumentException if the records come from fewer than two sources
     */
    public List<CrossSourceDuplicate> detectCrossSource(List<ComparableRecord> records) {
        List<ComparableRecord> active = new ArrayList<>();
        Set<String> sources = new LinkedHashSet<>();
        for (ComparableRecord record : records) {
            if (REJECTED_STATUS.equalsIgnoreCase(record.getStatus())) {
                continue;
            }
            active.add(record);
            if (record.getSourceId() != null) {
                sources.add(record.getSourceId());
            }
        }
        if (sources.size() < 2) {
            throw new IllegalArgumentException(
                    "Cross-source detection needs records from at least 2 sources, got " + sources.size());
        }

        Map<String, ComparableRecord> byId = new HashMap<>();
        for (ComparableRecord record : active) {
            if (record.hasId()) {
                byId.put(record.getId(), record);
            }
        }

        Map<String, DetectionResult> results = detectAgainst(active, active, ProgressCallback.NOOP);
        List<CrossSourceDuplicate> duplicates = new ArrayList<>();
        results.forEach((id, result) -> {
            if (!result.isDuplicate()) {
                return;
            }
            ComparableRecord record = byId.get(id);
            List<MatchCandidate> crossSource = new ArrayList<>();
            for (MatchCandidate match : result.matches()) {
                ComparableRecord matched = byId.get(match.matchedEntityId());
                if (matched != null && !sameSource(matched, record)) {
                    crossSource.add(match);
                }
            }
            if (!crossSource.isEmpty()) {
                duplicates.add(new CrossSourceDuplicate(id, record.getDealName(), record.getSourceId(), crossSource));
            }
        });

        log.info("Cross-source duplicate detection completed: sources={} records={} duplicates={}",
                sources.size(), active.size(), duplicates.size());
        return duplicates;
    }

    /**
     * Returns up to {@code limit} stored records that are duplicates of the record, best first.
     * The confidence floor is the larger of {@code minSimilarity} and the configured minimum
     * match threshold. A lookup only: nothing is logged or notified.
     */
    public List<MatchCandidate> findSimilar(ComparableRecord record, double minSimilarity, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        DetectionOptions options = DetectionOptions.builder()
                .candidates(detectionService.fetchCandidates(record))
                .threshold(Math.max(minSimilarity, detectionService.getConfig().getMinimumMatchThreshold()))
                .build();
        List<MatchCandidate> matches = detectionService.detect(record, options).matches();
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    private Map<String, DetectionResult> detectAgainst(List<ComparableRecord> records,
                                                       List<ComparableRecord> pool,
                                                       ProgressCallback progress) {
        Map<String, DetectionResult> results = new LinkedHashMap<>();
        DetectionOptions options = DetectionOptions.against(pool);
        int total = records.size();
        int batches = (total + batchSize - 1) / batchSize;

        for (int start = 0; start < total; start += batchSize) {
            int end = Math.min(start + batchSize, total);
            for (ComparableRecord record : records.subList(start, end)) {
                DetectionResult result = detectionService.detect(record, options);
                if (record.hasId()) {
                    results.put(record.getId(), result);
                }
            }
            int batchNumber = start / batchSize + 1;
            String message = "Processed batch " + batchNumber + "/" + batches;
            log.debug("{} ({} of {} records)", message, end, total);
            progress.onProgress(end, total, message);
        }
        return results;
    }

    private static boolean sameSource(ComparableRecord a, ComparableRecord b) {
        return a.getSourceId() == null ? b.getSourceId() == null : a.getSourceId().equals(b.getSourceId());
    }
}
