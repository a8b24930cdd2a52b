package com.dealflow.dedup.audit;

import com.dealflow.dedup.core.model.EntityKind;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.StrategyType;
import com.dealflow.dedup.metrics.MetricsService;
import com.dealflow.dedup.metrics.NoOpMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Best-effort recording of detected duplicates.
 * A failure to serialize or store an entry is logged and counted, never thrown.
 */
public class DetectionLogService {
    private static final Logger log = LoggerFactory.getLogger(DetectionLogService.class);

    static final String SIDE_EFFECT = "detection_log";

    private final DetectionLogRepository repository;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    public DetectionLogService(DetectionLogRepository repository) {
        this(repository, new ObjectMapper(), new NoOpMetricsService());
    }

    public DetectionLogService(DetectionLogRepository repository, ObjectMapper objectMapper,
                               MetricsService metricsService) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    /**
     * Records a match between {@code entityId} and the matched entity as a pending detection.
     *
     * @return the stored entry, or empty if recording failed
     */
    public Optional<DetectionLogEntry> record(EntityKind kind, String entityId, MatchCandidate match) {
        try {
            DetectionLogEntry entry = DetectionLogEntry.builder()
                    .entityKind(kind)
                    .pair(entityId, match.matchedEntityId())
                    .similarityScore(match.similarityScore())
                    .confidence(match.confidence())
                    .strategy(match.strategy())
                    .similarityFactors(objectMapper.writeValueAsString(match.factors().toKeyedMap()))
                    .status(DetectionLogStatus.PENDING)
                    .build();
            DetectionLogEntry stored = repository.upsert(entry);
            log.debug("Detection logged: {} ~ {} via {} ({})",
                    stored.entityId1(), stored.entityId2(), stored.strategy().getTag(), stored.confidence());
            return Optional.of(stored);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize similarity factors for {} ~ {}: {}",
                    entityId, match.matchedEntityId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to log duplicate detection for {} ~ {}: {}",
                    entityId, match.matchedEntityId(), e.getMessage());
        }
        metricsService.incrementSideEffectFailure(SIDE_EFFECT);
        return Optional.empty();
    }

    public List<DetectionLogEntry> findForEntity(String entityId) {
        return repository.findByEntityId(entityId);
    }

    public List<DetectionLogEntry> findPending() {
        return repository.findByStatus(DetectionLogStatus.PENDING);
    }

    /**
     * Pending detections of the given kind at or above {@code minConfidence},
     * most confident first. These are the pairs ready for review or merge.
     */
    public List<DetectionLogEntry> findHighConfidence(EntityKind kind, double minConfidence, int limit) {
        return repository.findByStatus(DetectionLogStatus.PENDING).stream()
                .filter(e -> e.entityKind() == kind)
                .filter(e -> e.confidence() >= minConfidence)
                .sorted(Comparator.comparingDouble(DetectionLogEntry::confidence).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Statistics per entity kind over the entries detected at or after {@code since}.
     * Kinds without entries in the window are left out.
     */
    public List<DetectionStatistics> statistics(Instant since) {
        Map<EntityKind, List<DetectionLogEntry>> byKind = repository.findAll().stream()
                .filter(e -> !e.detectedAt().isBefore(since))
                .collect(Collectors.groupingBy(DetectionLogEntry::entityKind,
                        () -> new EnumMap<>(EntityKind.class), Collectors.toList()));

        List<DetectionStatistics> statistics = new ArrayList<>();
        byKind.forEach((kind, entries) -> statistics.add(summarize(kind, entries)));
        return statistics;
    }

    /**
     * Statistics for one entity kind over the entries detected at or after {@code since}.
     */
    public DetectionStatistics statistics(EntityKind kind, Instant since) {
        List<DetectionLogEntry> entries = repository.findAll().stream()
                .filter(e -> e.entityKind() == kind)
                .filter(e -> !e.detectedAt().isBefore(since))
                .collect(Collectors.toList());
        return entries.isEmpty() ? DetectionStatistics.empty(kind) : summarize(kind, entries);
    }

    private static DetectionStatistics summarize(EntityKind kind, List<DetectionLogEntry> entries) {
        Map<DetectionLogStatus, Long> byStatus = entries.stream()
                .collect(Collectors.groupingBy(DetectionLogEntry::status,
                        () -> new EnumMap<>(DetectionLogStatus.class), Collectors.counting()));
        double average = entries.stream().mapToDouble(DetectionLogEntry::confidence).average().orElse(0.0);
        long veryHigh = entries.stream()
                .filter(e -> e.confidence() >= DetectionStatistics.VERY_HIGH_CONFIDENCE)
                .count();
        long high = entries.stream()
                .filter(e -> e.confidence() >= DetectionStatistics.HIGH_CONFIDENCE
                        && e.confidence() < DetectionStatistics.VERY_HIGH_CONFIDENCE)
                .count();

        Map<StrategyType, List<DetectionLogEntry>> byStrategy = entries.stream()
                .collect(Collectors.groupingBy(DetectionLogEntry::strategy,
                        () -> new EnumMap<>(StrategyType.class), Collectors.toList()));
        List<DetectionStatistics.StrategyUsage> breakdown = new ArrayList<>();
        byStrategy.forEach((strategy, used) -> breakdown.add(new DetectionStatistics.StrategyUsage(strategy,
                used.size(), used.stream().mapToDouble(DetectionLogEntry::confidence).average().orElse(0.0))));
        breakdown.sort(Comparator.comparingLong(DetectionStatistics.StrategyUsage::usageCount).reversed());

        return new DetectionStatistics(kind, entries.size(), byStatus, average, veryHigh, high, breakdown);
    }
}
