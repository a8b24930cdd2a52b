package com.dealflow.dedup.audit;

import com.dealflow.dedup.core.model.EntityKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link DetectionLogRepository}.
 * Thread-safe; the entry id of the first insert is kept across updates.
 */
public class InMemoryDetectionLogRepository implements DetectionLogRepository {

    private final Map<DetectionLogEntry.PairKey, DetectionLogEntry> entries = new ConcurrentHashMap<>();

    @Override
    public DetectionLogEntry upsert(DetectionLogEntry entry) {
        return entries.merge(entry.pairKey(), entry, (existing, update) -> new DetectionLogEntry(
                existing.id(),
                existing.entityKind(),
                existing.entityId1(),
                existing.entityId2(),
                update.similarityScore(),
                update.confidence(),
                update.strategy(),
                update.similarityFactors(),
                update.status(),
                existing.detectedBy(),
                update.detectedAt()));
    }

    @Override
    public Optional<DetectionLogEntry> findByPair(EntityKind kind, String entityId1, String entityId2) {
        DetectionLogEntry entry = entries.get(new DetectionLogEntry.PairKey(kind, entityId1, entityId2));
        if (entry == null) {
            entry = entries.get(new DetectionLogEntry.PairKey(kind, entityId2, entityId1));
        }
        return Optional.ofNullable(entry);
    }

    @Override
    public List<DetectionLogEntry> findByEntityId(String entityId) {
        return entries.values().stream()
                .filter(e -> entityId.equals(e.entityId1()) || entityId.equals(e.entityId2()))
                .collect(Collectors.toList());
    }

    @Override
    public List<DetectionLogEntry> findByStatus(DetectionLogStatus status) {
        return entries.values().stream()
                .filter(e -> e.status() == status)
                .collect(Collectors.toList());
    }

    @Override
    public List<DetectionLogEntry> findAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public int count() {
        return entries.size();
    }
}
