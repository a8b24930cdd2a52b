package com.dealflow.dedup.audit;

import com.dealflow.dedup.core.model.EntityKind;

import java.util.List;
import java.util.Optional;

/**
 * Storage for detection log entries.
 */
public interface DetectionLogRepository {

    /**
     * Inserts the entry, or replaces the scores, strategy, factors, status and
     * detection time of the entry already stored for the same pair.
     * Idempotent for repeated detections of one pair.
     *
     * @return the stored entry
     */
    DetectionLogEntry upsert(DetectionLogEntry entry);

    Optional<DetectionLogEntry> findByPair(EntityKind kind, String entityId1, String entityId2);

    /**
     * Entries in which the entity appears on either side.
     */
    List<DetectionLogEntry> findByEntityId(String entityId);

    List<DetectionLogEntry> findByStatus(DetectionLogStatus status);

    List<DetectionLogEntry> findAll();

    int count();
}
