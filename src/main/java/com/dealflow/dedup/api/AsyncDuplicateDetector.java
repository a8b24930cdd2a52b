package com.dealflow.dedup.api;

import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.DuplicateCluster;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous variant of the detector. Each call returns a {@link CompletableFuture}
 * that fails with a timeout after the configured async timeout.
 */
public interface AsyncDuplicateDetector extends AutoCloseable {

    CompletableFuture<DetectionResult> detectAsync(ComparableRecord record);

    CompletableFuture<DetectionResult> detectAsync(ComparableRecord record, DetectionOptions options);

    /**
     * Runs batch detection with at most {@code maxConcurrency} records in flight.
     * The result has the same content as the synchronous batch detection.
     */
    CompletableFuture<Map<String, DetectionResult>> detectBatchAsync(List<ComparableRecord> records,
                                                                     int maxConcurrency);

    /**
     * Runs the pairwise detections in parallel, waits for all of them, then
     * extracts clusters exactly as the synchronous cluster builder does.
     */
    CompletableFuture<List<DuplicateCluster>> clusterAsync(List<ComparableRecord> records, int maxConcurrency);

    @Override
    void close();
}
