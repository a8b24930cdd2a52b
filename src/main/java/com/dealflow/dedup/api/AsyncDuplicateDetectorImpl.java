package com.dealflow.dedup.api;

import com.dealflow.dedup.cluster.ClusterBuilder;
import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.DuplicateCluster;
import com.dealflow.dedup.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Thread-pool implementation of {@link AsyncDuplicateDetector}.
 * Detection is stateless, so records are processed on a fixed pool of daemon threads.
 *
 * <p>The configured async timeout bounds each detection from the moment it starts
 * running. Time spent queued behind the pool or the concurrency limit does not count.</p>
 */
public class AsyncDuplicateDetectorImpl implements AsyncDuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(AsyncDuplicateDetectorImpl.class);

    private final DuplicateDetectionService detectionService;
    private final ClusterBuilder clusterBuilder;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncDuplicateDetectorImpl(DuplicateDetectionService detectionService, ClusterBuilder clusterBuilder) {
        this(detectionService, clusterBuilder, Runtime.getRuntime().availableProcessors());
    }

    public AsyncDuplicateDetectorImpl(DuplicateDetectionService detectionService, ClusterBuilder clusterBuilder,
                                      int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.detectionService = detectionService;
        this.clusterBuilder = clusterBuilder;
        this.executor = Executors.newFixedThreadPool(threads, new DetectorThreadFactory());
        this.timeoutMs = detectionService.getConfig().getAsyncTimeout().toMillis();
    }

    @Override
    public CompletableFuture<DetectionResult> detectAsync(ComparableRecord record) {
        return detectAsync(record, DetectionOptions.defaults());
    }

    @Override
    public CompletableFuture<DetectionResult> detectAsync(ComparableRecord record, DetectionOptions options) {
        return startTimed(null, () -> detectionService.detect(record, options));
    }

    @Override
    public CompletableFuture<Map<String, DetectionResult>> detectBatchAsync(List<ComparableRecord> records,
                                                                            int maxConcurrency) {
        validateConcurrency(maxConcurrency);
        return startTimed(null, detectionService::fetchAll)
                .thenCompose(pool -> detectAll(records, DetectionOptions.against(pool), maxConcurrency));
    }

    @Override
    public CompletableFuture<List<DuplicateCluster>> clusterAsync(List<ComparableRecord> records,
                                                                  int maxConcurrency) {
        validateConcurrency(maxConcurrency);
        DetectionOptions options = clusterBuilder.pairwiseOptions(records, EntityKind.DEAL);
        return detectAll(records, options, maxConcurrency)
                .thenApply(results -> clusterBuilder.extractClusters(results, EntityKind.DEAL));
    }

    /**
     * Detects every record that has an id with bounded concurrency and collects
     * the results in input order once all of them are done.
     */
    private CompletableFuture<Map<String, DetectionResult>> detectAll(List<ComparableRecord> records,
                                                                      DetectionOptions options,
                                                                      int maxConcurrency) {
        Semaphore semaphore = new Semaphore(maxConcurrency);

        Map<String, CompletableFuture<DetectionResult>> futures = new LinkedHashMap<>();
        for (ComparableRecord record : records) {
            CompletableFuture<DetectionResult> future =
                    startTimed(semaphore, () -> detectionService.detect(record, options));
            if (record.hasId()) {
                futures.put(record.getId(), future);
            }
        }
        log.debug("Submitted {} detections with max concurrency {}", records.size(), maxConcurrency);

        return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    Map<String, DetectionResult> results = new LinkedHashMap<>();
                    futures.forEach((id, future) -> results.put(id, future.join()));
                    return results;
                });
    }

    /**
     * Runs the task on the pool, holding a permit of {@code semaphore} when one is given.
     * The timeout starts once the permit is held and the task is about to run.
     */
    private <T> CompletableFuture<T> startTimed(Semaphore semaphore, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> {
            if (semaphore != null) {
                try {
                    semaphore.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    result.completeExceptionally(e);
                    return;
                }
            }
            try {
                result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
                result.complete(task.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } finally {
                if (semaphore != null) {
                    semaphore.release();
                }
            }
        });
        return result;
    }

    private static void validateConcurrency(int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class DetectorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "duplicate-detector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
