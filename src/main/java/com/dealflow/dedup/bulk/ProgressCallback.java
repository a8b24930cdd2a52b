package com.dealflow.dedup.bulk;

/**
 * Receives progress of a batch detection after each chunk.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records processed so far
     * @param total     records in the batch
     * @param message   short progress description
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
