package com.dealflow.dedup.tracing;

import com.dealflow.dedup.core.model.SuggestedAction;

/**
 * Trace span around one detector operation. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.startSpan(DetectionOperation.DETECT, kind)) {
 *     span.setAttribute("candidates", pool.size());
 *     span.recordVerdict(matches.size(), topConfidence, action);
 *     span.succeed();
 * }
 * </pre>
 *
 * A span that is closed without {@link #succeed()} or {@link #fail(Throwable)} keeps an unset status.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    /**
     * Attaches the outcome of a single-record detection.
     */
    default void recordVerdict(int matches, double topConfidence, SuggestedAction action) {
        setAttribute("matches", matches);
        setAttribute("topConfidence", topConfidence);
        setAttribute("action", action.getTag());
    }

    void succeed();

    void fail(Throwable cause);

    @Override
    void close();
}
