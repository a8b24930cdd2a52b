package com.dealflow.dedup.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ranked verdict of a duplicate detection run for one record.
 * Matches are sorted by descending confidence with at most one entry per matched id.
 */
public record DetectionResult(
        boolean isDuplicate,
        List<MatchCandidate> matches,
        SuggestedAction suggestedAction,
        double confidence
) {
    private static final DetectionResult EMPTY = new DetectionResult(false, List.of(), SuggestedAction.NO_ACTION, 0.0);

    public DetectionResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
        Objects.requireNonNull(suggestedAction, "suggestedAction is required");
    }

    /**
     * Result for a record with no candidates or no match above threshold.
     */
    public static DetectionResult empty() {
        return EMPTY;
    }

    public Optional<MatchCandidate> topMatch() {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    public int matchCount() {
        return matches.size();
    }
}
