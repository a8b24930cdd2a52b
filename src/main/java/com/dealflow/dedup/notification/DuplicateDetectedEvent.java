package com.dealflow.dedup.notification;

import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.DetectionResult;
import com.dealflow.dedup.core.model.MatchCandidate;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of the {@value #EVENT_TYPE} event.
 * Carries at most {@value #MAX_SUMMARIZED_MATCHES} match summaries, best first.
 */
public record DuplicateDetectedEvent(
        String dealId,
        String dealName,
        int matchesCount,
        double topConfidence,
        String suggestedAction,
        List<MatchSummary> matches
) {
    public static final String EVENT_TYPE = "duplicate.detected";
    public static final int MAX_SUMMARIZED_MATCHES = 3;

    public DuplicateDetectedEvent {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static DuplicateDetectedEvent from(ComparableRecord record, DetectionResult result) {
        List<MatchSummary> summaries = new ArrayList<>();
        for (MatchCandidate match : result.matches()) {
            if (summaries.size() == MAX_SUMMARIZED_MATCHES) {
                break;
            }
            summaries.add(new MatchSummary(match.matchedEntityId(), match.confidence(), match.reasoning()));
        }
        return new DuplicateDetectedEvent(
                record.getId(),
                record.getDealName(),
                result.matchCount(),
                result.confidence(),
                result.suggestedAction().getTag(),
                summaries);
    }

    public record MatchSummary(String matchedEntityId, double confidence, String reasoning) {
    }
}
