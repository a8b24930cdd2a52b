package com.dealflow.dedup.decision;

import com.dealflow.dedup.core.model.MatchCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles the matches of several strategies into one ranked list.
 *
 * <p>For each matched id only the highest-confidence match is kept; on a tie the
 * first one seen wins. Matches below the threshold are dropped and the rest are
 * sorted by descending confidence. The sort is stable, so equal confidences keep
 * their discovery order.</p>
 */
public class MatchAggregator {

    public List<MatchCandidate> aggregate(List<MatchCandidate> matches, double threshold) {
        Map<String, MatchCandidate> best = new LinkedHashMap<>();
        for (MatchCandidate match : matches) {
            MatchCandidate existing = best.get(match.matchedEntityId());
            if (existing == null || match.confidence() > existing.confidence()) {
                best.put(match.matchedEntityId(), match);
            }
        }

        List<MatchCandidate> result = new ArrayList<>();
        for (MatchCandidate match : best.values()) {
            if (match.confidence() >= threshold) {
                result.add(match);
            }
        }
        result.sort(Comparator.comparingDouble(MatchCandidate::confidence).reversed());
        return result;
    }
}
