package com.dealflow.dedup.bulk;

import com.dealflow.dedup.core.model.MatchCandidate;

import java.util.List;

/**
 * A record whose duplicates come from a different source than the record itself.
 *
 * @param dealId   id of the record
 * @param dealName name of the record
 * @param sourceId the record's source
 * @param matches  matches from other sources, best first
 */
public record CrossSourceDuplicate(
        String dealId,
        String dealName,
        String sourceId,
        List<MatchCandidate> matches
) {
    public CrossSourceDuplicate {
        matches = List.copyOf(matches);
    }
}
