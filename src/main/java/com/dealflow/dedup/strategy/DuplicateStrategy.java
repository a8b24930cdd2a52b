package com.dealflow.dedup.strategy;

import com.dealflow.dedup.core.model.ComparableRecord;
import com.dealflow.dedup.core.model.MatchCandidate;
import com.dealflow.dedup.core.model.StrategyType;

import java.util.List;

/**
 * One independent heuristic for spotting duplicates.
 * Implementations are stateless and safe to share between threads.
 */
public interface DuplicateStrategy {

    /**
     * The strategy tag stamped on every match this strategy produces.
     */
    StrategyType type();

    /**
     * Compares the record against every candidate and returns the candidates
     * that satisfy this strategy's trigger, in candidate order.
     *
     * @param record     the record being checked
     * @param candidates existing records, each with an id
     * @return zero or more matches, at most one per candidate
     */
    List<MatchCandidate> findMatches(ComparableRecord record, List<ComparableRecord> candidates);
}
