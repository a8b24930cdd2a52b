package com.dealflow.dedup.repository;

import com.dealflow.dedup.core.model.ComparableRecord;

import java.util.List;

/**
 * Source of existing records to compare against.
 * Implementations throw {@link CandidateLookupException} instead of returning partial data.
 */
public interface RecordRepository {

    /**
     * Returns a bounded, pre-filtered pool of plausible duplicates for the record.
     * This is a narrowing query, not an exhaustive scan of the store.
     */
    List<ComparableRecord> findCandidates(ComparableRecord record);

    /**
     * Returns every stored record that is not rejected. Used by batch detection, which
     * fetches the pool once.
     */
    List<ComparableRecord> findAll();
}
