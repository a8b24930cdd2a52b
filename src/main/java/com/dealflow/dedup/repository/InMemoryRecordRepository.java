package com.dealflow.dedup.repository;

import com.dealflow.dedup.core.model.ComparableRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RecordRepository}. Thread-safe.
 *
 * <p>Candidates are records that are not rejected and whose customer name contains
 * the new record's customer name (case-insensitive), or that share its vendor id.
 * They are returned newest first, up to the candidate limit. A blank or missing customer
 * name matches no rows through the customer clause (unlike SQL {@code LIKE '%%'}, which
 * matches everything), so such a record only finds candidates by vendor id.</p>
 *
 * <p>{@link #findAll()} also skips rejected records, oldest first.</p>
 */
public class InMemoryRecordRepository implements RecordRepository {

    public static final String REJECTED_STATUS = "rejected";
    private static final int DEFAULT_CANDIDATE_LIMIT = 200;

    private final Map<String, ComparableRecord> records = new ConcurrentHashMap<>();
    private final int candidateLimit;

    public InMemoryRecordRepository() {
        this(DEFAULT_CANDIDATE_LIMIT);
    }

    public InMemoryRecordRepository(int candidateLimit) {
        if (candidateLimit <= 0) {
            throw new IllegalArgumentException("candidateLimit must be positive");
        }
        this.candidateLimit = candidateLimit;
    }

    /**
     * Stores or replaces a record. The record must have an id.
     */
    public ComparableRecord save(ComparableRecord record) {
        if (!record.hasId()) {
            throw new IllegalArgumentException("Only records with an id can be stored");
        }
        records.put(record.getId(), record);
        return record;
    }

    public void saveAll(Collection<ComparableRecord> toSave) {
        toSave.forEach(this::save);
    }

    public Optional<ComparableRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public int count() {
        return records.size();
    }

    @Override
    public List<ComparableRecord> findCandidates(ComparableRecord record) {
        String customer = record.getCustomerName() != null
                ? record.getCustomerName().trim().toLowerCase(Locale.ROOT) : "";

        return records.values().stream()
                .filter(InMemoryRecordRepository::isActive)
                .filter(existing -> customerContains(existing, customer) || sameVendor(existing, record))
                .sorted(Comparator.comparing(ComparableRecord::getCreatedAt).reversed())
                .limit(candidateLimit)
                .collect(Collectors.toList());
    }

    @Override
    public List<ComparableRecord> findAll() {
        return records.values().stream()
                .filter(InMemoryRecordRepository::isActive)
                .sorted(Comparator.comparing(ComparableRecord::getCreatedAt))
                .collect(Collectors.toList());
    }

    private static boolean isActive(ComparableRecord existing) {
        return !REJECTED_STATUS.equalsIgnoreCase(existing.getStatus());
    }

    private static boolean customerContains(ComparableRecord existing, String customer) {
        return !customer.isEmpty()
                && existing.getCustomerName() != null
                && existing.getCustomerName().toLowerCase(Locale.ROOT).contains(customer);
    }

    private static boolean sameVendor(ComparableRecord existing, ComparableRecord record) {
        return record.hasVendorId() && record.getVendorId().equals(existing.getVendorId());
    }
}
