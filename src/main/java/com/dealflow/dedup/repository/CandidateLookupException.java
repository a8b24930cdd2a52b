package com.dealflow.dedup.repository;

/**
 * Thrown when candidate records cannot be loaded from the store.
 * Detection aborts rather than continuing on a partial pool.
 */
public class CandidateLookupException extends RuntimeException {

    public CandidateLookupException(String message) {
        super(message);
    }

    public CandidateLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
