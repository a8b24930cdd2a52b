package com.dealflow.dedup.notification;

/**
 * Receives an event whenever a detection finds duplicates.
 * Callers treat notification as best effort: an exception thrown here is
 * logged and counted but never fails the detection.
 */
public interface DuplicateNotifier {

    void notifyDuplicate(DuplicateDetectedEvent event);
}
