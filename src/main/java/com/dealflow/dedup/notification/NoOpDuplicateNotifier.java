package com.dealflow.dedup.notification;

/**
 * Notifier that discards every event.
 */
public class NoOpDuplicateNotifier implements DuplicateNotifier {

    @Override
    public void notifyDuplicate(DuplicateDetectedEvent event) {
    }
}
