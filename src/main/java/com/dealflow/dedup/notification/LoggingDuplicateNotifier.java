package com.dealflow.dedup.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event to the log at INFO.
 */
public class LoggingDuplicateNotifier implements DuplicateNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingDuplicateNotifier.class);

    @Override
    public void notifyDuplicate(DuplicateDetectedEvent event) {
        log.info("{} dealId={} dealName='{}' matches={} topConfidence={} action={}",
                DuplicateDetectedEvent.EVENT_TYPE, event.dealId(), event.dealName(),
                event.matchesCount(), event.topConfidence(), event.suggestedAction());
        for (DuplicateDetectedEvent.MatchSummary match : event.matches()) {
            log.debug("  match {} ({}): {}", match.matchedEntityId(), match.confidence(), match.reasoning());
        }
    }
}
