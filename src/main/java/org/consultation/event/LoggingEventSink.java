package org.consultation.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the {@code org.consultation.event} log at INFO.
 */
public class LoggingEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void publish(GovernanceEvent event) {
        log.info("[Event] {} at {} {}", event.getType(), event.getTimestamp(), event.getAttributes());
    }
}
