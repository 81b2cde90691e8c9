package org.consultation.event;

/**
 * Receives one notification per successful mutating operation, after commit.
 * Implementations may fail; the publishing component logs the failure and
 * carries on.
 */
public interface EventSink {

    EventSink NONE = event -> {
    };

    void publish(GovernanceEvent event);

    /**
     * Publishes to this sink, then to {@code next}.
     */
    default EventSink andThen(EventSink next) {
        return event -> {
            publish(event);
            next.publish(event);
        };
    }
}
