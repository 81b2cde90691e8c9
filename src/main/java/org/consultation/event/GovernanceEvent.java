package org.consultation.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured notification of one committed operation: its type, the ledger time
 * at which it happened and the key identifiers / resulting values, in insertion order.
 */
public class GovernanceEvent {

    private final EventType type;
    private final long timestamp;
    private final Map<String, String> attributes;

    public GovernanceEvent(EventType type, long timestamp, Map<String, String> attributes) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.timestamp = timestamp;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder(EventType type, long timestamp) {
        return new Builder(type, timestamp);
    }

    public EventType getType() {
        return type;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String get(String attribute) {
        return attributes.get(attribute);
    }

    @Override
    public String toString() {
        return "GovernanceEvent{" +
                "type=" + type +
                ", timestamp=" + timestamp +
                ", attributes=" + attributes +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GovernanceEvent that = (GovernanceEvent) o;
        return timestamp == that.timestamp && type == that.type && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, timestamp, attributes);
    }

    public static final class Builder {
        private final EventType type;
        private final long timestamp;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(EventType type, long timestamp) {
            this.type = type;
            this.timestamp = timestamp;
        }

        public Builder with(String name, Object value) {
            attributes.put(name, String.valueOf(value));
            return this;
        }

        public GovernanceEvent build() {
            return new GovernanceEvent(type, timestamp, attributes);
        }
    }
}
