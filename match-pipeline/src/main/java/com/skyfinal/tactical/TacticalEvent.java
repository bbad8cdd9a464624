package com.skyfinal.tactical;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A derived, higher-level fact meant for human consumption.
 *
 * Never mutated after creation; the metadata map is an unmodifiable copy.
 */
public class TacticalEvent {

    private final TacticalEventType type;
    private final Instant timestamp;
    private final String description;
    private final Map<String, String> metadata;

    public TacticalEvent(TacticalEventType type, Instant timestamp, String description, Map<String, String> metadata) {
        this.type = type;
        this.timestamp = timestamp;
        this.description = description;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public TacticalEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "TacticalEvent{" +
                "type=" + type +
                ", timestamp=" + timestamp +
                ", description='" + description + '\'' +
                '}';
    }
}
