package com.chronicle.storage;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.chronicle.event.EventType;

/**
 * Persisted event. Written against an external session id; the backend resolves it to its
 * own session row when inserting.
 */
public final class EventRecord {

    private final String id;
    private final String sessionId;
    private final String externalSessionId;
    private final EventType eventType;
    private final String hookEventName;
    private final Instant timestamp;
    private final Map<String, Object> data;
    private final String toolName;
    private final Long durationMs;
    private final Instant createdAt;

    private EventRecord(Builder builder) {
        if (builder.durationMs != null && builder.durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative: " + builder.durationMs);
        }
        this.id = builder.id;
        this.sessionId = builder.sessionId;
        this.externalSessionId = builder.externalSessionId;
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        this.hookEventName = builder.hookEventName;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
        this.data = builder.data != null ? new LinkedHashMap<>(builder.data) : new LinkedHashMap<>();
        this.toolName = builder.toolName;
        this.durationMs = builder.durationMs;
        this.createdAt = builder.createdAt;
    }

    public static Builder builder(EventType eventType, Instant timestamp) {
        return new Builder(eventType, timestamp);
    }

    public Optional<String> getId() { return Optional.ofNullable(id); }
    public Optional<String> getSessionId() { return Optional.ofNullable(sessionId); }
    public Optional<String> getExternalSessionId() { return Optional.ofNullable(externalSessionId); }
    public EventType getEventType() { return eventType; }
    public Optional<String> getHookEventName() { return Optional.ofNullable(hookEventName); }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, Object> getData() { return data; }
    public Optional<String> getToolName() { return Optional.ofNullable(toolName); }
    public Optional<Long> getDurationMs() { return Optional.ofNullable(durationMs); }
    public Optional<Instant> getCreatedAt() { return Optional.ofNullable(createdAt); }

    @Override
    public String toString() {
        return String.format("Event{type=%s, session='%s', at=%s}", eventType,
                sessionId != null ? sessionId : externalSessionId, timestamp);
    }

    public static final class Builder {
        private String id;
        private String sessionId;
        private String externalSessionId;
        private final EventType eventType;
        private String hookEventName;
        private final Instant timestamp;
        private Map<String, Object> data;
        private String toolName;
        private Long durationMs;
        private Instant createdAt;

        private Builder(EventType eventType, Instant timestamp) {
            this.eventType = eventType;
            this.timestamp = timestamp;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder externalSessionId(String externalSessionId) { this.externalSessionId = externalSessionId; return this; }
        public Builder hookEventName(String hookEventName) { this.hookEventName = hookEventName; return this; }
        public Builder data(Map<String, Object> data) { this.data = data; return this; }
        public Builder toolName(String toolName) { this.toolName = toolName; return this; }
        public Builder durationMs(Long durationMs) { this.durationMs = durationMs; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public EventRecord build() {
            return new EventRecord(this);
        }
    }
}
