package com.chronicle.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fields every hook event carries, plus the input keys no variant recognises.
 */
public final class EventHeader {

    private final HookEventName hookEventName;
    private final String externalSessionId;
    private final Instant timestamp;
    private final String workingDirectory;
    private final String transcriptReference;
    private final Map<String, Object> extras;

    public EventHeader(HookEventName hookEventName, String externalSessionId, Instant timestamp,
            String workingDirectory, String transcriptReference, Map<String, Object> extras) {
        this.hookEventName = Objects.requireNonNull(hookEventName, "hookEventName");
        this.externalSessionId = Objects.requireNonNull(externalSessionId, "externalSessionId");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.workingDirectory = workingDirectory;
        this.transcriptReference = transcriptReference;
        this.extras = extras != null ? new LinkedHashMap<>(extras) : new LinkedHashMap<>();
    }

    public HookEventName getHookEventName() { return hookEventName; }
    public String getExternalSessionId() { return externalSessionId; }
    public Instant getTimestamp() { return timestamp; }
    public Optional<String> getWorkingDirectory() { return Optional.ofNullable(workingDirectory); }
    public Optional<String> getTranscriptReference() { return Optional.ofNullable(transcriptReference); }
    public Map<String, Object> getExtras() { return Collections.unmodifiableMap(extras); }

    Map<String, Object> extrasView() {
        return extras;
    }
}
