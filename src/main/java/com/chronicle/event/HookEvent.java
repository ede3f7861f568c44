package com.chronicle.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical, validated hook event. One subclass per hook name; each adds its known fields
 * and contributes them to the persisted data map.
 */
public abstract class HookEvent {

    private final EventHeader header;

    protected HookEvent(EventHeader header) {
        this.header = header;
    }

    public EventHeader getHeader() {
        return header;
    }

    public HookEventName getHookEventName() {
        return header.getHookEventName();
    }

    public EventType getEventType() {
        return header.getHookEventName().getEventType();
    }

    public String getExternalSessionId() {
        return header.getExternalSessionId();
    }

    public Instant getTimestamp() {
        return header.getTimestamp();
    }

    public Optional<String> getWorkingDirectory() {
        return header.getWorkingDirectory();
    }

    public Optional<String> getToolName() {
        return Optional.empty();
    }

    public Optional<Long> getDurationMs() {
        return Optional.empty();
    }

    /**
     * Event payload as stored: variant fields first, unrecognised input keys under {@code extras}.
     */
    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        header.getTranscriptReference().ifPresent(t -> data.put("transcript_path", t));
        header.getWorkingDirectory().ifPresent(w -> data.put("cwd", w));
        contributeData(data);
        if (!header.extrasView().isEmpty()) {
            data.put("extras", new LinkedHashMap<>(header.extrasView()));
        }
        return data;
    }

    protected abstract void contributeData(Map<String, Object> data);

    protected static void putIfPresent(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }

    @Override
    public String toString() {
        return String.format("%s{session='%s', at=%s}", getHookEventName(), getExternalSessionId(), getTimestamp());
    }
}
