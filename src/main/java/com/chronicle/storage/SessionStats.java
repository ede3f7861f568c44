package com.chronicle.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates derived from a session's event log at read time.
 */
public final class SessionStats {

    private final long totalEvents;
    private final long toolUses;
    private final long prompts;
    private final Instant startTime;
    private final Instant endTime;

    public SessionStats(long totalEvents, long toolUses, long prompts, Instant startTime, Instant endTime) {
        this.totalEvents = totalEvents;
        this.toolUses = toolUses;
        this.prompts = prompts;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public long getTotalEvents() { return totalEvents; }
    public long getToolUses() { return toolUses; }
    public long getPrompts() { return prompts; }
    public Instant getStartTime() { return startTime; }
    public Optional<Instant> getEndTime() { return Optional.ofNullable(endTime); }

    /** Session duration in milliseconds, present once the session has ended. */
    public Optional<Long> getDurationMs() {
        if (startTime == null || endTime == null) {
            return Optional.empty();
        }
        return Optional.of(Math.max(0, Duration.between(startTime, endTime).toMillis()));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_events", totalEvents);
        map.put("tool_uses", toolUses);
        map.put("prompts", prompts);
        getDurationMs().ifPresent(d -> map.put("session_duration_ms", d));
        return map;
    }

    @Override
    public String toString() {
        return String.format("SessionStats{events=%d, tools=%d, prompts=%d, durationMs=%s}",
                totalEvents, toolUses, prompts, getDurationMs().orElse(null));
    }
}
