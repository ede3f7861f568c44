package com.chronicle.event;

import java.util.Optional;

/**
 * Persisted event categories.
 */
public enum EventType {
    SESSION_START("session_start"),
    PROMPT("prompt"),
    PRE_TOOL_USE("pre_tool_use"),
    TOOL_USE("tool_use"),
    SESSION_END("session_end"),
    SUBAGENT_TERMINATION("subagent_termination"),
    NOTIFICATION("notification"),
    PRE_COMPACTION("pre_compaction");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<EventType> fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
