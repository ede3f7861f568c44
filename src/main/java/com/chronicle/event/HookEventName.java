package com.chronicle.event;

import java.util.Optional;

/**
 * Closed set of hook names the agent emits, each mapped to the event type it is stored as.
 */
public enum HookEventName {
    SESSION_START("SessionStart", EventType.SESSION_START),
    USER_PROMPT_SUBMIT("UserPromptSubmit", EventType.PROMPT),
    PRE_TOOL_USE("PreToolUse", EventType.PRE_TOOL_USE),
    POST_TOOL_USE("PostToolUse", EventType.TOOL_USE),
    STOP("Stop", EventType.SESSION_END),
    SUBAGENT_STOP("SubagentStop", EventType.SUBAGENT_TERMINATION),
    NOTIFICATION("Notification", EventType.NOTIFICATION),
    PRE_COMPACT("PreCompact", EventType.PRE_COMPACTION);

    private final String wireName;
    private final EventType eventType;

    HookEventName(String wireName, EventType eventType) {
        this.wireName = wireName;
        this.eventType = eventType;
    }

    public String getWireName() {
        return wireName;
    }

    public EventType getEventType() {
        return eventType;
    }

    public static Optional<HookEventName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (HookEventName hook : values()) {
            if (hook.wireName.equals(name)) {
                return Optional.of(hook);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
