package com.chronicle.event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class PostToolUseEvent extends HookEvent {

    private final String toolName;
    private final Map<String, Object> toolInput;
    private final Object toolResult;
    private final Long durationMs;

    public PostToolUseEvent(EventHeader header, String toolName, Map<String, Object> toolInput,
            Object toolResult, Long durationMs) {
        super(header);
        if (durationMs != null && durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative: " + durationMs);
        }
        this.toolName = toolName != null ? toolName : "unknown";
        this.toolInput = toolInput != null ? new LinkedHashMap<>(toolInput) : new LinkedHashMap<>();
        this.toolResult = toolResult;
        this.durationMs = durationMs;
    }

    public String getToolNameValue() {
        return toolName;
    }

    public Map<String, Object> getToolInput() {
        return toolInput;
    }

    /** String, map, list or null, as the agent reported it. */
    public Object getToolResult() {
        return toolResult;
    }

    @Override
    public Optional<String> getToolName() {
        return Optional.of(toolName);
    }

    @Override
    public Optional<Long> getDurationMs() {
        return Optional.ofNullable(durationMs);
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("tool_name", toolName);
        data.put("tool_input", toolInput);
        putIfPresent(data, "tool_response", toolResult);
        putIfPresent(data, "duration_ms", durationMs);
    }
}
