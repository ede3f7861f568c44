package com.chronicle.event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class PreToolUseEvent extends HookEvent {

    private final String toolName;
    private final Map<String, Object> toolInput;

    public PreToolUseEvent(EventHeader header, String toolName, Map<String, Object> toolInput) {
        super(header);
        this.toolName = toolName != null ? toolName : "unknown";
        this.toolInput = toolInput != null ? new LinkedHashMap<>(toolInput) : new LinkedHashMap<>();
    }

    public String getToolNameValue() {
        return toolName;
    }

    public Map<String, Object> getToolInput() {
        return toolInput;
    }

    @Override
    public Optional<String> getToolName() {
        return Optional.of(toolName);
    }

    @Override
    protected void contributeData(Map<String, Object> data) {
        data.put("tool_name", toolName);
        data.put("tool_input", toolInput);
    }
}
