package com.chronicle.permission;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A proposed tool action, as seen by the permission engine.
 */
public final class ToolInvocation {

    private static final List<String> PATH_KEYS = List.of("file_path", "path", "notebook_path", "filePath");
    private static final String COMMAND_KEY = "command";

    private final String toolName;
    private final Map<String, Object> toolInput;
    private final String workingDirectory;

    public ToolInvocation(String toolName, Map<String, Object> toolInput, String workingDirectory) {
        this.toolName = Objects.requireNonNull(toolName, "toolName");
        this.toolInput = toolInput != null ? new LinkedHashMap<>(toolInput) : new LinkedHashMap<>();
        this.workingDirectory = workingDirectory;
    }

    public static ToolInvocation of(String toolName, Map<String, Object> toolInput) {
        return new ToolInvocation(toolName, toolInput, null);
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getToolInput() {
        return Collections.unmodifiableMap(toolInput);
    }

    public Optional<String> getWorkingDirectory() {
        return Optional.ofNullable(workingDirectory);
    }

    /**
     * File paths named by the tool input, in parameter order.
     */
    public List<String> paths() {
        List<String> paths = new ArrayList<>();
        for (String key : PATH_KEYS) {
            Object value = toolInput.get(key);
            if (value instanceof String s && !s.isBlank()) {
                paths.add(s);
            }
        }
        return paths;
    }

    public Optional<String> command() {
        Object value = toolInput.get(COMMAND_KEY);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "ToolInvocation{" + toolName + ", " + toolInput.keySet() + "}";
    }
}
