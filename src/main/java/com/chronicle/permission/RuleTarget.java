package com.chronicle.permission;

import java.util.Locale;
import java.util.Optional;

/**
 * Which part of a tool invocation a rule pattern is matched against.
 */
public enum RuleTarget {
    /** The tool name itself. */
    TOOL_NAME,
    /** Any file path parameter of the tool input. */
    PATH,
    /** The shell command parameter of the tool input. */
    COMMAND;

    public static Optional<RuleTarget> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("TOOL".equals(normalized)) {
            return Optional.of(TOOL_NAME);
        }
        for (RuleTarget target : values()) {
            if (target.name().equals(normalized)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }
}
