package com.chronicle.permission;

import java.util.Locale;
import java.util.Optional;

public enum PermissionVerdict {
    ALLOW("allow"),
    DENY("deny"),
    ASK("ask");

    private final String value;

    PermissionVerdict(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<PermissionVerdict> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PermissionVerdict verdict : values()) {
            if (verdict.value.equals(normalized)) {
                return Optional.of(verdict);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
