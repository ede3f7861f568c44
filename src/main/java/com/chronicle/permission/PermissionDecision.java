package com.chronicle.permission;

import java.util.Objects;

public final class PermissionDecision {

    private final PermissionVerdict verdict;
    private final String reason;
    private final String ruleName;

    public PermissionDecision(PermissionVerdict verdict, String reason, String ruleName) {
        this.verdict = Objects.requireNonNull(verdict, "verdict");
        this.reason = Objects.requireNonNull(reason, "reason");
        this.ruleName = ruleName;
    }

    public PermissionVerdict getVerdict() { return verdict; }
    public String getReason() { return reason; }
    public String getRuleName() { return ruleName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermissionDecision)) return false;
        PermissionDecision that = (PermissionDecision) o;
        return verdict == that.verdict && reason.equals(that.reason) && Objects.equals(ruleName, that.ruleName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verdict, reason, ruleName);
    }

    @Override
    public String toString() {
        return verdict + " (" + ruleName + "): " + reason;
    }
}
