package com.chronicle.response;

import java.util.LinkedHashMap;
import java.util.Map;

import com.chronicle.permission.PermissionDecision;

/**
 * Assembles a {@link HookResponse}. Only {@link #block(String)} can produce
 * {@code continue=false}.
 */
public final class ResponseBuilder {

    private final Map<String, Object> specific = new LinkedHashMap<>();
    private boolean continueExecution = true;
    private String stopReason;
    private String error;

    private ResponseBuilder(String hookEventName, String sessionId) {
        specific.put("hookEventName", hookEventName);
        specific.put("sessionId", sessionId);
        specific.put("eventSaved", false);
    }

    public static ResponseBuilder forEvent(String hookEventName, String sessionId) {
        return new ResponseBuilder(hookEventName, sessionId);
    }

    public ResponseBuilder sessionUuid(String sessionUuid) {
        if (sessionUuid != null) {
            specific.put("sessionUuid", sessionUuid);
        }
        return this;
    }

    public ResponseBuilder eventSaved(boolean saved) {
        specific.put("eventSaved", saved);
        return this;
    }

    public ResponseBuilder permission(PermissionDecision decision) {
        if (decision != null) {
            specific.put("permissionDecision", decision.getVerdict().getValue());
            specific.put("permissionDecisionReason", decision.getReason());
        }
        return this;
    }

    public ResponseBuilder additionalContext(String context) {
        if (context != null && !context.isBlank()) {
            specific.put("additionalContext", context);
        }
        return this;
    }

    public ResponseBuilder put(String key, Object value) {
        if (value != null) {
            specific.put(key, value);
        }
        return this;
    }

    public ResponseBuilder error(String error) {
        this.error = error;
        return this;
    }

    /**
     * Stops the agent. Used only for prompts blocked by policy.
     */
    public ResponseBuilder block(String reason) {
        this.continueExecution = false;
        this.stopReason = reason;
        return this;
    }

    public boolean isBlocking() {
        return !continueExecution;
    }

    public boolean isEventSaved() {
        return Boolean.TRUE.equals(specific.get("eventSaved"));
    }

    public HookResponse build() {
        return new HookResponse(continueExecution, true, stopReason, specific, error);
    }
}
