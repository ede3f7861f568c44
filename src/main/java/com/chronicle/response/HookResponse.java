package com.chronicle.response;

import java.util.LinkedHashMap;
import java.util.Map;

import com.chronicle.util.Jsons;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Document written to stdout for the agent. {@code continue} is true unless the
 * prompt-blocking path stopped the agent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"continue", "suppressOutput", "stopReason", "hookSpecificOutput", "error"})
public final class HookResponse {

    private final boolean continueExecution;
    private final boolean suppressOutput;
    private final String stopReason;
    private final Map<String, Object> hookSpecificOutput;
    private final String error;

    HookResponse(boolean continueExecution, boolean suppressOutput, String stopReason,
            Map<String, Object> hookSpecificOutput, String error) {
        this.continueExecution = continueExecution;
        this.suppressOutput = suppressOutput;
        this.stopReason = stopReason;
        this.hookSpecificOutput = hookSpecificOutput != null ? new LinkedHashMap<>(hookSpecificOutput) : null;
        this.error = error;
    }

    /**
     * Response used when processing failed before a proper one could be built.
     */
    public static HookResponse safeDefault(String error) {
        return new HookResponse(true, true, null, null, error);
    }

    @JsonProperty("continue")
    public boolean isContinueExecution() {
        return continueExecution;
    }

    @JsonProperty("suppressOutput")
    public boolean isSuppressOutput() {
        return suppressOutput;
    }

    @JsonProperty("stopReason")
    public String getStopReason() {
        return stopReason;
    }

    @JsonProperty("hookSpecificOutput")
    public Map<String, Object> getHookSpecificOutput() {
        return hookSpecificOutput;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    public String toJson() {
        return Jsons.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
