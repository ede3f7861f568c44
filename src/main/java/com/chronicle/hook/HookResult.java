package com.chronicle.hook;

import java.util.Objects;
import java.util.Optional;

import com.chronicle.response.ExitCode;
import com.chronicle.response.HookResponse;

/**
 * What the process emits: the response document, the exit code and an optional stderr line.
 */
public final class HookResult {

    private final HookResponse response;
    private final ExitCode exitCode;
    private final String stderrMessage;

    public HookResult(HookResponse response, ExitCode exitCode, String stderrMessage) {
        this.response = Objects.requireNonNull(response, "response");
        this.exitCode = Objects.requireNonNull(exitCode, "exitCode");
        this.stderrMessage = stderrMessage;
    }

    public static HookResult failOpen(String error) {
        return new HookResult(HookResponse.safeDefault(error), ExitCode.WARNING, error);
    }

    public HookResponse getResponse() { return response; }
    public ExitCode getExitCode() { return exitCode; }
    public Optional<String> getStderrMessage() { return Optional.ofNullable(stderrMessage); }
}
