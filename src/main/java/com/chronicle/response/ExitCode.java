package com.chronicle.response;

/**
 * Process exit status reported to the agent.
 */
public enum ExitCode {
    /** Normal completion. */
    SUCCESS(0),
    /** Completed, but the input was rejected or the event was not durably saved. */
    WARNING(1),
    /** Reserved for the prompt-blocking path; the agent shows stderr to the user. */
    BLOCKING(2);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
