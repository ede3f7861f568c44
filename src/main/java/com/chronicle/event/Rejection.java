package com.chronicle.event;

import java.util.Objects;
import java.util.Optional;

/**
 * Input the normalizer refused. Keeps whatever identifiers could still be read so the
 * response can echo them.
 */
public final class Rejection {

    private final RejectionReason reason;
    private final String message;
    private final String hookEventName;
    private final String sessionId;

    public Rejection(RejectionReason reason, String message, String hookEventName, String sessionId) {
        this.reason = Objects.requireNonNull(reason, "reason");
        this.message = message != null ? message : reason.getTag();
        this.hookEventName = hookEventName;
        this.sessionId = sessionId;
    }

    public RejectionReason getReason() { return reason; }
    public String getMessage() { return message; }
    public Optional<String> getHookEventName() { return Optional.ofNullable(hookEventName); }
    public Optional<String> getSessionId() { return Optional.ofNullable(sessionId); }

    /** Text placed in the response {@code error} field. */
    public String describe() {
        return reason.getTag() + ": " + message;
    }

    @Override
    public String toString() {
        return "Rejection{" + describe() + "}";
    }
}
