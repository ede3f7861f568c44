package com.chronicle.storage;

import java.util.Optional;

/**
 * Result of ending a session: whether this call set the end time, the derived aggregates,
 * and where it happened.
 */
public final class SessionEndOutcome {

    private static final SessionEndOutcome FAILED = new SessionEndOutcome(false, false, null, null, null);

    private final boolean ok;
    private final boolean endedNow;
    private final String sessionId;
    private final SessionStats stats;
    private final String backend;

    private SessionEndOutcome(boolean ok, boolean endedNow, String sessionId, SessionStats stats, String backend) {
        this.ok = ok;
        this.endedNow = endedNow;
        this.sessionId = sessionId;
        this.stats = stats;
        this.backend = backend;
    }

    public static SessionEndOutcome ended(boolean endedNow, String sessionId, SessionStats stats, String backend) {
        return new SessionEndOutcome(true, endedNow, sessionId, stats, backend);
    }

    public static SessionEndOutcome failure() {
        return FAILED;
    }

    public boolean isOk() { return ok; }

    /** False when an earlier Stop already recorded the end time. */
    public boolean isEndedNow() { return endedNow; }

    public Optional<String> getSessionId() { return Optional.ofNullable(sessionId); }
    public Optional<SessionStats> getStats() { return Optional.ofNullable(stats); }
    public Optional<String> getBackend() { return Optional.ofNullable(backend); }
}
