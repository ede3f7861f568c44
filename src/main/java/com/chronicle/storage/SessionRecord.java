package com.chronicle.storage;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted session. {@code id} is assigned by the backend that stores it and is absent on
 * records that have not been saved yet.
 */
public final class SessionRecord {

    private final String id;
    private final String externalSessionId;
    private final Instant startTime;
    private final Instant endTime;
    private final String projectPath;
    private final String gitBranch;
    private final String gitCommit;
    private final String source;
    private final Instant createdAt;

    private SessionRecord(Builder builder) {
        this.id = builder.id;
        this.externalSessionId = Objects.requireNonNull(builder.externalSessionId, "externalSessionId");
        this.startTime = Objects.requireNonNull(builder.startTime, "startTime");
        this.endTime = builder.endTime;
        this.projectPath = builder.projectPath;
        this.gitBranch = builder.gitBranch;
        this.gitCommit = builder.gitCommit;
        this.source = builder.source;
        this.createdAt = builder.createdAt;
    }

    public static Builder builder(String externalSessionId, Instant startTime) {
        return new Builder(externalSessionId, startTime);
    }

    public Optional<String> getId() { return Optional.ofNullable(id); }
    public String getExternalSessionId() { return externalSessionId; }
    public Instant getStartTime() { return startTime; }
    public Optional<Instant> getEndTime() { return Optional.ofNullable(endTime); }
    public Optional<String> getProjectPath() { return Optional.ofNullable(projectPath); }
    public Optional<String> getGitBranch() { return Optional.ofNullable(gitBranch); }
    public Optional<String> getGitCommit() { return Optional.ofNullable(gitCommit); }
    public Optional<String> getSource() { return Optional.ofNullable(source); }
    public Optional<Instant> getCreatedAt() { return Optional.ofNullable(createdAt); }

    public boolean isEnded() {
        return endTime != null;
    }

    @Override
    public String toString() {
        return String.format("Session{id='%s', external='%s', start=%s, end=%s}", id, externalSessionId, startTime, endTime);
    }

    public static final class Builder {
        private String id;
        private final String externalSessionId;
        private final Instant startTime;
        private Instant endTime;
        private String projectPath;
        private String gitBranch;
        private String gitCommit;
        private String source;
        private Instant createdAt;

        private Builder(String externalSessionId, Instant startTime) {
            this.externalSessionId = externalSessionId;
            this.startTime = startTime;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder endTime(Instant endTime) { this.endTime = endTime; return this; }
        public Builder projectPath(String projectPath) { this.projectPath = projectPath; return this; }
        public Builder gitBranch(String gitBranch) { this.gitBranch = gitBranch; return this; }
        public Builder gitCommit(String gitCommit) { this.gitCommit = gitCommit; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public SessionRecord build() {
            return new SessionRecord(this);
        }
    }
}
