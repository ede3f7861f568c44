package com.chronicle.storage;

import java.util.Optional;

/**
 * Outcome of a persistence write: whether it landed, the id the backend resolved to,
 * and which backend took it.
 */
public final class SaveResult {

    private static final SaveResult FAILED = new SaveResult(false, null, null);

    private final boolean ok;
    private final String resolvedId;
    private final String backend;

    private SaveResult(boolean ok, String resolvedId, String backend) {
        this.ok = ok;
        this.resolvedId = resolvedId;
        this.backend = backend;
    }

    public static SaveResult success(String resolvedId, String backend) {
        return new SaveResult(true, resolvedId, backend);
    }

    public static SaveResult failure() {
        return FAILED;
    }

    public boolean isOk() { return ok; }
    public Optional<String> getResolvedId() { return Optional.ofNullable(resolvedId); }
    public Optional<String> getBackend() { return Optional.ofNullable(backend); }

    @Override
    public String toString() {
        return ok ? "SaveResult{ok, id=" + resolvedId + ", backend=" + backend + "}" : "SaveResult{failed}";
    }
}
