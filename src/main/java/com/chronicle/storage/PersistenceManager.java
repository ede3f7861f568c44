package com.chronicle.storage;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.config.Config;
import com.chronicle.config.HookContext;
import com.chronicle.exceptions.StorageException;

/**
 * Sole writer of sessions and events. Tries the primary (remote) store first and falls back to
 * the secondary (local) store on failure or timeout. Public methods never throw; failures are
 * logged and reported through the returned values.
 */
public class PersistenceManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceManager.class);

    private final StorageBackend primary;
    private final StorageBackend secondary;
    private final HealthCache healthCache;
    private final long timeoutMs;
    private final ExecutorService executor;

    /**
     * @param primary remote store, or null when none is configured
     * @param secondary local store, or null when it could not be opened
     */
    public PersistenceManager(StorageBackend primary, StorageBackend secondary, HealthCache healthCache, long timeoutMs) {
        this.primary = primary;
        this.secondary = secondary;
        this.healthCache = healthCache;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "chronicle-storage");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static PersistenceManager fromContext(HookContext context) {
        Config config = context.getConfig();
        StorageBackend remote = RemoteBackend.fromConfig(config).orElse(null);
        StorageBackend local = null;
        try {
            local = LocalBackend.fromConfig(config);
        } catch (StorageException e) {
            logger.error("Local store unavailable: {}", e.getMessage());
        }
        Path markerDir = config.getLocalDbPath().toAbsolutePath().getParent();
        HealthCache cache = new HealthCache(markerDir != null ? markerDir.resolve(HealthCache.MARKER_FILE) : null,
                config.getHealthCacheMs(), context.getClock());
        return new PersistenceManager(remote, local, cache, config.getBackendTimeoutMs());
    }

    @FunctionalInterface
    private interface BackendCall<T> {
        T apply(StorageBackend backend) throws StorageException;
    }

    private static final class Attempt<T> {
        final T value;
        final String backend;

        Attempt(T value, String backend) {
            this.value = value;
            this.backend = backend;
        }
    }

    /**
     * Probes the primary store, using the cached answer while it is fresh.
     * @return true if the primary is considered reachable
     */
    public boolean probeHealth() {
        if (primary == null) {
            return false;
        }
        Optional<Boolean> cached = healthCache.lookup();
        if (cached.isPresent()) {
            return cached.get();
        }
        try {
            callWithTimeout(primary, "ping", backend -> {
                backend.ping();
                return Boolean.TRUE;
            });
            healthCache.record(true);
            return true;
        } catch (StorageException e) {
            logger.warn("Primary store unhealthy: {}", e.getMessage());
            healthCache.record(false);
            return false;
        }
    }

    /**
     * Creates or merges the session, keyed by its external id.
     */
    public SaveResult saveSession(SessionRecord session) {
        return withFailover("saveSession", backend -> backend.upsertSession(session))
                .map(a -> SaveResult.success(a.value, a.backend))
                .orElseGet(() -> {
                    logger.error("Session {} could not be saved to any store", session.getExternalSessionId());
                    return SaveResult.failure();
                });
    }

    public SaveResult saveEvent(EventRecord event) {
        Optional<String> externalId = event.getExternalSessionId();
        if (externalId.isEmpty()) {
            logger.error("{} event has no external session id, not saved", event.getEventType());
            return SaveResult.failure();
        }
        return saveEvent(event, SessionRecord.builder(externalId.get(), event.getTimestamp()).build());
    }

    /**
     * Inserts the event, creating {@code sessionIfMissing} first when the store has never seen
     * the session. The resolved id of the result is the owning session's id.
     */
    public SaveResult saveEvent(EventRecord event, SessionRecord sessionIfMissing) {
        return withFailover("saveEvent", backend -> {
            String sessionId = resolveOrCreate(backend, sessionIfMissing);
            backend.insertEvent(sessionId, event);
            return sessionId;
        }).map(a -> SaveResult.success(a.value, a.backend))
                .orElseGet(() -> {
                    logger.error("{} event for session {} could not be saved to any store",
                            event.getEventType(), sessionIfMissing.getExternalSessionId());
                    return SaveResult.failure();
                });
    }

    /**
     * Looks the session up on the primary, then on the secondary when not found there or
     * when the primary fails.
     */
    public Optional<SessionRecord> getSession(String externalSessionId) {
        return readFirstFound("getSession", backend -> backend.findSession(externalSessionId)).map(a -> a.value);
    }

    /**
     * Records the end time once and derives the session aggregates on the same store.
     */
    public SessionEndOutcome endSession(SessionRecord sessionIfMissing, Instant endTime) {
        return withFailover("endSession", backend -> {
            String sessionId = resolveOrCreate(backend, sessionIfMissing);
            boolean endedNow = backend.markSessionEnded(sessionId, endTime);
            SessionStats stats = backend.computeStats(sessionId);
            return SessionEndOutcome.ended(endedNow, sessionId, stats, backend.name());
        }).map(a -> a.value).orElseGet(() -> {
            logger.error("Session {} could not be ended on any store", sessionIfMissing.getExternalSessionId());
            return SessionEndOutcome.failure();
        });
    }

    public List<EventRecord> getEvents(String externalSessionId) {
        return readFirstFound("getEvents", backend -> {
            Optional<SessionRecord> session = backend.findSession(externalSessionId);
            if (session.isEmpty()) {
                return Optional.<List<EventRecord>>empty();
            }
            return Optional.of(backend.findEvents(session.get().getId().orElseThrow()));
        }).map(a -> a.value).orElse(List.of());
    }

    public Optional<SessionStats> getSessionStats(String externalSessionId) {
        return readFirstFound("getSessionStats", backend -> {
            Optional<SessionRecord> session = backend.findSession(externalSessionId);
            if (session.isEmpty()) {
                return Optional.<SessionStats>empty();
            }
            return Optional.of(backend.computeStats(session.get().getId().orElseThrow()));
        }).map(a -> a.value);
    }

    private static String resolveOrCreate(StorageBackend backend, SessionRecord session) throws StorageException {
        Optional<SessionRecord> existing = backend.findSession(session.getExternalSessionId());
        if (existing.isPresent()) {
            return existing.get().getId().orElseThrow();
        }
        logger.info("Creating session {} on first event", session.getExternalSessionId());
        return backend.upsertSession(session);
    }

    private List<StorageBackend> candidates() {
        List<StorageBackend> order = new ArrayList<>(2);
        if (primary != null && probeHealth()) {
            order.add(primary);
        }
        if (secondary != null) {
            order.add(secondary);
        }
        return order;
    }

    private <T> Optional<Attempt<T>> withFailover(String operation, BackendCall<T> call) {
        for (StorageBackend backend : candidates()) {
            try {
                T value = callWithTimeout(backend, operation, call);
                if (backend != primary && primary != null) {
                    logger.warn("{} stored on {} after primary failover", operation, backend.name());
                }
                return Optional.of(new Attempt<>(value, backend.name()));
            } catch (StorageException e) {
                handleFailure(backend, operation, e);
            }
        }
        return Optional.empty();
    }

    private <T> Optional<Attempt<T>> readFirstFound(String operation, BackendCall<Optional<T>> call) {
        for (StorageBackend backend : candidates()) {
            try {
                Optional<T> value = callWithTimeout(backend, operation, call);
                if (value.isPresent()) {
                    return Optional.of(new Attempt<>(value.get(), backend.name()));
                }
            } catch (StorageException e) {
                handleFailure(backend, operation, e);
            }
        }
        return Optional.empty();
    }

    private void handleFailure(StorageBackend backend, String operation, StorageException e) {
        if (backend == primary) {
            logger.warn("{} failed on primary, failing over: {}", operation, e.getMessage());
            healthCache.record(false);
        } else {
            logger.error("{} failed on {}: {}", operation, backend.name(), e.getMessage());
        }
    }

    private <T> T callWithTimeout(StorageBackend backend, String operation, BackendCall<T> call) throws StorageException {
        Future<T> future = executor.submit(() -> call.apply(backend));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StorageException(backend.name(), operation + " timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException) {
                throw (StorageException) cause;
            }
            throw new StorageException(backend.name(), operation + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException(backend.name(), operation + " interrupted", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        if (primary != null) {
            primary.close();
        }
        if (secondary != null) {
            secondary.close();
        }
    }
}
