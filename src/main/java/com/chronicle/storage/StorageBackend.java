package com.chronicle.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.chronicle.exceptions.StorageException;

/**
 * Contract for a session/event store. Implementations throw {@link StorageException} on any
 * failure; the persistence manager decides what to do with it.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Short name used in logs and save results.
     */
    String name();

    /**
     * Cheap connectivity check.
     * @throws StorageException if the store cannot be reached
     */
    void ping() throws StorageException;

    /**
     * Creates the session or merges descriptive fields into the existing one.
     * Concurrent callers with the same external id receive the same id.
     * @param session the session to store
     * @return the backend id of the stored session
     */
    String upsertSession(SessionRecord session) throws StorageException;

    /**
     * Looks a session up by its caller-supplied id.
     * @param externalSessionId the external session identifier
     * @return Optional containing the session if found, empty otherwise
     */
    Optional<SessionRecord> findSession(String externalSessionId) throws StorageException;

    /**
     * Inserts an event under an existing session.
     * @param sessionId backend id of the owning session
     * @param event the event to store
     * @return the id of the inserted event
     */
    String insertEvent(String sessionId, EventRecord event) throws StorageException;

    /**
     * Events of one session in insertion order.
     */
    List<EventRecord> findEvents(String sessionId) throws StorageException;

    /**
     * Sets the end time unless one is already recorded.
     * @return true if this call set the end time, false if it was already set
     */
    boolean markSessionEnded(String sessionId, Instant endTime) throws StorageException;

    /**
     * Derives counts and duration from the stored event log.
     */
    SessionStats computeStats(String sessionId) throws StorageException;

    /**
     * Releases connections held by this backend.
     */
    @Override
    void close();
}
