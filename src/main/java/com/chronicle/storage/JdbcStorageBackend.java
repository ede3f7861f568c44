package com.chronicle.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.event.EventType;
import com.chronicle.exceptions.StorageException;
import com.chronicle.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * JDBC store using SQL that runs unchanged on H2 and PostgreSQL. Holds one connection for
 * the life of the backend; operations are serialized on it.
 */
public abstract class JdbcStorageBackend implements StorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageBackend.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final int UPSERT_ATTEMPTS = 3;

    private static final String CREATE_SESSIONS_TABLE = """
        CREATE TABLE IF NOT EXISTS sessions (
            id VARCHAR(36) PRIMARY KEY,
            external_session_id VARCHAR(255) NOT NULL UNIQUE,
            start_time TIMESTAMP WITH TIME ZONE NOT NULL,
            end_time TIMESTAMP WITH TIME ZONE,
            project_path VARCHAR(1024),
            git_branch VARCHAR(255),
            git_commit VARCHAR(64),
            source VARCHAR(64),
            created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
        )
    """;

    private static final String CREATE_EVENTS_TABLE = """
        CREATE TABLE IF NOT EXISTS events (
            id VARCHAR(36) PRIMARY KEY,
            seq BIGINT GENERATED BY DEFAULT AS IDENTITY,
            session_id VARCHAR(36) NOT NULL REFERENCES sessions(id) ON DELETE CASCADE,
            event_type VARCHAR(64) NOT NULL,
            hook_event_name VARCHAR(64),
            event_timestamp TIMESTAMP WITH TIME ZONE NOT NULL,
            data TEXT,
            tool_name VARCHAR(255),
            duration_ms BIGINT CHECK (duration_ms >= 0),
            created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
        )
    """;

    private static final String[] CREATE_INDEXES = {
        "CREATE INDEX IF NOT EXISTS idx_events_session ON events(session_id)",
        "CREATE INDEX IF NOT EXISTS idx_events_timestamp ON events(event_timestamp)",
        "CREATE INDEX IF NOT EXISTS idx_events_type ON events(event_type)"
    };

    private static final String SELECT_SESSION = """
        SELECT id, external_session_id, start_time, end_time, project_path, git_branch, git_commit, source, created_at
        FROM sessions WHERE external_session_id = ?
    """;

    private static final String INSERT_SESSION = """
        INSERT INTO sessions (id, external_session_id, start_time, end_time, project_path, git_branch, git_commit, source)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
    """;

    private static final String MERGE_SESSION = """
        UPDATE sessions SET
            project_path = COALESCE(?, project_path),
            git_branch = COALESCE(?, git_branch),
            git_commit = COALESCE(?, git_commit),
            source = COALESCE(?, source)
        WHERE id = ?
    """;

    private static final String END_SESSION =
        "UPDATE sessions SET end_time = ? WHERE id = ? AND end_time IS NULL";

    private static final String INSERT_EVENT = """
        INSERT INTO events (id, session_id, event_type, hook_event_name, event_timestamp, data, tool_name, duration_ms)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
    """;

    private static final String SELECT_EVENTS = """
        SELECT id, session_id, event_type, hook_event_name, event_timestamp, data, tool_name, duration_ms, created_at
        FROM events WHERE session_id = ? ORDER BY seq
    """;

    private static final String SESSION_STATS = """
        SELECT COUNT(*) AS total_events,
               SUM(CASE WHEN event_type = 'tool_use' THEN 1 ELSE 0 END) AS tool_uses,
               SUM(CASE WHEN event_type = 'prompt' THEN 1 ELSE 0 END) AS prompts
        FROM events WHERE session_id = ?
    """;

    private static final String SESSION_TIMES = "SELECT start_time, end_time FROM sessions WHERE id = ?";

    private final String name;
    private final int queryTimeoutSeconds;
    private Connection connection;

    protected JdbcStorageBackend(String name, long timeoutMs) {
        this.name = name;
        this.queryTimeoutSeconds = (int) Math.max(1, (timeoutMs + 999) / 1000);
    }

    /**
     * Opens a new JDBC connection to the store.
     */
    protected abstract Connection openConnection() throws SQLException;

    /**
     * Number of extra attempts for a failed operation when {@link #isRetryable} allows it.
     */
    protected int retries() {
        return 0;
    }

    protected boolean isRetryable(SQLException e) {
        return false;
    }

    @FunctionalInterface
    protected interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    @Override
    public String name() {
        return name;
    }

    protected void initSchema() throws StorageException {
        execute("initSchema", conn -> {
            applySchema(conn);
            return null;
        });
    }

    /**
     * Creates tables and indexes if they don't exist.
     */
    protected void applySchema(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_SESSIONS_TABLE);
            stmt.execute(CREATE_EVENTS_TABLE);
            for (String index : CREATE_INDEXES) {
                stmt.execute(index);
            }
        }
        logger.debug("Schema verified on {}", name);
    }

    protected synchronized <T> T execute(String operation, SqlWork<T> work) throws StorageException {
        int attempt = 0;
        while (true) {
            try {
                return work.run(connection());
            } catch (SQLException e) {
                if (attempt < retries() && isRetryable(e)) {
                    attempt++;
                    logger.debug("{} on {} contended, retry {}/{}", operation, name, attempt, retries());
                    pause(attempt);
                    continue;
                }
                if (isConnectionFailure(e)) {
                    discardConnection();
                }
                throw new StorageException(name, operation + " failed on " + name + ": " + e.getMessage(), e);
            }
        }
    }

    private Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = openConnection();
            connection.setAutoCommit(true);
        }
        return connection;
    }

    private static boolean isConnectionFailure(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    private static void pause(int attempt) throws StorageException {
        try {
            Thread.sleep(25L * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StorageException("jdbc", "Interrupted while retrying", ie);
        }
    }

    private static void backOff(int attempt) throws SQLException {
        try {
            Thread.sleep(10L * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while reading back a concurrent insert", ie);
        }
    }

    private void discardConnection() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException closeEx) {
                logger.debug("Error closing broken connection on {}: {}", name, closeEx.getMessage());
            }
            connection = null;
        }
    }

    @Override
    public void ping() throws StorageException {
        execute("ping", conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.execute("SELECT 1");
            }
            return null;
        });
    }

    @Override
    public String upsertSession(SessionRecord session) throws StorageException {
        return execute("upsertSession", conn -> {
            int attempt = 0;
            while (true) {
                Optional<SessionRecord> existing = selectSession(conn, session.getExternalSessionId());
                if (existing.isPresent()) {
                    String id = existing.get().getId().orElseThrow();
                    mergeSession(conn, id, session);
                    return id;
                }

                String id = UUID.randomUUID().toString();
                try {
                    insertSession(conn, id, session);
                    logger.debug("Created session {} ({}) on {}", id, session.getExternalSessionId(), name);
                    return id;
                } catch (SQLException e) {
                    // Another process inserted the same external id; its row wins.
                    if (!UNIQUE_VIOLATION.equals(e.getSQLState()) || attempt >= UPSERT_ATTEMPTS) {
                        throw e;
                    }
                    attempt++;
                    logger.debug("Session {} created concurrently on {}, reading it back",
                            session.getExternalSessionId(), name);
                    backOff(attempt);
                }
            }
        });
    }

    @Override
    public Optional<SessionRecord> findSession(String externalSessionId) throws StorageException {
        return execute("findSession", conn -> selectSession(conn, externalSessionId));
    }

    @Override
    public String insertEvent(String sessionId, EventRecord event) throws StorageException {
        return execute("insertEvent", conn -> {
            String id = UUID.randomUUID().toString();
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_EVENT)) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.setString(1, id);
                stmt.setString(2, sessionId);
                stmt.setString(3, event.getEventType().getValue());
                setNullableString(stmt, 4, event.getHookEventName().orElse(null));
                stmt.setObject(5, toOffset(event.getTimestamp()));
                stmt.setString(6, Jsons.toJson(event.getData()));
                setNullableString(stmt, 7, event.getToolName().orElse(null));
                if (event.getDurationMs().isPresent()) {
                    stmt.setLong(8, event.getDurationMs().get());
                } else {
                    stmt.setNull(8, Types.BIGINT);
                }
                stmt.executeUpdate();
            }
            return id;
        });
    }

    @Override
    public List<EventRecord> findEvents(String sessionId) throws StorageException {
        return execute("findEvents", conn -> {
            List<EventRecord> events = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_EVENTS)) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.setString(1, sessionId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        events.add(mapEvent(rs));
                    }
                }
            }
            return events;
        });
    }

    @Override
    public boolean markSessionEnded(String sessionId, Instant endTime) throws StorageException {
        return execute("markSessionEnded", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(END_SESSION)) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.setObject(1, toOffset(endTime));
                stmt.setString(2, sessionId);
                return stmt.executeUpdate() == 1;
            }
        });
    }

    @Override
    public SessionStats computeStats(String sessionId) throws StorageException {
        return execute("computeStats", conn -> {
            long total;
            long toolUses;
            long prompts;
            try (PreparedStatement stmt = conn.prepareStatement(SESSION_STATS)) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.setString(1, sessionId);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    total = rs.getLong("total_events");
                    toolUses = rs.getLong("tool_uses");
                    prompts = rs.getLong("prompts");
                }
            }
            Instant start = null;
            Instant end = null;
            try (PreparedStatement stmt = conn.prepareStatement(SESSION_TIMES)) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.setString(1, sessionId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        start = readInstant(rs, "start_time");
                        end = readInstant(rs, "end_time");
                    }
                }
            }
            return new SessionStats(total, toolUses, prompts, start, end);
        });
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                logger.debug("Closed connection to {}", name);
            } catch (SQLException e) {
                logger.warn("Error closing {} connection: {}", name, e.getMessage());
            }
            connection = null;
        }
    }

    private Optional<SessionRecord> selectSession(Connection conn, String externalSessionId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_SESSION)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, externalSessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(SessionRecord.builder(rs.getString("external_session_id"), readInstant(rs, "start_time"))
                        .id(rs.getString("id"))
                        .endTime(readInstant(rs, "end_time"))
                        .projectPath(rs.getString("project_path"))
                        .gitBranch(rs.getString("git_branch"))
                        .gitCommit(rs.getString("git_commit"))
                        .source(rs.getString("source"))
                        .createdAt(readInstant(rs, "created_at"))
                        .build());
            }
        }
    }

    private void insertSession(Connection conn, String id, SessionRecord session) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_SESSION)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, id);
            stmt.setString(2, session.getExternalSessionId());
            stmt.setObject(3, toOffset(session.getStartTime()));
            if (session.getEndTime().isPresent()) {
                stmt.setObject(4, toOffset(session.getEndTime().get()));
            } else {
                stmt.setNull(4, Types.TIMESTAMP_WITH_TIMEZONE);
            }
            setNullableString(stmt, 5, session.getProjectPath().orElse(null));
            setNullableString(stmt, 6, session.getGitBranch().orElse(null));
            setNullableString(stmt, 7, session.getGitCommit().orElse(null));
            setNullableString(stmt, 8, session.getSource().orElse(null));
            stmt.executeUpdate();
        }
    }

    private void mergeSession(Connection conn, String id, SessionRecord session) throws SQLException {
        if (session.getProjectPath().isEmpty() && session.getGitBranch().isEmpty()
                && session.getGitCommit().isEmpty() && session.getSource().isEmpty()) {
            return;
        }
        try (PreparedStatement stmt = conn.prepareStatement(MERGE_SESSION)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            setNullableString(stmt, 1, session.getProjectPath().orElse(null));
            setNullableString(stmt, 2, session.getGitBranch().orElse(null));
            setNullableString(stmt, 3, session.getGitCommit().orElse(null));
            setNullableString(stmt, 4, session.getSource().orElse(null));
            stmt.setString(5, id);
            stmt.executeUpdate();
        }
    }

    private EventRecord mapEvent(ResultSet rs) throws SQLException {
        String type = rs.getString("event_type");
        EventType eventType = EventType.fromValue(type)
                .orElseThrow(() -> new SQLException("Unknown event type in store: " + type));
        long duration = rs.getLong("duration_ms");
        Long durationMs = rs.wasNull() ? null : duration;
        return EventRecord.builder(eventType, readInstant(rs, "event_timestamp"))
                .id(rs.getString("id"))
                .sessionId(rs.getString("session_id"))
                .hookEventName(rs.getString("hook_event_name"))
                .data(readData(rs.getString("data")))
                .toolName(rs.getString("tool_name"))
                .durationMs(durationMs)
                .createdAt(readInstant(rs, "created_at"))
                .build();
    }

    private Map<String, Object> readData(String json) {
        try {
            return Jsons.toMap(json);
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable event data on {}: {}", name, e.getOriginalMessage());
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("raw", json);
            return raw;
        }
    }

    private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
