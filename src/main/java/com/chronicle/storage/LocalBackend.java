package com.chronicle.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLTransientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.config.Config;
import com.chronicle.exceptions.StorageException;

/**
 * Secondary store: an embedded H2 file database next to the user's configuration.
 * AUTO_SERVER lets several hook processes share the file at once.
 */
public class LocalBackend extends JdbcStorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(LocalBackend.class);

    public static final String NAME = "local";

    private static final int LOCK_TIMEOUT_ERROR = 50200;
    private static final int CONCURRENT_UPDATE_ERROR = 90131;

    private final String jdbcUrl;
    private final int lockRetries;

    public LocalBackend(Path dbPath, boolean autoServer, long timeoutMs, int lockRetries) throws StorageException {
        super(NAME, timeoutMs);
        this.lockRetries = lockRetries;
        Path absolute = dbPath.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new StorageException(NAME, "Cannot create local store directory " + absolute.getParent(), e);
        }
        this.jdbcUrl = String.format("jdbc:h2:file:%s;LOCK_TIMEOUT=%d%s",
                absolute, Math.min(timeoutMs, 1000), autoServer ? ";AUTO_SERVER=TRUE" : "");
        initSchema();
        logger.debug("Local store ready at {}", absolute);
    }

    public static LocalBackend fromConfig(Config config) throws StorageException {
        return new LocalBackend(config.getLocalDbPath(), config.isLocalAutoServer(),
                config.getBackendTimeoutMs(), config.getLocalLockRetries());
    }

    @Override
    protected Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, "sa", "");
    }

    @Override
    protected int retries() {
        return lockRetries;
    }

    @Override
    protected boolean isRetryable(SQLException e) {
        return e.getErrorCode() == LOCK_TIMEOUT_ERROR || e.getErrorCode() == CONCURRENT_UPDATE_ERROR
                || e instanceof SQLTransientException;
    }
}
