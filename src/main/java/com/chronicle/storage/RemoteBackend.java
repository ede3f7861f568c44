package com.chronicle.storage;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.config.Config;

/**
 * Primary store reached over JDBC, normally PostgreSQL. The schema is expected to exist
 * unless {@code remote.schema.create} is set.
 */
public class RemoteBackend extends JdbcStorageBackend {

    private static final Logger logger = LoggerFactory.getLogger(RemoteBackend.class);

    public static final String NAME = "remote";

    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final boolean createSchema;
    private boolean schemaChecked;

    public RemoteBackend(String jdbcUrl, String user, String password, boolean createSchema, long timeoutMs) {
        super(NAME, timeoutMs);
        this.jdbcUrl = jdbcUrl;
        this.createSchema = createSchema;
        this.connectionProperties = new Properties();
        connectionProperties.setProperty("user", user != null ? user : "");
        connectionProperties.setProperty("password", password != null ? password : "");
        if (jdbcUrl.startsWith("jdbc:postgresql:")) {
            long seconds = Math.max(1, (timeoutMs + 999) / 1000);
            connectionProperties.setProperty("connectTimeout", String.valueOf(seconds));
            connectionProperties.setProperty("socketTimeout", String.valueOf(seconds * 2));
            connectionProperties.setProperty("ApplicationName", "chronicle-hooks");
        }
    }

    /**
     * Remote backend for the configured URL, or empty when none is configured.
     */
    public static Optional<RemoteBackend> fromConfig(Config config) {
        return config.getRemoteUrl().map(url -> new RemoteBackend(url, config.getRemoteUser(),
                config.getRemotePassword(), config.isRemoteSchemaCreate(), config.getBackendTimeoutMs()));
    }

    @Override
    protected Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl, connectionProperties);
        if (createSchema && !schemaChecked) {
            applySchema(conn);
            schemaChecked = true;
            logger.info("Remote schema verified");
        }
        return conn;
    }
}
