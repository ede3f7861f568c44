package com.chronicle.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.exceptions.ConfigurationException;

/**
 * Hook configuration. Values resolve from system properties first, then environment
 * variables, then {@code chronicle.properties} in the home directory, then built-in defaults.
 */
public class Config {

    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    public static final String CONFIG_FILE_NAME = "chronicle.properties";
    public static final String HOME_ENV = "CHRONICLE_HOME";

    public static final String REMOTE_URL = "remote.url";
    public static final String REMOTE_USER = "remote.user";
    public static final String REMOTE_PASSWORD = "remote.password";
    public static final String REMOTE_SCHEMA_CREATE = "remote.schema.create";
    public static final String LOCAL_DB_PATH = "local.db.path";
    public static final String LOCAL_AUTO_SERVER = "local.auto.server";
    public static final String LOCAL_LOCK_RETRIES = "local.lock.retries";
    public static final String INPUT_MAX_BYTES = "input.max.bytes";
    public static final String BACKEND_TIMEOUT_MS = "backend.timeout.ms";
    public static final String HEALTH_CACHE_MS = "health.cache.ms";
    public static final String PERMISSIONS_ENABLED = "permissions.enabled";
    public static final String PERMISSIONS_RULES_PATH = "permissions.rules.path";
    public static final String PROMPT_BLOCKING_ENABLED = "prompt.blocking.enabled";
    public static final String GIT_DETECT_ENABLED = "git.detect.enabled";
    public static final String LATENCY_BUDGET_MS = "hook.latency.budget.ms";
    public static final String MAX_STRING_LENGTH = "sanitize.max.string.length";

    private static final Map<String, String> ENV_NAMES = Map.ofEntries(
            Map.entry(REMOTE_URL, "CHRONICLE_REMOTE_URL"),
            Map.entry(REMOTE_USER, "CHRONICLE_REMOTE_USER"),
            Map.entry(REMOTE_PASSWORD, "CHRONICLE_REMOTE_PASSWORD"),
            Map.entry(REMOTE_SCHEMA_CREATE, "CHRONICLE_REMOTE_SCHEMA_CREATE"),
            Map.entry(LOCAL_DB_PATH, "CHRONICLE_DB_PATH"),
            Map.entry(LOCAL_AUTO_SERVER, "CHRONICLE_LOCAL_AUTO_SERVER"),
            Map.entry(LOCAL_LOCK_RETRIES, "CHRONICLE_LOCAL_LOCK_RETRIES"),
            Map.entry(INPUT_MAX_BYTES, "CHRONICLE_MAX_INPUT_BYTES"),
            Map.entry(BACKEND_TIMEOUT_MS, "CHRONICLE_BACKEND_TIMEOUT_MS"),
            Map.entry(HEALTH_CACHE_MS, "CHRONICLE_HEALTH_CACHE_MS"),
            Map.entry(PERMISSIONS_ENABLED, "CHRONICLE_PERMISSIONS_ENABLED"),
            Map.entry(PERMISSIONS_RULES_PATH, "CHRONICLE_PERMISSIONS_RULES"),
            Map.entry(PROMPT_BLOCKING_ENABLED, "CHRONICLE_PROMPT_BLOCKING"),
            Map.entry(GIT_DETECT_ENABLED, "CHRONICLE_GIT_DETECT"),
            Map.entry(LATENCY_BUDGET_MS, "CHRONICLE_LATENCY_BUDGET_MS"),
            Map.entry(MAX_STRING_LENGTH, "CHRONICLE_MAX_STRING_LENGTH"));

    private final Path homeDir;
    private final Properties fileProperties;
    private final Map<String, String> env;
    private final Properties systemProperties;

    private Config(Path homeDir, Properties fileProperties, Map<String, String> env, Properties systemProperties) {
        this.homeDir = homeDir;
        this.fileProperties = fileProperties;
        this.env = env;
        this.systemProperties = systemProperties;
    }

    /**
     * Loads configuration from the home directory, writing a commented default file when none exists.
     *
     * @throws ConfigurationException if an existing configuration file cannot be read
     */
    public static Config load(Map<String, String> env, Properties systemProperties) throws ConfigurationException {
        Path homeDir = resolveHomeDir(env);
        Path configFile = homeDir.resolve(CONFIG_FILE_NAME);
        Properties properties = new Properties();

        if (Files.exists(configFile)) {
            try (InputStream input = Files.newInputStream(configFile)) {
                properties.load(input);
                logger.debug("Configuration loaded: {}", configFile);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read configuration file " + configFile, e);
            }
        } else {
            createDefaultConfigFile(configFile);
        }
        return new Config(homeDir, properties, env, systemProperties);
    }

    /**
     * Configuration built from the environment alone, used when the file is unusable.
     */
    public static Config defaults(Map<String, String> env, Properties systemProperties) {
        return new Config(resolveHomeDir(env), new Properties(), env, systemProperties);
    }

    /**
     * Configuration backed only by the given properties, ignoring the process environment.
     */
    public static Config fromProperties(Path homeDir, Properties properties) {
        return new Config(homeDir, properties, Map.of(), new Properties());
    }

    private static Path resolveHomeDir(Map<String, String> env) {
        String home = env.get(HOME_ENV);
        if (home != null && !home.isBlank()) {
            return Paths.get(home);
        }
        return Paths.get(System.getProperty("user.home"), ".chronicle");
    }

    private static void createDefaultConfigFile(Path configFile) {
        try {
            Files.createDirectories(configFile.getParent());
            try (Writer writer = Files.newBufferedWriter(configFile, StandardCharsets.UTF_8)) {
                writer.write(DEFAULT_CONTENT);
            }
            logger.info("Default configuration created: {}", configFile);
        } catch (IOException e) {
            logger.warn("Could not create default configuration {}: {}", configFile, e.getMessage());
        }
    }

    private static final String DEFAULT_CONTENT = """
            # Chronicle hook configuration
            # Every key can be overridden by a system property of the same name
            # or by the environment variable listed next to it.

            # Primary remote store (PostgreSQL). Leave empty to use the local store only.
            # CHRONICLE_REMOTE_URL, CHRONICLE_REMOTE_USER, CHRONICLE_REMOTE_PASSWORD
            remote.url=
            remote.user=
            remote.password=
            remote.schema.create=false

            # Secondary local store (H2 file database)
            # local.db.path=~/.chronicle/data/chronicle
            local.auto.server=true
            local.lock.retries=3

            # Limits
            input.max.bytes=5242880
            backend.timeout.ms=2000
            health.cache.ms=5000
            hook.latency.budget.ms=100
            sanitize.max.string.length=10000

            # Permissions
            permissions.enabled=true
            permissions.rules.path=

            # Prompt analysis
            prompt.blocking.enabled=false

            # Session context
            git.detect.enabled=true
            """;

    String get(String key) {
        String value = systemProperties.getProperty(key);
        if (isPresent(value)) {
            return value.trim();
        }
        String envName = ENV_NAMES.get(key);
        if (envName != null) {
            value = env.get(envName);
            if (isPresent(value)) {
                return value.trim();
            }
        }
        value = fileProperties.getProperty(key);
        return isPresent(value) ? value.trim() : null;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0) {
                logger.warn("Negative value for {}: {}, using {}", key, value, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Invalid number for {}: {}, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    public Path getHomeDir() {
        return homeDir;
    }

    public Optional<String> getRemoteUrl() {
        return Optional.ofNullable(get(REMOTE_URL));
    }

    public String getRemoteUser() {
        String user = get(REMOTE_USER);
        return user != null ? user : "";
    }

    public String getRemotePassword() {
        String password = get(REMOTE_PASSWORD);
        return password != null ? password : "";
    }

    public boolean isRemoteSchemaCreate() {
        return getBoolean(REMOTE_SCHEMA_CREATE, false);
    }

    public Path getLocalDbPath() {
        String path = get(LOCAL_DB_PATH);
        if (path == null) {
            return homeDir.resolve("data").resolve("chronicle");
        }
        if (path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(2));
        }
        return Paths.get(path);
    }

    public boolean isLocalAutoServer() {
        return getBoolean(LOCAL_AUTO_SERVER, true);
    }

    public int getLocalLockRetries() {
        return (int) Math.min(getLong(LOCAL_LOCK_RETRIES, 3), 10);
    }

    public long getInputMaxBytes() {
        return getLong(INPUT_MAX_BYTES, 5L * 1024 * 1024);
    }

    public long getBackendTimeoutMs() {
        return getLong(BACKEND_TIMEOUT_MS, 2000);
    }

    public long getHealthCacheMs() {
        return getLong(HEALTH_CACHE_MS, 5000);
    }

    public boolean isPermissionsEnabled() {
        return getBoolean(PERMISSIONS_ENABLED, true);
    }

    public Optional<Path> getPermissionsRulesPath() {
        return Optional.ofNullable(get(PERMISSIONS_RULES_PATH)).map(Paths::get);
    }

    public boolean isPromptBlockingEnabled() {
        return getBoolean(PROMPT_BLOCKING_ENABLED, false);
    }

    public boolean isGitDetectEnabled() {
        return getBoolean(GIT_DETECT_ENABLED, true);
    }

    public long getLatencyBudgetMs() {
        return getLong(LATENCY_BUDGET_MS, 100);
    }

    public int getMaxStringLength() {
        return (int) Math.min(getLong(MAX_STRING_LENGTH, 10_000), Integer.MAX_VALUE);
    }
}
