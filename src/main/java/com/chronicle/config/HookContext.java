package com.chronicle.config;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.exceptions.ConfigurationException;
import com.chronicle.logging.MdcContext;

/**
 * Everything one hook invocation depends on: configuration, clock, environment and the
 * hook name given on the command line. Built once in {@code main} and passed down explicitly.
 * Closing it clears the logging context.
 */
public final class HookContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HookContext.class);

    public static final String SESSION_ID_ENV = "CLAUDE_SESSION_ID";

    private final Config config;
    private final Clock clock;
    private final Map<String, String> env;
    private final String hookArgument;
    private final String invocationId;

    private HookContext(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.env = builder.env != null ? Map.copyOf(builder.env) : Map.of();
        this.hookArgument = builder.hookArgument;
        this.invocationId = UUID.randomUUID().toString().substring(0, 8);
    }

    public static HookContext fromEnvironment(String hookArgument) {
        Map<String, String> env = System.getenv();
        Properties system = System.getProperties();
        Config config;
        try {
            config = Config.load(env, system);
        } catch (ConfigurationException e) {
            logger.warn("Using default configuration: {}", e.getMessage());
            config = Config.defaults(env, system);
        }
        return builder().config(config).env(env).hookArgument(hookArgument).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public Optional<String> getEnv(String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public Optional<String> getHookArgument() {
        return Optional.ofNullable(hookArgument).filter(s -> !s.isBlank());
    }

    /**
     * Tags subsequent log lines of this invocation with its id, the hook and the session.
     */
    public void bindLogging(String hookEventName, String externalSessionId) {
        MdcContext.setInvocation(invocationId);
        MdcContext.setHook(hookEventName);
        MdcContext.setSession(externalSessionId);
    }

    @Override
    public void close() {
        MdcContext.clear();
    }

    public static final class Builder {
        private Config config;
        private Clock clock;
        private Map<String, String> env;
        private String hookArgument;

        private Builder() {
        }

        public Builder config(Config config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder hookArgument(String hookArgument) {
            this.hookArgument = hookArgument;
            return this;
        }

        public HookContext build() {
            return new HookContext(this);
        }
    }
}
