package com.sailfish.sched.config;

import com.sailfish.sched.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration holder for scheduler settings.
 * All settings have defaults matching the reference behaviour: five workers and
 * email/backup/report durations of 2s/3s/1s.
 * <p>
 * Instances are mutable through the {@code withX} setters and not thread-safe. Components
 * copy the values they need when they are built.
 */
public final class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    public static final String RESOURCE_NAME = "scheduler.properties";

    static final String KEY_POOL_SIZE = "scheduler.pool-size";
    static final String KEY_SHUTDOWN_TIMEOUT = "scheduler.shutdown-timeout-seconds";
    static final String KEY_DURATION_PREFIX = "scheduler.duration-ms.";

    static final String ENV_POOL_SIZE = "SCHEDULER_POOL_SIZE";
    static final String ENV_SHUTDOWN_TIMEOUT = "SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS";

    public static final int DEFAULT_POOL_SIZE = 5;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private int poolSize = DEFAULT_POOL_SIZE;
    private long shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;
    private final Map<TaskType, Duration> durations = new EnumMap<>(TaskType.class);

    private SchedulerConfig() {
        for (TaskType type : TaskType.values()) {
            durations.put(type, type.defaultDuration());
        }
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    /**
     * Defaults, overridden by {@value #RESOURCE_NAME} from the classpath when present,
     * then by environment variables.
     */
    public static SchedulerConfig load() {
        SchedulerConfig config = defaults();

        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                config.apply(props);
                log.debug("Loaded scheduler settings from classpath resource {}", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }

        String poolSize = System.getenv(ENV_POOL_SIZE);
        if (poolSize != null && !poolSize.isBlank()) {
            config.withPoolSize(parseInt(ENV_POOL_SIZE, poolSize));
        }
        String timeout = System.getenv(ENV_SHUTDOWN_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            config.withShutdownTimeoutSeconds(parseLong(ENV_SHUTDOWN_TIMEOUT, timeout));
        }

        log.info("Scheduler configuration: {}", config);
        return config;
    }

    public static SchedulerConfig fromProperties(Properties props) {
        SchedulerConfig config = defaults();
        config.apply(Objects.requireNonNull(props, "props cannot be null"));
        return config;
    }

    private void apply(Properties props) {
        String poolSize = props.getProperty(KEY_POOL_SIZE);
        if (poolSize != null && !poolSize.isBlank()) {
            withPoolSize(parseInt(KEY_POOL_SIZE, poolSize));
        }
        String timeout = props.getProperty(KEY_SHUTDOWN_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            withShutdownTimeoutSeconds(parseLong(KEY_SHUTDOWN_TIMEOUT, timeout));
        }
        for (TaskType type : TaskType.values()) {
            String key = KEY_DURATION_PREFIX + type.discriminant();
            String millis = props.getProperty(key);
            if (millis != null && !millis.isBlank()) {
                withDuration(type, Duration.ofMillis(parseLong(key, millis)));
            }
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    // Getters
    public int poolSize() {
        return poolSize;
    }

    public long shutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public Duration durationOf(TaskType type) {
        return durations.get(Objects.requireNonNull(type, "type cannot be null"));
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withPoolSize(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1, got " + poolSize);
        }
        this.poolSize = poolSize;
        return this;
    }

    public SchedulerConfig withShutdownTimeoutSeconds(long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("shutdownTimeoutSeconds must be non-negative");
        }
        this.shutdownTimeoutSeconds = seconds;
        return this;
    }

    public SchedulerConfig withDuration(TaskType type, Duration duration) {
        Objects.requireNonNull(type, "type cannot be null");
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration for " + type.discriminant() + " must be non-negative");
        }
        durations.put(type, duration);
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "poolSize=" + poolSize +
                ", shutdownTimeoutSeconds=" + shutdownTimeoutSeconds +
                ", durations=" + durations +
                '}';
    }
}
