package com.questrail.foil.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Loads ScheduleRuntimeConfig from a properties file on the classpath.
 *
 * Recognised keys (all optional, defaults from {@link ScheduleRuntimeConfig#defaults()}):
 *  - foil.executor              JDK_SCHEDULED_POOL | NETTY_EVENT_EXECUTOR
 *  - foil.threads
 *  - foil.threadNamePrefix
 *  - foil.periodicMode          FIXED_RATE | FIXED_DELAY
 *  - foil.failureMode           SUPPRESS_FURTHER | CONTINUE
 *  - foil.defaultZone           any {@link ZoneId} id
 *  - foil.shutdownTimeoutMillis
 */
public final class ScheduleConfigLoader {

    public static final String PREFIX = "foil.";

    private ScheduleConfigLoader() {}

    public static ScheduleRuntimeConfig loadFromClasspath(String fileName) {
        Properties props = new Properties();

        try (InputStream in = ScheduleConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new IllegalStateException("Config file not found on classpath: " + fileName);
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config: " + fileName, e);
        }

        return fromProperties(props);
    }

    public static ScheduleRuntimeConfig fromProperties(Properties props) {
        ScheduleRuntimeConfig defaults = ScheduleRuntimeConfig.defaults();

        String executor = getString(props, "executor");
        String threads = getString(props, "threads");
        String threadNamePrefix = getString(props, "threadNamePrefix");
        String periodicMode = getString(props, "periodicMode");
        String failureMode = getString(props, "failureMode");
        String defaultZone = getString(props, "defaultZone");
        String shutdownTimeoutMillis = getString(props, "shutdownTimeoutMillis");

        StrategyPolicy policy = new StrategyPolicy(
                periodicMode == null ? defaults.policy().periodicMode() : parseEnum(PeriodicMode.class, "periodicMode", periodicMode),
                failureMode == null ? defaults.policy().failureMode() : parseEnum(FailureMode.class, "failureMode", failureMode)
        );

        return ScheduleRuntimeConfig.builder()
                .withExecutorKind(executor == null ? defaults.executorKind() : parseEnum(ExecutorKind.class, "executor", executor))
                .withThreads(threads == null ? defaults.threads() : parseInt("threads", threads))
                .withThreadNamePrefix(threadNamePrefix == null ? defaults.threadNamePrefix() : threadNamePrefix)
                .withPolicy(policy)
                .withDefaultZone(defaultZone == null ? defaults.defaultZone() : parseZone(defaultZone))
                .withShutdownTimeout(shutdownTimeoutMillis == null
                        ? defaults.shutdownTimeout()
                        : Duration.ofMillis(parseLong("shutdownTimeoutMillis", shutdownTimeoutMillis)))
                .build();
    }

    private static String getString(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value == null ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid zone for " + PREFIX + "defaultZone: " + value, e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }
}
