package com.questrail.runner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * RunnerProperties
 * =============================================================================
 * Builds a {@link TestRunnerConfig} from properties.
 *
 * <h2>Sources</h2>
 * {@link #load()} reads {@value #RESOURCE} from the classpath (if present) and
 * then overlays JVM system properties, so {@code -Dquestrail.runner.timeoutMs=250}
 * wins over the file.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>{@code questrail.runner.timeoutMs}: default timeout in milliseconds</li>
 *   <li>{@code questrail.runner.timeoutMs.it}, {@code .before}, {@code .beforeEach},
 *       {@code .after}, {@code .afterEach}: per-phase timeouts</li>
 *   <li>{@code questrail.runner.stopOnFirstFail}: {@code true} or {@code false}</li>
 * </ul>
 */
public final class RunnerProperties
{
    private static final Logger log = LoggerFactory.getLogger(RunnerProperties.class);

    public static final String RESOURCE = "/questrail-runner.properties";
    public static final String PREFIX = "questrail.runner.";
    public static final String TIMEOUT_KEY = PREFIX + "timeoutMs";
    public static final String STOP_ON_FIRST_FAIL_KEY = PREFIX + "stopOnFirstFail";

    private RunnerProperties() {}

    /**
     * Classpath resource overlaid with system properties.
     */
    public static TestRunnerConfig load()
    {
        Properties merged = new Properties();
        try (InputStream is = RunnerProperties.class.getResourceAsStream(RESOURCE)) {
            if (is != null) {
                merged.load(is);
                log.debug("Loaded runner configuration from {}", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                merged.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(merged);
    }

    /**
     * Parses the runner keys out of {@code properties}; other keys are ignored.
     *
     * @throws IllegalArgumentException if a value is not a non-negative integer
     *         or boolean as its key requires
     */
    public static TestRunnerConfig fromProperties(Properties properties)
    {
        TimeoutConfig.Builder timeouts = TimeoutConfig.builder();

        String global = trimmed(properties, TIMEOUT_KEY);
        if (global != null) {
            timeouts.withDefault(millis(TIMEOUT_KEY, global));
        }
        for (Phase phase : Phase.values()) {
            String key = TIMEOUT_KEY + "." + phase.id();
            String value = trimmed(properties, key);
            if (value != null) {
                timeouts.with(phase, millis(key, value));
            }
        }

        TestRunnerConfig.Builder builder = TestRunnerConfig.builder().withTimeouts(timeouts.build());

        String stop = trimmed(properties, STOP_ON_FIRST_FAIL_KEY);
        if (stop != null) {
            if (!stop.equalsIgnoreCase("true") && !stop.equalsIgnoreCase("false")) {
                throw new IllegalArgumentException(STOP_ON_FIRST_FAIL_KEY + " must be true or false, got '" + stop + "'");
            }
            builder.withStopOnFirstFail(Boolean.parseBoolean(stop));
        }
        return builder.build();
    }

    private static String trimmed(Properties properties, String key)
    {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Duration millis(String key, String value)
    {
        long parsed;
        try {
            parsed = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number of milliseconds, got '" + value + "'", e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException(key + " must be non-negative, got " + parsed);
        }
        return Duration.ofMillis(parsed);
    }
}
