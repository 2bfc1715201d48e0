package com.questrail.runner.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunnerPropertiesTest
 * -----------------------------------------------------------------------------
 * Property keys, validation, and the classpath plus system property overlay.
 */
class RunnerPropertiesTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(RunnerProperties.TIMEOUT_KEY);
        System.clearProperty(RunnerProperties.STOP_ON_FIRST_FAIL_KEY);
    }

    private static Properties props(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    void emptyPropertiesGiveDefaults() {
        TestRunnerConfig config = RunnerProperties.fromProperties(new Properties());

        assertEquals(TestRunnerConfig.defaults(), config);
    }

    @Test
    void parsesDefaultAndPhaseTimeouts() {
        TestRunnerConfig config = RunnerProperties.fromProperties(props(
            "questrail.runner.timeoutMs", "250",
            "questrail.runner.timeoutMs.beforeEach", " 40 ",
            "questrail.runner.timeoutMs.it", "0",
            "questrail.runner.stopOnFirstFail", "TRUE",
            "unrelated.key", "whatever"));

        assertEquals(Optional.of(Duration.ofMillis(250)), config.timeouts().defaultTimeout());
        assertEquals(Optional.of(Duration.ofMillis(40)), config.timeouts().forPhase(Phase.BEFORE_EACH));
        assertEquals(Optional.of(Duration.ZERO), config.timeouts().forPhase(Phase.IT));
        assertEquals(Optional.empty(), config.timeouts().forPhase(Phase.AFTER));
        assertTrue(config.stopOnFirstFail());
    }

    @Test
    void malformedTimeoutNamesTheKey() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
            RunnerProperties.fromProperties(props("questrail.runner.timeoutMs.after", "soon")));

        assertTrue(e.getMessage().contains("questrail.runner.timeoutMs.after"));
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            RunnerProperties.fromProperties(props("questrail.runner.timeoutMs", "-1")));
    }

    @Test
    void stopOnFirstFailMustBeBoolean() {
        assertThrows(IllegalArgumentException.class, () ->
            RunnerProperties.fromProperties(props("questrail.runner.stopOnFirstFail", "yes")));
    }

    @Test
    void loadReadsClasspathResourceAndSystemPropertiesWin() {
        // src/test/resources/questrail-runner.properties sets timeoutMs=2000 and afterEach=100
        System.setProperty(RunnerProperties.TIMEOUT_KEY, "750");

        TestRunnerConfig config = RunnerProperties.load();

        assertEquals(Optional.of(Duration.ofMillis(750)), config.timeouts().defaultTimeout());
        assertEquals(Optional.of(Duration.ofMillis(100)), config.timeouts().forPhase(Phase.AFTER_EACH));
        assertFalse(config.stopOnFirstFail());
    }
}
