package com.questrail.runner.internal.exec;

import com.questrail.runner.api.Callback;
import com.questrail.runner.config.Phase;
import com.questrail.runner.config.TimeoutConfig;
import com.questrail.runner.model.DescribeNode;
import com.questrail.runner.model.HookKind;
import com.questrail.runner.model.Modifier;
import com.questrail.runner.model.TestNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimingPolicyTest
 * -----------------------------------------------------------------------------
 * Resolution order of per-unit deadlines.
 */
class TimingPolicyTest {

    private static TestNode test(Duration override) {
        return DescribeNode.root().addTest(
            new TestNode.Definition("t", Callback.fromBlock(() -> { }), override, Modifier.NONE, null));
    }

    @Test
    void unsetConfigurationFallsBackToBuiltInDefault() {
        TimingPolicy policy = new TimingPolicy(TimeoutConfig.unset());

        assertEquals(TimingPolicy.DEFAULT_TIMEOUT, policy.forTest(test(null)));
        for (HookKind kind : HookKind.values()) {
            assertEquals(Duration.ofMillis(5000), policy.forHook(kind));
        }
    }

    @Test
    void uniformTimeoutAppliesToEveryPhase() {
        TimingPolicy policy = new TimingPolicy(TimeoutConfig.uniform(Duration.ofMillis(200)));

        for (Phase phase : Phase.values()) {
            assertEquals(Duration.ofMillis(200), policy.forPhase(phase));
        }
    }

    @Test
    void phaseValueWinsOverDefault() {
        TimingPolicy policy = new TimingPolicy(TimeoutConfig.builder()
            .withDefault(Duration.ofMillis(300))
            .beforeEach(Duration.ofMillis(40))
            .build());

        assertEquals(Duration.ofMillis(40), policy.forHook(HookKind.BEFORE_EACH));
        assertEquals(Duration.ofMillis(300), policy.forHook(HookKind.AFTER_EACH));
        assertEquals(Duration.ofMillis(300), policy.forTest(test(null)));
    }

    @Test
    void phaseValueWithoutDefaultLeavesOthersAtBuiltIn() {
        TimingPolicy policy = new TimingPolicy(TimeoutConfig.builder().it(Duration.ofMillis(10)).build());

        assertEquals(Duration.ofMillis(10), policy.forTest(test(null)));
        assertEquals(TimingPolicy.DEFAULT_TIMEOUT, policy.forHook(HookKind.BEFORE));
    }

    @Test
    void perTestOverrideWinsOverEverything() {
        TimingPolicy policy = new TimingPolicy(TimeoutConfig.builder()
            .withDefault(Duration.ofMillis(300))
            .it(Duration.ofMillis(100))
            .build());

        assertEquals(Duration.ofMillis(7), policy.forTest(test(Duration.ofMillis(7))));
    }

    @Test
    void zeroIsKeptAsNoTimer() {
        TimingPolicy policy = new TimingPolicy(TimeoutConfig.uniform(Duration.ZERO));

        assertEquals(Duration.ZERO, policy.forTest(test(null)));
    }

    @Test
    void rejectsNullConfiguration() {
        assertThrows(NullPointerException.class, () -> new TimingPolicy(null));
    }

    @Test
    void negativeValuesAreRejectedAtConfigurationTime() {
        assertThrows(IllegalArgumentException.class, () -> TimeoutConfig.uniform(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () ->
            TimeoutConfig.builder().after(Duration.ofMillis(-5)));
    }
}
