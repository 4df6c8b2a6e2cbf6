package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.policy.Timer;
import com.ryuqq.retry.core.policy.TimerConfig;
import com.ryuqq.retry.core.runner.Retry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the retry loop against wall-clock time.
 *
 * <p>Runs real timers (no manual clock) and checks attempt counts, the reporter
 * outcome, and that every run finishes before {@code timeout + wait}.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Always-failing check with 1s/100ms → exactly 11 attempts, then give-up</li>
 *   <li>Passing check → exactly 1 attempt, no give-up</li>
 *   <li>Same two cases with the default 2s/25ms policy</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractRetryContractTest {

    private static final long TIMEOUT_MS = 1000;
    private static final long WAIT_MS = 100;

    @Test
    void testRunWith_AlwaysFails_GivesUpAfterTimeoutOverWaitPlusOneAttempts() {
        Timer timer = new Timer(TIMEOUT_MS, WAIT_MS);
        int wantCalls = (int) (TIMEOUT_MS / WAIT_MS) + 1;

        runTimed(TIMEOUT_MS, WAIT_MS, wantCalls, true, calls ->
                Retry.runWith(reporter, timer, countingCheck(calls, r -> r.fatalf("fail"))));

        assertEquals(1, reporter.getFailNowCount());
    }

    @Test
    void testRunWith_Passes_RunsOnce() {
        Timer timer = new Timer(TIMEOUT_MS, WAIT_MS);

        runTimed(TIMEOUT_MS, WAIT_MS, 1, false, calls ->
                Retry.runWith(reporter, timer, countingCheck(calls, r -> { })));

        assertSucceededSilently();
    }

    @Test
    void testRun_DefaultPolicy_AlwaysFails_GivesUpBeforeTimeoutPlusWait() {
        long timeout = TimerConfig.DEFAULT_TIMEOUT_MS;
        long wait = TimerConfig.DEFAULT_WAIT_MS;
        AtomicInteger calls = new AtomicInteger();

        try (SlowMarker marker = SlowMarker.after(timeout + wait)) {
            Retry.run(reporter, countingCheck(calls, r -> r.fatalf("fail")));

            // Sleep overshoot can cost the final attempt, never add one
            assertTrue(calls.get() > 1, "wanted more than one attempt, got " + calls.get());
            assertTrue(calls.get() <= timeout / wait + 1,
                    "wanted at most " + (timeout / wait + 1) + " attempts, got " + calls.get());
            assertTrue(reporter.isFailed(), "wanted reporter to be failed");
            assertTrue(marker.finishedBeforeMarked(), "wanted run to finish before " + (timeout + wait) + "ms");
        }
    }

    @Test
    void testRun_DefaultPolicy_Passes_RunsOnce() {
        runTimed(TimerConfig.DEFAULT_TIMEOUT_MS, TimerConfig.DEFAULT_WAIT_MS, 1, false, calls ->
                Retry.run(reporter, countingCheck(calls, r -> { })));

        assertSucceededSilently();
    }
}
