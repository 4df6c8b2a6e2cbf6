package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.context.AttemptContext;
import com.ryuqq.retry.core.runner.CheckFunction;
import com.ryuqq.retry.core.runner.Retry;
import com.ryuqq.retry.core.spi.Retryer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for retry harness contract tests.
 *
 * <p>Provides a fresh {@link RecordingReporter} per test plus helpers that run a
 * check while counting its calls and timing the whole run.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractRetryContractTest {
 *     {@literal @}Test
 *     void alwaysFails() {
 *         Timer timer = new Timer(1000, 100);
 *         runTimed(1000, 100, 11, true, calls -&gt;
 *             Retry.runWith(reporter, timer, countingCheck(calls, r -&gt; r.fatalf("fail"))));
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractRetryContractTest {

    protected RecordingReporter reporter;

    /**
     * Creates a fresh reporter before each test.
     */
    @BeforeEach
    void setUpReporter() {
        reporter = new RecordingReporter();
    }

    /**
     * Clears the reporter after each test.
     */
    @AfterEach
    void tearDownReporter() {
        if (reporter != null) {
            reporter.clear();
        }
    }

    /**
     * Wraps a check so that every invocation increments {@code calls} first.
     *
     * @param calls the call counter
     * @param body the check body
     * @return the counting check
     */
    protected CheckFunction countingCheck(AtomicInteger calls, CheckFunction body) {
        return r -> {
            calls.incrementAndGet();
            body.run(r);
        };
    }

    /**
     * Runs a check with the given policy and returns how many attempts ran.
     *
     * @param retryer the retry policy
     * @param body the check body
     * @return the number of attempts
     */
    protected int runCounting(Retryer retryer, CheckFunction body) {
        AtomicInteger calls = new AtomicInteger();
        Retry.runWith(reporter, retryer, countingCheck(calls, body));
        return calls.get();
    }

    /**
     * Runs {@code body} and asserts call count, reporter state and that it finished
     * before {@code timeoutMs + waitMs} elapsed.
     *
     * @param timeoutMs the policy timeout
     * @param waitMs the policy wait
     * @param wantCalls the expected number of attempts
     * @param wantFailed whether the reporter is expected to have been failed
     * @param body the run, given the call counter to thread into its check
     */
    protected void runTimed(long timeoutMs, long waitMs, int wantCalls, boolean wantFailed,
                            Consumer<AtomicInteger> body) {
        AtomicInteger calls = new AtomicInteger();
        try (SlowMarker marker = SlowMarker.after(timeoutMs + waitMs)) {
            body.accept(calls);

            assertEquals(wantCalls, calls.get(),
                    String.format("wanted check %d calls, got %d", wantCalls, calls.get()));
            assertEquals(wantFailed, reporter.isFailed(),
                    wantFailed ? "wanted reporter to be failed" : "wanted reporter to not be failed");
            assertTrue(marker.finishedBeforeMarked(),
                    "wanted run to finish before " + (timeoutMs + waitMs) + "ms");
        }
    }

    /**
     * Asserts the reporter was abandoned exactly once with the given diagnostics.
     *
     * @param expectedOutput the expected deduplicated output
     */
    protected void assertGaveUpWith(String expectedOutput) {
        assertEquals(1, reporter.getFailNowCount(), "failNow should be called exactly once");
        assertEquals(1, reporter.getLogs().size(), "diagnostics should be emitted exactly once");
        assertEquals(expectedOutput, reporter.getLogs().get(0));
    }

    /**
     * Asserts the run succeeded without any reporter interaction.
     */
    protected void assertSucceededSilently() {
        assertFalse(reporter.isFailed(), "failNow should not be called");
        assertTrue(reporter.getLogs().isEmpty(), "no diagnostics should be emitted on success");
    }

    /**
     * Strips the {@code File.java:line: } prefix from a recorded line.
     *
     * @param line a line recorded through {@link AttemptContext}
     * @return the message part
     */
    protected static String messageOf(String line) {
        int first = line.indexOf(": ");
        return first >= 0 ? line.substring(first + 2) : line;
    }
}
