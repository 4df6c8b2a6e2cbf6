package com.ryuqq.retry.testkit;

import com.ryuqq.retry.core.spi.Reporter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link Reporter} for testing.
 *
 * <p>Records every diagnostic and counts abandonment signals instead of failing
 * the surrounding test, so a test can assert on how a retry run ended.</p>
 *
 * <p>Thread-safe.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingReporter implements Reporter {

    private final List<String> logs = new CopyOnWriteArrayList<>();
    private final AtomicInteger failNowCount = new AtomicInteger();

    @Override
    public void log(String text) {
        logs.add(text);
    }

    @Override
    public void failNow() {
        failNowCount.incrementAndGet();
    }

    /**
     * Returns whether {@link #failNow()} was called at least once.
     *
     * @return true if the run was abandoned
     */
    public boolean isFailed() {
        return failNowCount.get() > 0;
    }

    /**
     * Returns how many times {@link #failNow()} was called.
     *
     * @return the abandonment count
     */
    public int getFailNowCount() {
        return failNowCount.get();
    }

    /**
     * Returns all recorded diagnostics in arrival order.
     *
     * @return an immutable snapshot
     */
    public List<String> getLogs() {
        return List.copyOf(logs);
    }

    /**
     * Clears all recorded state.
     */
    public void clear() {
        logs.clear();
        failNowCount.set(0);
    }
}
