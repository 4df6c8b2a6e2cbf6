package com.ryuqq.retry.testkit;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Flag that a background task raises after a fixed delay.
 *
 * <p>Used to assert that a retry run finished within {@code timeout + wait}:
 * arm the marker before the run, then call {@link #finishedBeforeMarked()} after it.</p>
 *
 * <pre>
 * try (SlowMarker marker = SlowMarker.after(timeoutMs + waitMs)) {
 *     Retry.runWith(reporter, new Timer(timeoutMs, waitMs), check);
 *     assertTrue(marker.finishedBeforeMarked());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SlowMarker implements AutoCloseable {

    private final AtomicBoolean slow = new AtomicBoolean();
    private final ScheduledExecutorService scheduler;

    private SlowMarker(long delayMs) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "retry-slow-marker");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.schedule(() -> slow.set(true), delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Arms a marker that fires after the given delay.
     *
     * @param delayMs the delay in milliseconds (must be positive)
     * @return the armed marker
     * @throws IllegalArgumentException if delayMs is not positive
     */
    public static SlowMarker after(long delayMs) {
        if (delayMs <= 0) {
            throw new IllegalArgumentException("delayMs must be positive (current: " + delayMs + ")");
        }
        return new SlowMarker(delayMs);
    }

    /**
     * Returns true if the marker had not fired yet, and prevents it from firing later.
     *
     * @return true if the caller finished before the delay elapsed
     */
    public boolean finishedBeforeMarked() {
        return slow.compareAndSet(false, true);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
