package com.qualitysentinel.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the periodic detection cycle on a single daemon worker.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} runs the first cycle immediately; each cycle schedules the
 * next one when it finishes, so cycles never overlap. {@link #stop()} lets the
 * cycle in progress complete, then shuts the worker down; pending cycles are
 * discarded. Both calls are idempotent.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A cycle that throws is logged and followed by the next cycle after the
 * short error backoff rather than the full interval. The loop only ends
 * through {@link #stop()}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionScheduler.class);

    static final String THREAD_NAME = "regression-detector";
    private static final long DRAIN_TIMEOUT_SECONDS = 30;

    private final Runnable cycle;
    private final Duration interval;
    private final Duration errorBackoff;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();

    private volatile ScheduledExecutorService executor;

    /**
     * @param cycle        the work of one detection cycle
     * @param interval     delay between the end of a cycle and the next one
     * @param errorBackoff delay after a failed cycle
     * @throws IllegalArgumentException if a delay is not positive
     */
    public DetectionScheduler(Runnable cycle, Duration interval, Duration errorBackoff) {
        this.cycle = Objects.requireNonNull(cycle, "cycle must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        if (errorBackoff.isZero() || errorBackoff.isNegative()) {
            throw new IllegalArgumentException("errorBackoff must be positive, got: " + errorBackoff);
        }
    }

    /**
     * Start the worker. Has no effect if already running.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor = pool;
        executor.execute(this::runCycle);
        LOG.info("Quality regression detection started (interval={}s)", interval.toSeconds());
    }

    /**
     * Stop the worker after the cycle in progress, waiting up to
     * {@value #DRAIN_TIMEOUT_SECONDS} seconds for it. Has no effect if not
     * running.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Detection cycle did not finish within {}s, interrupting", DRAIN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Quality regression detection stopped after {} cycles", completedCycles.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getInterval() {
        return interval;
    }

    /** @return cycles that finished, successfully or not */
    public long getCompletedCycles() {
        return completedCycles.get();
    }

    public long getFailedCycles() {
        return failedCycles.get();
    }

    // ---------------------------------------------------------------
    // Loop body
    // ---------------------------------------------------------------

    private void runCycle() {
        if (!running.get()) {
            return;
        }
        Duration next = errorBackoff;
        try {
            cycle.run();
            next = interval;
        } catch (Throwable t) {
            // any failure, errors included, must not end the loop
            failedCycles.incrementAndGet();
            LOG.error("Detection cycle failed, retrying in {} ms: {}", errorBackoff.toMillis(), t.getMessage(), t);
        } finally {
            completedCycles.incrementAndGet();
            scheduleNext(next);
        }
    }

    private void scheduleNext(Duration delay) {
        if (!running.get()) {
            return;
        }
        try {
            executor.schedule(this::runCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // stop() raced with the end of this cycle
            LOG.debug("Next detection cycle not scheduled: worker is shutting down");
        }
    }
}
