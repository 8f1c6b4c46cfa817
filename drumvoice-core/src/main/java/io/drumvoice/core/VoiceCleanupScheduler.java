package io.drumvoice.core;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a cleanup cycle on one dedicated daemon thread for the lifetime of its owner.
 *
 * CADENCE:
 *   Each cycle schedules the next one when it finishes. A cycle that completes
 *   normally is followed after intervalMs; a cycle that throws is followed after
 *   errorBackoffMs, then the normal interval resumes. A failing cycle never ends
 *   the task.
 *
 * LIFETIME:
 *   start() -> cycles -> stop(). stop() cancels the pending cycle and terminates the
 *   thread; a stopped scheduler may be started again with a fresh thread.
 *   Both are idempotent. A cycle still in flight from before a restart finishes
 *   but does not schedule a successor, so only one chain ever runs.
 *
 * THREAD SAFETY:
 *   start()/stop() may be called from any thread. The cycle itself always runs
 *   on the scheduler thread; the owner is responsible for serializing it against
 *   its own mutations.
 */
public final class VoiceCleanupScheduler {

    private static final long STOP_TIMEOUT_MS = 2_000L;

    private final Runnable cycle;
    private final long intervalMs;
    private final long errorBackoffMs;
    private final String threadName;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;
    private volatile Thread workerThread;
    private volatile boolean running = false;
    private long generation = 0L;   // bumped by start(); a cycle only reschedules its own

    // -- Telemetry ------------------------------------------------------------

    private final AtomicLong completedCycles = new AtomicLong(0L);
    private final AtomicLong failedCycles = new AtomicLong(0L);
    private volatile long lastScheduledDelayMs = 0L;

    /**
     * @param cycle          work to run each cycle; exceptions trigger the backoff
     * @param intervalMs     delay between successful cycles; > 0
     * @param errorBackoffMs delay after a failed cycle; > 0
     * @param threadName     name of the scheduler thread
     */
    public VoiceCleanupScheduler(Runnable cycle, long intervalMs, long errorBackoffMs,
                                 String threadName) {
        if (cycle == null) throw new NullPointerException("cycle");
        if (intervalMs <= 0 || errorBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs and errorBackoffMs must be > 0; actual = "
                + intervalMs + ", " + errorBackoffMs);
        }
        this.cycle = cycle;
        this.intervalMs = intervalMs;
        this.errorBackoffMs = errorBackoffMs;
        this.threadName = (threadName == null || threadName.isBlank())
            ? "drumvoice-cleanup" : threadName;
    }

    // -- Lifecycle ------------------------------------------------------------

    /** Starts the cycle loop. First cycle runs after one interval. No-op if running. */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) return;
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                workerThread = t;
                return t;
            });
            running = true;
            generation++;
            scheduleNext(intervalMs, generation);
        }
    }

    /**
     * Cancels the pending cycle and shuts the thread down.
     * Waits briefly for an in-flight cycle to finish unless called from the cycle itself.
     */
    public void stop() {
        ScheduledExecutorService toTerminate;
        synchronized (lifecycleLock) {
            if (!running) return;
            running = false;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            toTerminate = executor;
            executor = null;
        }
        toTerminate.shutdown();
        if (Thread.currentThread() == workerThread) {
            return;
        }
        try {
            if (!toTerminate.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                System.err.println("[DrumVoice] VoiceCleanupScheduler: '" + threadName
                    + "' did not stop within " + STOP_TIMEOUT_MS + " ms - interrupting");
                toTerminate.shutdownNow();
            }
        } catch (InterruptedException e) {
            toTerminate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() { return running; }

    // -- Telemetry ------------------------------------------------------------

    /** Cycles that completed without throwing. */
    public long completedCycles() { return completedCycles.get(); }

    /** Cycles that threw and triggered the error backoff. */
    public long failedCycles() { return failedCycles.get(); }

    /** Delay used for the most recently scheduled cycle. */
    public long lastScheduledDelayMs() { return lastScheduledDelayMs; }

    public long intervalMs() { return intervalMs; }
    public long errorBackoffMs() { return errorBackoffMs; }

    // -- Internal -------------------------------------------------------------

    private void runCycle(long cycleGeneration) {
        long nextDelay = intervalMs;
        try {
            cycle.run();
            completedCycles.incrementAndGet();
        } catch (Exception e) {
            failedCycles.incrementAndGet();
            nextDelay = errorBackoffMs;
            System.err.println("[DrumVoice] VoiceCleanupScheduler: cleanup cycle failed, "
                + "backing off " + errorBackoffMs + " ms - " + e);
        }
        scheduleNext(nextDelay, cycleGeneration);
    }

    /** No-op unless the scheduler is still running the start() that produced the cycle. */
    private void scheduleNext(long delayMs, long cycleGeneration) {
        synchronized (lifecycleLock) {
            if (!running || cycleGeneration != generation) return;
            lastScheduledDelayMs = delayMs;
            try {
                pending = executor.schedule(() -> runCycle(cycleGeneration),
                                            delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // executor is shutting down underneath a racing stop()
                running = false;
            }
        }
    }
}
