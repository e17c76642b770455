package io.recur4j.internal.executor;

import io.recur4j.core.ScheduledJob;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime state of a started job: its timers and how many attempts are executing right now.
 *
 * <p>The job definition is captured at start, so re-registering the name does not affect a running job.
 */
final class RunningJob {

    private final ScheduledJob job;
    private final Instant startedAt;
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile JobTimer.Cancellable initialTimer;
    private volatile JobTimer.Cancellable recurringTimer;
    private volatile boolean cancelled;

    RunningJob(ScheduledJob job, Instant startedAt) {
        this.job = job;
        this.startedAt = startedAt;
    }

    ScheduledJob job() {
        return job;
    }

    String name() {
        return job.name();
    }

    Instant startedAt() {
        return startedAt;
    }

    void armed(JobTimer.Cancellable initialTimer, JobTimer.Cancellable recurringTimer) {
        this.initialTimer = initialTimer;
        this.recurringTimer = recurringTimer;
    }

    boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancel both timers. Attempts already executing run to completion.
     */
    void cancel() {
        cancelled = true;
        JobTimer.Cancellable initial = initialTimer;
        if (initial != null) {
            initial.cancel();
            initialTimer = null;
        }
        JobTimer.Cancellable recurring = recurringTimer;
        if (recurring != null) {
            recurring.cancel();
            recurringTimer = null;
        }
    }

    void enter() {
        inFlight.incrementAndGet();
    }

    /**
     * Enter only if no other attempt of this job is executing.
     */
    boolean tryEnterExclusive() {
        return inFlight.compareAndSet(0, 1);
    }

    void exit() {
        inFlight.decrementAndGet();
    }

    int inFlight() {
        return inFlight.get();
    }
}
