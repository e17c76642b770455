package io.recur4j.internal.executor;

import java.time.Duration;

/**
 * Timer primitive the scheduler arms its one-shot and recurring fires on.
 */
public interface JobTimer {

    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Fire {@code task} after {@code initialDelay}, then every {@code period} measured from the first fire,
     * regardless of how long each fire takes.
     */
    Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Handle to a pending fire. Cancelling twice, or after the fire happened, is a no-op.
     */
    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
