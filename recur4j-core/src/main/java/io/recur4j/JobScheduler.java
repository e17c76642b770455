package io.recur4j;

import io.recur4j.core.ScheduledJob;
import io.recur4j.internal.SimpleJobBuilder;

import java.util.Collection;

/**
 * Main scheduler API.
 *
 * <p>Jobs are registered by name, then started individually or all at once. Every started job
 * runs on its own interval, optionally staggered by an initial delay and gated by business hours.
 * None of the lifecycle methods throw on misuse (unknown name, double start, stop of a stopped job);
 * such calls are logged and ignored.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.create("document-indexer", indexer::run)
 *          .description("Document indexer")
 *          .every("60 minutes")
 *          .initialDelay("1 minute")
 *          .options(new IndexerOptions(20))
 *          .logResultWhen(r -> r.documentsChecked() > 0)
 *          .register();
 *
 * scheduler.startAll();
 * ...
 * scheduler.stopAll();
 * }</pre>
 */
public interface JobScheduler {

    /**
     * Insert or replace the job registered under {@code job.name()}.
     * A replacement only takes effect on the next {@link #start(String)}.
     */
    void register(ScheduledJob job);

    void start(String name);

    void stop(String name);

    void startAll();

    void stopAll();

    boolean isRunning(String name);

    /**
     * Names of all registered jobs, running or not, in no particular order.
     */
    Collection<String> getRegisteredJobs();

    /**
     * Names of the jobs that are currently scheduled.
     */
    Collection<String> getRunningJobs();

    /**
     * Create a builder whose {@code register()} registers the built job with this scheduler.
     */
    default <O, R> JobBuilder<O, R> create(String name, JobRunner<O, R> runner) {
        return new SimpleJobBuilder<>(name, runner, this::register);
    }
}
