package io.recur4j.internal.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobScheduler;
import io.recur4j.config.SchedulerProperties;
import io.recur4j.core.BusinessHours;
import io.recur4j.core.OverlapPolicy;
import io.recur4j.core.RunResult;
import io.recur4j.core.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory recurring job scheduler on top of a timer thread and a worker pool.
 *
 * <p>Core behaviour:
 * <ul>
 *   <li>Each started job owns two independent timers: a one-shot initial fire (after the initial delay,
 *       or on the next tick) and a fixed-rate fire every interval measured from {@code start}</li>
 *   <li>Every fire dispatches one attempt to the worker pool, so a slow job never delays other jobs</li>
 *   <li>An attempt checks business hours, runs the job and logs the result; exceptions stop at the
 *       attempt boundary and never cancel the job</li>
 * </ul>
 *
 * <p>Nothing is persisted: registrations and schedules live only as long as this instance.
 */
public class ExecutorJobScheduler implements JobScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutorJobScheduler.class);
    private static final String MDC_JOB = "job";

    private final ConcurrentHashMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RunningJob> running = new ConcurrentHashMap<>();

    private final JobTimer timer;
    private final Executor workers;
    private final Clock clock;
    private final ZoneId zone;
    private final OverlapPolicy defaultOverlapPolicy;
    private final ResultFormatter resultFormatter;
    private final Duration shutdownTimeout;

    // only set when this instance created them, and therefore shuts them down
    private final ScheduledExecutorJobTimer ownedTimer;
    private final ExecutorService ownedWorkers;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Scheduler with its own timer thread and a fixed worker pool of {@code recur4j.worker-threads}.
     */
    public ExecutorJobScheduler(SchedulerProperties props, ObjectMapper objectMapper) {
        this(props, new ScheduledExecutorJobTimer(), newWorkerPool(props), Clock.systemUTC(),
                new ResultFormatter(objectMapper), true);
    }

    /**
     * Scheduler on caller-supplied collaborators. {@link #close()} does not shut them down.
     */
    public ExecutorJobScheduler(SchedulerProperties props, JobTimer timer, Executor workers, Clock clock,
                                ResultFormatter resultFormatter) {
        this(props, timer, workers, clock, resultFormatter, false);
    }

    private ExecutorJobScheduler(SchedulerProperties props, JobTimer timer, Executor workers, Clock clock,
                                 ResultFormatter resultFormatter, boolean owned) {
        Objects.requireNonNull(props, "props must not be null");
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.resultFormatter = Objects.requireNonNull(resultFormatter, "resultFormatter must not be null");
        this.zone = ZoneId.of(Objects.requireNonNull(props.getTimezone(), "recur4j.timezone must not be null"));
        this.defaultOverlapPolicy = props.getDefaultOverlapPolicy() != null
                ? props.getDefaultOverlapPolicy()
                : OverlapPolicy.ALLOW;
        this.shutdownTimeout = Objects.requireNonNull(props.getShutdownTimeout(), "recur4j.shutdownTimeout must not be null");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("recur4j.shutdownTimeout must not be negative");
        }
        this.ownedTimer = owned ? (ScheduledExecutorJobTimer) timer : null;
        this.ownedWorkers = owned ? (ExecutorService) workers : null;
    }

    private static ExecutorService newWorkerPool(SchedulerProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        int threads = props.getWorkerThreads();
        if (threads <= 0) {
            throw new IllegalArgumentException("recur4j.workerThreads must be a positive number");
        }
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("recur4j.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void register(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (jobs.containsKey(job.name())) {
            log.warn("Job already registered, replacing configuration name={}", job.name());
        }
        jobs.put(job.name(), job);
        log.debug("Job registered name={} description={}", job.name(), job.description());
    }

    @Override
    public synchronized void start(String name) {
        ScheduledJob job = name == null ? null : jobs.get(name);
        if (job == null) {
            log.error("Cannot start unknown job name={}", name);
            return;
        }
        if (running.containsKey(name)) {
            log.warn("Job already running name={}", name);
            return;
        }
        if (closed.get()) {
            log.error("Cannot start job on a closed scheduler name={}", name);
            return;
        }

        RunningJob handle = new RunningJob(job, clock.instant());

        JobTimer.Cancellable initialTimer = null;
        try {
            // both conversions throw ArithmeticException when the millisecond count overflows a long
            Duration initialDelay = job.initialDelay() != null ? job.initialDelay().toDuration() : Duration.ZERO;
            if (initialDelay.isNegative()) {
                initialDelay = Duration.ZERO;
            }
            Duration period = job.interval().toDuration();

            initialTimer = timer.schedule(() -> fire(handle), initialDelay);
            JobTimer.Cancellable recurringTimer = timer.scheduleAtFixedRate(() -> fire(handle), period, period);
            handle.armed(initialTimer, recurringTimer);
        } catch (RuntimeException e) {
            if (initialTimer != null) {
                initialTimer.cancel();
            }
            log.error("Failed to schedule job name={} msg={}", name, e.getMessage(), e);
            return;
        }

        running.put(name, handle);
        log.debug("Job scheduled name={} interval={} initialDelay={} businessHours={}",
                name,
                job.interval(),
                job.initialDelay() != null ? job.initialDelay() : "none",
                job.businessHours() != null ? job.businessHours() : "none");
    }

    @Override
    public synchronized void stop(String name) {
        RunningJob handle = name == null ? null : running.remove(name);
        if (handle == null) {
            return;
        }
        handle.cancel();
        log.info("Job stopped name={} startedAt={} inFlight={}", name, handle.startedAt(), handle.inFlight());
    }

    @Override
    public synchronized void startAll() {
        for (String name : List.copyOf(jobs.keySet())) {
            start(name);
        }
        log.info("Scheduled jobs started count={} running={}", jobs.size(), running.size());
    }

    @Override
    public synchronized void stopAll() {
        for (String name : List.copyOf(running.keySet())) {
            stop(name);
        }
        log.info("All scheduled jobs stopped");
    }

    @Override
    public boolean isRunning(String name) {
        return name != null && running.containsKey(name);
    }

    @Override
    public Collection<String> getRegisteredJobs() {
        return List.copyOf(jobs.keySet());
    }

    @Override
    public Collection<String> getRunningJobs() {
        return List.copyOf(running.keySet());
    }

    /**
     * Stop all jobs and release the executors this instance created. Should be idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        stopAll();

        if (ownedTimer != null) {
            ownedTimer.shutdown();
        }

        if (ownedWorkers != null) {
            ownedWorkers.shutdown();
            try {
                if (!ownedWorkers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Job workers did not finish within {}; interrupting", shutdownTimeout);
                    ownedWorkers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ownedWorkers.shutdownNow();
            }
        }
        log.info("Job scheduler closed");
    }

    /* ================= timer callbacks ================= */

    // Runs on the timer thread; must never throw, or the recurring timer would be silently cancelled.
    private void fire(RunningJob handle) {
        try {
            dispatch(handle);
        } catch (Exception e) {
            log.error("Job dispatch failed name={} msg={}", handle.name(), e.getMessage(), e);
        }
    }

    private void dispatch(RunningJob handle) {
        if (handle.isCancelled()) {
            return;
        }

        ScheduledJob job = handle.job();
        OverlapPolicy policy = job.overlapPolicy() != null ? job.overlapPolicy() : defaultOverlapPolicy;
        if (policy == OverlapPolicy.SKIP) {
            if (!handle.tryEnterExclusive()) {
                log.debug("Job skipped, previous run still in flight name={}", job.name());
                return;
            }
        } else {
            handle.enter();
        }

        try {
            workers.execute(() -> attempt(handle));
        } catch (RejectedExecutionException e) {
            handle.exit();
            log.error("Job attempt rejected name={} description={} msg={}", job.name(), job.description(), e.getMessage(), e);
        }
    }

    private void attempt(RunningJob handle) {
        ScheduledJob job = handle.job();
        MDC.put(MDC_JOB, job.name());
        try {
            BusinessHours hours = job.businessHours();
            if (hours != null && !hours.isWithinBusinessHours(clock.instant(), zone)) {
                log.debug("Job skipped outside business hours name={} businessHours={} zone={}", job.name(), hours, zone);
                return;
            }

            RunResult result = job.execute();
            if (result.logWorthy()) {
                log.info("Job completed name={} description={} result={}",
                        job.name(), job.description(), resultFormatter.format(result.result()));
            } else if (log.isDebugEnabled()) {
                log.debug("Job completed name={} description={} result={}",
                        job.name(), job.description(), resultFormatter.format(result.result()));
            }
        } catch (Exception e) {
            log.error("Job failed name={} description={} msg={}", job.name(), job.description(), e.getMessage(), e);
        } finally {
            handle.exit();
            MDC.remove(MDC_JOB);
        }
    }
}
