package io.recur4j.config;

import io.recur4j.JobScheduler;
import io.recur4j.core.JobConfig;
import io.recur4j.core.ScheduledJob;
import io.recur4j.core.TimeInterval;
import io.recur4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bridges job start/stop with the Spring container lifecycle.
 *
 * <p>On first start the job beans are registered, with {@code recur4j.intervals} overrides applied.
 * Jobs listed in {@code recur4j.disabled-jobs} stay registered but are not started.
 */
public class JobSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobSchedulerLifecycle.class);

    private final JobScheduler scheduler;
    private final List<ScheduledJob> jobs;
    private final SchedulerProperties props;
    private volatile boolean registered = false;
    private volatile boolean running = false;

    public JobSchedulerLifecycle(JobScheduler scheduler, List<ScheduledJob> jobs, SchedulerProperties props) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.jobs = List.copyOf(jobs);
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public void start() {
        if (!registered) {
            registerJobs();
            registered = true;
        }

        Set<String> disabled = props.getDisabledJobs();
        if (disabled == null || disabled.isEmpty()) {
            scheduler.startAll();
        } else {
            int started = 0;
            for (String name : scheduler.getRegisteredJobs()) {
                if (disabled.contains(name)) {
                    log.info("Job disabled by configuration name={}", name);
                    continue;
                }
                scheduler.start(name);
                started++;
            }
            log.info("Scheduled jobs started count={} disabled={}", started, disabled);
        }
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stopAll();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void registerJobs() {
        Map<String, String> overrides = props.getIntervals() == null ? Map.of() : props.getIntervals();

        // resolve every override first so a bad value fails startup before anything is registered
        List<ScheduledJob> resolved = new ArrayList<>(jobs.size());
        for (ScheduledJob job : jobs) {
            String override = overrides.get(job.name());
            resolved.add(override == null ? job : withInterval(job, override));
        }

        for (String name : overrides.keySet()) {
            if (jobs.stream().noneMatch(j -> j.name().equals(name))) {
                log.warn("Interval override for unknown job ignored name={}", name);
            }
        }

        resolved.forEach(scheduler::register);
    }

    private ScheduledJob withInterval(ScheduledJob job, String spec) {
        if (!(job instanceof JobConfig<?, ?> config)) {
            log.warn("Interval override not supported for job type name={} type={}", job.name(), job.getClass().getName());
            return job;
        }
        TimeInterval interval = IntervalParser.parse(spec);
        log.info("Job interval overridden name={} interval={} default={}", job.name(), interval, job.interval());
        return config.withInterval(interval);
    }
}
