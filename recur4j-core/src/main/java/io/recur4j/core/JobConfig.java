package io.recur4j.core;

import io.recur4j.JobRunner;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable job definition produced by JobBuilder.build().
 * Holds the typed runner and options; the scheduler only talks to it through {@link ScheduledJob}.
 */
public record JobConfig<O, R>(

        // identity
        String name,
        String description,

        // scheduling
        TimeInterval interval,
        TimeInterval initialDelay,
        BusinessHours businessHours,
        OverlapPolicy overlapPolicy,

        // execution
        JobRunner<O, R> runner,
        O options,
        Predicate<? super R> shouldLogResult
) implements ScheduledJob {

    public JobConfig {
        Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        Objects.requireNonNull(interval, "interval must not be null");
        Objects.requireNonNull(runner, "runner must not be null");
        if (description == null || description.isBlank()) {
            description = name;
        }
    }

    /**
     * Copy of this job running at a different cadence.
     */
    public JobConfig<O, R> withInterval(TimeInterval newInterval) {
        return new JobConfig<>(name, description, newInterval, initialDelay, businessHours, overlapPolicy,
                runner, options, shouldLogResult);
    }

    @Override
    public RunResult execute() throws Exception {
        R result = runner.run(options);
        boolean logWorthy = shouldLogResult != null && shouldLogResult.test(result);
        return new RunResult(result, logWorthy);
    }
}
