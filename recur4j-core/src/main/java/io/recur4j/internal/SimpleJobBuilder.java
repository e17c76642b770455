package io.recur4j.internal;

import io.recur4j.JobBuilder;
import io.recur4j.JobRunner;
import io.recur4j.core.BusinessHours;
import io.recur4j.core.JobConfig;
import io.recur4j.core.OverlapPolicy;
import io.recur4j.core.ScheduledJob;
import io.recur4j.core.TimeInterval;
import io.recur4j.utils.IntervalParser;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Default {@link JobBuilder} implementation.
 */
public class SimpleJobBuilder<O, R> implements JobBuilder<O, R> {

    private final String name;
    private final JobRunner<O, R> runner;
    private final Consumer<ScheduledJob> registrar;

    private String description;
    private TimeInterval interval;
    private TimeInterval initialDelay;
    private O options;
    private BusinessHours businessHours;
    private Predicate<? super R> shouldLogResult;
    private OverlapPolicy overlapPolicy;

    /**
     * @param registrar receives the built job on {@link #register()}; null for a standalone builder
     */
    public SimpleJobBuilder(String name, JobRunner<O, R> runner, Consumer<ScheduledJob> registrar) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("job name must not be blank");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.registrar = registrar;
    }

    @Override
    public JobBuilder<O, R> description(String description) {
        this.description = description;
        return this;
    }

    @Override
    public JobBuilder<O, R> every(TimeInterval interval) {
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        return this;
    }

    @Override
    public JobBuilder<O, R> every(String interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        return every(IntervalParser.parse(interval));
    }

    @Override
    public JobBuilder<O, R> initialDelay(TimeInterval initialDelay) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        return this;
    }

    @Override
    public JobBuilder<O, R> initialDelay(String initialDelay) {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        return initialDelay(IntervalParser.parse(initialDelay));
    }

    @Override
    public JobBuilder<O, R> options(O options) {
        this.options = options;
        return this;
    }

    @Override
    public JobBuilder<O, R> businessHours(BusinessHours businessHours) {
        this.businessHours = Objects.requireNonNull(businessHours, "businessHours must not be null");
        return this;
    }

    @Override
    public JobBuilder<O, R> logResultWhen(Predicate<? super R> shouldLogResult) {
        this.shouldLogResult = Objects.requireNonNull(shouldLogResult, "shouldLogResult must not be null");
        return this;
    }

    @Override
    public JobBuilder<O, R> overlapPolicy(OverlapPolicy overlapPolicy) {
        this.overlapPolicy = Objects.requireNonNull(overlapPolicy, "overlapPolicy must not be null");
        return this;
    }

    @Override
    public JobConfig<O, R> build() {
        if (interval == null) {
            throw new IllegalStateException("interval must be set for job: " + name);
        }
        return new JobConfig<>(
                name,
                description,
                interval,
                initialDelay,
                businessHours,
                overlapPolicy,
                runner,
                options,
                shouldLogResult
        );
    }

    @Override
    public JobConfig<O, R> register() {
        if (registrar == null) {
            throw new IllegalStateException("builder for job " + name + " is not bound to a scheduler; use build()");
        }
        JobConfig<O, R> config = build();
        registrar.accept(config);
        return config;
    }
}
