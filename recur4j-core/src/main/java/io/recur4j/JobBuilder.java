package io.recur4j;

import io.recur4j.core.BusinessHours;
import io.recur4j.core.JobConfig;
import io.recur4j.core.OverlapPolicy;
import io.recur4j.core.TimeInterval;
import io.recur4j.internal.SimpleJobBuilder;

import java.util.function.Predicate;

/**
 * Fluent builder for a {@link JobConfig}.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns the immutable job configuration</li>
 *   <li>register(): build() + register with the scheduler that created this builder</li>
 * </ul>
 */
public interface JobBuilder<O, R> {

    /**
     * Standalone builder, e.g. for declaring a job as a Spring bean. {@link #register()} is not available.
     */
    static <O, R> JobBuilder<O, R> of(String name, JobRunner<O, R> runner) {
        return new SimpleJobBuilder<>(name, runner, null);
    }

    /**
     * Human-readable label used in log messages. Defaults to the job name.
     */
    JobBuilder<O, R> description(String description);

    JobBuilder<O, R> every(TimeInterval interval);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours", "30s").
     */
    JobBuilder<O, R> every(String interval);

    /**
     * Delay before the first run. Without it the first run happens on the next timer tick.
     */
    JobBuilder<O, R> initialDelay(TimeInterval initialDelay);

    JobBuilder<O, R> initialDelay(String initialDelay);

    /**
     * Options passed to the runner on every invocation.
     */
    JobBuilder<O, R> options(O options);

    JobBuilder<O, R> businessHours(BusinessHours businessHours);

    /**
     * Results matching the predicate are logged at info, all others at debug.
     */
    JobBuilder<O, R> logResultWhen(Predicate<? super R> shouldLogResult);

    JobBuilder<O, R> overlapPolicy(OverlapPolicy overlapPolicy);

    JobConfig<O, R> build();

    /**
     * Build + register.
     */
    JobConfig<O, R> register();
}
