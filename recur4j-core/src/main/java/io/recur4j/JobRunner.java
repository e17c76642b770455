package io.recur4j;

/**
 * The unit of work a job invokes on every admitted attempt.
 *
 * <p>The scheduler treats a runner as opaque: it may block, may have side effects and is not assumed
 * to be idempotent. Anything it throws is caught and logged by the scheduler.
 *
 * @param <O> options passed on every invocation
 * @param <R> result handed to the job's log predicate
 */
@FunctionalInterface
public interface JobRunner<O, R> {

    R run(O options) throws Exception;
}
