package io.recur4j.core;

/**
 * Type-erased view of a job as stored in the scheduler registry.
 *
 * <p>The options/result types stay inside the implementation ({@link JobConfig}); the scheduler only
 * sees timing, gating and a way to execute.
 */
public interface ScheduledJob {

    String name();

    String description();

    TimeInterval interval();

    /**
     * Delay before the first run, or null to run on the next tick.
     */
    TimeInterval initialDelay();

    /**
     * Admission window, or null when the job may run at any time.
     */
    BusinessHours businessHours();

    /**
     * Overlap policy, or null to use the scheduler default.
     */
    OverlapPolicy overlapPolicy();

    RunResult execute() throws Exception;
}
