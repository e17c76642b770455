package io.recur4j.core;

/**
 * What to do when a job's timer fires while its previous run is still executing.
 */
public enum OverlapPolicy {
    /**
     * Start another invocation next to the one in flight.
     */
    ALLOW,
    /**
     * Drop the fire and wait for the next one.
     */
    SKIP
}
