package io.recur4j.core;

/**
 * Outcome of one successful runner invocation.
 *
 * @param result    whatever the runner returned, possibly null
 * @param logWorthy true when the job asked for this result to be logged at info
 */
public record RunResult(Object result, boolean logWorthy) {
}
