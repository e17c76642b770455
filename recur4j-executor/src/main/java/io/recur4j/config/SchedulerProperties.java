package io.recur4j.config;

import io.recur4j.core.OverlapPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration for the job scheduler.
 */
@ConfigurationProperties(prefix = "recur4j")
public class SchedulerProperties {
    private String timezone = "America/New_York"; // business hours are evaluated here
    private int workerThreads = 8;
    private OverlapPolicy defaultOverlapPolicy = OverlapPolicy.ALLOW;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Set<String> disabledJobs = new LinkedHashSet<>();
    private Map<String, String> intervals = new LinkedHashMap<>(); // job name -> "30 minutes"

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public OverlapPolicy getDefaultOverlapPolicy() {
        return defaultOverlapPolicy;
    }

    public void setDefaultOverlapPolicy(OverlapPolicy defaultOverlapPolicy) {
        this.defaultOverlapPolicy = defaultOverlapPolicy;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Set<String> getDisabledJobs() {
        return disabledJobs;
    }

    public void setDisabledJobs(Set<String> disabledJobs) {
        this.disabledJobs = disabledJobs;
    }

    public Map<String, String> getIntervals() {
        return intervals;
    }

    public void setIntervals(Map<String, String> intervals) {
        this.intervals = intervals;
    }
}
