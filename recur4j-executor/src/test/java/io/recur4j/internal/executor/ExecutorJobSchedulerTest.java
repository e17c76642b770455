package io.recur4j.internal.executor;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import io.recur4j.JobRunner;
import io.recur4j.config.SchedulerProperties;
import io.recur4j.core.BusinessHours;
import io.recur4j.core.OverlapPolicy;
import io.recur4j.core.TimeInterval;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorJobSchedulerTest {

    private static final ZoneId EASTERN = ZoneId.of("America/New_York");
    // 2026-01-14 is a Wednesday
    private static final Instant WEDNESDAY_NOON = civil("2026-01-14T12:00:00");

    record IndexerResult(int documentsChecked) {
    }

    private LogCapture logs;
    private ManualJobTimer timer;
    private ExecutorJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        logs = LogCapture.attach(ExecutorJobScheduler.class);
        useScheduler(WEDNESDAY_NOON, Runnable::run);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        logs.close();
    }

    @Test
    void firstRunWithoutInitialDelayShouldHappenOnNextTickThenEveryInterval() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("content-curator", counting(runs)).every("30 seconds").register();

        scheduler.start("content-curator");
        assertEquals(0, runs.get(), "start must not run the job inline");

        timer.runPending();
        assertEquals(1, runs.get());

        timer.advance(Duration.ofSeconds(29));
        assertEquals(1, runs.get());

        timer.advance(Duration.ofSeconds(1));
        assertEquals(2, runs.get());
    }

    @Test
    void initialDelayShouldOnlyTriggerTheInitialRun() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("summary-generator", counting(runs))
                .every("1 hour")
                .initialDelay("5 minutes")
                .register();

        scheduler.start("summary-generator");
        timer.runPending();
        assertEquals(0, runs.get());

        timer.advance(Duration.ofMinutes(5));
        assertEquals(1, runs.get());

        // recurring timer counts from start(), not from the initial run
        timer.advance(Duration.ofMinutes(55));
        assertEquals(2, runs.get());
    }

    @Test
    void closedBusinessHoursShouldSkipTheRunnerAndLogSkip() {
        // 2026-01-17 is a Saturday
        useScheduler(civil("2026-01-17T09:00:00"), Runnable::run);
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("task-reminder", counting(runs))
                .every("1 hour")
                .businessHours(BusinessHours.of(8, 11))
                .register();

        scheduler.start("task-reminder");
        timer.runPending();
        timer.advance(Duration.ofHours(1));

        assertEquals(0, runs.get());
        assertEquals(2, logs.matching(Level.DEBUG, "Job skipped outside business hours name=task-reminder").size());
        assertTrue(logs.matching(Level.DEBUG, "Job completed").isEmpty());
        assertTrue(logs.matching(Level.INFO, "Job completed").isEmpty());
    }

    @Test
    void openBusinessHoursShouldRunTheJob() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("goal-follow-up", counting(runs))
                .every("4 hours")
                .businessHours(BusinessHours.of(9, 18))
                .register();

        scheduler.start("goal-follow-up");
        timer.runPending();
        assertEquals(1, runs.get());

        // 16:00 ET is still open, 20:00 ET is not
        timer.advance(Duration.ofHours(4));
        assertEquals(2, runs.get());
        timer.advance(Duration.ofHours(4));
        assertEquals(2, runs.get());
    }

    @Test
    void failingRunnerShouldBeLoggedAndKeepJobScheduled() {
        scheduler.create("broken", (Void o) -> {
                    throw new IllegalStateException("boom");
                })
                .description("Broken job")
                .every("1 minute")
                .register();

        scheduler.start("broken");
        timer.runPending();

        List<ILoggingEvent> errors = logs.matching(Level.ERROR, "Job failed name=broken");
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getFormattedMessage().contains("description=Broken job"));
        assertTrue(errors.get(0).getFormattedMessage().contains("msg=boom"));
        assertTrue(scheduler.isRunning("broken"));

        timer.advance(Duration.ofMinutes(1));
        assertEquals(2, logs.matching(Level.ERROR, "Job failed name=broken").size());
    }

    @Test
    void oneFailingJobShouldNotAffectAnother() {
        AtomicInteger healthyRuns = new AtomicInteger();
        scheduler.create("job-a", (Void o) -> {
            throw new RuntimeException("always fails");
        }).every("5 minutes").register();
        scheduler.create("job-b", (Void o) -> healthyRuns.incrementAndGet())
                .every("5 minutes")
                .logResultWhen(n -> true)
                .register();

        scheduler.startAll();
        timer.runPending();
        for (int i = 0; i < 10; i++) {
            timer.advance(Duration.ofMinutes(5));
        }

        assertEquals(11, healthyRuns.get());
        assertEquals(11, logs.matching(Level.INFO, "Job completed name=job-b").size());
        assertEquals(11, logs.matching(Level.ERROR, "Job failed name=job-a").size());
        assertTrue(scheduler.isRunning("job-a"));
        assertTrue(scheduler.isRunning("job-b"));
    }

    @Test
    void resultSeverityShouldFollowPredicate() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.create("document-indexer", (Void o) -> new IndexerResult(calls.getAndIncrement() % 2))
                .description("Document indexer")
                .every("1 hour")
                .logResultWhen(r -> r.documentsChecked() > 0)
                .register();

        scheduler.start("document-indexer");
        timer.runPending();                  // documentsChecked = 0
        timer.advance(Duration.ofHours(1));  // documentsChecked = 1

        List<ILoggingEvent> quiet = logs.matching(Level.DEBUG, "Job completed name=document-indexer");
        List<ILoggingEvent> loud = logs.matching(Level.INFO, "Job completed name=document-indexer");
        assertEquals(1, quiet.size());
        assertEquals(1, loud.size());
        assertTrue(quiet.get(0).getFormattedMessage().contains("result={\"documentsChecked\":0}"));
        assertTrue(loud.get(0).getFormattedMessage().contains("result={\"documentsChecked\":1}"));
    }

    @Test
    void resultWithoutPredicateShouldBeLoggedAtDebug() {
        scheduler.create("engagement-scoring", (Void o) -> "scored").every("1 hour").register();

        scheduler.start("engagement-scoring");
        timer.runPending();

        assertEquals(1, logs.matching(Level.DEBUG, "Job completed name=engagement-scoring").size());
        assertTrue(logs.matching(Level.INFO, "Job completed").isEmpty());
    }

    @Test
    void startingTwiceShouldKeepSingleSchedule() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("alert-processor", counting(runs)).every("5 minutes").register();

        scheduler.start("alert-processor");
        scheduler.start("alert-processor");

        assertEquals(2, timer.pending());
        assertEquals(1, logs.matching(Level.WARN, "Job already running name=alert-processor").size());

        timer.runPending();
        timer.advance(Duration.ofMinutes(5));
        assertEquals(2, runs.get());
    }

    @Test
    void stopShouldBeIdempotentAndCancelTimers() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("feed-fetcher", counting(runs)).every("30 minutes").initialDelay("1 minute").register();

        assertDoesNotThrow(() -> scheduler.stop("feed-fetcher"));
        assertDoesNotThrow(() -> scheduler.stop("never-registered"));
        assertDoesNotThrow(() -> scheduler.stop(null));

        scheduler.start("feed-fetcher");
        scheduler.stop("feed-fetcher");
        scheduler.stop("feed-fetcher");

        assertFalse(scheduler.isRunning("feed-fetcher"));
        assertEquals(0, timer.pending());
        assertEquals(1, logs.matching(Level.INFO, "Job stopped name=feed-fetcher").size());

        timer.advance(Duration.ofHours(2));
        assertEquals(0, runs.get());
        assertTrue(scheduler.getRegisteredJobs().contains("feed-fetcher"));
    }

    @Test
    void startingUnknownJobShouldLogErrorWithoutThrowing() {
        assertDoesNotThrow(() -> scheduler.start("ghost"));
        assertDoesNotThrow(() -> scheduler.start(null));

        assertFalse(scheduler.isRunning("ghost"));
        assertEquals(1, logs.matching(Level.ERROR, "Cannot start unknown job name=ghost").size());
    }

    @Test
    void stopAllWithNothingRunningShouldOnlyLog() {
        assertDoesNotThrow(() -> scheduler.stopAll());

        assertEquals(1, logs.matching(Level.INFO, "All scheduled jobs stopped").size());
    }

    @Test
    void startAllAndStopAllShouldCoverEveryJob() {
        scheduler.create("moltbook-poster", (Void o) -> 0).every("2 hours").register();
        scheduler.create("moltbook-engagement", (Void o) -> 0).every("4 hours").register();

        scheduler.startAll();

        assertTrue(scheduler.getRunningJobs().containsAll(List.of("moltbook-poster", "moltbook-engagement")));
        assertEquals(1, logs.matching(Level.INFO, "Scheduled jobs started count=2 running=2").size());

        scheduler.stopAll();

        assertTrue(scheduler.getRunningJobs().isEmpty());
        assertEquals(2, scheduler.getRegisteredJobs().size());
        assertEquals(0, timer.pending());
    }

    @Test
    void overflowingIntervalShouldNotAbortStartAll() {
        for (int i = 0; i < 5; i++) {
            scheduler.create("ok-" + i, (Void o) -> 0).every("30 seconds").register();
        }
        scheduler.create("huge-interval", (Void o) -> 0)
                .every(TimeInterval.ofHours(Long.MAX_VALUE / 1000))
                .register();
        scheduler.create("huge-delay", (Void o) -> 0)
                .every("1 minute")
                .initialDelay(TimeInterval.ofHours(Long.MAX_VALUE / 1000))
                .register();

        assertDoesNotThrow(() -> scheduler.startAll());

        assertEquals(5, scheduler.getRunningJobs().size());
        assertTrue(scheduler.getRunningJobs().containsAll(List.of("ok-0", "ok-1", "ok-2", "ok-3", "ok-4")));
        assertFalse(scheduler.isRunning("huge-interval"));
        assertFalse(scheduler.isRunning("huge-delay"));
        assertEquals(1, logs.matching(Level.ERROR, "Failed to schedule job name=huge-interval").size());
        assertEquals(1, logs.matching(Level.ERROR, "Failed to schedule job name=huge-delay").size());
        // 5 jobs, each with an initial and a recurring timer
        assertEquals(10, timer.pending());
    }

    @Test
    void reRegisteringShouldReplaceConfiguration() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("digest", counting(runs)).every("1 hour").register();
        scheduler.create("digest", counting(runs)).every("10 seconds").register();

        assertEquals(1, logs.matching(Level.WARN, "Job already registered, replacing configuration name=digest").size());
        assertEquals(List.of("digest"), List.copyOf(scheduler.getRegisteredJobs()));

        scheduler.start("digest");
        timer.runPending();
        timer.advance(Duration.ofSeconds(10));

        assertEquals(2, runs.get());
    }

    @Test
    void reRegisteringShouldNotAffectRunningJobUntilRestart() {
        AtomicInteger oldRuns = new AtomicInteger();
        AtomicInteger newRuns = new AtomicInteger();
        scheduler.create("digest", counting(oldRuns)).every("1 hour").register();
        scheduler.start("digest");
        timer.runPending();

        scheduler.create("digest", counting(newRuns)).every("10 seconds").register();
        timer.advance(Duration.ofSeconds(10));

        assertEquals(1, oldRuns.get());
        assertEquals(0, newRuns.get());

        scheduler.stop("digest");
        scheduler.start("digest");
        timer.runPending();

        assertEquals(1, newRuns.get());
    }

    @Test
    void skipPolicyShouldDropFiresWhileRunIsInFlight() {
        List<Runnable> queued = new ArrayList<>();
        useScheduler(WEDNESDAY_NOON, queued::add);
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("slack-backfill", counting(runs))
                .every("1 minute")
                .overlapPolicy(OverlapPolicy.SKIP)
                .register();

        scheduler.start("slack-backfill");
        timer.runPending();
        timer.advance(Duration.ofMinutes(1));

        assertEquals(1, queued.size());
        assertEquals(1, logs.matching(Level.DEBUG, "Job skipped, previous run still in flight name=slack-backfill").size());

        queued.remove(0).run();
        timer.advance(Duration.ofMinutes(1));

        assertEquals(1, runs.get());
        assertEquals(1, queued.size());
    }

    @Test
    void allowPolicyShouldLetRunsOverlap() {
        List<Runnable> queued = new ArrayList<>();
        useScheduler(WEDNESDAY_NOON, queued::add);
        scheduler.create("outreach", (Void o) -> 0).every("1 minute").register();

        scheduler.start("outreach");
        timer.runPending();
        timer.advance(Duration.ofMinutes(1));

        assertEquals(2, queued.size());
    }

    @Test
    void inFlightRunShouldCompleteAfterStop() {
        List<Runnable> queued = new ArrayList<>();
        useScheduler(WEDNESDAY_NOON, queued::add);
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("enrichment", counting(runs)).every("6 hours").logResultWhen(n -> true).register();

        scheduler.start("enrichment");
        timer.runPending();
        scheduler.stop("enrichment");
        queued.remove(0).run();

        assertEquals(1, runs.get());
        assertEquals(1, logs.matching(Level.INFO, "Job completed name=enrichment").size());
        assertFalse(scheduler.isRunning("enrichment"));
    }

    @Test
    void closeShouldStopJobsAndRefuseNewStarts() {
        scheduler.create("curator", (Void o) -> 0).every("5 minutes").register();
        scheduler.start("curator");

        scheduler.close();
        scheduler.start("curator");

        assertFalse(scheduler.isRunning("curator"));
        assertEquals(0, timer.pending());
        assertEquals(1, logs.matching(Level.ERROR, "Cannot start job on a closed scheduler name=curator").size());
    }

    @Test
    void businessHoursShouldUseConfiguredTimezone() {
        SchedulerProperties props = new SchedulerProperties();
        props.setTimezone("UTC");
        scheduler.close();
        timer = new ManualJobTimer(WEDNESDAY_NOON); // 17:00 UTC
        scheduler = new ExecutorJobScheduler(props, timer, Runnable::run, timer.clock(), new ResultFormatter());
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("utc-job", counting(runs)).every("1 hour").businessHours(BusinessHours.of(16, 18)).register();

        scheduler.start("utc-job");
        timer.runPending();

        // closed at 12:00 in New York, open at 17:00 UTC
        assertEquals(1, runs.get());
    }

    @Test
    void businessHoursShouldDefaultToEasternTime() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.create("eastern-job", counting(runs)).every("1 hour").businessHours(BusinessHours.of(16, 18)).register();

        scheduler.start("eastern-job");
        timer.runPending();

        assertEquals(0, runs.get());
    }

    /* ================= helper ================= */

    private void useScheduler(Instant now, Executor workers) {
        if (scheduler != null) {
            scheduler.close();
        }
        timer = new ManualJobTimer(now);
        scheduler = new ExecutorJobScheduler(new SchedulerProperties(), timer, workers, timer.clock(), new ResultFormatter());
    }

    private static JobRunner<Void, Integer> counting(AtomicInteger runs) {
        return o -> runs.incrementAndGet();
    }

    private static Instant civil(String localDateTime) {
        return LocalDateTime.parse(localDateTime).atZone(EASTERN).toInstant();
    }
}
