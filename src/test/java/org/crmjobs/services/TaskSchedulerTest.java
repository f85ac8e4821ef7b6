package org.crmjobs.services;

import org.crmjobs.config.utils.LogContext;
import org.crmjobs.services.log.ExecutionLogSink;
import org.crmjobs.services.log.LogSinkException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class TaskSchedulerTest {

    // Sunday
    private static final Instant SUNDAY_0200 = Instant.parse("2024-01-07T02:00:10Z");
    private static final RecurrenceRule SUNDAY_AT_TWO = RecurrenceRule.weekly(DayOfWeek.SUNDAY, 2, 0);

    private MutableClock clock;
    private RecordingSink sink;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(SUNDAY_0200, ZoneOffset.UTC);
        sink = new RecordingSink();
        scheduler = new TaskScheduler(clock, sink, 2, Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop(Duration.ofSeconds(5));
    }

    @Test
    void duplicateNamesAreRejected() {
        scheduler.register(new TestTask("cleanup", SUNDAY_AT_TWO, now -> "ok"));

        assertThatThrownBy(() -> scheduler.register(new TestTask("cleanup", SUNDAY_AT_TWO, now -> "again")))
                .isInstanceOf(DuplicateJobException.class)
                .hasMessageContaining("cleanup");
    }

    @Test
    @DisplayName("runNow of an unknown job fails and writes no log line")
    void runNowUnknownJob() {
        assertThatThrownBy(() -> scheduler.runNow("nope")).isInstanceOf(JobNotFoundException.class);
        assertThat(sink.results).isEmpty();
    }

    @Test
    @DisplayName("a matching minute dispatches the job exactly once")
    void dispatchesOncePerMatchingMinute() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        scheduler.register(new TestTask("cleanup", SUNDAY_AT_TWO, now -> "run " + runs.incrementAndGet()));

        assertThat(scheduler.tick()).containsExactly("cleanup");
        JobResult first = sink.next();
        assertThat(first.isSuccess()).isTrue();
        assertThat(first.summary()).isEqualTo("run 1");
        assertThat(first.startedAt()).isEqualTo(SUNDAY_0200);
        awaitIdle("cleanup");

        // second tick in the same minute
        clock.advance(Duration.ofSeconds(30));
        assertThat(scheduler.tick()).isEmpty();

        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.tick()).isEmpty();

        clock.set(SUNDAY_0200.plus(Duration.ofDays(7)));
        assertThat(scheduler.tick()).containsExactly("cleanup");
        assertThat(sink.next().summary()).isEqualTo("run 2");
        assertThat(runs).hasValue(2);
    }

    @Test
    @DisplayName("a failing job is recorded as a failure and the scheduler keeps running")
    void failureIsRecorded() throws Exception {
        scheduler.register(new TestTask("report", SUNDAY_AT_TWO, now -> {
            throw new IllegalStateException("GraphQL endpoint unreachable");
        }));
        scheduler.register(new TestTask("silent", RecurrenceRule.daily(9, 0), now -> {
            throw new RuntimeException();
        }));
        scheduler.register(new TestTask("heartbeat", RecurrenceRule.everyMinutes(1), now -> "CRM is alive"));

        assertThat(scheduler.tick()).containsExactlyInAnyOrder("report", "heartbeat");
        JobResult a = sink.next();
        JobResult b = sink.next();
        JobResult failure = a.jobName().equals("report") ? a : b;
        assertThat(failure.outcome()).isEqualTo(JobResult.Outcome.FAILURE);
        assertThat(failure.message()).isEqualTo("ERROR: GraphQL endpoint unreachable");

        JobResult silent = scheduler.runNow("silent");
        assertThat(silent.message()).isEqualTo("ERROR: RuntimeException");

        assertThat(scheduler.statuses())
                .extracting(JobStatus::name, JobStatus::failureCount, JobStatus::successCount)
                .containsExactly(
                        tuple("heartbeat", 0L, 1L),
                        tuple("report", 1L, 0L),
                        tuple("silent", 1L, 0L));
    }

    @Test
    @DisplayName("a job still running is not triggered again")
    void inFlightJobIsSkipped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        scheduler.register(new TestTask("slow", RecurrenceRule.everyMinutes(1), now -> {
            runs.incrementAndGet();
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "done";
        }));

        assertThat(scheduler.tick()).containsExactly("slow");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.tick()).isEmpty();
        assertThatThrownBy(() -> scheduler.runNow("slow")).isInstanceOf(JobAlreadyRunningException.class);
        assertThat(scheduler.statuses().get(0).running()).isTrue();

        release.countDown();
        assertThat(sink.next().summary()).isEqualTo("done");
        awaitIdle("slow");
        assertThat(sink.results).isEmpty();
        assertThat(runs).hasValue(1);

        // the skipped trigger was not remembered, so a later minute runs again
        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.tick()).containsExactly("slow");
        assertThat(sink.next().summary()).isEqualTo("done");
    }

    @Test
    @DisplayName("runNow leaves the caller's logging context as it found it")
    void runNowRestoresCallerContext() {
        scheduler.register(new TestTask("cleanup", SUNDAY_AT_TWO, now -> {
            assertThat(MDC.get("component")).isEqualTo("cleanup");
            return "ok";
        }));
        LogContext.start("Main");
        String traceId = LogContext.getTraceId();
        try {
            assertThat(scheduler.runNow("cleanup").isSuccess()).isTrue();

            assertThat(MDC.get("component")).isEqualTo("Main");
            assertThat(LogContext.getTraceId()).isEqualTo(traceId);
        } finally {
            LogContext.clear();
        }
    }

    @Test
    @DisplayName("a rule minute skipped by a daylight-saving gap runs at the first minute after it")
    void springForwardGapStillRunsWeeklyJob() throws Exception {
        ZoneId newYork = ZoneId.of("America/New_York");
        // 2024-03-10 02:00 local does not exist; clocks jump from 01:59 EST to 03:00 EDT
        MutableClock dstClock = new MutableClock(Instant.parse("2024-03-10T06:59:00Z"), newYork);
        TaskScheduler local = new TaskScheduler(dstClock, sink, 1, Duration.ofSeconds(30));
        try {
            local.register(new TestTask("cleanup", SUNDAY_AT_TWO, now -> "ran"));

            assertThat(local.tick()).isEmpty();
            dstClock.set(Instant.parse("2024-03-10T07:00:00Z"));
            assertThat(local.tick()).containsExactly("cleanup");
            assertThat(sink.next().startedAt()).isEqualTo(Instant.parse("2024-03-10T07:00:00Z"));
            dstClock.set(Instant.parse("2024-03-10T07:01:00Z"));
            assertThat(local.tick()).isEmpty();
        } finally {
            local.stop(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("the repeated hour after clocks fall back does not run a fixed-time job twice")
    void fallBackOverlapRunsOnce() throws Exception {
        ZoneId newYork = ZoneId.of("America/New_York");
        // 2024-11-03 01:30 local occurs at 05:30Z (EDT) and again at 06:30Z (EST)
        MutableClock dstClock = new MutableClock(Instant.parse("2024-11-03T05:30:00Z"), newYork);
        TaskScheduler local = new TaskScheduler(dstClock, sink, 1, Duration.ofSeconds(30));
        try {
            local.register(new TestTask("nightly", RecurrenceRule.daily(1, 30), now -> "ran"));

            assertThat(local.tick()).containsExactly("nightly");
            sink.next();
            dstClock.set(Instant.parse("2024-11-03T06:30:00Z"));
            assertThat(local.tick()).isEmpty();
        } finally {
            local.stop(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("runNow runs outside the schedule and returns the recorded result")
    void runNowOutsideSchedule() throws Exception {
        scheduler.register(new TestTask("cleanup", SUNDAY_AT_TWO, now -> "No inactive customers found to delete"));
        clock.set(Instant.parse("2024-01-10T15:42:00Z"));

        JobResult result = scheduler.runNow("cleanup");

        assertThat(result.summary()).isEqualTo("No inactive customers found to delete");
        assertThat(sink.next()).isEqualTo(result);
        assertThat(scheduler.statuses().get(0).lastRunAt()).isEqualTo(Instant.parse("2024-01-10T15:42:00Z"));
        assertThat(scheduler.statuses().get(0).nextRunAt()).isEqualTo(Instant.parse("2024-01-14T02:00:00Z"));
    }

    @Test
    @DisplayName("a log sink failure does not change the outcome")
    void sinkFailureKeepsOutcome() {
        TaskScheduler failingLog = new TaskScheduler(clock, result -> {
            throw new LogSinkException("disk full", null);
        });
        try {
            failingLog.register(new TestTask("cleanup", SUNDAY_AT_TWO, now -> "ok"));

            JobResult result = failingLog.runNow("cleanup");

            assertThat(result.isSuccess()).isTrue();
            assertThat(failingLog.statuses().get(0).successCount()).isEqualTo(1);
        } finally {
            failingLog.stop();
        }
    }

    @Test
    void stopIsIdempotentAndFinal() {
        scheduler.register(new TestTask("heartbeat", RecurrenceRule.everyMinutes(1), now -> "ok"));
        scheduler.start();
        assertThatThrownBy(() -> scheduler.start()).isInstanceOf(IllegalStateException.class);

        scheduler.stop();
        scheduler.stop();

        assertThat(scheduler.isStopped()).isTrue();
        assertThat(scheduler.tick()).isEmpty();
        assertThatThrownBy(() -> scheduler.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("stop with a deadline returns while a job is still running")
    void stopWithDeadlineAbandonsRunningJob() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scheduler.register(new TestTask("slow", RecurrenceRule.everyMinutes(1), now -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return "done";
        }));
        scheduler.tick();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        long begin = System.nanoTime();
        scheduler.stop(Duration.ofMillis(200));
        assertThat(Duration.ofNanos(System.nanoTime() - begin)).isLessThan(Duration.ofSeconds(5));

        release.countDown();
    }

    @Test
    void rejectsTickLongerThanAMinute() {
        assertThatThrownBy(() -> new TaskScheduler(clock, sink, 1, Duration.ofMinutes(2)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void awaitIdle(String name) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (isRunning(name)) {
            assertThat(System.nanoTime()).as("job %s still running after 5s", name).isLessThan(deadline);
            Thread.sleep(10);
        }
    }

    private boolean isRunning(String name) {
        return scheduler.statuses().stream().anyMatch(s -> s.name().equals(name) && s.running());
    }

    interface Body {
        String run(Instant now) throws Exception;
    }

    static final class TestTask implements ScheduledTask {
        private final String name;
        private final RecurrenceRule rule;
        private final Body body;

        TestTask(String name, RecurrenceRule rule, Body body) {
            this.name = name;
            this.rule = rule;
            this.body = body;
        }

        @Override public String name() { return name; }
        @Override public RecurrenceRule recurrence() { return rule; }
        @Override public String execute(Instant now) throws Exception { return body.run(now); }
    }

    static final class RecordingSink implements ExecutionLogSink {
        final BlockingQueue<JobResult> results = new LinkedBlockingQueue<>();

        @Override
        public void append(JobResult result) {
            results.add(result);
        }

        JobResult next() throws InterruptedException {
            JobResult result = results.poll(5, TimeUnit.SECONDS);
            assertThat(result).as("job result within 5s").isNotNull();
            return result;
        }
    }
}
