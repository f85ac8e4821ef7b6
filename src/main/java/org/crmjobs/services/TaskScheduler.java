package org.crmjobs.services;

import org.crmjobs.config.utils.LogContext;
import org.crmjobs.services.log.ExecutionLogSink;
import org.crmjobs.services.log.LogSinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TaskScheduler triggers registered ScheduledTasks at the minutes their recurrence rule matches.
 * A single loop thread ticks on a fixed interval; executions run on a pool of daemon workers.
 * Each task has an in-flight lock, so the same task never runs twice at once. A trigger that
 * finds the task still running is dropped for that tick.
 * Every execution yields exactly one JobResult, which is appended to the execution log sink.
 */
public class TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    public static final Duration DEFAULT_TICK = Duration.ofSeconds(30);
    public static final int DEFAULT_WORKERS = 4;

    private final Clock clock;
    private final ExecutionLogSink logSink;
    private final Duration tickInterval;
    private final ThreadPoolExecutor workers;
    private final Map<String, JobEntry> jobs = new ConcurrentHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private ScheduledExecutorService loop;

    public TaskScheduler(Clock clock, ExecutionLogSink logSink) {
        this(clock, logSink, DEFAULT_WORKERS, DEFAULT_TICK);
    }

    public TaskScheduler(Clock clock, ExecutionLogSink logSink, int workerThreads, Duration tickInterval) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        if (tickInterval.isZero() || tickInterval.isNegative() || tickInterval.compareTo(Duration.ofMinutes(1)) > 0) {
            throw new IllegalArgumentException("tickInterval must be positive and at most one minute");
        }
        this.clock = clock;
        this.logSink = logSink;
        this.tickInterval = tickInterval;
        this.workers = new ThreadPoolExecutor(workerThreads, workerThreads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("crm-job-worker-"));
    }

    /**
     * Register a task. Names are unique.
     */
    public synchronized void register(ScheduledTask task) {
        if (jobs.putIfAbsent(task.name(), new JobEntry(task)) != null) {
            throw new DuplicateJobException(task.name());
        }
        logger.debug("Registered job {} with schedule '{}'", task.name(), task.recurrence());
    }

    /**
     * Start the trigger loop. The first tick happens immediately.
     */
    public synchronized void start() {
        if (stopped.get()) {
            throw new IllegalStateException("TaskScheduler has been stopped");
        }
        if (loop != null) {
            throw new IllegalStateException("TaskScheduler already started");
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        for (JobEntry entry : jobs.values()) {
            logger.info("Scheduling job {} at '{}', next run {}",
                    entry.task.name(), entry.task.recurrence(), entry.task.recurrence().nextMatch(now));
        }
        loop = Executors.newSingleThreadScheduledExecutor(daemonThreads("crm-job-scheduler-"));
        loop.scheduleAtFixedRate(this::safeTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("[--------- TaskScheduler started with {} jobs, tick {}s ---------]",
                jobs.size(), tickInterval.toSeconds());
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            // an exception here would cancel the periodic loop
            logger.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Evaluate one tick: dispatch every job whose rule matches the current minute and that has
     * not already run in that minute.
     *
     * @return names of the jobs dispatched on this tick
     */
    public List<String> tick() {
        List<String> dispatched = new ArrayList<>();
        if (stopped.get()) {
            return dispatched;
        }
        ZonedDateTime minute = ZonedDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);

        for (JobEntry entry : jobs.values()) {
            String name = entry.task.name();
            // compared as wall-clock time, so the repeated hour when clocks fall back does not run a job twice
            if (!entry.task.recurrence().isDue(minute) || minute.toLocalDateTime().equals(entry.lastRunMinute)) {
                continue;
            }
            if (!entry.inFlight.compareAndSet(false, true)) {
                logger.warn("Job {} is still running, skipping trigger at {}", name, minute);
                continue;
            }
            entry.lastRunMinute = minute.toLocalDateTime();
            try {
                workers.execute(() -> {
                    try {
                        executeAndRecord(entry);
                    } finally {
                        entry.inFlight.set(false);
                    }
                });
                dispatched.add(name);
            } catch (RejectedExecutionException e) {
                entry.inFlight.set(false);
                logger.warn("Job {} not dispatched, worker pool is shutting down", name);
            }
        }
        return dispatched;
    }

    /**
     * Run a job immediately on the calling thread, outside its schedule.
     *
     * @throws JobNotFoundException       if no job has that name
     * @throws JobAlreadyRunningException if the job has an execution in flight
     */
    public JobResult runNow(String name) {
        JobEntry entry = jobs.get(name);
        if (entry == null) {
            throw new JobNotFoundException(name);
        }
        if (!entry.inFlight.compareAndSet(false, true)) {
            throw new JobAlreadyRunningException(name);
        }
        try {
            logger.info("Manual run requested for job {}", name);
            entry.lastRunMinute = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
            return executeAndRecord(entry);
        } finally {
            entry.inFlight.set(false);
        }
    }

    private JobResult executeAndRecord(JobEntry entry) {
        String name = entry.task.name();
        Map<String, String> callerContext = LogContext.snapshot();
        LogContext.start(name);
        try {
            Instant startedAt = clock.instant();
            JobResult result;
            try {
                String summary = entry.task.execute(startedAt);
                result = JobResult.success(name, startedAt, clock.instant(), summary);
                logger.info("Job {} succeeded: {}", name, summary);
            } catch (Exception e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                result = JobResult.failure(name, startedAt, clock.instant(), error);
                logger.error("Job {} failed: {}", name, error, e);
            }
            entry.update(result);
            record(result);
            return result;
        } finally {
            LogContext.restore(callerContext);
        }
    }

    private void record(JobResult result) {
        try {
            logSink.append(result);
        } catch (LogSinkException | RuntimeException e) {
            logger.error("[ExecutionLog] Failed to record {} result of job {}: {}",
                    result.outcome(), result.jobName(), e.getMessage(), e);
        }
    }

    /**
     * Stop triggering and wait for in-flight executions to finish.
     */
    public void stop() {
        stop(null);
    }

    /**
     * Stop triggering and wait at most {@code deadline} for in-flight executions.
     * Executions still running afterwards are abandoned, never interrupted. Calling this again is a no-op.
     */
    public void stop(Duration deadline) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("[--------- Stopping TaskScheduler ---------]");
        synchronized (this) {
            if (loop != null) {
                loop.shutdown();
            }
        }
        workers.shutdown();
        try {
            boolean finished = deadline == null
                    ? workers.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS)
                    : workers.awaitTermination(deadline.toMillis(), TimeUnit.MILLISECONDS);
            if (finished) {
                logger.info("[--------- TaskScheduler stopped ---------]");
            } else {
                logger.warn("TaskScheduler stop deadline of {}s passed, abandoning in-flight executions: {}",
                        deadline.toSeconds(), runningJobNames());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("TaskScheduler shutdown interrupted, abandoning in-flight executions: {}", runningJobNames());
        }
    }

    public synchronized boolean isStarted() {
        return loop != null;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public List<JobStatus> statuses() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        List<JobStatus> result = new ArrayList<>();
        for (JobEntry entry : jobs.values()) {
            result.add(entry.snapshot(now));
        }
        result.sort(Comparator.comparing(JobStatus::name));
        return result;
    }

    public Clock clock() {
        return clock;
    }

    private List<String> runningJobNames() {
        List<String> names = new ArrayList<>();
        for (JobEntry entry : jobs.values()) {
            if (entry.inFlight.get()) names.add(entry.task.name());
        }
        return names;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class JobEntry {
        private final ScheduledTask task;
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        private final AtomicLong successCount = new AtomicLong();
        private final AtomicLong failureCount = new AtomicLong();
        private volatile LocalDateTime lastRunMinute;
        private volatile JobResult lastResult;

        private JobEntry(ScheduledTask task) {
            this.task = task;
        }

        private void update(JobResult result) {
            lastResult = result;
            if (result.isSuccess()) {
                successCount.incrementAndGet();
            } else {
                failureCount.incrementAndGet();
            }
        }

        private JobStatus snapshot(ZonedDateTime now) {
            JobResult last = lastResult;
            ZonedDateTime next = task.recurrence().nextMatch(now);
            return new JobStatus(
                    task.name(),
                    task.recurrence().toString(),
                    inFlight.get(),
                    last != null ? last.startedAt() : null,
                    next != null ? next.toInstant() : null,
                    last != null ? last.outcome() : null,
                    last != null ? last.message() : null,
                    successCount.get(),
                    failureCount.get());
        }
    }
}
