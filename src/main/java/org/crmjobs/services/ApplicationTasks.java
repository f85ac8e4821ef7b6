package org.crmjobs.services;

import org.crmjobs.config.XmlConfiguration;
import org.crmjobs.config.database.ConnectionSource;
import org.crmjobs.data.CustomerRepository;
import org.crmjobs.data.OrderRepository;
import org.crmjobs.services.log.BackgroundTaskLogSink;
import org.crmjobs.services.log.CompositeExecutionLogSink;
import org.crmjobs.services.log.ExecutionLogSink;
import org.crmjobs.services.log.FileExecutionLogSink;
import org.crmjobs.services.tasks.CrmHeartbeatTask;
import org.crmjobs.services.tasks.CrmReportTask;
import org.crmjobs.services.tasks.CustomerCleanupTask;
import org.crmjobs.services.tasks.OrderReminderTask;
import org.crmjobs.stats.GraphQlClient;
import org.crmjobs.stats.GraphQlStatsFetcher;
import org.crmjobs.stats.JdbcStatsFetcher;
import org.crmjobs.stats.StatsFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the scheduler, its execution log and the configured jobs from config.xml.
 * When the configuration lists no jobs, the four default jobs are registered with their default schedules.
 */
public class ApplicationTasks {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationTasks.class);

    public enum JobType { CUSTOMER_CLEANUP, CRM_REPORT, HEARTBEAT, ORDER_REMINDERS }

    /**
     * Collaborators the jobs run against. {@code connections} is null when no database is configured.
     */
    public record Dependencies(CustomerRepository customers,
                               OrderRepository orders,
                               ConnectionSource connections,
                               GraphQlClient graphQl) {
    }

    private ApplicationTasks() {}

    public static TaskScheduler createScheduler(XmlConfiguration cfg, Clock clock, ExecutionLogSink sink) {
        XmlConfiguration.Scheduler s = cfg.scheduler != null ? cfg.scheduler : new XmlConfiguration.Scheduler();
        return new TaskScheduler(clock, sink, s.workerThreads, Duration.ofSeconds(s.tickSeconds));
    }

    public static void registerApplicationTasks(TaskScheduler scheduler, List<ScheduledTask> tasks) {
        logger.info("[------------ Registering Jobs ------------]");
        for (ScheduledTask task : tasks) {
            scheduler.register(task);
        }
        logger.info("[------------ {} jobs registered ------------]", tasks.size());
    }

    public static List<XmlConfiguration.Job> effectiveJobs(XmlConfiguration cfg) {
        if (cfg.jobs != null && !cfg.jobs.isEmpty()) {
            return cfg.jobs;
        }
        logger.debug("No jobs configured, using the default job set");
        return defaultJobs();
    }

    public static List<ScheduledTask> createTasks(XmlConfiguration cfg, Dependencies deps) {
        List<ScheduledTask> tasks = new ArrayList<>();
        for (XmlConfiguration.Job job : effectiveJobs(cfg)) {
            if (!job.enabled) {
                logger.info("Job {} is disabled, not registering", job.name);
                continue;
            }
            tasks.add(createTask(job, deps));
        }
        return tasks;
    }

    static ScheduledTask createTask(XmlConfiguration.Job job, Dependencies deps) {
        if (job.name == null || job.name.isBlank()) {
            throw new IllegalStateException("Every job needs a name");
        }
        JobType type = parseType(job);
        switch (type) {
            case CUSTOMER_CLEANUP:
                return new CustomerCleanupTask(job.name,
                        scheduleOf(job, CustomerCleanupTask.DEFAULT_SCHEDULE),
                        deps.customers(),
                        Duration.ofDays(job.inactivityDays));
            case CRM_REPORT:
                return new CrmReportTask(job.name,
                        scheduleOf(job, CrmReportTask.DEFAULT_SCHEDULE),
                        statsFetcher(job, deps));
            case HEARTBEAT:
                return new CrmHeartbeatTask(job.name,
                        scheduleOf(job, CrmHeartbeatTask.DEFAULT_SCHEDULE),
                        deps.graphQl());
            case ORDER_REMINDERS:
                return new OrderReminderTask(job.name,
                        scheduleOf(job, OrderReminderTask.DEFAULT_SCHEDULE),
                        deps.orders(),
                        Duration.ofDays(job.reminderDays));
            default:
                throw new IllegalStateException("Unsupported job type " + type);
        }
    }

    /**
     * File log routed per job, plus the background_tasks table when enabled and a database is configured.
     */
    public static ExecutionLogSink createLogSink(XmlConfiguration cfg, ZoneId zone, List<ScheduledTask> tasks,
                                                 ConnectionSource connections) {
        XmlConfiguration.ExecutionLog logCfg = cfg.executionLog != null ? cfg.executionLog : new XmlConfiguration.ExecutionLog();
        FileExecutionLogSink fileSink = new FileExecutionLogSink(Path.of(logCfg.defaultFile), zone);
        for (XmlConfiguration.Job job : effectiveJobs(cfg)) {
            if (job.logFile != null && !job.logFile.isBlank()) {
                fileSink.route(job.name, Path.of(job.logFile));
            }
        }

        if (!logCfg.recordToDatabase) {
            return fileSink;
        }
        if (connections == null) {
            logger.warn("executionLog.recordToDatabase is set but no dataSource is configured, logging to files only");
            return fileSink;
        }
        Map<String, RecurrenceRule> schedules = new LinkedHashMap<>();
        for (ScheduledTask task : tasks) {
            schedules.put(task.name(), task.recurrence());
        }
        return new CompositeExecutionLogSink()
                .addSink(fileSink)
                .addSink(new BackgroundTaskLogSink(connections, schedules, zone));
    }

    private static JobType parseType(XmlConfiguration.Job job) {
        if (job.type == null) {
            throw new IllegalStateException("Job " + job.name + " has no type");
        }
        try {
            return JobType.valueOf(job.type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Job " + job.name + " has unknown type " + job.type, e);
        }
    }

    private static RecurrenceRule scheduleOf(XmlConfiguration.Job job, RecurrenceRule fallback) {
        if (job.schedule == null || job.schedule.isBlank()) {
            return fallback;
        }
        return RecurrenceRule.parse(job.schedule);
    }

    private static StatsFetcher statsFetcher(XmlConfiguration.Job job, Dependencies deps) {
        String source = job.statsSource != null ? job.statsSource.trim().toUpperCase(Locale.ROOT) : "GRAPHQL";
        switch (source) {
            case "GRAPHQL":
                return new GraphQlStatsFetcher(deps.graphQl());
            case "DATABASE":
                if (deps.connections() == null) {
                    throw new IllegalStateException("Job " + job.name + " reads stats from the database but no dataSource is configured");
                }
                return new JdbcStatsFetcher(deps.connections());
            default:
                throw new IllegalStateException("Job " + job.name + " has unknown statsSource " + job.statsSource);
        }
    }

    private static List<XmlConfiguration.Job> defaultJobs() {
        List<XmlConfiguration.Job> jobs = new ArrayList<>();
        jobs.add(job(CustomerCleanupTask.DEFAULT_NAME, JobType.CUSTOMER_CLEANUP, "/tmp/customer_cleanup_log.txt"));
        jobs.add(job(CrmReportTask.DEFAULT_NAME, JobType.CRM_REPORT, "/tmp/crm_report_log.txt"));
        jobs.add(job(CrmHeartbeatTask.DEFAULT_NAME, JobType.HEARTBEAT, "/tmp/crm_heartbeat_log.txt"));
        jobs.add(job(OrderReminderTask.DEFAULT_NAME, JobType.ORDER_REMINDERS, "/tmp/order_reminders_log.txt"));
        return jobs;
    }

    private static XmlConfiguration.Job job(String name, JobType type, String logFile) {
        XmlConfiguration.Job job = new XmlConfiguration.Job();
        job.name = name;
        job.type = type.name();
        job.logFile = logFile;
        return job;
    }
}
