package org.crmjobs;

import io.undertow.Undertow;
import org.crmjobs.config.ConfigLoader;
import org.crmjobs.config.XmlConfiguration;
import org.crmjobs.config.database.ConnectionSource;
import org.crmjobs.config.database.DBTaskScheduler;
import org.crmjobs.config.database.DatabaseManager;
import org.crmjobs.config.utils.LogContext;
import org.crmjobs.data.InMemoryCustomerRepository;
import org.crmjobs.data.JdbcCustomerRepository;
import org.crmjobs.rest.RestApiServer;
import org.crmjobs.services.ApplicationTasks;
import org.crmjobs.services.JobNotFoundException;
import org.crmjobs.services.JobResult;
import org.crmjobs.services.ScheduledTask;
import org.crmjobs.services.TaskScheduler;
import org.crmjobs.services.log.ExecutionLogSink;
import org.crmjobs.services.log.FileExecutionLogSink;
import org.crmjobs.stats.GraphQlClient;
import org.crmjobs.utils.security.KeyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.crmjobs.services.ApplicationTasks.registerApplicationTasks;

/**
 * Entry point
 *   Main [config.xml]                    start the scheduler and the admin API
 *   Main config.xml run &lt;jobName&gt;         run one job once and exit (0 success, 1 failure, 2 unknown job)
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_JOB_FAILED = 1;
    static final int EXIT_UNKNOWN_JOB = 2;

    public static void main(String[] args) {
        LogContext.start("Main");

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        try {
            logger.info("[------------ Starting CRM Jobs ------------]");

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            boolean runMode = args.length > 1 && "run".equals(args[1]);
            if (runMode && args.length < 3) {
                logger.error("Usage: Main <config.xml> run <jobName>");
                System.exit(EXIT_UNKNOWN_JOB);
            }

            logger.info("Environment: {}", KeyProvider.getEnvironment());
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);

            XmlConfiguration.Scheduler schedulerCfg = cfg.scheduler != null ? cfg.scheduler : new XmlConfiguration.Scheduler();
            ZoneId zone = ZoneId.of(schedulerCfg.zoneId);
            Clock clock = Clock.system(zone);

            ConnectionSource connections = null;
            ApplicationTasks.Dependencies deps;
            if (cfg.dataSource != null && cfg.dataSource.jdbcUrl != null) {
                connections = DatabaseManager::getConnection;
                JdbcCustomerRepository repository = new JdbcCustomerRepository(connections);
                deps = new ApplicationTasks.Dependencies(repository, repository, connections, graphQlClient(cfg));
                connectDatabase(cfg);
            } else {
                logger.warn("No dataSource configured, jobs run against an empty in-memory store");
                InMemoryCustomerRepository repository = new InMemoryCustomerRepository();
                deps = new ApplicationTasks.Dependencies(repository, repository, null, graphQlClient(cfg));
            }

            List<ScheduledTask> tasks = ApplicationTasks.createTasks(cfg, deps);
            ExecutionLogSink sink = ApplicationTasks.createLogSink(cfg, zone, tasks, connections);
            TaskScheduler scheduler = ApplicationTasks.createScheduler(cfg, clock, sink);
            registerApplicationTasks(scheduler, tasks);

            if (runMode) {
                System.exit(runOnce(scheduler, args[2], zone));
            }

            Undertow server = null;
            if (cfg.server != null && cfg.server.enabled) {
                logger.info("[------------ Starting Undertow server ------------]");
                server = RestApiServer.startUndertow(cfg.server, scheduler, KeyProvider.getAdminToken());
            }
            scheduler.start();

            Undertow adminServer = server;
            Duration shutdownTimeout = Duration.ofSeconds(schedulerCfg.shutdownTimeoutSeconds);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                scheduler.stop(shutdownTimeout);
                if (adminServer != null) {
                    adminServer.stop();
                }
                DBTaskScheduler.shutdown();
                DatabaseManager.shutdown();
                logger.info("[------------ CRM Jobs shutdown complete ------------]");
                shutdownLatch.countDown();
            }));

        } catch (Exception e) {
            logger.error("[------------ System startup failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }

        // scheduler and worker threads are daemons
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one job on the calling thread and print its execution log line.
     */
    static int runOnce(TaskScheduler scheduler, String jobName, ZoneId zone) {
        try {
            JobResult result = scheduler.runNow(jobName);
            System.out.println(FileExecutionLogSink.format(result, zone));
            return result.isSuccess() ? EXIT_OK : EXIT_JOB_FAILED;
        } catch (JobNotFoundException e) {
            logger.error(e.getMessage());
            return EXIT_UNKNOWN_JOB;
        } finally {
            scheduler.stop(Duration.ZERO);
            DatabaseManager.shutdown();
        }
    }

    private static GraphQlClient graphQlClient(XmlConfiguration cfg) {
        XmlConfiguration.GraphQl g = cfg.graphql != null ? cfg.graphql : new XmlConfiguration.GraphQl();
        return new GraphQlClient(g.endpoint, Duration.ofSeconds(g.timeoutSeconds));
    }

    private static void connectDatabase(XmlConfiguration cfg) {
        try {
            DatabaseManager.initialize(cfg);
        } catch (Exception e) {
            logger.error("Database initialization failed: {}", e.getMessage());
            logger.warn("[------------ Continuing in DEGRADED MODE, database unavailable ------------]");
            logger.info("[------------ Starting background DB reconnection monitor ------------]");
            DBTaskScheduler.scheduleReconnect(() -> {
                try {
                    DatabaseManager.initialize(cfg);
                    logger.info("[------------ Database reconnected successfully ------------]");
                    return true;
                } catch (Exception retry) {
                    logger.debug("Database still unavailable: {}", retry.getMessage());
                    return false;
                }
            });
        }
    }
}
