package org.crmjobs.config;

import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElementWrapper;
import jakarta.xml.bind.annotation.XmlRootElement;

import java.util.ArrayList;
import java.util.List;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public DataSource dataSource;
    public ConnectionPool connectionPool = new ConnectionPool();
    public Scheduler scheduler = new Scheduler();
    public GraphQl graphql;
    public ExecutionLog executionLog = new ExecutionLog();

    @XmlElementWrapper(name = "jobs")
    @XmlElement(name = "job")
    public List<Job> jobs = new ArrayList<>();

    // --- Undertow admin server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public boolean enabled = true;
        public String host = "127.0.0.1";
        public int port = 8090;
        public int ioThreads = 2;
        public int workerThreads = 8;
        public String basePath = "/api/crm";
    }

    // --- Data Source ---
    @XmlRootElement(name = "dataSource")
    public static class DataSource {
        public String driverClassName;
        public String jdbcUrl;
        public String username;
        public String password;
    }

    // --- HikariCP Connection Pool ---
    @XmlRootElement(name = "connectionPool")
    public static class ConnectionPool {
        public int maximumPoolSize = 5;
        public int minimumIdle = 1;
        public long idleTimeout = 600000;
        public long connectionTimeout = 30000;
        public long maxLifetime = 1800000;
    }

    // --- Job scheduler ---
    @XmlRootElement(name = "scheduler")
    public static class Scheduler {
        public String zoneId = "UTC";
        public int tickSeconds = 30;
        public int workerThreads = 4;
        public int shutdownTimeoutSeconds = 30;
    }

    // --- GraphQL endpoint of the CRM ---
    @XmlRootElement(name = "graphql")
    public static class GraphQl {
        public String endpoint = "http://localhost:8000/graphql";
        public int timeoutSeconds = 10;
    }

    // --- Execution log ---
    @XmlRootElement(name = "executionLog")
    public static class ExecutionLog {
        public String defaultFile = "/tmp/crm_jobs_log.txt";
        public boolean recordToDatabase = false;
    }

    /**
     * One scheduled job. {@code type} selects the implementation:
     * CUSTOMER_CLEANUP, CRM_REPORT, HEARTBEAT or ORDER_REMINDERS.
     */
    @XmlRootElement(name = "job")
    public static class Job {
        public String name;
        public String type;
        public String schedule;
        public boolean enabled = true;
        public String logFile;

        // CUSTOMER_CLEANUP
        public int inactivityDays = 365;

        // CRM_REPORT: GRAPHQL or DATABASE
        public String statsSource = "GRAPHQL";

        // ORDER_REMINDERS
        public int reminderDays = 7;
    }
}
