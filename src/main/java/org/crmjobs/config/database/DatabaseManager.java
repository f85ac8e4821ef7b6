package org.crmjobs.config.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.crmjobs.config.XmlConfiguration;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * The process-wide Hikari pool behind every JDBC repository.
 * Until {@link #initialize} succeeds the jobs run in degraded mode: {@link #getConnection()}
 * throws, and each JDBC-backed execution is recorded as a failure.
 */
public class DatabaseManager {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private static volatile HikariDataSource pool;

    private DatabaseManager() {}

    /**
     * Open the pool and check one connection. Called at startup and by the reconnect monitor;
     * a call while a pool is already open does nothing.
     */
    public static synchronized void initialize(XmlConfiguration cfg) throws SQLException {
        if (pool != null) {
            return;
        }
        if (cfg == null || cfg.dataSource == null || cfg.dataSource.jdbcUrl == null) {
            throw new SQLException("No dataSource configured");
        }

        HikariDataSource candidate;
        try {
            candidate = new HikariDataSource(poolConfig(cfg));
        } catch (RuntimeException e) {
            // Hikari fails fast when the first connection cannot be made
            throw new SQLException("Cannot connect to " + cfg.dataSource.jdbcUrl + ": " + e.getMessage(), e);
        }
        try (Connection conn = candidate.getConnection()) {
            if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection to " + cfg.dataSource.jdbcUrl + " is not valid");
            }
        } catch (SQLException e) {
            candidate.close();
            throw e;
        }
        pool = candidate;
        logger.info("Connected to {}", cfg.dataSource.jdbcUrl);
    }

    @NotNull
    private static HikariConfig poolConfig(XmlConfiguration cfg) {
        XmlConfiguration.ConnectionPool limits = cfg.connectionPool != null ? cfg.connectionPool : new XmlConfiguration.ConnectionPool();
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("crm-jobs-pool");
        hc.setJdbcUrl(cfg.dataSource.jdbcUrl);
        hc.setUsername(cfg.dataSource.username);
        hc.setPassword(cfg.dataSource.password);
        if (cfg.dataSource.driverClassName != null) {
            hc.setDriverClassName(cfg.dataSource.driverClassName);
        }
        hc.setMaximumPoolSize(limits.maximumPoolSize);
        hc.setMinimumIdle(limits.minimumIdle);
        hc.setIdleTimeout(limits.idleTimeout);
        hc.setConnectionTimeout(limits.connectionTimeout);
        hc.setMaxLifetime(limits.maxLifetime);
        return hc;
    }

    public static boolean isInitialized() {
        return pool != null;
    }

    /**
     * True when the pool is open and hands out a valid connection. Used by the health endpoint.
     */
    public static boolean isReachable() {
        if (pool == null) {
            return false;
        }
        try (Connection conn = getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            logger.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    public static Connection getConnection() throws SQLException {
        HikariDataSource current = pool;
        if (current == null) {
            throw new SQLException("Database unavailable: connection pool not initialized");
        }
        return current.getConnection();
    }

    public static synchronized void shutdown() {
        if (pool != null) {
            pool.close();
            pool = null;
            logger.info("Database connection pool closed");
        }
    }
}
