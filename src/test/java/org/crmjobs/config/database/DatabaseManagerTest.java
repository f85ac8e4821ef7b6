package org.crmjobs.config.database;

import org.crmjobs.config.XmlConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseManagerTest {

    @AfterEach
    void tearDown() {
        DatabaseManager.shutdown();
    }

    @Test
    @DisplayName("without a pool, connections fail and the database is reported unreachable")
    void degradedWithoutPool() {
        assertThat(DatabaseManager.isInitialized()).isFalse();
        assertThat(DatabaseManager.isReachable()).isFalse();
        assertThatThrownBy(DatabaseManager::getConnection)
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("Database unavailable");
    }

    @Test
    void missingDataSourceIsRejected() {
        assertThatThrownBy(() -> DatabaseManager.initialize(new XmlConfiguration()))
                .isInstanceOf(SQLException.class)
                .hasMessage("No dataSource configured");
        assertThatThrownBy(() -> DatabaseManager.initialize(null))
                .isInstanceOf(SQLException.class);
        assertThat(DatabaseManager.isInitialized()).isFalse();
    }

    @Test
    @DisplayName("an unreachable server leaves the manager uninitialized")
    void unreachableServer() {
        XmlConfiguration cfg = new XmlConfiguration();
        cfg.dataSource = new XmlConfiguration.DataSource();
        cfg.dataSource.jdbcUrl = "jdbc:postgresql://127.0.0.1:1/crm";
        cfg.dataSource.username = "crm";
        cfg.dataSource.password = "crm";
        cfg.connectionPool = new XmlConfiguration.ConnectionPool();
        cfg.connectionPool.connectionTimeout = 500;

        assertThatThrownBy(() -> DatabaseManager.initialize(cfg))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("jdbc:postgresql://127.0.0.1:1/crm");
        assertThat(DatabaseManager.isInitialized()).isFalse();
        assertThat(DatabaseManager.isReachable()).isFalse();
    }
}
