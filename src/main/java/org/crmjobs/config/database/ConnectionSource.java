package org.crmjobs.config.database;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out JDBC connections. Callers close what they get.
 */
@FunctionalInterface
public interface ConnectionSource {

    Connection getConnection() throws SQLException;
}
