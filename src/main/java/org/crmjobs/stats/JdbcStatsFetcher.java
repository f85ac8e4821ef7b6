package org.crmjobs.stats;

import org.crmjobs.config.database.ConnectionSource;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Reads the report aggregates straight from the database.
 */
public class JdbcStatsFetcher implements StatsFetcher {

    static final String SQL_STATS = """
            SELECT (SELECT COUNT(*) FROM crm_customer) AS customer_count,
                   (SELECT COUNT(*) FROM crm_order) AS order_count,
                   (SELECT COALESCE(SUM(total_amount), 0) FROM crm_order) AS total_revenue
            """;

    private final ConnectionSource connections;

    public JdbcStatsFetcher(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    public CrmStats getStats() throws FetchException {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_STATS);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new FetchException("Stats query returned no rows");
            }
            BigDecimal revenue = rs.getBigDecimal("total_revenue");
            return new CrmStats(
                    rs.getLong("customer_count"),
                    rs.getLong("order_count"),
                    revenue != null ? revenue : BigDecimal.ZERO);
        } catch (SQLException e) {
            throw new FetchException("Failed to read CRM stats: " + e.getMessage(), e);
        }
    }
}
