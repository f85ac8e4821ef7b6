package org.crmjobs.data;

import org.crmjobs.config.database.ConnectionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * PostgreSQL-backed access to crm_customer and crm_order.
 */
public class JdbcCustomerRepository implements CustomerRepository, OrderRepository {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCustomerRepository.class);

    static final String SQL_NO_ORDERS = """
            SELECT c.id
            FROM crm_customer c
            WHERE NOT EXISTS (SELECT 1 FROM crm_order o WHERE o.customer_id = c.id)
            ORDER BY c.id
            """;

    static final String SQL_STALE_LATEST_ORDER = """
            SELECT o.customer_id
            FROM crm_order o
            GROUP BY o.customer_id
            HAVING MAX(o.order_date) < ?
            ORDER BY o.customer_id
            """;

    static final String SQL_DELETE_ORDERS = "DELETE FROM crm_order WHERE customer_id = ANY(?)";
    static final String SQL_DELETE_CUSTOMERS = "DELETE FROM crm_customer WHERE id = ANY(?)";

    static final String SQL_PENDING_SINCE = """
            SELECT o.id, c.email, o.order_date
            FROM crm_order o
            JOIN crm_customer c ON c.id = o.customer_id
            WHERE o.status = 'PENDING' AND o.order_date >= ?
            ORDER BY o.order_date, o.id
            """;

    private final ConnectionSource connections;

    public JdbcCustomerRepository(ConnectionSource connections) {
        this.connections = connections;
    }

    @Override
    public Set<Long> listCustomersWithNoOrders() throws RepositoryException {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_NO_ORDERS);
             ResultSet rs = ps.executeQuery()) {
            return readIds(rs);
        } catch (SQLException e) {
            throw new RepositoryException("Failed to list customers without orders: " + e.getMessage(), e);
        }
    }

    @Override
    public Set<Long> listCustomersWithStaleLatestOrder(Instant cutoff) throws RepositoryException {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_STALE_LATEST_ORDER)) {
            ps.setTimestamp(1, Timestamp.from(cutoff));
            try (ResultSet rs = ps.executeQuery()) {
                return readIds(rs);
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to list customers with stale orders: " + e.getMessage(), e);
        }
    }

    /**
     * Deletes the customers and their orders in one transaction.
     */
    @Override
    public int deleteByIds(Set<Long> customerIds) throws RepositoryException {
        if (customerIds.isEmpty()) {
            return 0;
        }
        try (Connection c = connections.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement deleteOrders = c.prepareStatement(SQL_DELETE_ORDERS);
                 PreparedStatement deleteCustomers = c.prepareStatement(SQL_DELETE_CUSTOMERS)) {
                Array ids = c.createArrayOf("bigint", customerIds.toArray());
                deleteOrders.setArray(1, ids);
                int orders = deleteOrders.executeUpdate();
                deleteCustomers.setArray(1, ids);
                int customers = deleteCustomers.executeUpdate();
                c.commit();
                logger.debug("Deleted {} customers and {} of their orders", customers, orders);
                return customers;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RepositoryException("Failed to delete customers: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PendingOrder> listPendingOrdersSince(Instant since) throws RepositoryException {
        try (Connection c = connections.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_PENDING_SINCE)) {
            ps.setTimestamp(1, Timestamp.from(since));
            List<PendingOrder> orders = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    orders.add(new PendingOrder(
                            rs.getLong("id"),
                            rs.getString("email"),
                            rs.getTimestamp("order_date").toInstant()));
                }
            }
            return orders;
        } catch (SQLException e) {
            throw new RepositoryException("Failed to list pending orders: " + e.getMessage(), e);
        }
    }

    private static Set<Long> readIds(ResultSet rs) throws SQLException {
        Set<Long> ids = new LinkedHashSet<>();
        while (rs.next()) {
            ids.add(rs.getLong(1));
        }
        return ids;
    }
}
