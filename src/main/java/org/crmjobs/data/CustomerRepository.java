package org.crmjobs.data;

import java.time.Instant;
import java.util.Set;

/**
 * Customer access needed by the cleanup job.
 */
public interface CustomerRepository {

    /**
     * Ids of customers that have never placed an order.
     */
    Set<Long> listCustomersWithNoOrders() throws RepositoryException;

    /**
     * Ids of customers whose most recent order is strictly before {@code cutoff}.
     * Customers without orders are not included.
     */
    Set<Long> listCustomersWithStaleLatestOrder(Instant cutoff) throws RepositoryException;

    /**
     * Delete the given customers and report how many rows were actually removed.
     */
    int deleteByIds(Set<Long> customerIds) throws RepositoryException;
}
