package org.crmjobs.data;

import java.time.Instant;
import java.util.List;

public interface OrderRepository {

    /**
     * Pending orders placed at or after {@code since}, oldest first.
     */
    List<PendingOrder> listPendingOrdersSince(Instant since) throws RepositoryException;
}
