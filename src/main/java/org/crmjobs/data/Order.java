package org.crmjobs.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An order as seen by the jobs: read-only.
 */
public record Order(long id, long customerId, Instant orderDate, BigDecimal totalAmount, String status) {

    public static final String STATUS_PENDING = "PENDING";

    public boolean isPending() {
        return STATUS_PENDING.equalsIgnoreCase(status);
    }
}
