package org.crmjobs.data;

import java.time.Instant;

public record PendingOrder(long orderId, String customerEmail, Instant orderDate) {
}
