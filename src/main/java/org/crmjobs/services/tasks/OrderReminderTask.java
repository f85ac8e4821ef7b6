package org.crmjobs.services.tasks;

import org.crmjobs.data.OrderRepository;
import org.crmjobs.data.PendingOrder;
import org.crmjobs.data.RepositoryException;
import org.crmjobs.services.RecurrenceRule;
import org.crmjobs.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Logs a reminder for every pending order placed within the look-back window.
 */
public class OrderReminderTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(OrderReminderTask.class);

    public static final String DEFAULT_NAME = "order-reminders";
    public static final RecurrenceRule DEFAULT_SCHEDULE = RecurrenceRule.daily(8, 0);
    public static final Duration DEFAULT_LOOK_BACK = Duration.ofDays(7);

    private final String name;
    private final RecurrenceRule recurrence;
    private final OrderRepository repository;
    private final Duration lookBack;

    public OrderReminderTask(OrderRepository repository) {
        this(DEFAULT_NAME, DEFAULT_SCHEDULE, repository, DEFAULT_LOOK_BACK);
    }

    public OrderReminderTask(String name, RecurrenceRule recurrence, OrderRepository repository, Duration lookBack) {
        this.name = name;
        this.recurrence = recurrence;
        this.repository = repository;
        this.lookBack = lookBack;
    }

    @Override public String name() { return name; }
    @Override public RecurrenceRule recurrence() { return recurrence; }

    @Override
    public String execute(Instant now) throws RepositoryException {
        List<PendingOrder> orders = repository.listPendingOrdersSince(now.minus(lookBack));
        if (orders.isEmpty()) {
            return "Order reminders processed! No recent pending orders found";
        }
        for (PendingOrder order : orders) {
            logger.info("Order ID: {}, Customer Email: {}, Order Date: {}",
                    order.orderId(), order.customerEmail(), order.orderDate());
        }
        return "Order reminders processed! " + orders.size() + " reminders logged";
    }
}
