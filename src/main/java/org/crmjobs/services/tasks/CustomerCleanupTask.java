package org.crmjobs.services.tasks;

import org.crmjobs.data.CustomerRepository;
import org.crmjobs.data.RepositoryException;
import org.crmjobs.services.RecurrenceRule;
import org.crmjobs.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Deletes inactive customers: those who never ordered, plus those whose latest order
 * is strictly older than the inactivity window.
 * Nothing is retried within a run; the next run recomputes from the current data.
 */
public class CustomerCleanupTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(CustomerCleanupTask.class);

    public static final String DEFAULT_NAME = "customer-cleanup";
    public static final Duration DEFAULT_INACTIVITY_WINDOW = Duration.ofDays(365);
    public static final RecurrenceRule DEFAULT_SCHEDULE = RecurrenceRule.weekly(DayOfWeek.SUNDAY, 2, 0);

    private final String name;
    private final RecurrenceRule recurrence;
    private final CustomerRepository repository;
    private final Duration inactivityWindow;

    public CustomerCleanupTask(CustomerRepository repository) {
        this(DEFAULT_NAME, DEFAULT_SCHEDULE, repository, DEFAULT_INACTIVITY_WINDOW);
    }

    public CustomerCleanupTask(String name, RecurrenceRule recurrence, CustomerRepository repository, Duration inactivityWindow) {
        this.name = name;
        this.recurrence = recurrence;
        this.repository = repository;
        this.inactivityWindow = inactivityWindow;
    }

    @Override public String name() { return name; }
    @Override public RecurrenceRule recurrence() { return recurrence; }

    @Override
    public String execute(Instant now) throws RepositoryException {
        Instant cutoff = now.minus(inactivityWindow);
        logger.info("Finding customers inactive since {}", cutoff);

        Set<Long> withoutOrders = repository.listCustomersWithNoOrders();
        Set<Long> staleLatestOrder = repository.listCustomersWithStaleLatestOrder(cutoff);

        Set<Long> toDelete = new LinkedHashSet<>(withoutOrders);
        toDelete.addAll(staleLatestOrder);
        logger.debug("Inactive customers: {} without orders, {} with stale latest order, {} distinct",
                withoutOrders.size(), staleLatestOrder.size(), toDelete.size());

        if (toDelete.isEmpty()) {
            return "No inactive customers found to delete";
        }

        int deleted = repository.deleteByIds(toDelete);
        if (deleted != toDelete.size()) {
            logger.warn("Requested deletion of {} customers but the repository removed {} (concurrent modification?)",
                    toDelete.size(), deleted);
        }
        return "Successfully deleted " + toDelete.size() + " inactive customers";
    }
}
