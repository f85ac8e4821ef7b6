package org.crmjobs.services.tasks;

import org.crmjobs.services.RecurrenceRule;
import org.crmjobs.services.ScheduledTask;
import org.crmjobs.stats.CrmStats;
import org.crmjobs.stats.FetchException;
import org.crmjobs.stats.StatsFetcher;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Instant;

/**
 * Weekly CRM summary: customer count, order count and total revenue.
 */
public class CrmReportTask implements ScheduledTask {

    public static final String DEFAULT_NAME = "crm-report";
    public static final RecurrenceRule DEFAULT_SCHEDULE = RecurrenceRule.weekly(DayOfWeek.MONDAY, 6, 0);

    private final String name;
    private final RecurrenceRule recurrence;
    private final StatsFetcher fetcher;

    public CrmReportTask(StatsFetcher fetcher) {
        this(DEFAULT_NAME, DEFAULT_SCHEDULE, fetcher);
    }

    public CrmReportTask(String name, RecurrenceRule recurrence, StatsFetcher fetcher) {
        this.name = name;
        this.recurrence = recurrence;
        this.fetcher = fetcher;
    }

    @Override public String name() { return name; }
    @Override public RecurrenceRule recurrence() { return recurrence; }

    @Override
    public String execute(Instant now) throws FetchException {
        return format(fetcher.getStats());
    }

    static String format(CrmStats stats) {
        return "Report: " + stats.customerCount() + " customers, "
                + stats.orderCount() + " orders, "
                + formatMoney(stats.totalRevenue()) + " revenue";
    }

    static String formatMoney(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
