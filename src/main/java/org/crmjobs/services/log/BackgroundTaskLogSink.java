package org.crmjobs.services.log;

import org.crmjobs.config.database.ConnectionSource;
import org.crmjobs.services.JobResult;
import org.crmjobs.services.RecurrenceRule;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Keeps the latest status of every job in the background_tasks table (one row per job).
 */
public class BackgroundTaskLogSink implements ExecutionLogSink {

    static final String SQL_UPSERT =
            "INSERT INTO background_tasks(task_name, task_type, status, last_run_at, next_run_at, error_message, date_created, date_modified) " +
                    "VALUES (?, ?, ?, ?, ?, ?, now(), now()) " +
                    "ON CONFLICT (task_name) DO UPDATE SET " +
                    "status = EXCLUDED.status, last_run_at = EXCLUDED.last_run_at, " +
                    "next_run_at = EXCLUDED.next_run_at, error_message = EXCLUDED.error_message, date_modified = now()";

    private final ConnectionSource connections;
    private final Map<String, RecurrenceRule> schedules;
    private final ZoneId zone;

    public BackgroundTaskLogSink(ConnectionSource connections, Map<String, RecurrenceRule> schedules, ZoneId zone) {
        this.connections = connections;
        this.schedules = Map.copyOf(schedules);
        this.zone = zone;
    }

    @Override
    public void append(JobResult result) throws LogSinkException {
        try (Connection conn = connections.getConnection();
             PreparedStatement ps = conn.prepareStatement(SQL_UPSERT)) {
            ps.setString(1, result.jobName());
            ps.setString(2, "SCHEDULED");
            ps.setString(3, result.isSuccess() ? "SUCCESS" : "FAILED");
            ps.setTimestamp(4, Timestamp.from(result.startedAt()));
            ps.setTimestamp(5, nextRun(result));
            ps.setString(6, result.error());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LogSinkException("Failed to record task " + result.jobName() + " in background_tasks: " + e.getMessage(), e);
        }
    }

    private Timestamp nextRun(JobResult result) {
        RecurrenceRule rule = schedules.get(result.jobName());
        if (rule == null) {
            return null;
        }
        ZonedDateTime next = rule.nextMatch(result.finishedAt().atZone(zone));
        return next != null ? Timestamp.from(next.toInstant()) : null;
    }
}
