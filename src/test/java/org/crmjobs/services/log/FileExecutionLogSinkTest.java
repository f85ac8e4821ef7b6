package org.crmjobs.services.log;

import org.crmjobs.services.JobResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileExecutionLogSinkTest {

    private static final Instant START = Instant.parse("2024-01-07T02:00:00Z");

    @TempDir
    Path dir;

    @Test
    void appendsOneLinePerExecution() throws Exception {
        Path file = dir.resolve("nested/customer_cleanup_log.txt");
        FileExecutionLogSink sink = new FileExecutionLogSink(file, ZoneOffset.UTC);

        sink.append(JobResult.success("customer-cleanup", START, START.plusSeconds(1), "Successfully deleted 3 inactive customers"));
        sink.append(JobResult.failure("customer-cleanup", START.plusSeconds(604800), START.plusSeconds(604801), "connection refused"));

        assertThat(Files.readAllLines(file)).containsExactly(
                "2024-01-07 02:00:00 - Successfully deleted 3 inactive customers",
                "2024-01-14 02:00:00 - ERROR: connection refused");
    }

    @Test
    @DisplayName("a multi-line error message is written as a single log line")
    void multiLineErrorStaysOnOneLine() throws Exception {
        Path file = dir.resolve("customer_cleanup_log.txt");
        FileExecutionLogSink sink = new FileExecutionLogSink(file, ZoneOffset.UTC);

        sink.append(JobResult.failure("customer-cleanup", START, START,
                "ERROR: relation \"crm_order\" does not exist\n  Position: 55"));
        sink.append(JobResult.failure("customer-cleanup", START, START, "timeout\r\nretry later\r\n"));

        assertThat(Files.readAllLines(file)).containsExactly(
                "2024-01-07 02:00:00 - ERROR: ERROR: relation \"crm_order\" does not exist Position: 55",
                "2024-01-07 02:00:00 - ERROR: timeout retry later");
    }

    @Test
    void keepsExistingContent() throws Exception {
        Path file = dir.resolve("crm_report_log.txt");
        Files.writeString(file, "2024-01-01 06:00:00 - Report: 1 customers, 0 orders, 0.00 revenue\n");
        FileExecutionLogSink sink = new FileExecutionLogSink(file, ZoneOffset.UTC);

        sink.append(JobResult.success("crm-report", START, START, "Report: 2 customers, 1 orders, 10.00 revenue"));

        assertThat(Files.readAllLines(file)).hasSize(2);
    }

    @Test
    void routesJobsToTheirOwnFiles() throws Exception {
        Path shared = dir.resolve("crm_jobs_log.txt");
        Path report = dir.resolve("crm_report_log.txt");
        FileExecutionLogSink sink = new FileExecutionLogSink(shared, ZoneOffset.UTC).route("crm-report", report);

        sink.append(JobResult.success("crm-report", START, START, "Report: 0 customers, 0 orders, 0.00 revenue"));
        sink.append(JobResult.success("crm-heartbeat", START, START, "CRM is alive | GraphQL: No response"));

        assertThat(Files.readAllLines(report)).hasSize(1);
        assertThat(Files.readAllLines(shared)).containsExactly("2024-01-07 02:00:00 - CRM is alive | GraphQL: No response");
    }

    @Test
    void timestampUsesConfiguredZone() {
        FileExecutionLogSink sink = new FileExecutionLogSink(dir.resolve("x.txt"), ZoneId.of("Africa/Nairobi"));

        assertThat(sink.format(JobResult.success("x", START, START, "ok"))).isEqualTo("2024-01-07 05:00:00 - ok");
    }

    @Test
    void unwritableFileFails() throws Exception {
        Path directory = Files.createDirectory(dir.resolve("taken"));
        FileExecutionLogSink sink = new FileExecutionLogSink(directory, ZoneOffset.UTC);

        assertThatThrownBy(() -> sink.append(JobResult.success("x", START, START, "ok")))
                .isInstanceOf(LogSinkException.class);
    }
}
