package org.crmjobs.services.log;

import org.crmjobs.services.JobResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Appends one line per execution: "{timestamp} - {summary}" or "{timestamp} - ERROR: {error}".
 * Each job can be routed to its own file; unrouted jobs share the default file.
 * The file is opened in append mode for every line and created when missing.
 */
public class FileExecutionLogSink implements ExecutionLogSink {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path defaultFile;
    private final Map<String, Path> routes = new HashMap<>();
    private final DateTimeFormatter formatter;

    public FileExecutionLogSink(Path defaultFile, ZoneId zone) {
        this.defaultFile = defaultFile;
        this.formatter = TIMESTAMP.withZone(zone);
    }

    /**
     * Send results of {@code jobName} to {@code file} instead of the default file.
     */
    public synchronized FileExecutionLogSink route(String jobName, Path file) {
        routes.put(jobName, file);
        return this;
    }

    public synchronized Path fileFor(String jobName) {
        return routes.getOrDefault(jobName, defaultFile);
    }

    public String format(JobResult result) {
        return formatter.format(result.startedAt()) + " - " + singleLine(result.message());
    }

    public static String format(JobResult result, ZoneId zone) {
        return TIMESTAMP.withZone(zone).format(result.startedAt()) + " - " + singleLine(result.message());
    }

    // driver errors such as PSQLException carry "\n  Position: ..." detail lines
    static String singleLine(String message) {
        return message == null ? null : message.replaceAll("\\s*\\R+\\s*", " ").trim();
    }

    @Override
    public synchronized void append(JobResult result) throws LogSinkException {
        Path file = fileFor(result.jobName());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                writer.write(format(result));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new LogSinkException("Failed to append to " + file + ": " + e.getMessage(), e);
        }
    }
}
