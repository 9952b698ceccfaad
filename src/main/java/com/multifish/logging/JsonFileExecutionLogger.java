package com.multifish.logging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;
import com.multifish.scheduler.ExecutionHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes each machine attempt to its own JSON file named
 * {@code <job>_<machine>_<action>_<timestamp>_<success|error>.json} and appends
 * run summaries to a daily {@code job-executions-<date>.log} (one JSON document per line).
 */
public class JsonFileExecutionLogger implements ExecutionLogger {

    private static final Logger log = LoggerFactory.getLogger(JsonFileExecutionLogger.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path logsDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonFileExecutionLogger(String logsDir, ObjectMapper objectMapper, Clock clock) throws IOException {
        if (logsDir == null || logsDir.isBlank()) {
            throw new IllegalArgumentException("logs directory path cannot be empty");
        }
        this.logsDir = Path.of(logsDir);
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
        Files.createDirectories(this.logsDir);
        log.info("Execution logs directory: {}", this.logsDir.toAbsolutePath());
    }

    @Override
    public void recordSuccess(String jobId, String machineId, ActionType action,
                              Duration duration, JobPayload payload) throws IOException {
        OffsetDateTime now = OffsetDateTime.now(clock);
        ExecutionLogRecord record = new ExecutionLogRecord(jobId, machineId, action.wireName(),
                now.toString(), ExecutionLogRecord.STATUS_SUCCESS, duration.toString(), payload, null, null);
        write(fileName(jobId, machineId, action, now, "success"), record);
    }

    @Override
    public void recordFailure(String jobId, String machineId, ActionType action,
                              Throwable error, JobPayload payload) throws IOException {
        OffsetDateTime now = OffsetDateTime.now(clock);
        ExecutionLogRecord record = new ExecutionLogRecord(jobId, machineId, action.wireName(),
                now.toString(), ExecutionLogRecord.STATUS_ERROR, null, payload,
                error.getClass().getSimpleName(), error.getMessage());
        write(fileName(jobId, machineId, action, now, "error"), record);
    }

    @Override
    public void recordHistory(ExecutionHistory history) throws IOException {
        String day = OffsetDateTime.ofInstant(history.executionTime(), clock.getZone()).format(DAY);
        Path file = logsDir.resolve("job-executions-" + day + ".log");
        String line = objectMapper.writeValueAsString(history) + System.lineSeparator();
        synchronized (this) {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        log.debug("Execution history for job {} appended to {}", history.jobId(), file);
    }

    public Path getLogsDir() { return logsDir; }

    /**
     * Never overwrites: a name already taken by an attempt in the same millisecond
     * gets a {@code _1}, {@code _2}, ... suffix.
     */
    private void write(String fileName, ExecutionLogRecord record) throws IOException {
        byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
        for (int sequence = 0; ; sequence++) {
            Path file = logsDir.resolve(withSequence(fileName, sequence));
            try {
                Files.write(file, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return;
            } catch (FileAlreadyExistsException e) {
                log.debug("Execution log {} already exists", file.getFileName());
            }
        }
    }

    static String withSequence(String fileName, int sequence) {
        if (sequence == 0) {
            return fileName;
        }
        int dot = fileName.lastIndexOf('.');
        return fileName.substring(0, dot) + "_" + sequence + fileName.substring(dot);
    }

    static String fileName(String jobId, String machineId, ActionType action,
                           OffsetDateTime timestamp, String outcome) {
        return sanitize(jobId) + "_" + sanitize(machineId) + "_" + action.wireName() + "_"
                + timestamp.format(FILE_TIMESTAMP) + "_" + outcome + ".json";
    }

    private static String sanitize(String part) {
        return part == null ? "unknown" : part.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
