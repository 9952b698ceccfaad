package com.multifish.logging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.multifish.action.ActionType;
import com.multifish.action.ActionExecutionException;
import com.multifish.action.payload.PatchProfilePayload;
import com.multifish.action.payload.ProfilePatch;
import com.multifish.scheduler.ExecutionHistory;
import com.multifish.scheduler.MachineExecutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileExecutionLoggerTest {

    private static final Instant NOW = Instant.parse("2026-02-10T10:00:00.123Z");
    private static final PatchProfilePayload PAYLOAD = PatchProfilePayload.of(
            List.of(new PatchProfilePayload.Entry("bmc", new ProfilePatch("Performance"))));

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private JsonFileExecutionLogger logger;

    @BeforeEach
    void setUp() throws Exception {
        logger = new JsonFileExecutionLogger(tempDir.resolve("logs").toString(), mapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createsLogsDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("logs")));
    }

    @Test
    void blankDirectoryIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new JsonFileExecutionLogger(" ", mapper, Clock.systemUTC()));
    }

    @Test
    void successWritesOneJsonFilePerAttempt() throws Exception {
        logger.recordSuccess("Job-1", "m1", ActionType.PATCH_PROFILE, Duration.ofMillis(250), PAYLOAD);

        Path file = logger.getLogsDir().resolve("Job-1_m1_PatchProfile_20260210_100000_123_success.json");
        assertTrue(Files.exists(file));
        JsonNode record = mapper.readTree(file.toFile());
        assertEquals("Job-1", record.get("job_id").asText());
        assertEquals("Success", record.get("status").asText());
        assertEquals("PT0.25S", record.get("duration").asText());
        assertEquals("Performance", record.get("payload").get(0).get("Payload").get("Profile").asText());
        assertFalse(record.has("error") && !record.get("error").isNull());
    }

    @Test
    void sameMillisecondAttemptsOnRepeatedMachineKeepBothFiles() throws Exception {
        logger.recordSuccess("Job-1", "m1", ActionType.PATCH_PROFILE, Duration.ofMillis(10), PAYLOAD);
        logger.recordFailure("Job-1", "m1", ActionType.PATCH_PROFILE,
                new ActionExecutionException("m1", "busy"), PAYLOAD);
        logger.recordSuccess("Job-1", "m1", ActionType.PATCH_PROFILE, Duration.ofMillis(20), PAYLOAD);

        Path first = logger.getLogsDir().resolve("Job-1_m1_PatchProfile_20260210_100000_123_success.json");
        Path second = logger.getLogsDir().resolve("Job-1_m1_PatchProfile_20260210_100000_123_success_1.json");
        assertEquals("PT0.01S", mapper.readTree(first.toFile()).get("duration").asText());
        assertEquals("PT0.02S", mapper.readTree(second.toFile()).get("duration").asText());
        assertTrue(Files.exists(logger.getLogsDir().resolve("Job-1_m1_PatchProfile_20260210_100000_123_error.json")));
    }

    @Test
    void failureRecordsErrorTypeAndMessage() throws Exception {
        logger.recordFailure("Job-1", "rack/2", ActionType.PATCH_PROFILE,
                new ActionExecutionException("rack/2", "connection refused"), PAYLOAD);

        Path file = logger.getLogsDir().resolve("Job-1_rack_2_PatchProfile_20260210_100000_123_error.json");
        JsonNode record = mapper.readTree(file.toFile());
        assertEquals("Error", record.get("status").asText());
        assertEquals("ActionExecutionException", record.get("error_type").asText());
        assertEquals("connection refused", record.get("error").asText());
        assertEquals("rack/2", record.get("machine_id").asText());
    }

    @Test
    void historyIsAppendedToDailyFile() throws Exception {
        MachineExecutionResult ok = MachineExecutionResult.succeeded("m1", "ok", NOW, NOW, Duration.ZERO);
        logger.recordHistory(ExecutionHistory.aggregate("Job-1", NOW, List.of(ok)));
        logger.recordHistory(ExecutionHistory.aggregate("Job-2", NOW, List.of(ok)));

        List<String> lines = Files.readAllLines(logger.getLogsDir().resolve("job-executions-2026-02-10.log"));
        assertEquals(2, lines.size());
        assertEquals("Job-2", mapper.readTree(lines.get(1)).get("JobId").asText());
        assertEquals("Completed", mapper.readTree(lines.get(0)).get("Status").asText());
    }

    @Test
    void fileNamesAreSanitized() {
        String name = JsonFileExecutionLogger.fileName("Job 1", "10.0.0.1:443", ActionType.PATCH_FAN_ZONE,
                OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), "success");

        assertEquals("Job_1_10.0.0.1_443_PatchFanZone_20260210_100000_123_success.json", name);
    }
}
