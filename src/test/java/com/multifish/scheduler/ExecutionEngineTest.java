package com.multifish.scheduler;

import com.multifish.action.ActionDispatcher;
import com.multifish.action.ActionExecutionException;
import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;
import com.multifish.action.payload.PatchProfilePayload;
import com.multifish.action.payload.ProfilePatch;
import com.multifish.logging.ExecutionLogger;
import com.multifish.machine.MachineDirectory;
import com.multifish.machine.MachineHandle;
import com.multifish.machine.MachineNotFoundException;
import com.multifish.observability.JobServiceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2026-02-10T10:00:00Z");
    private static final JobPayload PAYLOAD = PatchProfilePayload.of(
            List.of(new PatchProfilePayload.Entry("bmc", new ProfilePatch("Performance"))));

    @Mock private MachineDirectory machineDirectory;
    @Mock private ActionDispatcher actionDispatcher;
    @Mock private ExecutionLogger executionLogger;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final JobServiceMetrics metrics = new JobServiceMetrics(meterRegistry);
    private final ExecutorService machineExecutor = Executors.newCachedThreadPool();

    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ExecutionEngine(machineDirectory, actionDispatcher, executionLogger,
                metrics, new MutableClock(NOW), machineExecutor);
        when(machineDirectory.resolve(anyString()))
                .thenAnswer(inv -> new MachineHandle(inv.getArgument(0), "https://bmc"));
    }

    @AfterEach
    void tearDown() {
        machineExecutor.shutdownNow();
    }

    private Job job(String... machines) {
        return new Job("Job-1", "profile", List.of(machines), ActionType.PATCH_PROFILE,
                PAYLOAD, Schedule.once("02:00:00"), NOW);
    }

    @Test
    void allMachinesSucceedingCompletesJob() throws Exception {
        ExecutionHistory history = engine.executeJob(job("m1", "m2"));

        assertEquals(JobStatus.COMPLETED, history.status());
        assertEquals("Job-1", history.jobId());
        assertEquals(NOW, history.executionTime());
        assertEquals(2, history.results().size());
        assertTrue(history.results().stream().allMatch(MachineExecutionResult::success));
        assertEquals("Successfully executed PatchProfile", history.results().get(0).message());
        verify(executionLogger, times(2)).recordSuccess(eq("Job-1"), anyString(),
                eq(ActionType.PATCH_PROFILE), any(), eq(PAYLOAD));
        verify(executionLogger).recordHistory(history);
        assertEquals(1.0, meterRegistry.get("multifish.jobs.executions")
                .tag("status", "Completed").counter().count());
    }

    @Test
    void oneFailingMachineFailsJobButOthersStillRun() throws Exception {
        doThrow(new ActionExecutionException("m2", "connection refused"))
                .when(actionDispatcher).dispatch(argThat(m -> m.id().equals("m2")), any(), any());

        ExecutionHistory history = engine.executeJob(job("m1", "m2", "m3"));

        assertEquals(JobStatus.FAILED, history.status());
        assertEquals(1, history.failureCount());
        assertEquals(List.of("m1", "m2", "m3"),
                history.results().stream().map(MachineExecutionResult::machineId).toList());
        MachineExecutionResult failed = history.results().get(1);
        assertFalse(failed.success());
        assertEquals("Failed to execute PatchProfile", failed.message());
        assertEquals("connection refused", failed.error());
        assertTrue(history.results().get(2).success());
        verify(executionLogger).recordFailure(eq("Job-1"), eq("m2"), eq(ActionType.PATCH_PROFILE),
                any(ActionExecutionException.class), eq(PAYLOAD));
        assertEquals(1.0, meterRegistry.get("multifish.machine.attempts")
                .tag("outcome", "failure").counter().count());
    }

    @Test
    void unknownMachineIsReportedAsLookupFailure() {
        doThrow(new MachineNotFoundException("ghost")).when(machineDirectory).resolve("ghost");

        ExecutionHistory history = engine.executeJob(job("ghost"));

        MachineExecutionResult result = history.results().get(0);
        assertFalse(result.success());
        assertEquals("Failed to get machine", result.message());
        verifyNoInteractions(actionDispatcher);
    }

    @Test
    void loggerFailuresDoNotAffectOutcome() throws Exception {
        doThrow(new IOException("disk full")).when(executionLogger)
                .recordSuccess(anyString(), anyString(), any(), any(), any());
        doThrow(new IOException("disk full")).when(executionLogger).recordHistory(any());

        ExecutionHistory history = engine.executeJob(job("m1"));

        assertEquals(JobStatus.COMPLETED, history.status());
    }

    @Test
    void machinesAreContactedConcurrently() {
        CountDownLatch bothInside = new CountDownLatch(2);
        AtomicInteger sawOther = new AtomicInteger();
        doAnswer(inv -> {
            bothInside.countDown();
            if (bothInside.await(5, TimeUnit.SECONDS)) {
                sawOther.incrementAndGet();
            }
            return null;
        }).when(actionDispatcher).dispatch(any(), any(), any());

        ExecutionHistory history = engine.executeJob(job("m1", "m2"));

        assertEquals(2, sawOther.get());
        assertEquals(JobStatus.COMPLETED, history.status());
    }
}
