package com.multifish.scheduler;

import com.multifish.action.ActionDispatcher;
import com.multifish.logging.ExecutionLogger;
import com.multifish.machine.MachineDirectory;
import com.multifish.machine.MachineHandle;
import com.multifish.machine.MachineNotFoundException;
import com.multifish.observability.JobServiceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a job's action against every target machine in parallel and aggregates
 * the outcome. Machine attempts are independent: one failing never stops the
 * others. Fan-out is not limited here; {@code machineExecutor} is expected to
 * grow with demand.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final MachineDirectory machineDirectory;
    private final ActionDispatcher actionDispatcher;
    private final ExecutionLogger executionLogger;
    private final JobServiceMetrics metrics;
    private final Clock clock;
    private final Executor machineExecutor;

    public ExecutionEngine(MachineDirectory machineDirectory,
                           ActionDispatcher actionDispatcher,
                           ExecutionLogger executionLogger,
                           JobServiceMetrics metrics,
                           Clock clock,
                           Executor machineExecutor) {
        this.machineDirectory = machineDirectory;
        this.actionDispatcher = actionDispatcher;
        this.executionLogger = executionLogger;
        this.metrics = metrics;
        this.clock = clock;
        this.machineExecutor = machineExecutor;
    }

    public ExecutionHistory executeJob(Job job) {
        Instant executionTime = clock.instant();
        long started = System.nanoTime();

        List<CompletableFuture<MachineExecutionResult>> attempts = job.getMachines().stream()
                .map(machineId -> CompletableFuture.supplyAsync(
                        () -> executeMachine(job, machineId), machineExecutor))
                .toList();
        List<MachineExecutionResult> results = attempts.stream()
                .map(CompletableFuture::join)
                .toList();

        ExecutionHistory history = ExecutionHistory.aggregate(job.getId(), executionTime, results);
        metrics.recordJobExecution(job.getAction().wireName(), history.status().wireName(),
                Duration.ofNanos(System.nanoTime() - started));

        try {
            executionLogger.recordHistory(history);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write execution history for job {}: {}", job.getId(), e.getMessage());
        }

        log.info("Job {} executed on {} machines: status={} failures={}",
                job.getId(), results.size(), history.status().wireName(), history.failureCount());
        return history;
    }

    private MachineExecutionResult executeMachine(Job job, String machineId) {
        MDC.put("jobId", job.getId());
        MDC.put("machineId", machineId);
        Instant startTime = clock.instant();
        long started = System.nanoTime();
        try {
            MachineHandle machine = machineDirectory.resolve(machineId);
            actionDispatcher.dispatch(machine, job.getAction(), job.getPayload());

            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            String message = "Successfully executed " + job.getAction().wireName();
            log.info("Executed action={} on machine={} for job={} in {}",
                    job.getAction().wireName(), machineId, job.getId(), duration);
            metrics.recordMachineAttempt(job.getAction().wireName(), true);
            try {
                executionLogger.recordSuccess(job.getId(), machineId, job.getAction(), duration, job.getPayload());
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to write success log for machine {}: {}", machineId, e.getMessage());
            }
            return MachineExecutionResult.succeeded(machineId, message, startTime, clock.instant(), duration);
        } catch (RuntimeException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            String message = e instanceof MachineNotFoundException
                    ? "Failed to get machine"
                    : "Failed to execute " + job.getAction().wireName();
            log.error("{} on machine={} for job={}: {}", message, machineId, job.getId(), e.getMessage());
            metrics.recordMachineAttempt(job.getAction().wireName(), false);
            try {
                executionLogger.recordFailure(job.getId(), machineId, job.getAction(), e, job.getPayload());
            } catch (IOException | RuntimeException logError) {
                log.warn("Failed to write error log for machine {}: {}", machineId, logError.getMessage());
            }
            return MachineExecutionResult.failed(machineId, message, e.getMessage(),
                    startTime, clock.instant(), duration);
        } finally {
            MDC.remove("jobId");
            MDC.remove("machineId");
        }
    }
}
