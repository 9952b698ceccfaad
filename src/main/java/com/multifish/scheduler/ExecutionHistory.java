package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one scheduler-triggered run of a job. {@code results} follow the
 * order of the job's machine list.
 */
public record ExecutionHistory(
        @JsonProperty("JobId") String jobId,
        @JsonProperty("ExecutionTime") Instant executionTime,
        @JsonProperty("Status") JobStatus status,
        @JsonProperty("Results") List<MachineExecutionResult> results
) {
    public ExecutionHistory {
        results = List.copyOf(results);
    }

    /**
     * Completed only when every machine succeeded. An empty result list counts as Completed.
     */
    public static ExecutionHistory aggregate(String jobId, Instant executionTime,
                                             List<MachineExecutionResult> results) {
        boolean allSucceeded = results.stream().allMatch(MachineExecutionResult::success);
        return new ExecutionHistory(jobId, executionTime,
                allSucceeded ? JobStatus.COMPLETED : JobStatus.FAILED, results);
    }

    public long failureCount() {
        return results.stream().filter(r -> !r.success()).count();
    }
}
