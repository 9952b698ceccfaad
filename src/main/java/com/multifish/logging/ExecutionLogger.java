package com.multifish.logging;

import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;
import com.multifish.scheduler.ExecutionHistory;

import java.io.IOException;
import java.time.Duration;

/**
 * Audit trail of job executions. One record per machine attempt plus one per run.
 */
public interface ExecutionLogger {

    void recordSuccess(String jobId, String machineId, ActionType action,
                       Duration duration, JobPayload payload) throws IOException;

    void recordFailure(String jobId, String machineId, ActionType action,
                       Throwable error, JobPayload payload) throws IOException;

    void recordHistory(ExecutionHistory history) throws IOException;
}
