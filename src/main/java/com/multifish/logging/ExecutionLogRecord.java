package com.multifish.logging;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.multifish.action.payload.JobPayload;

public record ExecutionLogRecord(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("machine_id") String machineId,
        @JsonProperty("action") String action,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("status") String status,
        @JsonProperty("duration") String duration,
        @JsonProperty("payload") JobPayload payload,
        @JsonProperty("error_type") String errorType,
        @JsonProperty("error") String error
) {
    public static final String STATUS_SUCCESS = "Success";
    public static final String STATUS_ERROR = "Error";
}
