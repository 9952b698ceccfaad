package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MachineExecutionResult(
        @JsonProperty("MachineId") String machineId,
        @JsonProperty("Success") boolean success,
        @JsonProperty("Message") String message,
        @JsonProperty("Error") String error,
        @JsonProperty("StartTime") Instant startTime,
        @JsonProperty("EndTime") Instant endTime,
        @JsonProperty("Duration") Duration duration
) {
    public static MachineExecutionResult succeeded(String machineId, String message,
                                                   Instant start, Instant end, Duration duration) {
        return new MachineExecutionResult(machineId, true, message, null, start, end, duration);
    }

    public static MachineExecutionResult failed(String machineId, String message, String error,
                                                Instant start, Instant end, Duration duration) {
        return new MachineExecutionResult(machineId, false, message, error, start, end, duration);
    }
}
