package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.multifish.action.ActionType;
import com.multifish.action.payload.JobPayload;

import java.util.List;

/**
 * Complete validation outcome of a {@link JobCreateRequest}. Every category is
 * always evaluated so callers see all problems at once. The resolved action and
 * typed payload are only present when their own checks passed.
 */
public record ValidationResult(
        @JsonProperty("Valid") boolean valid,
        @JsonProperty("Message") String message,
        @JsonProperty("RequestErrors") List<String> requestErrors,
        @JsonProperty("ScheduleValid") boolean scheduleValid,
        @JsonProperty("ScheduleErrors") List<String> scheduleErrors,
        @JsonProperty("ActionValid") boolean actionValid,
        @JsonProperty("ActionErrors") List<String> actionErrors,
        @JsonProperty("PayloadValid") boolean payloadValid,
        @JsonProperty("PayloadErrors") List<String> payloadErrors,
        @JsonProperty("MachineResults") List<MachineValidationResult> machineResults,
        @JsonIgnore ActionType resolvedAction,
        @JsonIgnore JobPayload resolvedPayload
) {

    static ValidationResult of(List<String> requestErrors, List<String> scheduleErrors,
                               List<String> actionErrors, List<String> payloadErrors,
                               List<MachineValidationResult> machineResults,
                               ActionType action, JobPayload payload) {
        boolean machinesValid = machineResults.stream().allMatch(MachineValidationResult::valid);
        boolean valid = requestErrors.isEmpty() && scheduleErrors.isEmpty()
                && actionErrors.isEmpty() && payloadErrors.isEmpty() && machinesValid;
        return new ValidationResult(valid,
                valid ? "Job validation successful" : "Job validation failed",
                List.copyOf(requestErrors),
                scheduleErrors.isEmpty(), List.copyOf(scheduleErrors),
                actionErrors.isEmpty(), List.copyOf(actionErrors),
                payloadErrors.isEmpty(), List.copyOf(payloadErrors),
                List.copyOf(machineResults),
                action, payload);
    }
}
