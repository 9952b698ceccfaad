package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MachineValidationResult(
        @JsonProperty("MachineId") String machineId,
        @JsonProperty("Valid") boolean valid,
        @JsonProperty("Message") String message,
        @JsonProperty("Errors") List<String> errors
) {
    public MachineValidationResult {
        errors = List.copyOf(errors);
    }
}
