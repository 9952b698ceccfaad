package com.multifish.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Job creation input as received. {@code action} and {@code payload} stay
 * untyped until {@link JobValidator} resolves them.
 */
public record JobCreateRequest(
        @JsonProperty("Name") String name,
        @JsonProperty("Machines") List<String> machines,
        @JsonProperty("Action") String action,
        @JsonProperty("Payload") JsonNode payload,
        @JsonProperty("Schedule") Schedule schedule
) {
    public JobCreateRequest {
        machines = machines == null ? List.of() : machines;
    }
}
