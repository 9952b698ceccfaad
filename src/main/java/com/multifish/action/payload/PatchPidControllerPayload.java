package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.multifish.action.ActionType;
import com.multifish.action.ManagerOperations;
import com.multifish.machine.MachineHandle;

import java.util.ArrayList;
import java.util.List;

public record PatchPidControllerPayload(List<Entry> entries) implements JobPayload {

    public record Entry(@JsonProperty("ManagerID") String managerId,
                        @JsonProperty("PidControllerID") String pidControllerId,
                        @JsonProperty("Payload") PidControllerPatch payload) {}

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PatchPidControllerPayload of(List<Entry> entries) {
        return new PatchPidControllerPayload(entries);
    }

    @JsonValue
    public List<Entry> asList() { return entries; }

    @Override
    public ActionType action() { return ActionType.PATCH_PID_CONTROLLER; }

    @Override
    public List<String> validate() {
        return PayloadChecks.checkEntries(entries, "PID controller", entry -> {
            List<String> errors = new ArrayList<>();
            if (PayloadChecks.isBlank(entry.managerId())) {
                errors.add("ManagerID is required and cannot be empty");
            }
            if (PayloadChecks.isBlank(entry.pidControllerId())) {
                errors.add("PidControllerID is required and cannot be empty");
            }
            if (entry.payload() == null) {
                errors.add("Payload is required");
            }
            return errors;
        }, entry -> entry.managerId() + ":" + entry.pidControllerId());
    }

    @Override
    public void applyTo(ManagerOperations operations, MachineHandle machine) {
        for (Entry entry : entries) {
            operations.patchPidController(machine, entry.managerId(), entry.pidControllerId(), entry.payload());
        }
    }
}
