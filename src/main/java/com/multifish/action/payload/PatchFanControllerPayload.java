package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.multifish.action.ActionType;
import com.multifish.action.ManagerOperations;
import com.multifish.machine.MachineHandle;

import java.util.ArrayList;
import java.util.List;

public record PatchFanControllerPayload(List<Entry> entries) implements JobPayload {

    public record Entry(@JsonProperty("ManagerID") String managerId,
                        @JsonProperty("FanControllerID") String fanControllerId,
                        @JsonProperty("Payload") FanControllerPatch payload) {}

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PatchFanControllerPayload of(List<Entry> entries) {
        return new PatchFanControllerPayload(entries);
    }

    @JsonValue
    public List<Entry> asList() { return entries; }

    @Override
    public ActionType action() { return ActionType.PATCH_FAN_CONTROLLER; }

    @Override
    public List<String> validate() {
        return PayloadChecks.checkEntries(entries, "fan controller", entry -> {
            List<String> errors = new ArrayList<>();
            if (PayloadChecks.isBlank(entry.managerId())) {
                errors.add("ManagerID is required and cannot be empty");
            }
            if (PayloadChecks.isBlank(entry.fanControllerId())) {
                errors.add("FanControllerID is required and cannot be empty");
            }
            if (entry.payload() == null) {
                errors.add("Payload is required");
            }
            return errors;
        }, entry -> entry.managerId() + ":" + entry.fanControllerId());
    }

    @Override
    public void applyTo(ManagerOperations operations, MachineHandle machine) {
        for (Entry entry : entries) {
            operations.patchFanController(machine, entry.managerId(), entry.fanControllerId(), entry.payload());
        }
    }
}
