package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.multifish.action.ActionType;
import com.multifish.action.ManagerOperations;
import com.multifish.machine.MachineHandle;

import java.util.ArrayList;
import java.util.List;

public record PatchFanZonePayload(List<Entry> entries) implements JobPayload {

    public record Entry(@JsonProperty("ManagerID") String managerId,
                        @JsonProperty("FanZoneID") String fanZoneId,
                        @JsonProperty("Payload") FanZonePatch payload) {}

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PatchFanZonePayload of(List<Entry> entries) {
        return new PatchFanZonePayload(entries);
    }

    @JsonValue
    public List<Entry> asList() { return entries; }

    @Override
    public ActionType action() { return ActionType.PATCH_FAN_ZONE; }

    @Override
    public List<String> validate() {
        return PayloadChecks.checkEntries(entries, "fan zone", entry -> {
            List<String> errors = new ArrayList<>();
            if (PayloadChecks.isBlank(entry.managerId())) {
                errors.add("ManagerID is required and cannot be empty");
            }
            if (PayloadChecks.isBlank(entry.fanZoneId())) {
                errors.add("FanZoneID is required and cannot be empty");
            }
            if (entry.payload() == null) {
                errors.add("Payload is required");
            }
            return errors;
        }, entry -> entry.managerId() + ":" + entry.fanZoneId());
    }

    @Override
    public void applyTo(ManagerOperations operations, MachineHandle machine) {
        for (Entry entry : entries) {
            operations.patchFanZone(machine, entry.managerId(), entry.fanZoneId(), entry.payload());
        }
    }
}
