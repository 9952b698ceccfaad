package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.multifish.action.ActionType;
import com.multifish.action.ManagerOperations;
import com.multifish.machine.MachineHandle;

import java.util.ArrayList;
import java.util.List;

public record PatchManagerPayload(List<Entry> entries) implements JobPayload {

    public record Entry(@JsonProperty("ManagerID") String managerId,
                        @JsonProperty("Payload") ManagerPatch payload) {}

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PatchManagerPayload of(List<Entry> entries) {
        return new PatchManagerPayload(entries);
    }

    @JsonValue
    public List<Entry> asList() { return entries; }

    @Override
    public ActionType action() { return ActionType.PATCH_MANAGER; }

    @Override
    public List<String> validate() {
        return PayloadChecks.checkEntries(entries, "manager", entry -> {
            List<String> errors = new ArrayList<>();
            if (PayloadChecks.isBlank(entry.managerId())) {
                errors.add("ManagerID is required and cannot be empty");
            } else if (entry.payload() == null
                    || PayloadChecks.isBlank(entry.payload().serviceIdentification())) {
                errors.add("ServiceIdentification cannot be empty for ManagerID '" + entry.managerId() + "'");
            }
            return errors;
        }, Entry::managerId);
    }

    @Override
    public void applyTo(ManagerOperations operations, MachineHandle machine) {
        for (Entry entry : entries) {
            operations.patchManager(machine, entry.managerId(), entry.payload());
        }
    }
}
