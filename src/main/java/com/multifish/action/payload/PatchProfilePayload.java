package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.multifish.action.ActionType;
import com.multifish.action.ManagerOperations;
import com.multifish.machine.MachineHandle;

import java.util.ArrayList;
import java.util.List;

/**
 * Sets the power/performance profile of one or more managers.
 */
public record PatchProfilePayload(List<Entry> entries) implements JobPayload {

    public record Entry(@JsonProperty("ManagerID") String managerId,
                        @JsonProperty("Payload") ProfilePatch payload) {}

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PatchProfilePayload of(List<Entry> entries) {
        return new PatchProfilePayload(entries);
    }

    @JsonValue
    public List<Entry> asList() { return entries; }

    @Override
    public ActionType action() { return ActionType.PATCH_PROFILE; }

    @Override
    public List<String> validate() {
        return PayloadChecks.checkEntries(entries, "manager", entry -> {
            List<String> errors = new ArrayList<>();
            if (PayloadChecks.isBlank(entry.managerId())) {
                errors.add("ManagerID is required and cannot be empty");
            } else if (entry.payload() == null || PayloadChecks.isBlank(entry.payload().profile())) {
                errors.add("profile cannot be empty for ManagerID '" + entry.managerId() + "'");
            } else if (!entry.payload().isKnownProfile()) {
                errors.add("invalid Profile value '" + entry.payload().profile()
                        + "'. Must be one of: " + String.join(", ", ProfilePatch.ALLOWED_PROFILES));
            }
            return errors;
        }, Entry::managerId);
    }

    @Override
    public void applyTo(ManagerOperations operations, MachineHandle machine) {
        for (Entry entry : entries) {
            operations.patchProfile(machine, entry.managerId(), entry.payload());
        }
    }
}
