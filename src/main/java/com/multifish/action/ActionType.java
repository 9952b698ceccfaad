package com.multifish.action;

import com.fasterxml.jackson.annotation.JsonValue;
import com.multifish.action.payload.JobPayload;
import com.multifish.action.payload.PatchFanControllerPayload;
import com.multifish.action.payload.PatchFanZonePayload;
import com.multifish.action.payload.PatchManagerPayload;
import com.multifish.action.payload.PatchPidControllerPayload;
import com.multifish.action.payload.PatchProfilePayload;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Remote operations a job can perform. Each action has exactly one payload type.
 */
public enum ActionType {
    PATCH_PROFILE("PatchProfile", PatchProfilePayload.class),
    PATCH_MANAGER("PatchManager", PatchManagerPayload.class),
    PATCH_FAN_CONTROLLER("PatchFanController", PatchFanControllerPayload.class),
    PATCH_FAN_ZONE("PatchFanZone", PatchFanZonePayload.class),
    PATCH_PID_CONTROLLER("PatchPidController", PatchPidControllerPayload.class);

    private final String wireName;
    private final Class<? extends JobPayload> payloadType;

    ActionType(String wireName, Class<? extends JobPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public Class<? extends JobPayload> payloadType() { return payloadType; }

    public static Optional<ActionType> fromWireName(String value) {
        for (ActionType action : values()) {
            if (action.wireName.equals(value)) return Optional.of(action);
        }
        return Optional.empty();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(ActionType::wireName).toList();
    }
}
