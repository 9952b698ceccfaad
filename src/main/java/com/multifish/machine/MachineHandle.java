package com.multifish.machine;

import com.multifish.action.ActionType;

import java.util.Set;

/**
 * A resolved machine. An empty {@code supportedActions} set means the machine
 * accepts every action.
 */
public record MachineHandle(String id, String endpoint, Set<ActionType> supportedActions) {

    public MachineHandle {
        supportedActions = supportedActions == null ? Set.of() : Set.copyOf(supportedActions);
    }

    public MachineHandle(String id, String endpoint) {
        this(id, endpoint, Set.of());
    }

    public boolean supports(ActionType action) {
        return supportedActions.isEmpty() || supportedActions.contains(action);
    }
}
