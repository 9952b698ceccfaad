package com.multifish.action.payload;

import com.multifish.action.ActionType;
import com.multifish.action.ManagerOperations;
import com.multifish.machine.MachineHandle;

import java.util.List;

/**
 * Action-specific data carried by a job. There is one implementation per
 * {@link ActionType}; {@link #applyTo} routes each variant to the matching
 * {@link ManagerOperations} call so dispatch never inspects the payload type.
 */
public interface JobPayload {

    ActionType action();

    /**
     * Semantic checks beyond the JSON shape. An empty list means the payload is usable.
     */
    List<String> validate();

    void applyTo(ManagerOperations operations, MachineHandle machine);
}
