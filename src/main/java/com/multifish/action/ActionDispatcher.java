package com.multifish.action;

import com.multifish.action.payload.JobPayload;
import com.multifish.machine.MachineHandle;

public interface ActionDispatcher {

    /**
     * Performs {@code action} on the machine. Returns normally on success.
     *
     * @throws ActionExecutionException when the machine rejected or failed the operation
     */
    void dispatch(MachineHandle machine, ActionType action, JobPayload payload);
}
