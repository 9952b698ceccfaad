package com.multifish.action;

import com.multifish.action.payload.FanControllerPatch;
import com.multifish.action.payload.FanZonePatch;
import com.multifish.action.payload.ManagerPatch;
import com.multifish.action.payload.PidControllerPatch;
import com.multifish.action.payload.ProfilePatch;
import com.multifish.machine.MachineHandle;

/**
 * Device-level PATCH operations against a machine's BMC managers. Implementations
 * own the wire protocol; every method throws {@link ActionExecutionException}
 * when the manager cannot be reached or refuses the change.
 */
public interface ManagerOperations {

    void patchProfile(MachineHandle machine, String managerId, ProfilePatch patch);

    void patchManager(MachineHandle machine, String managerId, ManagerPatch patch);

    void patchFanController(MachineHandle machine, String managerId, String fanControllerId,
                            FanControllerPatch patch);

    void patchFanZone(MachineHandle machine, String managerId, String fanZoneId, FanZonePatch patch);

    void patchPidController(MachineHandle machine, String managerId, String pidControllerId,
                            PidControllerPatch patch);
}
