package com.multifish.action;

import com.multifish.action.payload.FanControllerPatch;
import com.multifish.action.payload.FanZonePatch;
import com.multifish.action.payload.ManagerPatch;
import com.multifish.action.payload.PidControllerPatch;
import com.multifish.action.payload.ProfilePatch;
import com.multifish.machine.MachineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ManagerOperations} that only logs the request it would have sent.
 * Used when no device client is configured.
 */
public class DryRunManagerOperations implements ManagerOperations {

    private static final Logger log = LoggerFactory.getLogger(DryRunManagerOperations.class);

    @Override
    public void patchProfile(MachineHandle machine, String managerId, ProfilePatch patch) {
        log.info("Would PATCH {}/Managers/{} profile={}", machine.endpoint(), managerId, patch.profile());
    }

    @Override
    public void patchManager(MachineHandle machine, String managerId, ManagerPatch patch) {
        log.info("Would PATCH {}/Managers/{} serviceIdentification={}",
                machine.endpoint(), managerId, patch.serviceIdentification());
    }

    @Override
    public void patchFanController(MachineHandle machine, String managerId, String fanControllerId,
                                   FanControllerPatch patch) {
        log.info("Would PATCH {}/Managers/{}/Oem/OpenBmc/Fan/FanControllers/{} body={}",
                machine.endpoint(), managerId, fanControllerId, patch);
    }

    @Override
    public void patchFanZone(MachineHandle machine, String managerId, String fanZoneId, FanZonePatch patch) {
        log.info("Would PATCH {}/Managers/{}/Oem/OpenBmc/Fan/FanZones/{} body={}",
                machine.endpoint(), managerId, fanZoneId, patch);
    }

    @Override
    public void patchPidController(MachineHandle machine, String managerId, String pidControllerId,
                                   PidControllerPatch patch) {
        log.info("Would PATCH {}/Managers/{}/Oem/OpenBmc/Fan/PidControllers/{} body={}",
                machine.endpoint(), managerId, pidControllerId, patch);
    }
}
