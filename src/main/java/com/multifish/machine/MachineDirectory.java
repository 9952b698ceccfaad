package com.multifish.machine;

public interface MachineDirectory {

    /**
     * @throws MachineNotFoundException when no machine is registered under {@code machineId}
     */
    MachineHandle resolve(String machineId);
}
