package com.multifish.machine;

public class MachineNotFoundException extends RuntimeException {

    private final String machineId;

    public MachineNotFoundException(String machineId) {
        super("machine not found: " + machineId);
        this.machineId = machineId;
    }

    public String getMachineId() { return machineId; }
}
