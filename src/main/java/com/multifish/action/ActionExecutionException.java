package com.multifish.action;

/**
 * Raised when an action could not be carried out on a machine.
 */
public class ActionExecutionException extends RuntimeException {

    private final String machineId;

    public ActionExecutionException(String machineId, String message) {
        super(message);
        this.machineId = machineId;
    }

    public ActionExecutionException(String machineId, String message, Throwable cause) {
        super(message, cause);
        this.machineId = machineId;
    }

    public String getMachineId() { return machineId; }
}
