package com.multifish.machine;

import com.multifish.action.ActionType;
import com.multifish.config.MultifishProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Machine directory backed by the {@code multifish.machines} list.
 */
public class ConfiguredMachineDirectory implements MachineDirectory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredMachineDirectory.class);

    private final Map<String, MachineHandle> machines = new LinkedHashMap<>();

    public ConfiguredMachineDirectory(List<MultifishProperties.MachineProperties> configured) {
        for (MultifishProperties.MachineProperties machine : configured) {
            if (machine.getId() == null || machine.getId().isBlank()) {
                throw new IllegalArgumentException("multifish.machines entries require an id");
            }
            MachineHandle handle = new MachineHandle(machine.getId(), machine.getEndpoint(),
                    parseActions(machine.getId(), machine.getSupportedActions()));
            if (machines.put(handle.id(), handle) != null) {
                throw new IllegalArgumentException("duplicate machine id in configuration: " + handle.id());
            }
        }
        log.info("Machine directory loaded with {} machines", machines.size());
    }

    @Override
    public MachineHandle resolve(String machineId) {
        MachineHandle handle = machines.get(machineId);
        if (handle == null) {
            throw new MachineNotFoundException(machineId);
        }
        return handle;
    }

    private static Set<ActionType> parseActions(String machineId, List<String> names) {
        Set<ActionType> actions = EnumSet.noneOf(ActionType.class);
        for (String name : names) {
            actions.add(ActionType.fromWireName(name).orElseThrow(() -> new IllegalArgumentException(
                    "unknown action '" + name + "' for machine " + machineId
                            + ". Valid actions: " + ActionType.wireNames())));
        }
        return actions;
    }
}
