package com.multifish.action;

import com.multifish.action.payload.JobPayload;
import com.multifish.machine.MachineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes a job payload to {@link ManagerOperations}. The payload variant decides
 * which operation runs; this class only guards that payload and action agree and
 * normalizes failures to {@link ActionExecutionException}.
 */
@Component
public class DefaultActionDispatcher implements ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionDispatcher.class);

    private final ManagerOperations operations;

    public DefaultActionDispatcher(ManagerOperations operations) {
        this.operations = operations;
    }

    @Override
    public void dispatch(MachineHandle machine, ActionType action, JobPayload payload) {
        if (payload == null) {
            throw new ActionExecutionException(machine.id(),
                    "no payload supplied for action " + action.wireName());
        }
        if (payload.action() != action) {
            throw new ActionExecutionException(machine.id(),
                    "payload for " + payload.action().wireName()
                            + " cannot be used with action " + action.wireName());
        }
        if (!machine.supports(action)) {
            throw new ActionExecutionException(machine.id(),
                    "machine " + machine.id() + " does not support action " + action.wireName());
        }

        log.debug("Dispatching action={} to machine={} endpoint={}",
                action.wireName(), machine.id(), machine.endpoint());
        try {
            payload.applyTo(operations, machine);
        } catch (ActionExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ActionExecutionException(machine.id(),
                    action.wireName() + " failed: " + e.getMessage(), e);
        }
    }
}
