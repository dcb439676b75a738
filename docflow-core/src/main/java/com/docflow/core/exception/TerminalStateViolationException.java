package com.docflow.core.exception;

import java.util.UUID;

/**
 * Thrown when a stimulus targets a node that is not active, or an instance that has
 * already finished.
 */
public class TerminalStateViolationException extends WorkflowException {

    public static final String ERROR_CODE = "TERMINAL_STATE_VIOLATION";

    public TerminalStateViolationException(UUID instanceId, String nodeId, String reason) {
        super(ERROR_CODE, String.format(
            "Cannot act on node %s of instance %s: %s",
            nodeId, instanceId, reason
        ));
    }
}
