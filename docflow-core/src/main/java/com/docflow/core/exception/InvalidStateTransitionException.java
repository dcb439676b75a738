package com.docflow.core.exception;

import com.docflow.core.model.WorkflowStatus;

/**
 * Thrown when an instance status change is not allowed by the status machine.
 */
public class InvalidStateTransitionException extends WorkflowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(WorkflowStatus currentStatus, WorkflowStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(WorkflowStatus currentStatus, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s while instance is %s",
            operation, currentStatus
        ));
    }
}
