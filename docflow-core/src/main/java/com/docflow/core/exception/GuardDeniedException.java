package com.docflow.core.exception;

import com.docflow.core.model.guard.GuardResult;

/**
 * Thrown when a guard or edge condition rejects a transition. Nothing is persisted.
 */
public class GuardDeniedException extends WorkflowException {

    public static final String ERROR_CODE = "GUARD_DENIED";

    private final String nodeId;
    private final transient GuardResult result;

    public GuardDeniedException(String nodeId, GuardResult result) {
        super(ERROR_CODE, String.format(
            "Entry to node %s denied: %s",
            nodeId, result.reason()
        ));
        this.nodeId = nodeId;
        this.result = result;
    }

    public GuardDeniedException(String nodeId, String reason) {
        this(nodeId, GuardResult.deny(reason, "condition"));
    }

    public String getNodeId() {
        return nodeId;
    }

    public GuardResult getResult() {
        return result;
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
