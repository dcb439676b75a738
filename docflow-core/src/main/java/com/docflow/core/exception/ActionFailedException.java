package com.docflow.core.exception;

/**
 * Thrown when an action could not be completed.
 * Transient failures exhausted their retries; fatal ones were never retried.
 */
public class ActionFailedException extends WorkflowException {

    public static final String ERROR_CODE = "ACTION_FAILED";

    private final String nodeId;
    private final String actionId;
    private final String causeCode;
    private final boolean transientFailure;
    private final int attempts;

    public ActionFailedException(String nodeId, String actionId, String causeCode, String message,
                                 boolean transientFailure, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Action %s on node %s failed (%s, %s after %d attempt(s)): %s",
            actionId, nodeId, causeCode, transientFailure ? "transient" : "fatal", attempts, message
        ), cause);
        this.nodeId = nodeId;
        this.actionId = actionId;
        this.causeCode = causeCode;
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getActionId() {
        return actionId;
    }

    public String getCauseCode() {
        return causeCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public int getAttempts() {
        return attempts;
    }
}
