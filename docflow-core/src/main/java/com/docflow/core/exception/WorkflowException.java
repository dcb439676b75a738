package com.docflow.core.exception;

/**
 * Base exception for all workflow engine errors.
 * Every rejection carries a stable error code and a displayable message.
 */
public class WorkflowException extends RuntimeException {

    private final String errorCode;

    public WorkflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WorkflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may retry the same command after reloading state.
     */
    public boolean isRecoverable() {
        return false;
    }
}
