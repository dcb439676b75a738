package com.docflow.action;

/**
 * Thrown by action handlers and collaborator sinks when a side effect fails.
 * Transient failures are retried by the executor according to its {@link RetryPolicy};
 * permanent ones fail the action immediately.
 */
public class ActionException extends Exception {

    private final String errorCode;
    private final boolean transientFailure;

    public ActionException(String errorCode, String message, boolean transientFailure) {
        super(message);
        this.errorCode = errorCode;
        this.transientFailure = transientFailure;
    }

    public ActionException(String errorCode, String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.errorCode = errorCode;
        this.transientFailure = transientFailure;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Failure that will not go away on retry, e.g. an unknown template or a rejected request.
     */
    public static ActionException permanent(String errorCode, String message) {
        return new ActionException(errorCode, message, false);
    }

    /**
     * Failure worth retrying, e.g. a timeout or an unavailable downstream system.
     */
    public static ActionException transientFailure(String errorCode, String message) {
        return new ActionException(errorCode, message, true);
    }
}
