package com.docflow.core.model;

/**
 * Lifecycle states for a workflow instance.
 * Transitions follow a strict state machine - see {@link #canTransitionTo}.
 */
public enum WorkflowStatus {
    /**
     * Active; accepts stimuli.
     * Transitions: -> SUSPENDED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Halted by an operator. Timers are deferred, transitions rejected.
     * Transitions: -> RUNNING, CANCELLED
     */
    SUSPENDED,

    /**
     * Every active branch reached an end node. Terminal state.
     */
    COMPLETED,

    /**
     * A fatal action failure with no error edge. Terminal state.
     */
    FAILED,

    /**
     * Cancelled by request. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean acceptsTransitions() {
        return this == RUNNING;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case RUNNING -> target == SUSPENDED || target == COMPLETED || target == FAILED || target == CANCELLED;
            case SUSPENDED -> target == RUNNING || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
