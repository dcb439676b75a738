package com.docflow.core.event;

/**
 * Types of lifecycle events published for audit and integration.
 */
public enum WorkflowEventType {
    WORKFLOW_STARTED,
    WORKFLOW_TRANSITIONED,
    TASK_COMPLETED,
    WORKFLOW_ESCALATED,
    ESCALATION_FAILED,
    TIMER_FIRED,
    SIGNAL_RECEIVED,
    WORKFLOW_SUSPENDED,
    WORKFLOW_RESUMED,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    WORKFLOW_CANCELLED;

    public boolean isTerminal() {
        return this == WORKFLOW_COMPLETED || this == WORKFLOW_FAILED || this == WORKFLOW_CANCELLED;
    }
}
