package com.docflow.core.model;

/**
 * Stimulus that produced a history record.
 */
public enum TransitionKind {
    START,
    TRANSITION,
    TASK_COMPLETION,
    TIMER,
    SIGNAL,
    JOIN_ARRIVAL,
    ERROR_ROUTE
}
