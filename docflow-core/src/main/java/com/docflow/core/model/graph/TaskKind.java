package com.docflow.core.model.graph;

/**
 * What sort of work a task node represents. Informational for assignees and analytics.
 */
public enum TaskKind {
    MANUAL,
    AUTOMATIC,
    REVIEW,
    NOTIFICATION,
    INTEGRATION
}
