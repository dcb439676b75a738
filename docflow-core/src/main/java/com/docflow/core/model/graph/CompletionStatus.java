package com.docflow.core.model.graph;

/**
 * Outcome recorded on an instance when it completes at an end node.
 */
public enum CompletionStatus {
    SUCCESS,
    WARNING,
    ERROR,
    CANCELLED
}
