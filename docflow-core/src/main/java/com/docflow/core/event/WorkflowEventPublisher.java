package com.docflow.core.event;

/**
 * Sink for lifecycle events. Called after the instance change is persisted; a failing
 * publisher never undoes the change.
 */
@FunctionalInterface
public interface WorkflowEventPublisher {

    void publish(WorkflowEvent event);

    WorkflowEventPublisher NO_OP = event -> { };
}
