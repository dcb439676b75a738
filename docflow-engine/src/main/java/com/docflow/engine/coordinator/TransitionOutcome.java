package com.docflow.engine.coordinator;

import com.docflow.core.model.FailureInfo;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowTransition;

import java.util.List;

/**
 * Result of one accepted stimulus, ready to be saved.
 *
 * @param instance the instance at its next version
 * @param transition the history record appended, null when the instance failed
 * @param entered nodes the walk entered, to arm timers for
 * @param left nodes the walk left, to disarm timers for
 * @param failure set when an action failed with no error edge to take
 */
record TransitionOutcome(
    WorkflowInstance instance,
    WorkflowTransition transition,
    List<String> entered,
    List<String> left,
    FailureInfo failure
) {
    boolean failed() {
        return failure != null;
    }
}
