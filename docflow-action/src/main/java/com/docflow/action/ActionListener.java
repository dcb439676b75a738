package com.docflow.action;

import com.docflow.core.exception.ActionFailedException;

/**
 * Observer for executor retries and final failures.
 */
public interface ActionListener {

    ActionListener NO_OP = new ActionListener() {
    };

    default void onRetry(ActionRequest request, int failedAttempt, ActionException failure) {
    }

    default void onFailure(ActionRequest request, ActionFailedException failure) {
    }
}
