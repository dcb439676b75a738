package com.docflow.core.model.guard;

/**
 * Built-in permissions. Custom permission names are plain strings on {@link Actor}.
 */
public enum Permission {
    VIEW,
    COMPLETE_TASK,
    REVIEW,
    APPROVE,
    CANCEL,
    MODIFY,
    ADMIN
}
