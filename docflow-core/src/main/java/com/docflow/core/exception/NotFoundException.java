package com.docflow.core.exception;

/**
 * Thrown when a definition, instance or entity is not found.
 */
public class NotFoundException extends WorkflowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
