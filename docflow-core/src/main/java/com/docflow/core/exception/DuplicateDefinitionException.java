package com.docflow.core.exception;

/**
 * Thrown when a definition with the same name and version is already published.
 */
public class DuplicateDefinitionException extends WorkflowException {

    public static final String ERROR_CODE = "DUPLICATE_DEFINITION";

    public DuplicateDefinitionException(String name, String version) {
        super(ERROR_CODE, String.format(
            "Workflow definition already published: %s@%s",
            name, version
        ));
    }
}
