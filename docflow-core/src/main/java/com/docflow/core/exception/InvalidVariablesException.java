package com.docflow.core.exception;

import java.util.List;

/**
 * Thrown when start variables are missing or do not match their declared types.
 */
public class InvalidVariablesException extends WorkflowException {

    public static final String ERROR_CODE = "INVALID_VARIABLES";

    private final List<String> violations;

    public InvalidVariablesException(String definition, List<String> violations) {
        super(ERROR_CODE, String.format(
            "Invalid variables for %s: %s",
            definition, String.join("; ", violations)
        ));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
