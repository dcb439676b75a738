package com.docflow.core.exception;

import com.docflow.core.validation.DefinitionProblem;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a definition is structurally unsound, either at publish or when a
 * runtime evaluation exposes a defect (a decision with no matching branch and no default).
 */
public class WorkflowDefinitionException extends WorkflowException {

    public static final String ERROR_CODE = "DEFINITION_ERROR";

    private final String definition;
    private final List<DefinitionProblem> problems;

    public WorkflowDefinitionException(String definition, List<DefinitionProblem> problems) {
        super(ERROR_CODE, String.format(
            "Invalid workflow definition %s: %s",
            definition,
            problems.stream().map(DefinitionProblem::toString).collect(Collectors.joining("; "))
        ));
        this.definition = definition;
        this.problems = List.copyOf(problems);
    }

    public WorkflowDefinitionException(String definition, DefinitionProblem problem) {
        this(definition, List.of(problem));
    }

    public WorkflowDefinitionException(String definition, DefinitionProblem problem, Throwable cause) {
        super(ERROR_CODE, String.format("Invalid workflow definition %s: %s", definition, problem), cause);
        this.definition = definition;
        this.problems = List.of(problem);
    }

    public String getDefinition() {
        return definition;
    }

    public List<DefinitionProblem> getProblems() {
        return problems;
    }

    public boolean hasProblem(String code) {
        return problems.stream().anyMatch(p -> p.code().equals(code));
    }
}
