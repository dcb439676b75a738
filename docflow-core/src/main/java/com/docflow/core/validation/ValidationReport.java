package com.docflow.core.validation;

import com.docflow.core.exception.WorkflowDefinitionException;

import java.util.List;

/**
 * Result of validating a definition. Empty problem list means the definition may be published.
 */
public record ValidationReport(String definition, List<DefinitionProblem> problems) {

    public ValidationReport {
        problems = List.copyOf(problems);
    }

    public boolean valid() {
        return problems.isEmpty();
    }

    public boolean has(String code) {
        return problems.stream().anyMatch(p -> p.code().equals(code));
    }

    public List<DefinitionProblem> problemsFor(String subjectId) {
        return problems.stream()
            .filter(p -> subjectId.equals(p.subjectId()))
            .toList();
    }

    public void throwIfInvalid() {
        if (!valid()) {
            throw new WorkflowDefinitionException(definition, problems);
        }
    }
}
