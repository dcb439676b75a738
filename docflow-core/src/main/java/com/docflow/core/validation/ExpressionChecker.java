package com.docflow.core.validation;

import java.util.Optional;

/**
 * Syntax check for condition expressions, supplied by whichever module owns the expression
 * language.
 */
@FunctionalInterface
public interface ExpressionChecker {

    ExpressionChecker ACCEPT_ALL = expression -> Optional.empty();

    /**
     * @return a parse error message, or empty if the expression is well formed
     */
    Optional<String> check(String expression);
}
