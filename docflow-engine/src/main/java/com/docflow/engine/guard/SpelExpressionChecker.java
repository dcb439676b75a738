package com.docflow.engine.guard;

import com.docflow.core.validation.ExpressionChecker;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;

import java.util.Optional;

/**
 * Syntax check for condition expressions at publish time.
 */
public class SpelExpressionChecker implements ExpressionChecker {

    private final SpelExpressionParser parser = new SpelExpressionParser();

    @Override
    public Optional<String> check(String expression) {
        try {
            parser.parseExpression(expression);
            return Optional.empty();
        } catch (ParseException e) {
            return Optional.of(e.getMessage());
        }
    }
}
