package com.docflow.engine.guard;

import com.docflow.core.model.graph.Condition;
import com.docflow.core.model.guard.GuardContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates edge and decision-branch conditions.
 *
 * Expressions are SpEL evaluated against the variable map with a restricted context:
 * variables are readable as properties; type references and bean lookups are unavailable, and an
 * assignment only touches the per-evaluation copy of the variables.
 * A condition that reads an unset variable, fails to evaluate, or yields a non-boolean is false.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();
    private final GuardEvaluator guardEvaluator;
    private final ObjectMapper objectMapper;

    public ConditionEvaluator(GuardEvaluator guardEvaluator, ObjectMapper objectMapper) {
        this.guardEvaluator = guardEvaluator;
        this.objectMapper = objectMapper;
    }

    /**
     * A missing condition holds.
     */
    public boolean test(Condition condition, GuardContext context) {
        if (condition == null) {
            return true;
        }
        if (condition instanceof Condition.VariableEquals) {
            Condition.VariableEquals equals = (Condition.VariableEquals) condition;
            JsonNode actual = context.variable(equals.variable());
            return actual != null && !actual.isNull() && actual.equals(equals.value());
        }
        if (condition instanceof Condition.GuardRef) {
            return guardEvaluator.evaluateNamed(((Condition.GuardRef) condition).guardName(), context).allowed();
        }
        return testExpression(((Condition.Expression) condition).expression(), context);
    }

    private boolean testExpression(String expression, GuardContext context) {
        Expression parsed;
        try {
            parsed = cache.computeIfAbsent(expression, parser::parseExpression);
        } catch (ParseException e) {
            log.warn("Condition does not parse on node {}: {}", context.nodeId(), e.getMessage());
            return false;
        }

        EvaluationContext evaluationContext = SimpleEvaluationContext
            .forPropertyAccessors(new MapAccessor())
            .withInstanceMethods()
            .build();
        try {
            Object value = parsed.getValue(evaluationContext, toPlainValues(context.variables()));
            return Boolean.TRUE.equals(value);
        } catch (EvaluationException e) {
            log.debug("Condition [{}] is false on node {}: {}", expression, context.nodeId(), e.getMessage());
            return false;
        }
    }

    private Map<String, Object> toPlainValues(Map<String, JsonNode> variables) {
        Map<String, Object> values = new LinkedHashMap<>();
        variables.forEach((name, node) -> {
            // JSON null reads as unset
            if (node != null && !node.isNull()) {
                values.put(name, objectMapper.convertValue(node, Object.class));
            }
        });
        return values;
    }
}
