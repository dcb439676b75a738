package com.docflow.core.model.guard;

/**
 * Custom guard registered under a name in the evaluator's lookup table.
 * Implementations must be pure: same context, same result.
 */
@FunctionalInterface
public interface NamedGuard {

    GuardResult evaluate(GuardContext context);
}
