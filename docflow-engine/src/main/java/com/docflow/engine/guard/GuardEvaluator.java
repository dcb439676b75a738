package com.docflow.engine.guard;

import com.docflow.core.model.guard.Guard;
import com.docflow.core.model.guard.GuardContext;
import com.docflow.core.model.guard.GuardResult;

import java.util.List;
import java.util.Set;

/**
 * Evaluates declarative guards against an owned context snapshot.
 * Evaluation has no side effects: the same guard and context always give the same result.
 */
public interface GuardEvaluator {

    GuardResult evaluate(Guard guard, GuardContext context);

    /**
     * AND of the guards in declared order. The first denial short-circuits; outstanding
     * requirements accumulate until then.
     */
    GuardResult evaluateAll(List<Guard> guards, GuardContext context);

    /**
     * Evaluate a guard registered by name. Unknown names deny.
     */
    GuardResult evaluateNamed(String name, GuardContext context);

    /**
     * Names in the guard table, used to validate definitions before publish.
     */
    Set<String> guardNames();
}
