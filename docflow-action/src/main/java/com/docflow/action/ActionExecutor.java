package com.docflow.action;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs node actions. Results arrive asynchronously; a failed action completes its future
 * exceptionally with {@link com.docflow.core.exception.ActionFailedException}.
 */
public interface ActionExecutor {

    CompletableFuture<ActionResult> execute(ActionRequest request);

    /**
     * Run actions one after another in list order. Stops at the first failure; actions
     * after it are not started.
     */
    default CompletableFuture<List<ActionResult>> executeInOrder(List<ActionRequest> requests) {
        CompletableFuture<List<ActionResult>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (ActionRequest request : requests) {
            chain = chain.thenCompose(results -> execute(request).thenApply(result -> {
                results.add(result);
                return results;
            }));
        }
        return chain;
    }
}
