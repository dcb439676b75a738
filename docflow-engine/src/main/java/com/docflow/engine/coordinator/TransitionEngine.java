package com.docflow.engine.coordinator;

import com.docflow.action.ActionExecutor;
import com.docflow.action.ActionRequest;
import com.docflow.action.ActionResult;
import com.docflow.core.exception.ActionFailedException;
import com.docflow.core.exception.GuardDeniedException;
import com.docflow.core.exception.WorkflowDefinitionException;
import com.docflow.core.model.FailureInfo;
import com.docflow.core.model.JoinProgress;
import com.docflow.core.model.TransitionKind;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;
import com.docflow.core.model.WorkflowTransition;
import com.docflow.core.model.action.Action;
import com.docflow.core.model.graph.CompletionStatus;
import com.docflow.core.model.graph.DecisionBranch;
import com.docflow.core.model.graph.DecisionNode;
import com.docflow.core.model.graph.Edge;
import com.docflow.core.model.graph.EndNode;
import com.docflow.core.model.graph.JoinNode;
import com.docflow.core.model.graph.Node;
import com.docflow.core.model.graph.TaskNode;
import com.docflow.core.model.graph.TimerNode;
import com.docflow.core.model.graph.WorkflowGraph;
import com.docflow.core.model.guard.GuardContext;
import com.docflow.core.model.guard.GuardResult;
import com.docflow.core.validation.DefinitionProblem;
import com.docflow.engine.guard.ConditionEvaluator;
import com.docflow.engine.guard.GuardEvaluator;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Computes what one stimulus does to an instance.
 *
 * A walk starts at the departing node and follows edges until every branch rests on a
 * waiting node (task, timer, pending join) or an end node:
 * <ol>
 *   <li>exit actions of the departing node</li>
 *   <li>per entered node: entry guards (a denial aborts the whole walk), then entry actions</li>
 *   <li>decisions and completed joins pass straight through, parallels fan out along every edge</li>
 * </ol>
 * The walk works on an {@link ExecutionState} copy; nothing is saved here. An action that fails
 * after its retries routes the branch along the node's error edge, or fails the instance.
 */
final class TransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    // Nodes entered in one walk before routing is considered runaway
    static final int MAX_STEPS = 256;

    private final GuardEvaluator guardEvaluator;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionExecutor actionExecutor;
    private final int snapshotLimit;

    TransitionEngine(GuardEvaluator guardEvaluator, ConditionEvaluator conditionEvaluator,
                     ActionExecutor actionExecutor, int snapshotLimit) {
        this.guardEvaluator = guardEvaluator;
        this.conditionEvaluator = conditionEvaluator;
        this.actionExecutor = actionExecutor;
        this.snapshotLimit = snapshotLimit;
    }

    // ========== Stimuli ==========

    /**
     * Enter the start node named by {@code stimulus.fromNode()} and route onwards.
     */
    TransitionOutcome start(Stimulus stimulus) {
        Walk walk = new Walk(stimulus);
        return walk.run(() -> walk.arrive(walk.graph.node(stimulus.fromNode()), null));
    }

    /**
     * Leave an active waiting node along the requested or first eligible edge.
     *
     * @param timedOut run the timer node's timeout actions before leaving
     */
    TransitionOutcome depart(Stimulus stimulus, boolean timedOut) {
        Walk walk = new Walk(stimulus);
        return walk.run(() -> walk.departFrom(walk.graph.node(stimulus.fromNode()), timedOut));
    }

    /**
     * Destinations currently reachable from an active node: edges whose condition holds and
     * whose target admits the actor.
     */
    List<String> availableTargets(Stimulus stimulus) {
        WorkflowGraph graph = stimulus.definition().graph();
        Node from = graph.node(stimulus.fromNode());
        GuardContext context = context(stimulus, stimulus.instance().variables(), from.id());
        LinkedHashSet<String> targets = new LinkedHashSet<>();
        for (Edge edge : graph.outgoing(from.id())) {
            if (edge.id().equals(from.errorEdgeId()) || !conditionEvaluator.test(edge.condition(), context)) {
                continue;
            }
            Node target = graph.node(edge.target());
            GuardContext targetContext = context(stimulus, stimulus.instance().variables(), target.id());
            if (guardEvaluator.evaluateAll(target.entryGuards(), targetContext).allowed()) {
                targets.add(target.id());
            }
        }
        return List.copyOf(targets);
    }

    /**
     * Wait for an action future, surfacing the failure it completed with.
     */
    static ActionResult await(CompletableFuture<ActionResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static GuardContext context(Stimulus stimulus, Map<String, JsonNode> variables, String nodeId) {
        return new GuardContext(stimulus.actor(), variables, stimulus.now(),
            stimulus.instance().instanceId(), nodeId);
    }

    // ========== Walk ==========

    private final class Walk {

        private final Stimulus stimulus;
        private final WorkflowGraph graph;
        private final ExecutionState state;
        private final String ordinal;

        private final Map<String, Integer> visits = new HashMap<>();
        private final List<String> via = new ArrayList<>();
        private final List<String> activated = new ArrayList<>();
        private String toNode;
        private ActionFailedException routedFailure;
        private int steps;

        Walk(Stimulus stimulus) {
            this.stimulus = stimulus;
            this.graph = stimulus.definition().graph();
            this.state = new ExecutionState(stimulus.instance());
            this.ordinal = String.valueOf(stimulus.instance().history().size());
        }

        TransitionOutcome run(Runnable body) {
            VariableBinder.checkTypes(stimulus.definition(), stimulus.data());
            state.setVariables(stimulus.data());
            try {
                body.run();
            } catch (ActionFailedException e) {
                return failed(e);
            }
            return accepted();
        }

        void departFrom(Node from, boolean timedOut) {
            if (timedOut && from instanceof TimerNode) {
                runActions(from, ((TimerNode) from).timeoutActions(), IdempotencyKeys.TIMEOUT, ordinal);
            }
            Edge edge = selectEdge(from, stimulus.targetNode());
            try {
                runActions(from, from.exitActions(), IdempotencyKeys.EXIT, ordinal);
            } catch (ActionFailedException e) {
                routeOnError(from, e);
                return;
            }
            state.leave(from.id());
            follow(edge, from.id());
        }

        void follow(Edge edge, String fromId) {
            log.debug("Following edge {} from {} to {}", edge.id(), fromId, edge.target());
            arrive(graph.node(edge.target()), fromId);
        }

        void arrive(Node node, String fromId) {
            if (++steps > MAX_STEPS) {
                throw new WorkflowDefinitionException(stimulus.definition().key(), new DefinitionProblem(
                    DefinitionProblem.UNGUARDED_CYCLE, node.id(),
                    "Routing did not come to rest within " + MAX_STEPS + " steps"));
            }
            if (node instanceof JoinNode) {
                arriveAtJoin((JoinNode) node, fromId);
                return;
            }

            checkGuards(node);
            try {
                runActions(node, node.entryActions(), IdempotencyKeys.ENTRY, nextOrdinal(node.id()));
            } catch (ActionFailedException e) {
                routeOnError(node, e);
                return;
            }

            switch (node.nodeType()) {
                case TASK, TIMER, END -> settle(node);
                case DECISION -> {
                    via.add(node.id());
                    follow(decide((DecisionNode) node), node.id());
                }
                case PARALLEL -> {
                    if (toNode == null) {
                        toNode = node.id();
                    }
                    for (Edge edge : graph.outgoing(node.id())) {
                        follow(edge, node.id());
                    }
                }
                case START -> follow(selectEdge(node, null), node.id());
                case JOIN -> throw new IllegalStateException("Join handled on arrival: " + node.id());
            }
        }

        private void settle(Node node) {
            state.enter(node.id(), stimulus.now());
            if (!activated.contains(node.id())) {
                activated.add(node.id());
            }
            if (toNode == null) {
                toNode = node.id();
            }
            if (node instanceof TaskNode) {
                TaskNode task = (TaskNode) node;
                state.assign(task.id(), VariableBinder.resolveAssignees(task.assignees(), state.variables(),
                    stimulus.instance().initiator()));
                if (task.sla() != null) {
                    state.slaDeadline(task.id(), stimulus.now().plus(task.sla()));
                }
            }
        }

        private void arriveAtJoin(JoinNode join, String fromId) {
            JoinProgress current = state.joinProgress(join.id());
            if (current.expectsLateArrival()) {
                state.joinProgress(join.id(), current.absorbLateArrival());
                if (toNode == null) {
                    toNode = join.id();
                }
                log.info("Join {} already released, retiring late branch from {}", join.id(), fromId);
                return;
            }

            JoinProgress progress = current.arrive(fromId);
            if (progress.arrivals() < join.expectedBranches()) {
                state.joinProgress(join.id(), progress);
                state.holdAtJoin(join.id(), stimulus.now());
                if (toNode == null) {
                    toNode = join.id();
                }
                log.debug("Join {} has {}/{} arrivals", join.id(), progress.arrivals(), join.expectedBranches());
                return;
            }

            log.debug("Join {} complete on visit {}", join.id(), progress.visit());
            state.leave(join.id());
            int owed = graph.incoming(join.id()).size() - join.expectedBranches() - retireOpenBranches(join);
            state.joinProgress(join.id(), progress.nextVisit(Math.max(0, owed)));
            checkGuards(join);
            runActions(join, join.entryActions(), IdempotencyKeys.ENTRY, nextOrdinal(join.id()));
            via.add(join.id());
            follow(selectEdge(join, null), join.id());
        }

        /**
         * A join released before all of its incoming branches arrived retires the branches
         * still open on the way to it. Returns how many were retired.
         */
        private int retireOpenBranches(JoinNode join) {
            if (join.expectedBranches() >= graph.incoming(join.id()).size()) {
                return 0;
            }
            int retired = 0;
            for (String nodeId : state.activeNodes()) {
                if (graph.isEnd(nodeId) || !graph.reachesWithinBranch(nodeId, join.id())) {
                    continue;
                }
                if (graph.node(nodeId) instanceof JoinNode) {
                    state.joinProgress(nodeId, state.joinProgress(nodeId).nextVisit());
                }
                state.leave(nodeId);
                activated.remove(nodeId);
                retired++;
                log.info("Join {} released, retiring open branch at {}", join.id(), nodeId);
            }
            return retired;
        }

        private void routeOnError(Node node, ActionFailedException failure) {
            String errorEdgeId = node.errorEdgeId();
            if (errorEdgeId == null) {
                throw failure;
            }
            Edge errorEdge = graph.findEdge(errorEdgeId).orElseThrow(() -> failure);
            log.warn("Action {} failed on node {}, taking error edge {}",
                failure.getActionId(), node.id(), errorEdgeId);
            if (routedFailure == null) {
                routedFailure = failure;
            }
            state.leave(node.id());
            follow(errorEdge, node.id());
        }

        // ========== Edge selection ==========

        private Edge selectEdge(Node from, String target) {
            GuardContext context = context(stimulus, state.variables(), from.id());
            List<Edge> candidates = graph.outgoing(from.id()).stream()
                .filter(e -> !e.id().equals(from.errorEdgeId()))
                .toList();

            if (target != null) {
                List<Edge> toTarget = candidates.stream().filter(e -> e.target().equals(target)).toList();
                if (toTarget.isEmpty()) {
                    throw new GuardDeniedException(from.id(), "No edge from " + from.id() + " to " + target);
                }
                for (Edge edge : toTarget) {
                    if (conditionEvaluator.test(edge.condition(), context)) {
                        return edge;
                    }
                }
                throw new GuardDeniedException(target,
                    "Condition on edge " + toTarget.get(0).id() + " does not hold");
            }

            for (Edge edge : candidates) {
                if (conditionEvaluator.test(edge.condition(), context)) {
                    return edge;
                }
            }
            throw new GuardDeniedException(from.id(), "No outgoing edge of " + from.id() + " is eligible");
        }

        private Edge decide(DecisionNode decision) {
            GuardContext context = context(stimulus, state.variables(), decision.id());
            for (DecisionBranch branch : decision.branches()) {
                if (conditionEvaluator.test(branch.condition(), context)) {
                    log.debug("Decision {} took branch {}", decision.id(), branch.name());
                    return edge(decision, branch.edgeId());
                }
            }
            if (decision.defaultEdgeId() != null) {
                log.debug("Decision {} took its default edge", decision.id());
                return edge(decision, decision.defaultEdgeId());
            }
            throw new WorkflowDefinitionException(stimulus.definition().key(), new DefinitionProblem(
                DefinitionProblem.NO_DECISION_MATCH, decision.id(),
                "No branch of decision " + decision.id() + " matched and it has no default edge"));
        }

        private Edge edge(Node node, String edgeId) {
            return graph.findEdge(edgeId).orElseThrow(() -> new WorkflowDefinitionException(
                stimulus.definition().key(), new DefinitionProblem(DefinitionProblem.DANGLING_EDGE, node.id(),
                    "Node " + node.id() + " routes to unknown edge " + edgeId)));
        }

        // ========== Guards and actions ==========

        private void checkGuards(Node node) {
            if (node.entryGuards().isEmpty()) {
                return;
            }
            GuardResult result = guardEvaluator.evaluateAll(node.entryGuards(),
                context(stimulus, state.variables(), node.id()));
            if (!result.allowed()) {
                throw new GuardDeniedException(node.id(), result);
            }
        }

        private void runActions(Node node, List<Action> actions, String phase, String keyOrdinal) {
            for (Action action : actions) {
                ActionRequest request = new ActionRequest(
                    stimulus.instance().instanceId(),
                    node.id(),
                    action,
                    IdempotencyKeys.action(stimulus.instance().instanceId(), node.id(), action.id(), phase, keyOrdinal),
                    state.variables(),
                    stimulus.actor().id(),
                    stimulus.instance().initiator());
                ActionResult result = await(actionExecutor.execute(request));
                if (result.status() == ActionResult.Status.SKIPPED_DUPLICATE) {
                    log.debug("Action {} on node {} already dispatched, replaying its updates",
                        action.id(), node.id());
                }
                state.setVariables(result.variableUpdates());
            }
        }

        private String nextOrdinal(String nodeId) {
            int visit = visits.merge(nodeId, 1, Integer::sum);
            return visit == 1 ? ordinal : ordinal + "." + visit;
        }

        // ========== Outcomes ==========

        private TransitionOutcome accepted() {
            Instant now = stimulus.now();
            boolean errorRouted = routedFailure != null;
            WorkflowTransition transition = new WorkflowTransition(
                stimulus.fromNode(),
                toNode != null ? toNode : stimulus.fromNode(),
                via,
                activated,
                now,
                stimulus.actor().id(),
                errorRouted
                    ? "Error route after " + routedFailure.getCauseCode() + ": " + routedFailure.getMessage()
                    : stimulus.reason(),
                errorRouted ? TransitionKind.ERROR_ROUTE : stimulus.kind(),
                snapshot());

            WorkflowInstance.Builder builder = state.applyTo(stimulus.instance().toBuilder())
                .appendTransition(transition)
                .updatedAt(now)
                .incrementVersion();

            List<String> active = state.activeNodes();
            if (active.stream().allMatch(graph::isEnd)) {
                builder.status(WorkflowStatus.COMPLETED)
                    .completionStatus(completionStatus(active))
                    .completedAt(now);
            }
            return new TransitionOutcome(builder.build(), transition,
                List.copyOf(new LinkedHashSet<>(state.entered())), List.copyOf(state.left()), null);
        }

        private TransitionOutcome failed(ActionFailedException e) {
            Instant now = stimulus.now();
            FailureInfo failure = new FailureInfo(e.getNodeId(), e.getActionId(), e.getCauseCode(),
                e.getMessage(), now);
            WorkflowInstance failedInstance = stimulus.instance().toBuilder()
                .status(WorkflowStatus.FAILED)
                .failure(failure)
                .updatedAt(now)
                .completedAt(now)
                .incrementVersion()
                .build();
            return new TransitionOutcome(failedInstance, null, List.of(),
                stimulus.instance().activeNodes(), failure);
        }

        private CompletionStatus completionStatus(List<String> endNodes) {
            CompletionStatus worst = CompletionStatus.SUCCESS;
            for (String nodeId : endNodes) {
                CompletionStatus status = ((EndNode) graph.node(nodeId)).status();
                if (status.ordinal() > worst.ordinal()) {
                    worst = status;
                }
            }
            return worst;
        }

        private Map<String, JsonNode> snapshot() {
            Map<String, JsonNode> snapshot = new LinkedHashMap<>();
            for (String name : state.touchedVariables()) {
                if (snapshot.size() >= snapshotLimit) {
                    break;
                }
                snapshot.put(name, state.variables().get(name));
            }
            return snapshot;
        }
    }
}
