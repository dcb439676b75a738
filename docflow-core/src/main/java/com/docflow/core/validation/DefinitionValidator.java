package com.docflow.core.validation;

import com.docflow.core.model.VariableDefinition;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.action.Action;
import com.docflow.core.model.graph.Condition;
import com.docflow.core.model.graph.DecisionBranch;
import com.docflow.core.model.graph.DecisionNode;
import com.docflow.core.model.graph.Edge;
import com.docflow.core.model.graph.JoinNode;
import com.docflow.core.model.graph.Node;
import com.docflow.core.model.graph.NodeType;
import com.docflow.core.model.graph.TimerNode;
import com.docflow.core.model.graph.WorkflowGraph;
import com.docflow.core.model.guard.Guard;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural validation of workflow definitions. Runs once at publish time; the engine
 * relies on its guarantees and does not re-check per transition.
 *
 * Checks:
 * - at least one start and one end node; start nodes have no incoming edges
 * - every edge connects existing nodes
 * - every node is reachable from a start and can reach an end
 * - non-end nodes have outgoing edges, end nodes have none
 * - decisions have a default edge and only route along their own outgoing edges
 * - join branch counts fit their incoming edges
 * - timers have a duration or a signal
 * - error edges leave the node that declares them
 * - no cycle consists solely of unguarded edges
 * - condition expressions parse; named guards exist when the guard table is known
 * - action ids are unique per node; variable defaults match their declared types
 */
public class DefinitionValidator {

    private final ExpressionChecker expressionChecker;
    private final Set<String> knownGuards;

    /**
     * Validator that checks only structure, not expression syntax or guard names.
     */
    public DefinitionValidator() {
        this(ExpressionChecker.ACCEPT_ALL, null);
    }

    /**
     * @param expressionChecker syntax check for expression conditions
     * @param knownGuards names in the guard table, or null to skip the lookup check
     */
    public DefinitionValidator(ExpressionChecker expressionChecker, Set<String> knownGuards) {
        this.expressionChecker = expressionChecker;
        this.knownGuards = knownGuards == null ? null : Set.copyOf(knownGuards);
    }

    public ValidationReport validate(WorkflowDefinition definition) {
        List<DefinitionProblem> problems = new ArrayList<>();
        validateGraph(definition.graph(), problems);
        validateActions(definition.graph(), problems);
        validateVariables(definition.variables(), problems);
        return new ValidationReport(definition.key(), problems);
    }

    public ValidationReport validate(String name, WorkflowGraph graph) {
        List<DefinitionProblem> problems = new ArrayList<>();
        validateGraph(graph, problems);
        validateActions(graph, problems);
        return new ValidationReport(name, problems);
    }

    // ========== Graph Structure ==========

    private void validateGraph(WorkflowGraph graph, List<DefinitionProblem> problems) {
        Map<String, Node> nodes = graph.nodes();

        if (graph.startNodeIds().isEmpty()) {
            problems.add(new DefinitionProblem(DefinitionProblem.NO_START, null,
                "Graph has no start node"));
        }
        if (graph.endNodeIds().isEmpty()) {
            problems.add(new DefinitionProblem(DefinitionProblem.NO_END, null,
                "Graph has no end node"));
        }

        for (Edge edge : graph.edges().values()) {
            if (!nodes.containsKey(edge.source())) {
                problems.add(new DefinitionProblem(DefinitionProblem.DANGLING_EDGE, edge.id(),
                    "Edge source does not exist: " + edge.source()));
            }
            if (!nodes.containsKey(edge.target())) {
                problems.add(new DefinitionProblem(DefinitionProblem.DANGLING_EDGE, edge.id(),
                    "Edge target does not exist: " + edge.target()));
            }
            checkCondition(edge.condition(), edge.id(), problems);
        }

        for (Node node : nodes.values()) {
            List<Edge> out = graph.outgoing(node.id());
            List<Edge> in = graph.incoming(node.id());

            if (node.nodeType() == NodeType.START && !in.isEmpty()) {
                problems.add(new DefinitionProblem(DefinitionProblem.START_HAS_INCOMING, node.id(),
                    "Start node has incoming edges: " + edgeIds(in)));
            }
            if (node.nodeType() == NodeType.END && !out.isEmpty()) {
                problems.add(new DefinitionProblem(DefinitionProblem.END_HAS_OUTGOING, node.id(),
                    "End node has outgoing edges: " + edgeIds(out)));
            }
            if (node.nodeType() != NodeType.END && out.isEmpty()) {
                problems.add(new DefinitionProblem(DefinitionProblem.DEAD_END, node.id(),
                    "Non-end node has no outgoing edges"));
            }
            if (node.errorEdgeId() != null && out.stream().noneMatch(e -> e.id().equals(node.errorEdgeId()))) {
                problems.add(new DefinitionProblem(DefinitionProblem.INVALID_ERROR_EDGE, node.id(),
                    "Error edge is not an outgoing edge of this node: " + node.errorEdgeId()));
            }
            for (Guard guard : node.entryGuards()) {
                checkGuard(guard, node.id(), problems);
            }

            switch (node.nodeType()) {
                case DECISION -> validateDecision((DecisionNode) node, out, problems);
                case JOIN -> validateJoin((JoinNode) node, in, problems);
                case TIMER -> validateTimer((TimerNode) node, problems);
                default -> {
                }
            }
        }

        Set<String> reachable = reachableFromStarts(graph);
        for (String nodeId : nodes.keySet()) {
            if (!reachable.contains(nodeId)) {
                problems.add(new DefinitionProblem(DefinitionProblem.UNREACHABLE_NODE, nodeId,
                    "Node is not reachable from any start node"));
            }
        }

        Set<String> reachesEnd = reachingAnEnd(graph);
        for (String nodeId : reachable) {
            if (!reachesEnd.contains(nodeId)) {
                problems.add(new DefinitionProblem(DefinitionProblem.NO_PATH_TO_END, nodeId,
                    "No path from this node reaches an end node"));
            }
        }

        findUnguardedCycle(graph).ifPresent(cycle ->
            problems.add(new DefinitionProblem(DefinitionProblem.UNGUARDED_CYCLE, cycle.get(0),
                "Cycle without any guarded edge: " + String.join(" -> ", cycle))));
    }

    private void validateDecision(DecisionNode decision, List<Edge> out, List<DefinitionProblem> problems) {
        Set<String> outIds = new HashSet<>();
        out.forEach(e -> outIds.add(e.id()));
        Set<String> routed = new HashSet<>();

        if (decision.defaultEdgeId() == null) {
            problems.add(new DefinitionProblem(DefinitionProblem.DECISION_WITHOUT_DEFAULT, decision.id(),
                "Decision node has no default edge"));
        } else if (!outIds.contains(decision.defaultEdgeId())) {
            problems.add(new DefinitionProblem(DefinitionProblem.DECISION_FOREIGN_EDGE, decision.id(),
                "Default edge is not an outgoing edge of this decision: " + decision.defaultEdgeId()));
        } else {
            routed.add(decision.defaultEdgeId());
        }

        for (DecisionBranch branch : decision.branches()) {
            if (!outIds.contains(branch.edgeId())) {
                problems.add(new DefinitionProblem(DefinitionProblem.DECISION_FOREIGN_EDGE, decision.id(),
                    "Branch '" + branch.name() + "' routes along a foreign edge: " + branch.edgeId()));
            } else {
                routed.add(branch.edgeId());
            }
            checkCondition(branch.condition(), decision.id(), problems);
        }

        for (String edgeId : outIds) {
            if (!routed.contains(edgeId)) {
                problems.add(new DefinitionProblem(DefinitionProblem.DECISION_UNROUTED_EDGE, decision.id(),
                    "Outgoing edge is not referenced by any branch or the default: " + edgeId));
            }
        }
    }

    private void validateJoin(JoinNode join, List<Edge> in, List<DefinitionProblem> problems) {
        if (join.expectedBranches() < 1 || join.expectedBranches() > in.size()) {
            problems.add(new DefinitionProblem(DefinitionProblem.JOIN_BRANCH_COUNT, join.id(),
                String.format("Join expects %d branches but has %d incoming edges",
                    join.expectedBranches(), in.size())));
        }
    }

    private void validateTimer(TimerNode timer, List<DefinitionProblem> problems) {
        boolean hasDuration = timer.duration() != null && !timer.duration().isNegative() && !timer.duration().isZero();
        boolean hasSignal = timer.signalName() != null && !timer.signalName().isBlank();
        if (!hasDuration && !hasSignal) {
            problems.add(new DefinitionProblem(DefinitionProblem.TIMER_WITHOUT_TRIGGER, timer.id(),
                "Timer needs a positive duration or a signal name"));
        }
    }

    private void checkCondition(Condition condition, String subjectId, List<DefinitionProblem> problems) {
        if (condition == null) {
            return;
        }
        if (condition instanceof Condition.Expression) {
            String expression = ((Condition.Expression) condition).expression();
            expressionChecker.check(expression).ifPresent(error ->
                problems.add(new DefinitionProblem(DefinitionProblem.INVALID_EXPRESSION, subjectId,
                    "Cannot parse '" + expression + "': " + error)));
        } else if (condition instanceof Condition.GuardRef) {
            checkGuardName(((Condition.GuardRef) condition).guardName(), subjectId, problems);
        }
    }

    private void checkGuard(Guard guard, String nodeId, List<DefinitionProblem> problems) {
        if (guard instanceof Guard.Named) {
            checkGuardName(((Guard.Named) guard).name(), nodeId, problems);
        } else if (guard instanceof Guard.AllOf) {
            ((Guard.AllOf) guard).guards().forEach(g -> checkGuard(g, nodeId, problems));
        } else if (guard instanceof Guard.AnyOf) {
            ((Guard.AnyOf) guard).guards().forEach(g -> checkGuard(g, nodeId, problems));
        } else if (guard instanceof Guard.Not) {
            checkGuard(((Guard.Not) guard).guard(), nodeId, problems);
        }
    }

    private void checkGuardName(String name, String subjectId, List<DefinitionProblem> problems) {
        if (knownGuards != null && !knownGuards.contains(name)) {
            problems.add(new DefinitionProblem(DefinitionProblem.UNKNOWN_GUARD, subjectId,
                "No guard registered under name: " + name));
        }
    }

    // ========== Reachability ==========

    private Set<String> reachableFromStarts(WorkflowGraph graph) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(graph.startNodeIds());
        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            if (!graph.nodes().containsKey(nodeId) || !visited.add(nodeId)) {
                continue;
            }
            for (Edge edge : graph.outgoing(nodeId)) {
                queue.add(edge.target());
            }
        }
        return visited;
    }

    private Set<String> reachingAnEnd(WorkflowGraph graph) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(graph.endNodeIds());
        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            if (!visited.add(nodeId)) {
                continue;
            }
            for (Edge edge : graph.incoming(nodeId)) {
                if (graph.nodes().containsKey(edge.source())) {
                    queue.add(edge.source());
                }
            }
        }
        return visited;
    }

    /**
     * An edge is guarded when it carries a condition, leaves a decision (which routes by
     * condition) or enters a node with entry guards.
     */
    private boolean isGuarded(WorkflowGraph graph, Edge edge) {
        if (edge.hasCondition()) {
            return true;
        }
        Optional<Node> source = graph.findNode(edge.source());
        if (source.isPresent() && source.get().nodeType() == NodeType.DECISION) {
            return true;
        }
        Optional<Node> target = graph.findNode(edge.target());
        return target.isPresent() && !target.get().entryGuards().isEmpty();
    }

    private Optional<List<String>> findUnguardedCycle(WorkflowGraph graph) {
        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        for (String nodeId : graph.nodes().keySet()) {
            if (!state.containsKey(nodeId)) {
                List<String> path = new ArrayList<>();
                Optional<List<String>> cycle = dfs(graph, nodeId, state, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> dfs(WorkflowGraph graph, String nodeId,
                                       Map<String, Integer> state, List<String> path) {
        state.put(nodeId, 1);
        path.add(nodeId);
        for (Edge edge : graph.outgoing(nodeId)) {
            if (isGuarded(graph, edge) || !graph.nodes().containsKey(edge.target())) {
                continue;
            }
            Integer targetState = state.get(edge.target());
            if (targetState == null) {
                Optional<List<String>> cycle = dfs(graph, edge.target(), state, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            } else if (targetState == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(edge.target()), path.size()));
                cycle.add(edge.target());
                return Optional.of(cycle);
            }
        }
        path.remove(path.size() - 1);
        state.put(nodeId, 2);
        return Optional.empty();
    }

    // ========== Actions & Variables ==========

    private void validateActions(WorkflowGraph graph, List<DefinitionProblem> problems) {
        for (Node node : graph.nodes().values()) {
            List<Action> actions = new ArrayList<>(node.entryActions());
            actions.addAll(node.exitActions());
            if (node.nodeType() == NodeType.TIMER) {
                actions.addAll(((TimerNode) node).timeoutActions());
            }
            Set<String> seen = new HashSet<>();
            for (Action action : actions) {
                if (action.id() == null || action.id().isBlank()) {
                    problems.add(new DefinitionProblem(DefinitionProblem.MISSING_ID, node.id(),
                        "Action without id: " + action.kind()));
                } else if (!seen.add(action.id())) {
                    problems.add(new DefinitionProblem(DefinitionProblem.DUPLICATE_ACTION_ID, node.id(),
                        "Action id used more than once on this node: " + action.id()));
                }
            }
        }
    }

    private void validateVariables(List<VariableDefinition> variables, List<DefinitionProblem> problems) {
        Set<String> names = new HashSet<>();
        for (VariableDefinition variable : variables) {
            if (!names.add(variable.name())) {
                problems.add(new DefinitionProblem(DefinitionProblem.INVALID_VARIABLE, variable.name(),
                    "Variable declared more than once"));
            }
            if (!variable.type().accepts(variable.defaultValue())) {
                problems.add(new DefinitionProblem(DefinitionProblem.INVALID_VARIABLE, variable.name(),
                    "Default value does not match declared type " + variable.type()));
            }
        }
    }

    private static List<String> edgeIds(List<Edge> edges) {
        return edges.stream().map(Edge::id).toList();
    }
}
