package com.docflow.core.model.graph;

import com.docflow.core.exception.WorkflowDefinitionException;
import com.docflow.core.validation.DefinitionProblem;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable node/edge index of a workflow definition.
 *
 * Nodes and edges are keyed by id. Outgoing edges per node are pre-sorted by
 * (priority, id) so edge selection never re-sorts per transition.
 * Structural soundness (reachability, dangling edges, ...) is checked by
 * {@link com.docflow.core.validation.DefinitionValidator}, not here.
 */
public final class WorkflowGraph {

    private static final Comparator<Edge> EDGE_ORDER =
        Comparator.comparingInt(Edge::priority).thenComparing(Edge::id);

    private final Map<String, Node> nodes;
    private final Map<String, Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final Set<String> startNodeIds;
    private final Set<String> endNodeIds;

    @JsonCreator
    public WorkflowGraph(
            @JsonProperty("nodes") List<Node> nodeList,
            @JsonProperty("edges") List<Edge> edgeList) {
        List<DefinitionProblem> duplicates = new ArrayList<>();

        Map<String, Node> nodeIndex = new LinkedHashMap<>();
        for (Node node : nodeList == null ? List.<Node>of() : nodeList) {
            if (node.id() == null || node.id().isBlank()) {
                duplicates.add(new DefinitionProblem(DefinitionProblem.MISSING_ID, null,
                    "Node without id: " + node.name()));
            } else if (nodeIndex.putIfAbsent(node.id(), node) != null) {
                duplicates.add(new DefinitionProblem(DefinitionProblem.DUPLICATE_ID, node.id(),
                    "Duplicate node id: " + node.id()));
            }
        }

        Map<String, Edge> edgeIndex = new LinkedHashMap<>();
        for (Edge edge : edgeList == null ? List.<Edge>of() : edgeList) {
            if (edge.id() == null || edge.id().isBlank()) {
                duplicates.add(new DefinitionProblem(DefinitionProblem.MISSING_ID, null,
                    "Edge without id: " + edge.source() + " -> " + edge.target()));
            } else if (edgeIndex.putIfAbsent(edge.id(), edge) != null) {
                duplicates.add(new DefinitionProblem(DefinitionProblem.DUPLICATE_ID, edge.id(),
                    "Duplicate edge id: " + edge.id()));
            }
        }

        if (!duplicates.isEmpty()) {
            throw new WorkflowDefinitionException("graph", duplicates);
        }

        Map<String, List<Edge>> out = new LinkedHashMap<>();
        Map<String, List<Edge>> in = new LinkedHashMap<>();
        for (Edge edge : edgeIndex.values()) {
            out.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        out.replaceAll((k, v) -> {
            v.sort(EDGE_ORDER);
            return List.copyOf(v);
        });
        in.replaceAll((k, v) -> {
            v.sort(EDGE_ORDER);
            return List.copyOf(v);
        });

        Set<String> starts = new LinkedHashSet<>();
        Set<String> ends = new LinkedHashSet<>();
        for (Node node : nodeIndex.values()) {
            if (node.nodeType() == NodeType.START) {
                starts.add(node.id());
            } else if (node.nodeType() == NodeType.END) {
                ends.add(node.id());
            }
        }

        this.nodes = Collections.unmodifiableMap(nodeIndex);
        this.edges = Collections.unmodifiableMap(edgeIndex);
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
        this.startNodeIds = Collections.unmodifiableSet(starts);
        this.endNodeIds = Collections.unmodifiableSet(ends);
    }

    public Map<String, Node> nodes() {
        return nodes;
    }

    public Map<String, Edge> edges() {
        return edges;
    }

    @JsonProperty("nodes")
    List<Node> nodeList() {
        return List.copyOf(nodes.values());
    }

    @JsonProperty("edges")
    List<Edge> edgeList() {
        return List.copyOf(edges.values());
    }

    public Set<String> startNodeIds() {
        return startNodeIds;
    }

    public Set<String> endNodeIds() {
        return endNodeIds;
    }

    public Optional<Node> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * Get a node that the definition guarantees to exist.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public Node node(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return node;
    }

    public Optional<Edge> findEdge(String edgeId) {
        return Optional.ofNullable(edges.get(edgeId));
    }

    /**
     * Outgoing edges of a node in evaluation order.
     */
    public List<Edge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<Edge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public boolean isEnd(String nodeId) {
        return endNodeIds.contains(nodeId);
    }

    /**
     * Whether {@code to} can be reached from {@code from} without passing through a parallel
     * node, that is, along the branch {@code from} sits on.
     */
    public boolean reachesWithinBranch(String from, String to) {
        Deque<String> pending = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (!seen.add(current)) {
                continue;
            }
            for (Edge edge : outgoing(current)) {
                if (edge.target().equals(to)) {
                    return true;
                }
                Node next = nodes.get(edge.target());
                if (next != null && next.nodeType() != NodeType.PARALLEL) {
                    pending.push(edge.target());
                }
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowGraph other = (WorkflowGraph) o;
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + edges.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowGraph[nodes=" + nodes.keySet() + ", edges=" + edges.keySet() + "]";
    }

    public static class Builder {
        private final List<Node> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();

        public Builder node(Node node) {
            nodes.add(node);
            return this;
        }

        public Builder edge(Edge edge) {
            edges.add(edge);
            return this;
        }

        public Builder edge(String id, String source, String target) {
            return edge(Edge.of(id, source, target));
        }

        public Builder edge(String id, String source, String target, Condition condition, int priority) {
            return edge(Edge.when(id, source, target, condition, priority));
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(nodes, edges);
        }
    }
}
