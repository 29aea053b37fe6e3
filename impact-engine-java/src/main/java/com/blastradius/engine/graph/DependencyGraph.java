package com.blastradius.engine.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Directed, possibly cyclic graph of code entities.
 *
 * Instances are immutable once built: nodes are kept sorted by id so every
 * algorithm iterates them in the same order, and both adjacency indices are
 * computed once at construction. Use {@link Builder} (or {@link GraphBuilder}
 * from summaries) to create one.
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = new Builder().build();

    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final Map<NodeKey, String> idsByKey;
    private final List<BuildDiagnostic> diagnostics;
    private final List<MergeConflict> conflicts;

    private DependencyGraph(Builder builder) {
        this.nodes = Collections.unmodifiableMap(new TreeMap<>(builder.nodes));
        this.edges = List.copyOf(builder.edges.values());
        this.diagnostics = List.copyOf(builder.diagnostics);
        this.conflicts = List.copyOf(builder.conflicts);

        Map<String, List<Edge>> out = new LinkedHashMap<>();
        Map<String, List<Edge>> in = new LinkedHashMap<>();
        Map<NodeKey, String> keys = new LinkedHashMap<>();
        for (Node node : nodes.values()) {
            out.put(node.id(), new ArrayList<>());
            in.put(node.id(), new ArrayList<>());
            keys.putIfAbsent(node.key(), node.id());
        }
        for (Edge edge : edges) {
            out.get(edge.sourceId()).add(edge);
            in.get(edge.targetId()).add(edge);
        }
        out.replaceAll((id, list) -> List.copyOf(list));
        in.replaceAll((id, list) -> List.copyOf(list));
        this.outgoing = out;
        this.incoming = in;
        this.idsByKey = keys;
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    // -----------------------------------------------------------------------
    // Nodes and edges
    // -----------------------------------------------------------------------

    /** All nodes keyed by id, in ascending id order. */
    public Map<String, Node> nodes() {
        return nodes;
    }

    /** Node ids in ascending order. */
    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    /** @return the node, or null if the id is unknown */
    public Node node(String id) {
        return nodes.get(id);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public List<Edge> edges() {
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    // -----------------------------------------------------------------------
    // Adjacency
    // -----------------------------------------------------------------------

    /** Edges leaving {@code id}: what the node depends on. */
    public List<Edge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /** Edges entering {@code id}: who depends on the node. */
    public List<Edge> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /** Distinct ids of the nodes {@code id} depends on, in edge order. */
    public Set<String> dependencies(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (Edge e : outgoing(id)) result.add(e.targetId());
        return result;
    }

    /** Distinct ids of the nodes that depend on {@code id}, in edge order. */
    public Set<String> dependents(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (Edge e : incoming(id)) result.add(e.sourceId());
        return result;
    }

    // -----------------------------------------------------------------------
    // Lookup
    // -----------------------------------------------------------------------

    /** @return id of the node with this kind and qualified name, or null */
    public String idOf(NodeKind kind, String qualifiedName) {
        return idsByKey.get(new NodeKey(kind, qualifiedName));
    }

    /** Ids of every node with the given qualified name, whatever its kind. */
    public List<String> idsByQualifiedName(String qualifiedName) {
        List<String> result = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.qualifiedName().equals(qualifiedName)) result.add(node.id());
        }
        return result;
    }

    // -----------------------------------------------------------------------
    // Build records
    // -----------------------------------------------------------------------

    public List<BuildDiagnostic> diagnostics() {
        return diagnostics;
    }

    public List<MergeConflict> conflicts() {
        return conflicts;
    }

    public GraphStatistics statistics() {
        int externals = 0;
        for (Node node : nodes.values()) {
            if (node.isExternal()) externals++;
        }
        double avgDegree = nodes.isEmpty() ? 0.0 : (edges.size() * 2.0) / nodes.size();
        return new GraphStatistics(nodes.size(), edges.size(), externals, avgDegree,
                CycleDetector.findCycles(this).size());
    }

    @Override
    public String toString() {
        return "DependencyGraph[" + nodes.size() + " nodes, " + edges.size() + " edges]";
    }

    /**
     * Mutable accumulator for a graph. Edges are collapsed on (source, target, kind);
     * edges whose endpoints are not nodes are rejected.
     */
    public static final class Builder {

        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Map<String, Edge> edges = new LinkedHashMap<>();
        private final List<BuildDiagnostic> diagnostics = new ArrayList<>();
        private final List<MergeConflict> conflicts = new ArrayList<>();

        /** Adds or replaces the node with the same id. */
        public Builder addNode(Node node) {
            nodes.put(node.id(), node);
            return this;
        }

        public boolean hasNode(String id) {
            return nodes.containsKey(id);
        }

        Node getNode(String id) {
            return nodes.get(id);
        }

        Set<String> nodeIds() {
            return nodes.keySet();
        }

        Node removeNode(String id) {
            return nodes.remove(id);
        }

        /**
         * Adds an edge unless one with the same source, target and kind exists.
         *
         * @return true if the edge was added
         * @throws IllegalArgumentException if either endpoint is not a node
         */
        public boolean addEdge(Edge edge) {
            if (!nodes.containsKey(edge.sourceId()) || !nodes.containsKey(edge.targetId())) {
                throw new IllegalArgumentException("Edge references unknown node: "
                        + edge.sourceId() + " -> " + edge.targetId());
            }
            return edges.putIfAbsent(edge.dedupKey(), edge) == null;
        }

        Collection<Edge> edges() {
            return edges.values();
        }

        public Builder addDiagnostic(BuildDiagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        Builder addDiagnostics(Collection<BuildDiagnostic> all) {
            diagnostics.addAll(all);
            return this;
        }

        Builder addConflict(MergeConflict conflict) {
            conflicts.add(conflict);
            return this;
        }

        Builder addConflicts(Collection<MergeConflict> all) {
            conflicts.addAll(all);
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(this);
        }
    }
}
