package com.blastradius.engine;

import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.Edge;
import com.blastradius.engine.graph.EdgeKind;
import com.blastradius.engine.graph.Node;
import com.blastradius.engine.graph.NodeKind;
import com.blastradius.engine.graph.SourceLocation;
import com.blastradius.engine.graph.Visibility;
import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import com.blastradius.engine.model.SummaryModel.SummaryEntity;
import com.blastradius.engine.model.SummaryModel.SummaryLocation;
import com.blastradius.engine.model.SummaryModel.SummaryRelationship;

import java.util.ArrayList;
import java.util.List;

/** Shared builders for summaries and hand-made graphs. */
final class Fixtures {

    private Fixtures() {}

    // --- Summaries ---

    static SummaryEntity entity(String kind, String qualifiedName, String visibility) {
        SummaryEntity e = new SummaryEntity();
        e.kind = kind;
        e.qualifiedName = qualifiedName;
        e.visibility = visibility;
        return e;
    }

    static SummaryEntity function(String qualifiedName, String visibility, List<String> parameters, String returnType) {
        SummaryEntity e = entity("function", qualifiedName, visibility);
        e.parameters = parameters;
        e.returnType = returnType;
        return e;
    }

    static SummaryEntity within(SummaryEntity entity, String container) {
        entity.container = container;
        return entity;
    }

    static SummaryEntity at(SummaryEntity entity, String file, int line) {
        SummaryLocation loc = new SummaryLocation();
        loc.file = file;
        loc.lineStart = line;
        loc.lineEnd = line;
        entity.location = loc;
        return entity;
    }

    static SummaryRelationship rel(String from, String to, String kind) {
        SummaryRelationship r = new SummaryRelationship();
        r.from = from;
        r.to = to;
        r.kind = kind;
        return r;
    }

    static SummaryRelationship rel(String from, String to, String kind, double weight) {
        SummaryRelationship r = rel(from, to, kind);
        r.weight = weight;
        return r;
    }

    static StructuralSummary summary(String file, List<SummaryEntity> entities, List<SummaryRelationship> rels) {
        StructuralSummary s = new StructuralSummary();
        s.file = file;
        s.language = "rust";
        s.entities = new ArrayList<>(entities);
        s.relationships = new ArrayList<>(rels);
        return s;
    }

    // --- Hand-made graphs: node id doubles as the qualified name ---

    static Node node(String id, boolean exported) {
        return new Node(id, NodeKind.FUNCTION, id, exported ? Visibility.PUBLIC : Visibility.PRIVATE,
                "", "0000000000000000", new SourceLocation("src/" + id + ".rs", 1, 1), exported);
    }

    static Edge calls(String source, String target) {
        return new Edge(source, target, EdgeKind.CALLS, 1.0);
    }

    static Edge edge(String source, String target, EdgeKind kind, double weight) {
        return new Edge(source, target, kind, weight);
    }

    static DependencyGraph graph(List<Node> nodes, List<Edge> edges) {
        DependencyGraph.Builder b = new DependencyGraph.Builder();
        nodes.forEach(b::addNode);
        edges.forEach(b::addEdge);
        return b.build();
    }

    /** Scenario A: B calls A, C and D call B. */
    static DependencyGraph scenarioA(boolean exported) {
        return graph(
                List.of(node("A", exported), node("B", exported), node("C", exported), node("D", exported)),
                List.of(calls("B", "A"), calls("C", "B"), calls("D", "B")));
    }
}
