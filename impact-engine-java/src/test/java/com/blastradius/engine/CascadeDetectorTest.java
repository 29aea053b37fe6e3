package com.blastradius.engine;

import com.blastradius.engine.breaking.BreakingChange;
import com.blastradius.engine.breaking.ChangeType;
import com.blastradius.engine.breaking.Mitigations;
import com.blastradius.engine.breaking.Severity;
import com.blastradius.engine.cascade.CascadeDetector;
import com.blastradius.engine.cascade.CascadeEffect;
import com.blastradius.engine.cascade.TerminalClassification;
import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.EdgeKind;
import com.blastradius.engine.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static com.blastradius.engine.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CascadeDetectorTest {

    private static BreakingChange change(ChangeType type, String name) {
        Severity severity = type == ChangeType.ADDED ? Severity.INFO : Severity.CRITICAL;
        return new BreakingChange(type, NodeKind.FUNCTION, name, "src/" + name + ".rs", "f()", null,
                severity, "test change", Mitigations.forChange(type, name));
    }

    private static CascadeDetector withDepth(int maxDepth) {
        return new CascadeDetector(AnalysisConfig.builder().maxDepth(maxDepth).build());
    }

    @Test
    void scenarioAChains() {
        List<CascadeEffect> cascades = withDepth(2).detect(scenarioA(true), List.of(change(ChangeType.REMOVED, "A")));

        assertEquals(2, cascades.size());
        assertEquals(List.of("A", "B", "C"), cascades.get(0).path());
        assertEquals(List.of("A", "B", "D"), cascades.get(1).path());
        for (CascadeEffect c : cascades) {
            assertEquals(List.of(EdgeKind.CALLS, EdgeKind.CALLS), c.edgeKinds());
            assertEquals(TerminalClassification.PUBLIC_API_EXPOSURE, c.terminal());
            assertEquals("A", c.rootChange().qualifiedName());
            assertEquals(0.49, c.strength(), 1e-12);
        }
    }

    @Test
    void scenarioAWithPrivateCallers() {
        DependencyGraph g = graph(
                List.of(node("A", true), node("B", false), node("C", false), node("D", false)),
                List.of(calls("B", "A"), calls("C", "B"), calls("D", "B")));

        List<CascadeEffect> cascades = withDepth(2).detect(g, List.of(change(ChangeType.REMOVED, "A")));

        assertEquals(List.of(List.of("A", "B", "C"), List.of("A", "B", "D")),
                cascades.stream().map(CascadeEffect::path).toList());
        for (CascadeEffect c : cascades) {
            assertEquals(TerminalClassification.CHAIN_END, c.terminal());
            assertEquals(0.49, c.strength(), 1e-12);
        }
    }

    @Test
    void depthLimitedChainIsRecorded() {
        DependencyGraph chain = graph(
                List.of(node("A", false), node("B", false), node("C", false), node("D", false)),
                List.of(calls("B", "A"), calls("C", "B"), calls("D", "C")));

        List<CascadeEffect> cascades = withDepth(2).detect(chain, List.of(change(ChangeType.REMOVED, "A")));

        assertEquals(1, cascades.size());
        assertEquals(List.of("A", "B", "C"), cascades.get(0).path());
        assertEquals(TerminalClassification.DEPTH_LIMITED, cascades.get(0).terminal());
    }

    @Test
    void privateLeafEndsTheChain() {
        DependencyGraph chain = graph(
                List.of(node("A", false), node("B", false)),
                List.of(calls("B", "A")));

        List<CascadeEffect> cascades = withDepth(4).detect(chain, List.of(change(ChangeType.REMOVED, "A")));

        assertEquals(1, cascades.size());
        assertEquals(List.of("A", "B"), cascades.get(0).path());
        assertEquals(TerminalClassification.CHAIN_END, cascades.get(0).terminal());
    }

    @Test
    void changedNodeWithoutDependentsStartsNothing() {
        DependencyGraph lone = graph(List.of(node("A", false)), List.of());

        assertTrue(withDepth(4).detect(lone, List.of(change(ChangeType.REMOVED, "A"))).isEmpty());
    }

    @Test
    void independentBreakIsCompound() {
        DependencyGraph chain = graph(
                List.of(node("A", false), node("B", false), node("C", false)),
                List.of(calls("B", "A"), calls("C", "B")));

        List<CascadeEffect> cascades = withDepth(4).detect(chain, List.of(
                change(ChangeType.REMOVED, "A"),
                change(ChangeType.SIGNATURE_CHANGED, "B")));

        assertEquals(2, cascades.size());
        assertEquals(List.of("A", "B"), cascades.get(0).path());
        assertEquals(TerminalClassification.COMPOUND_BREAK, cascades.get(0).terminal());
        // the walk from A stops at B; B's own change carries on to C
        assertEquals(List.of("B", "C"), cascades.get(1).path());
        assertEquals("B", cascades.get(1).rootChange().qualifiedName());
        assertEquals(TerminalClassification.CHAIN_END, cascades.get(1).terminal());
    }

    @Test
    void compoundBeatsPublicExposure() {
        DependencyGraph g = graph(List.of(node("A", true), node("B", true)), List.of(calls("B", "A")));

        List<CascadeEffect> cascades = withDepth(1).detect(g, List.of(
                change(ChangeType.REMOVED, "A"),
                change(ChangeType.VISIBILITY_REDUCED, "B")));

        assertEquals(1, cascades.size());
        assertEquals(TerminalClassification.COMPOUND_BREAK, cascades.get(0).terminal());
    }

    @Test
    void pathsNeverRepeatNodes() {
        DependencyGraph cyclic = graph(
                List.of(node("A", false), node("B", false), node("C", true), node("D", false)),
                List.of(calls("B", "A"), calls("A", "B"), calls("C", "B"), calls("D", "C"), calls("B", "D"),
                        calls("A", "A")));

        List<CascadeEffect> cascades = withDepth(6).detect(cyclic, List.of(change(ChangeType.REMOVED, "A")));

        assertFalse(cascades.isEmpty());
        for (CascadeEffect c : cascades) {
            assertEquals(c.path().size(), new HashSet<>(c.path()).size(), "repeated node in " + c.path());
            assertEquals(c.path().size() - 1, c.edgeKinds().size());
        }
    }

    @Test
    void nonBreakingAndUnknownChangesStartNothing() {
        List<CascadeEffect> cascades = new CascadeDetector().detect(scenarioA(true), List.of(
                change(ChangeType.ADDED, "A"),
                change(ChangeType.REMOVED, "not_in_graph")));

        assertTrue(cascades.isEmpty());
    }

    @Test
    void zeroDepthFindsNothing() {
        assertTrue(withDepth(0).detect(scenarioA(true), List.of(change(ChangeType.REMOVED, "A"))).isEmpty());
    }

    @Test
    void strongestEdgeNamesTheHop() {
        DependencyGraph g = graph(
                List.of(node("A", false), node("B", true)),
                List.of(edge("B", "A", EdgeKind.DEPENDS_ON, 0.8), edge("B", "A", EdgeKind.CALLS, 1.0)));

        CascadeEffect c = withDepth(1).detect(g, List.of(change(ChangeType.REMOVED, "A"))).get(0);

        assertEquals(List.of(EdgeKind.CALLS), c.edgeKinds());
        assertEquals(0.7, c.strength(), 1e-12);
    }

    @Test
    void strongerCascadesComeFirst() {
        DependencyGraph g = graph(
                List.of(node("A", false), node("B", true), node("C", true)),
                List.of(edge("B", "A", EdgeKind.CONTAINS, 0.5), calls("C", "A")));

        List<CascadeEffect> cascades = withDepth(1).detect(g, List.of(change(ChangeType.REMOVED, "A")));

        assertEquals(List.of("A", "C"), cascades.get(0).path());
        assertEquals(List.of("A", "B"), cascades.get(1).path());
    }

    @Test
    void cascadeCountIsCapped() {
        DependencyGraph fan = graph(
                List.of(node("A", false), node("B1", true), node("B2", true), node("B3", true),
                        node("B4", true), node("B5", true)),
                List.of(calls("B1", "A"), calls("B2", "A"), calls("B3", "A"), calls("B4", "A"), calls("B5", "A")));
        CascadeDetector detector = new CascadeDetector(AnalysisConfig.builder().maxCascades(3).build());

        assertEquals(3, detector.detect(fan, List.of(change(ChangeType.REMOVED, "A"))).size());
    }
}
