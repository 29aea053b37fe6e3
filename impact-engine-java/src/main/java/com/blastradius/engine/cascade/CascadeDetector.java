package com.blastradius.engine.cascade;

import com.blastradius.engine.breaking.BreakingChange;
import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.Edge;
import com.blastradius.engine.graph.EdgeKind;
import com.blastradius.engine.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the multi-hop chains through which breaking changes reach other code.
 *
 * From each breaking change a depth-bounded DFS walks reverse edges (towards
 * dependents). A path is recorded when it hits a node with its own breaking
 * change, an exported node, the depth limit with dependents left over, or a
 * node with no dependents left. The walk does not continue past a node with
 * its own breaking change; that change starts its own cascades. Paths never
 * revisit a node. A recorded path that is a strict prefix of a longer path
 * from the same change is dropped.
 */
public class CascadeDetector {

    private static final Logger log = LoggerFactory.getLogger(CascadeDetector.class);

    private static final Comparator<CascadeEffect> ORDER = Comparator
            .comparingDouble(CascadeEffect::strength).reversed()
            .thenComparing(e -> String.join("\n", e.path()))
            .thenComparing(e -> e.rootChange().changeType());

    private final AnalysisConfig config;

    public CascadeDetector() {
        this(AnalysisConfig.defaults());
    }

    public CascadeDetector(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * @param graph   the dependency graph
     * @param changes classified changes; only breaking ones located in the graph start a cascade
     * @return cascades, strongest first, then by path
     */
    public List<CascadeEffect> detect(DependencyGraph graph, List<BreakingChange> changes) {
        Set<String> brokenNodes = new HashSet<>();
        for (BreakingChange change : changes) {
            String id = graph.idOf(change.kind(), change.qualifiedName());
            if (id != null && change.isBreaking()) brokenNodes.add(id);
        }

        List<CascadeEffect> effects = new ArrayList<>();
        for (BreakingChange change : changes) {
            if (!change.isBreaking()) continue;
            String root = graph.idOf(change.kind(), change.qualifiedName());
            if (root == null) {
                log.debug("No graph node for {} {}, skipping cascade search", change.kind(), change.qualifiedName());
                continue;
            }

            Walk walk = new Walk(graph, change, root, brokenNodes);
            List<String> path = new ArrayList<>();
            path.add(root);
            walk.visit(path, new ArrayList<>(), 1.0);
            effects.addAll(pruneStrictPrefixes(walk.recorded));
        }

        effects.sort(ORDER);
        if (effects.size() > config.getMaxCascades()) {
            log.warn("Found {} cascades, keeping the {} strongest", effects.size(), config.getMaxCascades());
            effects = new ArrayList<>(effects.subList(0, config.getMaxCascades()));
        }
        return effects;
    }

    /** DFS state for a single root change. */
    private final class Walk {

        private final DependencyGraph graph;
        private final BreakingChange change;
        private final String root;
        private final Set<String> brokenNodes;
        private final List<CascadeEffect> recorded = new ArrayList<>();
        private final Set<String> onPath = new HashSet<>();

        Walk(DependencyGraph graph, BreakingChange change, String root, Set<String> brokenNodes) {
            this.graph = graph;
            this.change = change;
            this.root = root;
            this.brokenNodes = brokenNodes;
        }

        void visit(List<String> path, List<EdgeKind> kinds, double weightProduct) {
            if (recorded.size() >= config.getMaxCascades()) return;

            String current = path.get(path.size() - 1);
            int depth = path.size() - 1;
            onPath.add(current);

            Set<String> next = new TreeSet<>(graph.dependents(current));
            next.removeAll(onPath);

            TerminalClassification terminal = depth > 0 ? classify(current, depth, next.isEmpty()) : null;
            if (terminal != null) {
                double strength = weightProduct * Math.pow(config.getDecayFactor(), depth);
                recorded.add(new CascadeEffect(path, kinds, change, terminal, strength));
            }

            if (terminal != TerminalClassification.COMPOUND_BREAK && depth < config.getMaxDepth()) {
                for (String dependent : next) {
                    Edge hop = strongestEdge(dependent, current);
                    path.add(dependent);
                    kinds.add(hop.kind());
                    visit(path, kinds, weightProduct * hop.weight());
                    path.remove(path.size() - 1);
                    kinds.remove(kinds.size() - 1);
                }
            }

            onPath.remove(current);
        }

        private TerminalClassification classify(String id, int depth, boolean exhausted) {
            Node node = graph.node(id);
            if (brokenNodes.contains(id) && !id.equals(root)) return TerminalClassification.COMPOUND_BREAK;
            if (node.exported()) return TerminalClassification.PUBLIC_API_EXPOSURE;
            if (exhausted) return TerminalClassification.CHAIN_END;
            if (depth == config.getMaxDepth()) return TerminalClassification.DEPTH_LIMITED;
            return null;
        }

        /** Highest-weight edge from {@code source} to {@code target}; ties go to the earlier kind. */
        private Edge strongestEdge(String source, String target) {
            Edge best = null;
            for (Edge e : graph.outgoing(source)) {
                if (!e.targetId().equals(target)) continue;
                if (best == null || e.weight() > best.weight()
                        || (e.weight() == best.weight() && e.kind().compareTo(best.kind()) < 0)) {
                    best = e;
                }
            }
            return best;
        }
    }

    static List<CascadeEffect> pruneStrictPrefixes(List<CascadeEffect> paths) {
        Set<List<String>> prefixes = new LinkedHashSet<>();
        for (CascadeEffect effect : paths) {
            List<String> p = effect.path();
            for (int len = 2; len < p.size(); len++) {
                prefixes.add(p.subList(0, len));
            }
        }
        List<CascadeEffect> kept = new ArrayList<>();
        for (CascadeEffect effect : paths) {
            if (!prefixes.contains(effect.path())) kept.add(effect);
        }
        return kept;
    }
}
