package com.blastradius.engine.graph;

import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.graph.BuildDiagnostic.Category;
import com.blastradius.engine.model.SummaryModel;
import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import com.blastradius.engine.model.SummaryModel.SummaryEntity;
import com.blastradius.engine.model.SummaryModel.SummaryRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns structural summaries into a {@link DependencyGraph}.
 *
 * Summaries are processed in file order, so the same summaries in any order
 * produce the same graph. A bad entity or relationship is skipped with a
 * diagnostic; it never fails the build. References that match no declared
 * entity become synthetic EXTERNAL nodes so the edge survives.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final AnalysisConfig config;

    public GraphBuilder() {
        this(AnalysisConfig.defaults());
    }

    public GraphBuilder(AnalysisConfig config) {
        this.config = config;
    }

    public DependencyGraph build(StructuralSummary... summaries) {
        return build(Arrays.asList(summaries));
    }

    public DependencyGraph build(List<StructuralSummary> summaries) {
        return new Pass(summaries).run();
    }

    /** State of a single build call. */
    private final class Pass {

        private final List<StructuralSummary> ordered;
        private final DependencyGraph.Builder graph = new DependencyGraph.Builder();
        private final Map<NodeKey, String> idByKey = new HashMap<>();
        private final Map<String, List<String>> idsByQualifiedName = new HashMap<>();
        private final Map<String, List<String>> idsBySimpleName = new HashMap<>();
        private final List<PendingContainment> containments = new ArrayList<>();

        Pass(List<StructuralSummary> summaries) {
            List<StructuralSummary> copy = new ArrayList<>();
            for (StructuralSummary s : summaries) {
                if (s != null) copy.add(s);
            }
            copy.sort(SummaryModel.CANONICAL_ORDER);
            this.ordered = copy;
        }

        DependencyGraph run() {
            // --- 1. Declared entities ---
            for (StructuralSummary summary : ordered) {
                List<SummaryEntity> entities = summary.getEntities();
                for (int ordinal = 0; ordinal < entities.size(); ordinal++) {
                    declare(summary.file, ordinal, entities.get(ordinal));
                }
            }

            // --- 2. Containment from lexical nesting ---
            for (PendingContainment c : containments) {
                String containerId = resolve(c.containerName(), c.file(), "container");
                addEdge(containerId, c.childId(), EdgeKind.CONTAINS, null);
            }

            // --- 3. Declared relationships ---
            for (StructuralSummary summary : ordered) {
                for (SummaryRelationship rel : summary.getRelationships()) {
                    relate(summary.file, rel);
                }
            }

            DependencyGraph built = graph.build();
            log.debug("Built graph from {} summaries: {} nodes, {} edges, {} diagnostics",
                    ordered.size(), built.nodeCount(), built.edgeCount(), built.diagnostics().size());
            return built;
        }

        private void declare(String summaryFile, int ordinal, SummaryEntity entity) {
            String problem = ParsedEntity.problemWith(entity, summaryFile);
            if (problem != null) {
                String subject = entity != null && entity.qualifiedName != null
                        ? entity.qualifiedName : "entity #" + ordinal;
                malformed(summaryFile, subject, problem);
                return;
            }

            ParsedEntity parsed = ParsedEntity.parse(entity, summaryFile);
            String existingId = idByKey.get(parsed.key());
            if (existingId != null) {
                mergeDuplicate(existingId, parsed, ordinal);
                return;
            }

            String id = NodeIdGenerator.disambiguate(
                    NodeIdGenerator.forEntity(parsed.file(), ordinal, parsed.qualifiedName()), graph.nodeIds());
            graph.addNode(toNode(id, parsed));
            idByKey.put(parsed.key(), id);
            idsByQualifiedName.computeIfAbsent(parsed.qualifiedName(), k -> new ArrayList<>()).add(id);
            idsBySimpleName.computeIfAbsent(NodeIdGenerator.simpleName(parsed.qualifiedName()),
                    k -> new ArrayList<>()).add(id);

            if (parsed.container() != null) {
                containments.add(new PendingContainment(parsed.container(), id, parsed.file()));
            }
        }

        private void mergeDuplicate(String existingId, ParsedEntity duplicate, int ordinal) {
            Node existing = graph.getNode(existingId);
            String duplicateId = NodeIdGenerator.forEntity(duplicate.file(), ordinal, duplicate.qualifiedName());
            graph.addDiagnostic(new BuildDiagnostic(Category.DUPLICATE_ENTITY, duplicate.file(),
                    duplicate.qualifiedName(), "also declared as " + existingId + ", policy "
                    + config.getConflictPolicy()));

            boolean differs = !existing.fingerprint().equals(duplicate.fingerprint())
                    || existing.visibility() != duplicate.visibility();
            if (differs) {
                graph.addConflict(new MergeConflict(duplicate.key(), existingId, duplicateId,
                        config.getConflictPolicy()));
                log.debug("Conflicting definitions of {}: kept {} under {}",
                        duplicate.key(), existingId, config.getConflictPolicy());
            }
            if (config.getConflictPolicy() == ConflictPolicy.LAST_WINS) {
                graph.addNode(toNode(existingId, duplicate));
            }
            if (duplicate.container() != null) {
                containments.add(new PendingContainment(duplicate.container(), existingId, duplicate.file()));
            }
        }

        private void relate(String summaryFile, SummaryRelationship rel) {
            if (rel == null) {
                malformed(summaryFile, "relationship", "relationship is null");
                return;
            }
            String subject = rel.from + " -> " + rel.to;
            if (rel.from == null || rel.from.isBlank() || rel.to == null || rel.to.isBlank()) {
                malformed(summaryFile, subject, "missing from/to");
                return;
            }
            EdgeKind kind = EdgeKind.parse(rel.kind);
            if (kind == null) {
                malformed(summaryFile, subject, "unknown relationship kind '" + rel.kind + "'");
                return;
            }
            Double weight = rel.weight;
            if (weight != null && (!Double.isFinite(weight) || weight < 0.0)) {
                malformed(summaryFile, subject, "invalid weight " + weight + ", using " + kind + " default");
                weight = null;
            }

            String sourceId = resolve(rel.from.trim(), summaryFile, "relationship source");
            String targetId = resolve(rel.to.trim(), summaryFile, "relationship target");
            addEdge(sourceId, targetId, kind, weight);
        }

        private void addEdge(String sourceId, String targetId, EdgeKind kind, Double weight) {
            double w = weight != null ? weight : config.weightOf(kind);
            graph.addEdge(new Edge(sourceId, targetId, kind, w));
        }

        /**
         * Resolves a reference to a node id: exact qualified name first, then a
         * simple name in the same file, then a simple name unique project-wide.
         * Anything else lands on an EXTERNAL node.
         */
        private String resolve(String reference, String scopeFile, String role) {
            List<String> exact = idsByQualifiedName.get(reference);
            if (exact != null && !exact.isEmpty()) {
                return preferSameFile(exact, scopeFile);
            }

            if (NodeIdGenerator.simpleName(reference).equals(reference)) {
                List<String> candidates = idsBySimpleName.getOrDefault(reference, List.of());
                List<String> sameFile = candidates.stream()
                        .filter(id -> scopeFile != null && scopeFile.equals(graph.getNode(id).location().file()))
                        .toList();
                if (sameFile.size() == 1) return sameFile.get(0);
                if (sameFile.isEmpty() && candidates.size() == 1) return candidates.get(0);
                if (candidates.size() > 1) {
                    graph.addDiagnostic(new BuildDiagnostic(Category.AMBIGUOUS_REFERENCE, scopeFile, reference,
                            role + " matches " + (sameFile.isEmpty() ? candidates.size() : sameFile.size())
                                    + " declarations"));
                    log.debug("Ambiguous {} '{}' in {}", role, reference, scopeFile);
                    return external(reference);
                }
            }

            graph.addDiagnostic(new BuildDiagnostic(Category.UNRESOLVED_REFERENCE, scopeFile, reference,
                    role + " not declared in any summary"));
            log.debug("Unresolved {} '{}' in {}", role, reference, scopeFile);
            return external(reference);
        }

        private String preferSameFile(List<String> ids, String scopeFile) {
            for (String id : ids) {
                if (scopeFile != null && scopeFile.equals(graph.getNode(id).location().file())) return id;
            }
            return ids.stream().sorted().findFirst().orElseThrow();
        }

        private String external(String reference) {
            String id = NodeIdGenerator.forExternal(reference);
            if (!graph.hasNode(id)) {
                graph.addNode(externalNode(id, reference));
            }
            return id;
        }

        private void malformed(String file, String subject, String problem) {
            graph.addDiagnostic(new BuildDiagnostic(Category.MALFORMED_INPUT, file, subject, problem));
            log.warn("Skipping malformed summary entry in {}: {} ({})", file, subject, problem);
        }
    }

    static Node toNode(String id, ParsedEntity parsed) {
        return new Node(id, parsed.kind(), parsed.qualifiedName(), parsed.visibility(), parsed.signature(),
                parsed.fingerprint(), parsed.location(), parsed.exported());
    }

    static Node externalNode(String id, String reference) {
        return new Node(id, NodeKind.EXTERNAL, reference, Visibility.UNKNOWN, "",
                NodeIdGenerator.fingerprint(null, List.of(), null), SourceLocation.unknown(), false);
    }

    private record PendingContainment(String containerName, String childId, String file) {}
}
