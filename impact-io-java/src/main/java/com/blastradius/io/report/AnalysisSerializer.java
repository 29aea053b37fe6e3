package com.blastradius.io.report;

import com.blastradius.engine.ImpactAnalysis;
import com.blastradius.engine.breaking.BreakingChange;
import com.blastradius.engine.cascade.CascadeEffect;
import com.blastradius.engine.centrality.CentralityResult;
import com.blastradius.engine.graph.BuildDiagnostic;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.Edge;
import com.blastradius.engine.graph.GraphStatistics;
import com.blastradius.engine.graph.MergeConflict;
import com.blastradius.engine.graph.Node;
import com.blastradius.engine.propagation.ImpactScope;
import com.blastradius.engine.propagation.ImpactedNode;
import com.blastradius.engine.summary.GraphSummary;
import com.blastradius.engine.summary.RankedNode;
import com.blastradius.io.report.ReportModel.ChangeEntry;
import com.blastradius.io.report.ReportModel.ConflictEntry;
import com.blastradius.io.report.ReportModel.DiagnosticEntry;
import com.blastradius.io.report.ReportModel.EdgeEntry;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Serializes an analysis to graph.json and impact_report.json.
 * Produces deterministic output by sorting every array before writing.
 */
public class AnalysisSerializer {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSerializer.class);

    static final String REPORT_VERSION = "0.1";
    public static final String GRAPH_FILE = "graph.json";
    public static final String REPORT_FILE = "impact_report.json";

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code analysis} to {@code outputDir/graph.json} and {@code outputDir/impact_report.json}.
     *
     * @param analysis  result of one analysis call
     * @param outputDir directory to write into (created if absent)
     */
    public void write(ImpactAnalysis analysis, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        writeJson(gson, toGraphReport(analysis.graph(), true), outputDir.resolve(GRAPH_FILE));
        writeJson(gson, toImpactReport(analysis), outputDir.resolve(REPORT_FILE));
    }

    /**
     * Compact JSON of the graph's nodes and edges only, sorted. Two graphs with
     * equal node and edge sets give identical strings.
     */
    public String toNormalizedJson(DependencyGraph graph) {
        return new Gson().toJson(toGraphReport(graph, false));
    }

    private static void writeJson(Gson gson, Object report, Path path) {
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(report, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
        log.info("{} written: {}", path.getFileName(), path);
    }

    // -----------------------------------------------------------------------
    // graph.json
    // -----------------------------------------------------------------------

    ReportModel.GraphReport toGraphReport(DependencyGraph graph, boolean full) {
        ReportModel.GraphReport report = new ReportModel.GraphReport();
        report.reportVersion = REPORT_VERSION;

        report.nodes = new ArrayList<>();
        for (Node node : graph.nodes().values()) {
            ReportModel.NodeEntry entry = new ReportModel.NodeEntry();
            entry.id = node.id();
            entry.kind = node.kind().name();
            entry.qualifiedName = node.qualifiedName();
            entry.visibility = node.visibility().name();
            entry.signature = node.signature();
            entry.fingerprint = node.fingerprint();
            entry.file = node.location().file();
            entry.lineStart = node.location().lineStart();
            entry.lineEnd = node.location().lineEnd();
            entry.exported = node.exported();
            report.nodes.add(entry);
        }
        report.nodes.sort(Comparator.comparing(n -> n.id));

        report.edges = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            EdgeEntry entry = new EdgeEntry();
            entry.source = edge.sourceId();
            entry.target = edge.targetId();
            entry.kind = edge.kind().name();
            entry.weight = edge.weight();
            report.edges.add(entry);
        }
        report.edges.sort(Comparator.comparing((EdgeEntry e) -> e.source)
                .thenComparing(e -> e.target)
                .thenComparing(e -> e.kind));

        if (!full) return report;

        report.diagnostics = new ArrayList<>();
        for (BuildDiagnostic d : graph.diagnostics()) {
            DiagnosticEntry entry = new DiagnosticEntry();
            entry.category = d.category().name();
            entry.file = d.file();
            entry.subject = d.subject();
            entry.message = d.message();
            report.diagnostics.add(entry);
        }
        report.diagnostics.sort(Comparator.comparing((DiagnosticEntry d) -> d.category)
                .thenComparing(d -> d.file, NULLS_FIRST)
                .thenComparing(d -> d.subject, NULLS_FIRST)
                .thenComparing(d -> d.message, NULLS_FIRST));

        report.conflicts = new ArrayList<>();
        for (MergeConflict c : graph.conflicts()) {
            ConflictEntry entry = new ConflictEntry();
            entry.kind = c.key().kind().name();
            entry.qualifiedName = c.key().qualifiedName();
            entry.keptId = c.keptId();
            entry.discardedId = c.discardedId();
            entry.policy = c.policy().name();
            report.conflicts.add(entry);
        }
        report.conflicts.sort(Comparator.comparing((ConflictEntry c) -> c.qualifiedName)
                .thenComparing(c -> c.kind)
                .thenComparing(c -> c.discardedId));

        GraphStatistics stats = graph.statistics();
        report.statistics = new ReportModel.StatisticsEntry();
        report.statistics.nodeCount = stats.nodeCount();
        report.statistics.edgeCount = stats.edgeCount();
        report.statistics.externalNodeCount = stats.externalNodeCount();
        report.statistics.averageDegree = stats.averageDegree();
        report.statistics.cycleCount = stats.cycleCount();
        return report;
    }

    // -----------------------------------------------------------------------
    // impact_report.json
    // -----------------------------------------------------------------------

    ReportModel.ImpactReport toImpactReport(ImpactAnalysis analysis) {
        ReportModel.ImpactReport report = new ReportModel.ImpactReport();
        report.reportVersion = REPORT_VERSION;

        report.risk = new ReportModel.RiskEntry();
        report.risk.level = analysis.risk().level().name();
        report.risk.score = analysis.risk().score();
        report.risk.changeCount = analysis.risk().changeCount();
        report.risk.recommendations = analysis.risk().recommendations();

        report.breakingChanges = new ArrayList<>();
        for (BreakingChange change : analysis.breakingChanges()) {
            report.breakingChanges.add(changeEntry(change));
        }
        report.breakingChanges.sort(Comparator.comparing((ChangeEntry c) -> c.qualifiedName)
                .thenComparing(c -> c.kind)
                .thenComparing(c -> c.changeType));

        report.impact = impactEntry(analysis.impactScope());

        // Cascades keep the detector's order: strongest first, ties by path
        report.cascades = new ArrayList<>();
        for (CascadeEffect effect : analysis.cascades()) {
            ReportModel.CascadeEntry entry = new ReportModel.CascadeEntry();
            entry.path = effect.path();
            entry.edgeKinds = effect.edgeKinds().stream().map(Enum::name).toList();
            entry.rootQualifiedName = effect.rootChange().qualifiedName();
            entry.rootChangeType = effect.rootChange().changeType().name();
            entry.terminal = effect.terminal().name();
            entry.strength = effect.strength();
            report.cascades.add(entry);
        }

        report.centrality = centralityEntry(analysis.centrality());
        report.summary = summaryEntry(analysis.summary(), analysis.centrality());
        return report;
    }

    private static ChangeEntry changeEntry(BreakingChange change) {
        ChangeEntry entry = new ChangeEntry();
        entry.changeType = change.changeType().name();
        entry.kind = change.kind().name();
        entry.qualifiedName = change.qualifiedName();
        entry.file = change.file();
        entry.beforeSignature = change.beforeSignature();
        entry.afterSignature = change.afterSignature();
        entry.severity = change.severity().name();
        entry.description = change.description();
        entry.mitigations = change.mitigations();
        return entry;
    }

    private static ReportModel.ImpactEntry impactEntry(ImpactScope scope) {
        ReportModel.ImpactEntry entry = new ReportModel.ImpactEntry();
        entry.sources = new ArrayList<>(scope.sources());
        entry.directImpacts = new ArrayList<>(scope.directImpacts());
        entry.indirectImpacts = new ArrayList<>();
        for (ImpactedNode node : scope.indirectImpacts().values()) {
            ReportModel.ImpactedEntry impacted = new ReportModel.ImpactedEntry();
            impacted.id = node.nodeId();
            impacted.distance = node.distance();
            impacted.score = node.score();
            impacted.via = node.via();
            entry.indirectImpacts.add(impacted);
        }
        entry.indirectImpacts.sort(Comparator.comparing(i -> i.id));
        entry.totalTouched = scope.statistics().totalTouched();
        entry.highImpactCount = scope.statistics().highImpactCount();
        entry.maxDistanceReached = scope.statistics().maxDistanceReached();
        entry.averageScore = scope.statistics().averageScore();
        return entry;
    }

    private static ReportModel.CentralityEntry centralityEntry(CentralityResult result) {
        ReportModel.CentralityEntry entry = new ReportModel.CentralityEntry();
        entry.converged = result.converged();
        entry.iterations = result.iterations();
        entry.criticalNodes = new ArrayList<>(result.criticalNodes());
        entry.criticalNodes.sort(Comparator.naturalOrder());
        entry.scores = new ArrayList<>();
        result.scores().forEach((id, score) -> {
            ReportModel.ScoreEntry s = new ReportModel.ScoreEntry();
            s.id = id;
            s.score = score;
            entry.scores.add(s);
        });
        entry.scores.sort(Comparator.comparing(s -> s.id));
        return entry;
    }

    private static ReportModel.SummaryEntry summaryEntry(GraphSummary summary, CentralityResult centrality) {
        ReportModel.SummaryEntry entry = new ReportModel.SummaryEntry();
        // Selection order is the ranking itself
        entry.selected = new ArrayList<>();
        for (RankedNode node : summary.selected()) {
            ReportModel.RankedEntry ranked = new ReportModel.RankedEntry();
            ranked.id = node.nodeId();
            ranked.kind = node.kind().name();
            ranked.qualifiedName = node.qualifiedName();
            ranked.centrality = node.centrality();
            ranked.impact = node.impact();
            ranked.rank = node.rank();
            ranked.critical = centrality.isCritical(node.nodeId());
            ranked.tokens = node.tokens();
            entry.selected.add(ranked);
        }
        entry.truncated = summary.truncated();
        entry.omittedCount = summary.omittedCount();
        entry.budgetUsed = summary.budgetUsed();
        entry.budgetTotal = summary.budgetTotal();
        entry.topK = summary.topK();
        return entry;
    }
}
