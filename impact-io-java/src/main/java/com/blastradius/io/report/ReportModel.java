package com.blastradius.io.report;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs for graph.json and impact_report.json.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class GraphReport {
        @SerializedName("report_version") public String reportVersion;
        @SerializedName("nodes")          public List<NodeEntry> nodes;
        @SerializedName("edges")          public List<EdgeEntry> edges;
        @SerializedName("diagnostics")    public List<DiagnosticEntry> diagnostics;   // omitted in normalized form
        @SerializedName("conflicts")      public List<ConflictEntry> conflicts;       // omitted in normalized form
        @SerializedName("statistics")     public StatisticsEntry statistics;          // omitted in normalized form
    }

    public static class NodeEntry {
        @SerializedName("id")             public String id;
        @SerializedName("kind")           public String kind;
        @SerializedName("qualified_name") public String qualifiedName;
        @SerializedName("visibility")     public String visibility;
        @SerializedName("signature")      public String signature;
        @SerializedName("fingerprint")    public String fingerprint;
        @SerializedName("file")           public String file;        // null for external nodes
        @SerializedName("line_start")     public int lineStart;
        @SerializedName("line_end")       public int lineEnd;
        @SerializedName("exported")       public boolean exported;
    }

    public static class EdgeEntry {
        @SerializedName("source") public String source;
        @SerializedName("target") public String target;
        @SerializedName("kind")   public String kind;
        @SerializedName("weight") public double weight;
    }

    public static class DiagnosticEntry {
        @SerializedName("category") public String category;
        @SerializedName("file")     public String file;
        @SerializedName("subject")  public String subject;
        @SerializedName("message")  public String message;
    }

    public static class ConflictEntry {
        @SerializedName("kind")           public String kind;
        @SerializedName("qualified_name") public String qualifiedName;
        @SerializedName("kept_id")        public String keptId;
        @SerializedName("discarded_id")   public String discardedId;
        @SerializedName("policy")         public String policy;
    }

    public static class StatisticsEntry {
        @SerializedName("node_count")          public int nodeCount;
        @SerializedName("edge_count")          public int edgeCount;
        @SerializedName("external_node_count") public int externalNodeCount;
        @SerializedName("average_degree")      public double averageDegree;
        @SerializedName("cycle_count")         public int cycleCount;
    }

    // -----------------------------------------------------------------------
    // impact_report.json
    // -----------------------------------------------------------------------

    public static class ImpactReport {
        @SerializedName("report_version")   public String reportVersion;
        @SerializedName("risk")             public RiskEntry risk;
        @SerializedName("breaking_changes") public List<ChangeEntry> breakingChanges;
        @SerializedName("impact")           public ImpactEntry impact;
        @SerializedName("cascades")         public List<CascadeEntry> cascades;
        @SerializedName("centrality")       public CentralityEntry centrality;
        @SerializedName("summary")          public SummaryEntry summary;
    }

    public static class RiskEntry {
        @SerializedName("level")           public String level;
        @SerializedName("score")           public int score;
        @SerializedName("change_count")    public int changeCount;
        @SerializedName("recommendations") public List<String> recommendations;
    }

    public static class ChangeEntry {
        @SerializedName("change_type")      public String changeType;
        @SerializedName("kind")             public String kind;
        @SerializedName("qualified_name")   public String qualifiedName;
        @SerializedName("file")             public String file;
        @SerializedName("before_signature") public String beforeSignature;
        @SerializedName("after_signature")  public String afterSignature;
        @SerializedName("severity")         public String severity;
        @SerializedName("description")      public String description;
        @SerializedName("mitigations")      public List<String> mitigations;
    }

    public static class ImpactEntry {
        @SerializedName("sources")              public List<String> sources;
        @SerializedName("direct_impacts")       public List<String> directImpacts;
        @SerializedName("indirect_impacts")     public List<ImpactedEntry> indirectImpacts;
        @SerializedName("total_touched")        public int totalTouched;
        @SerializedName("high_impact_count")    public int highImpactCount;
        @SerializedName("max_distance_reached") public int maxDistanceReached;
        @SerializedName("average_score")        public double averageScore;
    }

    public static class ImpactedEntry {
        @SerializedName("id")       public String id;
        @SerializedName("distance") public int distance;
        @SerializedName("score")    public double score;
        @SerializedName("via")      public String via;
    }

    public static class CascadeEntry {
        @SerializedName("path")                public List<String> path;
        @SerializedName("edge_kinds")          public List<String> edgeKinds;
        @SerializedName("root_qualified_name") public String rootQualifiedName;
        @SerializedName("root_change_type")    public String rootChangeType;
        @SerializedName("terminal")            public String terminal;
        @SerializedName("strength")            public double strength;
    }

    public static class CentralityEntry {
        @SerializedName("converged")      public boolean converged;
        @SerializedName("iterations")     public int iterations;
        @SerializedName("critical_nodes") public List<String> criticalNodes;
        @SerializedName("scores")         public List<ScoreEntry> scores;
    }

    public static class ScoreEntry {
        @SerializedName("id")    public String id;
        @SerializedName("score") public double score;
    }

    public static class SummaryEntry {
        @SerializedName("selected")      public List<RankedEntry> selected;
        @SerializedName("truncated")     public boolean truncated;
        @SerializedName("omitted_count") public int omittedCount;
        @SerializedName("budget_used")   public int budgetUsed;
        @SerializedName("budget_total")  public int budgetTotal;
        @SerializedName("top_k")         public int topK;
    }

    public static class RankedEntry {
        @SerializedName("id")             public String id;
        @SerializedName("kind")           public String kind;
        @SerializedName("qualified_name") public String qualifiedName;
        @SerializedName("centrality")     public double centrality;
        @SerializedName("impact")         public double impact;
        @SerializedName("rank")           public double rank;
        @SerializedName("critical")       public boolean critical;
        @SerializedName("tokens")         public int tokens;
    }
}
