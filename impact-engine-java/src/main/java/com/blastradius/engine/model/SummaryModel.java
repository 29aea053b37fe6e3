package com.blastradius.engine.model;

import com.google.gson.Gson;
import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * POJOs for the structural summary handed over by the per-language extractor.
 * Field names use @SerializedName for JSON snake_case mapping.
 *
 * Every field is nullable: the extractor is not trusted, and incomplete
 * entries are skipped individually by the consumers.
 */
public final class SummaryModel {

    private SummaryModel() {}

    private static final Gson GSON = new Gson();

    /**
     * Orders summaries by file, then by their serialized content. Several summaries
     * of one file (one per diff hunk) therefore sort the same whatever order they
     * arrive in.
     */
    public static final Comparator<StructuralSummary> CANONICAL_ORDER = Comparator
            .comparing((StructuralSummary s) -> s.file == null ? "" : s.file)
            .thenComparing(s -> GSON.toJson(s));

    public static class StructuralSummary {
        @SerializedName("file")          public String file;
        @SerializedName("language")      public String language;
        @SerializedName("entities")      public List<SummaryEntity> entities;
        @SerializedName("relationships") public List<SummaryRelationship> relationships;

        public List<SummaryEntity> getEntities() {
            return entities != null ? entities : Collections.emptyList();
        }

        public List<SummaryRelationship> getRelationships() {
            return relationships != null ? relationships : Collections.emptyList();
        }
    }

    public static class SummaryEntity {
        @SerializedName("kind")           public String kind;           // function, type, interface, module
        @SerializedName("qualified_name") public String qualifiedName;
        @SerializedName("visibility")     public String visibility;
        @SerializedName("signature")      public String signature;
        @SerializedName("parameters")     public List<String> parameters;
        @SerializedName("return_type")    public String returnType;
        @SerializedName("container")      public String container;      // nullable
        @SerializedName("exported")       public Boolean exported;      // nullable, overrides visibility
        @SerializedName("location")       public SummaryLocation location;

        public List<String> getParameters() {
            return parameters != null ? parameters : Collections.emptyList();
        }
    }

    public static class SummaryLocation {
        @SerializedName("file")       public String file;
        @SerializedName("line_start") public int lineStart;
        @SerializedName("line_end")   public int lineEnd;
    }

    public static class SummaryRelationship {
        @SerializedName("from")   public String from;
        @SerializedName("to")     public String to;
        @SerializedName("kind")   public String kind;    // calls, contains, implements, depends_on
        @SerializedName("weight") public Double weight;  // nullable, overrides the edge-weight table
    }
}
