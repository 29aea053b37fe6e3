package com.blastradius.engine.breaking;

import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.graph.ConflictPolicy;
import com.blastradius.engine.graph.NodeKey;
import com.blastradius.engine.graph.ParsedEntity;
import com.blastradius.engine.model.SummaryModel;
import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import com.blastradius.engine.model.SummaryModel.SummaryEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Diffs the entities of two versions of the code and classifies every difference.
 *
 * Entities are matched by (kind, qualified name); a rename shows up as a
 * removal plus an addition. One matched pair can produce both a visibility
 * change and a signature change.
 */
public class BreakingChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(BreakingChangeDetector.class);

    private static final Comparator<BreakingChange> ORDER = Comparator
            .comparing(BreakingChange::qualifiedName)
            .thenComparing(BreakingChange::kind)
            .thenComparing(BreakingChange::changeType);

    private final AnalysisConfig config;

    public BreakingChangeDetector() {
        this(AnalysisConfig.defaults());
    }

    public BreakingChangeDetector(AnalysisConfig config) {
        this.config = config;
    }

    public List<BreakingChange> detect(StructuralSummary before, StructuralSummary after) {
        return detect(before == null ? List.of() : List.of(before), after == null ? List.of() : List.of(after));
    }

    /**
     * @param before summaries of the code before the edit
     * @param after  summaries of the code after the edit
     * @return classified changes sorted by qualified name, kind and change type
     */
    public List<BreakingChange> detect(List<StructuralSummary> before, List<StructuralSummary> after) {
        Map<NodeKey, ParsedEntity> old = index(before);
        Map<NodeKey, ParsedEntity> current = index(after);

        Set<NodeKey> keys = new LinkedHashSet<>(old.keySet());
        keys.addAll(current.keySet());

        List<BreakingChange> changes = new ArrayList<>();
        for (NodeKey key : keys) {
            ParsedEntity was = old.get(key);
            ParsedEntity is = current.get(key);
            if (is == null) {
                changes.add(removed(was));
            } else if (was == null) {
                changes.add(added(is));
            } else {
                compare(was, is, changes);
            }
        }

        changes.sort(ORDER);
        log.debug("Detected {} changes ({} breaking) across {} entities",
                changes.size(), changes.stream().filter(BreakingChange::isBreaking).count(), keys.size());
        return changes;
    }

    private Map<NodeKey, ParsedEntity> index(List<StructuralSummary> summaries) {
        List<StructuralSummary> ordered = new ArrayList<>();
        for (StructuralSummary s : summaries) {
            if (s != null) ordered.add(s);
        }
        ordered.sort(SummaryModel.CANONICAL_ORDER);

        Map<NodeKey, ParsedEntity> byKey = new HashMap<>();
        for (StructuralSummary summary : ordered) {
            for (SummaryEntity entity : summary.getEntities()) {
                String problem = ParsedEntity.problemWith(entity, summary.file);
                if (problem != null) {
                    log.debug("Ignoring entity in {} while diffing: {}", summary.file, problem);
                    continue;
                }
                ParsedEntity parsed = ParsedEntity.parse(entity, summary.file);
                if (config.getConflictPolicy() == ConflictPolicy.LAST_WINS) {
                    byKey.put(parsed.key(), parsed);
                } else {
                    byKey.putIfAbsent(parsed.key(), parsed);
                }
            }
        }
        return byKey;
    }

    // -----------------------------------------------------------------------
    // Classification
    // -----------------------------------------------------------------------

    private static BreakingChange removed(ParsedEntity was) {
        Severity severity = was.exported() ? Severity.CRITICAL : Severity.MEDIUM;
        String description = label(was) + " was removed" + (was.exported() ? " from the public surface" : "");
        return change(ChangeType.REMOVED, was, was.file(), was.signature(), null, severity, description);
    }

    private static BreakingChange added(ParsedEntity is) {
        return change(ChangeType.ADDED, is, is.file(), null, is.signature(), Severity.INFO, label(is) + " was added");
    }

    private static void compare(ParsedEntity was, ParsedEntity is, List<BreakingChange> out) {
        if (is.visibility().isNarrowerThan(was.visibility())) {
            out.add(change(ChangeType.VISIBILITY_REDUCED, is, is.file(), was.signature(), is.signature(),
                    Severity.HIGH, label(is) + " visibility narrowed from " + was.visibility()
                            + " to " + is.visibility()));
        } else if (is.visibility().isWiderThan(was.visibility())) {
            out.add(change(ChangeType.VISIBILITY_WIDENED, is, is.file(), was.signature(), is.signature(),
                    Severity.INFO, label(is) + " visibility widened from " + was.visibility()
                            + " to " + is.visibility()));
        }

        if (!was.fingerprint().equals(is.fingerprint())) {
            Severity severity = was.exported() ? Severity.HIGH : Severity.LOW;
            out.add(change(ChangeType.SIGNATURE_CHANGED, is, is.file(), was.signature(), is.signature(),
                    severity, label(is) + " changed signature: " + signatureDelta(was, is)));
        }
    }

    /** Names the parameter-count and return-type differences where there are any. */
    static String signatureDelta(ParsedEntity was, ParsedEntity is) {
        List<String> parts = new ArrayList<>();
        if (was.parameters().size() != is.parameters().size()) {
            parts.add("parameter count " + was.parameters().size() + " -> " + is.parameters().size());
        } else if (!was.parameters().equals(is.parameters())) {
            parts.add("parameter types " + was.parameters() + " -> " + is.parameters());
        }
        if (!Objects.equals(was.returnType(), is.returnType())) {
            parts.add("return type " + orNone(was.returnType()) + " -> " + orNone(is.returnType()));
        }
        if (parts.isEmpty()) {
            parts.add("'" + was.signature() + "' -> '" + is.signature() + "'");
        }
        return String.join("; ", parts);
    }

    private static BreakingChange change(ChangeType type, ParsedEntity entity, String file, String beforeSignature,
                                         String afterSignature, Severity severity, String description) {
        return new BreakingChange(type, entity.kind(), entity.qualifiedName(), file, beforeSignature,
                afterSignature, severity, description, Mitigations.forChange(type, entity.qualifiedName()));
    }

    private static String label(ParsedEntity entity) {
        return entity.kind().name().toLowerCase(Locale.ROOT) + " '" + entity.qualifiedName() + "'";
    }

    private static String orNone(String value) {
        return value == null ? "none" : value;
    }
}
