package com.blastradius.engine;

import com.blastradius.engine.breaking.BreakingChange;
import com.blastradius.engine.breaking.BreakingChangeDetector;
import com.blastradius.engine.breaking.ChangeType;
import com.blastradius.engine.breaking.Severity;
import com.blastradius.engine.graph.NodeKind;
import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import com.blastradius.engine.model.SummaryModel.SummaryEntity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.blastradius.engine.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BreakingChangeDetectorTest {

    private final BreakingChangeDetector detector = new BreakingChangeDetector();

    private static StructuralSummary file(SummaryEntity... entities) {
        return summary("src/lib.rs", List.of(entities), List.of());
    }

    private List<BreakingChange> diff(SummaryEntity before, SummaryEntity after) {
        return detector.detect(before == null ? file() : file(before), after == null ? file() : file(after));
    }

    private static BreakingChange only(List<BreakingChange> changes) {
        assertEquals(1, changes.size(), "changes: " + changes);
        return changes.get(0);
    }

    @Test
    void removedExportedIsCritical() {
        BreakingChange c = only(diff(function("lib::parse", "pub", List.of("&str"), "Config"), null));

        assertEquals(ChangeType.REMOVED, c.changeType());
        assertEquals(Severity.CRITICAL, c.severity());
        assertEquals(NodeKind.FUNCTION, c.kind());
        assertEquals("parse(&str) -> Config", c.beforeSignature());
        assertNull(c.afterSignature());
        assertEquals("src/lib.rs", c.file());
        assertTrue(c.mitigations().get(0).contains("deprecated"));
    }

    @Test
    void removedPrivateIsMedium() {
        BreakingChange c = only(diff(function("lib::helper", "private", List.of(), null), null));
        assertEquals(ChangeType.REMOVED, c.changeType());
        assertEquals(Severity.MEDIUM, c.severity());
    }

    @Test
    void exportedFlagOverridesVisibility() {
        SummaryEntity e = function("lib::hook", "private", List.of(), null);
        e.exported = true;

        assertEquals(Severity.CRITICAL, only(diff(e, null)).severity());
    }

    @Test
    void addedIsInfo() {
        BreakingChange c = only(diff(null, function("lib::fresh", "pub", List.of(), null)));
        assertEquals(ChangeType.ADDED, c.changeType());
        assertEquals(Severity.INFO, c.severity());
        assertFalse(c.isBreaking());
    }

    @Test
    void exportedSignatureChangeIsHighAndNamesTheDifference() {
        BreakingChange c = only(diff(
                function("lib::parse", "pub", List.of("&str"), "Config"),
                function("lib::parse", "pub", List.of("&str", "bool"), "Result<Config>")));

        assertEquals(ChangeType.SIGNATURE_CHANGED, c.changeType());
        assertEquals(Severity.HIGH, c.severity());
        assertTrue(c.description().contains("parameter count 1 -> 2"), c.description());
        assertTrue(c.description().contains("return type Config -> Result<Config>"), c.description());
        assertEquals("parse(&str, bool) -> Result<Config>", c.afterSignature());
    }

    @Test
    void privateSignatureChangeIsLow() {
        BreakingChange c = only(diff(
                function("lib::helper", "private", List.of("i32"), null),
                function("lib::helper", "private", List.of("i64"), null)));

        assertEquals(Severity.LOW, c.severity());
        assertTrue(c.description().contains("parameter types"), c.description());
    }

    @Test
    void whitespaceOnlyEditIsNoChange() {
        SummaryEntity before = function("lib::f", "pub", List.of("&str"), null);
        before.signature = "fn f(x: &str)";
        SummaryEntity after = function("lib::f", "pub", List.of(" &str "), null);
        after.signature = "fn  f(x:  &str)";

        assertTrue(diff(before, after).isEmpty());
    }

    @Test
    void narrowedVisibilityIsHigh() {
        BreakingChange c = only(diff(
                function("lib::f", "pub", List.of(), null),
                function("lib::f", "internal", List.of(), null)));

        assertEquals(ChangeType.VISIBILITY_REDUCED, c.changeType());
        assertEquals(Severity.HIGH, c.severity());
        assertTrue(c.isBreaking());
    }

    @Test
    void widenedVisibilityIsInfo() {
        BreakingChange c = only(diff(
                function("lib::f", "private", List.of(), null),
                function("lib::f", "public", List.of(), null)));

        assertEquals(ChangeType.VISIBILITY_WIDENED, c.changeType());
        assertEquals(Severity.INFO, c.severity());
    }

    @Test
    void unknownVisibilitySuppressesVisibilityChange() {
        assertTrue(diff(
                function("lib::f", "pub", List.of(), null),
                function("lib::f", "friend", List.of(), null)).isEmpty());
    }

    @Test
    void oneEntityCanYieldVisibilityAndSignatureChanges() {
        List<BreakingChange> changes = diff(
                function("lib::f", "pub", List.of("i32"), null),
                function("lib::f", "private", List.of("i64"), null));

        assertEquals(List.of(ChangeType.SIGNATURE_CHANGED, ChangeType.VISIBILITY_REDUCED),
                changes.stream().map(BreakingChange::changeType).toList());
        assertEquals(Severity.HIGH, changes.get(0).severity(), "exported before the edit");
    }

    @Test
    void renameIsRemovePlusAdd() {
        List<BreakingChange> changes = diff(
                function("lib::old_name", "pub", List.of(), null),
                function("lib::new_name", "pub", List.of(), null));

        assertEquals(List.of(ChangeType.ADDED, ChangeType.REMOVED),
                changes.stream().map(BreakingChange::changeType).toList());
        assertEquals("lib::new_name", changes.get(0).qualifiedName());
    }

    @Test
    void sameNameDifferentKindIsNotMatched() {
        List<BreakingChange> changes = diff(
                entity("struct", "lib::Thing", "pub"),
                entity("trait", "lib::Thing", "pub"));

        assertEquals(2, changes.size());
        assertEquals(NodeKind.TYPE, changes.get(0).kind());
        assertEquals(ChangeType.REMOVED, changes.get(0).changeType());
        assertEquals(NodeKind.INTERFACE, changes.get(1).kind());
        assertEquals(ChangeType.ADDED, changes.get(1).changeType());
    }

    @Test
    void outputIsSortedByQualifiedName() {
        StructuralSummary before = file(
                function("lib::zeta", "pub", List.of(), null),
                function("lib::alpha", "pub", List.of(), null));
        StructuralSummary after = file();

        List<BreakingChange> changes = detector.detect(before, after);

        assertEquals(List.of("lib::alpha", "lib::zeta"),
                changes.stream().map(BreakingChange::qualifiedName).toList());
    }

    @Test
    void malformedEntitiesAreIgnored() {
        assertTrue(diff(entity("widget", "lib::w", "pub"), null).isEmpty());
    }

    @Test
    void identicalInputsGiveNoChanges() {
        StructuralSummary s = file(function("lib::f", "pub", List.of("i32"), "u8"));
        assertTrue(detector.detect(s, s).isEmpty());
    }
}
