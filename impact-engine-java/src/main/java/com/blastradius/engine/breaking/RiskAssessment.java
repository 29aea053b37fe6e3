package com.blastradius.engine.breaking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Overall risk of a set of changes.
 *
 * @param level           highest severity among the changes, INFO when there are none
 * @param score           weighted mean risk in [0, 100], 0 when there are no changes
 * @param changeCount     number of assessed changes
 * @param recommendations score-band advice followed by the per-change mitigations, without duplicates
 */
public record RiskAssessment(Severity level, int score, int changeCount, List<String> recommendations) {

    public RiskAssessment {
        recommendations = List.copyOf(recommendations);
    }

    public static RiskAssessment none() {
        return new RiskAssessment(Severity.INFO, 0, 0, List.of());
    }

    public static RiskAssessment of(List<BreakingChange> changes) {
        if (changes.isEmpty()) return none();

        Severity level = Severity.INFO;
        int total = 0;
        int weights = 0;
        for (BreakingChange change : changes) {
            if (change.severity().isMoreSevereThan(level)) level = change.severity();
            total += riskOf(change.severity()) * weightOf(change.severity());
            weights += weightOf(change.severity());
        }
        int score = Math.min(100, total / weights);

        Set<String> recommendations = new LinkedHashSet<>(bandAdvice(score));
        for (BreakingChange change : changes) {
            recommendations.addAll(change.mitigations());
        }
        return new RiskAssessment(level, score, changes.size(), new ArrayList<>(recommendations));
    }

    static int riskOf(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 90;
            case HIGH -> 70;
            case MEDIUM -> 40;
            case LOW -> 15;
            case INFO -> 0;
        };
    }

    static int weightOf(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 10;
            case HIGH -> 8;
            case MEDIUM -> 5;
            case LOW -> 2;
            case INFO -> 1;
        };
    }

    private static List<String> bandAdvice(int score) {
        if (score >= 70) {
            return List.of("Run the full integration test suite before merging",
                    "Prepare a rollback plan",
                    "Consider a staged rollout");
        }
        if (score >= 40) {
            return List.of("Increase unit test coverage around the changed code",
                    "Update the affected documentation and API notes");
        }
        if (score >= 15) {
            return List.of("Confirm the change behaves as intended",
                    "Consider updating usage examples");
        }
        return List.of();
    }
}
