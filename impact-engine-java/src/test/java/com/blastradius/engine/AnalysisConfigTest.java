package com.blastradius.engine;

import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.config.CriticalNodePolicy;
import com.blastradius.engine.graph.ConflictPolicy;
import com.blastradius.engine.graph.EdgeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigTest {

    @Test
    void defaults() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertEquals(0.85, config.getDampingFactor());
        assertEquals(1e-6, config.getConvergenceEpsilon());
        assertEquals(100, config.getMaxIterations());
        assertEquals(0.7, config.getDecayFactor());
        assertEquals(4, config.getMaxDepth());
        assertEquals(200, config.getTopK());
        assertEquals(3000, config.getTokenBudget());
        assertEquals(CriticalNodePolicy.stdDev(1.0), config.getCriticalNodePolicy());
        assertEquals(ConflictPolicy.FIRST_WINS, config.getConflictPolicy());
        assertEquals(1.0, config.weightOf(EdgeKind.CALLS));
        assertEquals(0.5, config.weightOf(EdgeKind.CONTAINS));
        assertEquals(0.8, config.weightOf(EdgeKind.IMPLEMENTS));
        assertEquals(0.8, config.weightOf(EdgeKind.DEPENDS_ON));
    }

    @Test
    void everyInvalidSettingIsReported() {
        AnalysisConfig.Builder builder = AnalysisConfig.builder()
                .dampingFactor(1.0)
                .maxDepth(-1)
                .tokenBudget(0);

        AnalysisConfig.ConfigurationException ex =
                assertThrows(AnalysisConfig.ConfigurationException.class, builder::build);
        assertTrue(ex.getMessage().contains("damping factor"), ex.getMessage());
        assertTrue(ex.getMessage().contains("max depth"), ex.getMessage());
        assertTrue(ex.getMessage().contains("token budget"), ex.getMessage());
    }

    @Test
    void negativeEdgeWeightRejected() {
        AnalysisConfig.Builder builder = AnalysisConfig.builder().edgeWeight(EdgeKind.CALLS, -0.1);

        AnalysisConfig.ConfigurationException ex =
                assertThrows(AnalysisConfig.ConfigurationException.class, builder::build);
        assertTrue(ex.getMessage().contains("CALLS"), ex.getMessage());
    }

    @Test
    void zeroEdgeWeightAllowed() {
        AnalysisConfig config = AnalysisConfig.builder().edgeWeight(EdgeKind.CONTAINS, 0.0).build();
        assertEquals(0.0, config.weightOf(EdgeKind.CONTAINS));
    }

    @Test
    void rankingWeightsMustNotBothBeZero() {
        AnalysisConfig.Builder builder = AnalysisConfig.builder().centralityWeight(0.0).impactWeight(0.0);
        assertThrows(AnalysisConfig.ConfigurationException.class, builder::build);

        assertDoesNotThrow(() -> AnalysisConfig.builder().centralityWeight(0.0).impactWeight(1.0).build());
    }

    @Test
    void percentileMustBeAFraction() {
        assertThrows(AnalysisConfig.ConfigurationException.class,
                () -> AnalysisConfig.builder().criticalNodePolicy(CriticalNodePolicy.percentile(0.0)).build());
        assertThrows(AnalysisConfig.ConfigurationException.class,
                () -> AnalysisConfig.builder().criticalNodePolicy(CriticalNodePolicy.percentile(1.5)).build());
        assertDoesNotThrow(
                () -> AnalysisConfig.builder().criticalNodePolicy(CriticalNodePolicy.percentile(1.0)).build());
    }

    @Test
    void zeroDepthIsValid() {
        assertEquals(0, AnalysisConfig.builder().maxDepth(0).build().getMaxDepth());
    }

    @Test
    void toBuilderKeepsSettings() {
        AnalysisConfig original = AnalysisConfig.builder()
                .decayFactor(0.5)
                .edgeWeight(EdgeKind.DEPENDS_ON, 0.3)
                .conflictPolicy(ConflictPolicy.LAST_WINS)
                .build();

        AnalysisConfig copy = original.toBuilder().topK(10).build();

        assertEquals(0.5, copy.getDecayFactor());
        assertEquals(0.3, copy.weightOf(EdgeKind.DEPENDS_ON));
        assertEquals(ConflictPolicy.LAST_WINS, copy.getConflictPolicy());
        assertEquals(10, copy.getTopK());
        assertEquals(200, original.getTopK());
    }
}
