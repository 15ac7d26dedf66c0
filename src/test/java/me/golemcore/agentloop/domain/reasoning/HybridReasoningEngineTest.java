package me.golemcore.agentloop.domain.reasoning;

import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HybridReasoningEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private ChainOfThoughtEngine chainEngine;
    private TreeOfThoughtsEngine treeEngine;
    private HybridReasoningEngine engine;

    @BeforeEach
    void setUp() {
        chainEngine = mock(ChainOfThoughtEngine.class);
        treeEngine = mock(TreeOfThoughtsEngine.class);
        engine = new HybridReasoningEngine(chainEngine, treeEngine, Runnable::run, CLOCK);
    }

    // ==================== combine ====================

    @Test
    void shouldWeighBothConclusions() {
        ReasoningResult result = engine.combine(success("cache builds", 0.8), success("parallelise", 0.5),
                Duration.ofSeconds(2));

        assertTrue(result.isSuccess());
        assertEquals("Analysis: cache builds\n\nExploration: parallelise", result.getConclusion());
        assertEquals(0.68, result.getConfidence(), 1e-9);
        assertEquals(Duration.ofSeconds(2), result.getExecutionTime());
        assertEquals("hybrid", result.getMetadata().get("method"));
        assertEquals(0.8, result.getMetadata().get("chain_confidence"));
        assertEquals(0.5, result.getMetadata().get("tree_confidence"));
        assertEquals(true, result.getMetadata().get("chain_success"));
        assertEquals(true, result.getMetadata().get("tree_success"));
    }

    @Test
    void shouldUseChainAloneWhenTreeFails() {
        ReasoningResult result = engine.combine(success("cache builds", 0.8),
                ReasoningResult.failure("tree broke", Duration.ZERO), Duration.ZERO);

        assertTrue(result.isSuccess());
        assertEquals("Analysis: cache builds", result.getConclusion());
        assertEquals(0.8, result.getConfidence(), 1e-9);
        assertEquals(false, result.getMetadata().get("tree_success"));
    }

    @Test
    void shouldUseTreeAloneWhenChainFails() {
        ReasoningResult result = engine.combine(ReasoningResult.failure("chain broke", Duration.ZERO),
                success("parallelise", 0.5), Duration.ZERO);

        assertTrue(result.isSuccess());
        assertEquals("Exploration: parallelise", result.getConclusion());
        assertEquals(0.5, result.getConfidence(), 1e-9);
    }

    @Test
    void shouldFailWhenBothFail() {
        ReasoningResult result = engine.combine(ReasoningResult.failure("chain broke", Duration.ZERO),
                ReasoningResult.failure("tree broke", Duration.ZERO), Duration.ZERO);

        assertFalse(result.isSuccess());
        assertEquals("Both reasoning methods failed: chain=chain broke, tree=tree broke", result.getError());
        assertEquals(0.0, result.getMetadata().get("combined_confidence"));
    }

    // ==================== reason ====================

    @Test
    void shouldRunBothEngines() {
        when(chainEngine.reason(anyString(), any(), anyList())).thenReturn(success("c", 1.0));
        when(treeEngine.reason(anyString(), any(), anyList())).thenReturn(success("t", 0.5));

        ReasoningResult result = engine.reason("goal", "ctx", List.of());

        assertTrue(result.isSuccess());
        assertEquals(0.8, result.getConfidence(), 1e-9);
        verify(chainEngine).reason("goal", "ctx", List.of());
        verify(treeEngine).reason("goal", "ctx", List.of());
        assertEquals(ReasoningType.HYBRID, engine.getType());
    }

    @Test
    void shouldTreatThrowingEngineAsFailedSide() {
        when(chainEngine.reason(anyString(), any(), anyList())).thenThrow(new IllegalStateException("exploded"));
        when(treeEngine.reason(anyString(), any(), anyList())).thenReturn(success("t", 0.5));

        ReasoningResult result = engine.reason("goal", null, List.of());

        assertTrue(result.isSuccess());
        assertEquals("Exploration: t", result.getConclusion());
        assertEquals(false, result.getMetadata().get("chain_success"));
    }

    private static ReasoningResult success(String conclusion, double confidence) {
        return ReasoningResult.builder()
                .success(true)
                .conclusion(conclusion)
                .confidence(confidence)
                .build();
    }
}
