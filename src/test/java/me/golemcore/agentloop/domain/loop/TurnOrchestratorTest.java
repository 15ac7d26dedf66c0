package me.golemcore.agentloop.domain.loop;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.agentloop.domain.cache.IdempotencyCache;
import me.golemcore.agentloop.domain.cache.ToolCallFingerprinter;
import me.golemcore.agentloop.domain.model.AgentAction;
import me.golemcore.agentloop.domain.model.AgentLlmCallCompletedEvent;
import me.golemcore.agentloop.domain.model.AgentLlmCallStartedEvent;
import me.golemcore.agentloop.domain.model.AgentState;
import me.golemcore.agentloop.domain.model.AgentStepCompletedEvent;
import me.golemcore.agentloop.domain.model.AgentStepStartedEvent;
import me.golemcore.agentloop.domain.model.AgentToolCallCompletedEvent;
import me.golemcore.agentloop.domain.model.AgentToolCallStartedEvent;
import me.golemcore.agentloop.domain.model.AgentTurn;
import me.golemcore.agentloop.domain.model.FunctionCallResult;
import me.golemcore.agentloop.domain.model.LlmCompletion;
import me.golemcore.agentloop.domain.model.LlmMessage;
import me.golemcore.agentloop.domain.model.LlmUsage;
import me.golemcore.agentloop.domain.model.ReasoningChain;
import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.StatusUpdate;
import me.golemcore.agentloop.domain.model.StepResult;
import me.golemcore.agentloop.domain.model.ToolExecutionResult;
import me.golemcore.agentloop.domain.model.ToolFailureKind;
import me.golemcore.agentloop.domain.parser.ResilientResponseParser;
import me.golemcore.agentloop.domain.reasoning.ReasoningManager;
import me.golemcore.agentloop.domain.service.AgentCancelledException;
import me.golemcore.agentloop.domain.service.AgentMetrics;
import me.golemcore.agentloop.domain.service.DefaultPromptBuilder;
import me.golemcore.agentloop.domain.service.StatusEventService;
import me.golemcore.agentloop.domain.service.ToolCallExecutionService;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import me.golemcore.agentloop.infrastructure.config.AgentLoopConfiguration;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.port.outbound.LlmPort;
import me.golemcore.agentloop.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnOrchestratorTest {

    private static final String AGENT_ID = "agent-1";
    private static final String GOAL = "Count the lines in notes.txt";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("path", Map.of("type", "string")),
            "required", List.of("path"));
    private static final String READ_CALL = "{\"thoughts\": \"read it\", \"action\": \"tool_call\","
            + " \"action_input\": {\"tool\": \"read_file\", \"params\": {\"path\": \"notes.txt\"}}}";
    private static final String FINISH = "{\"thoughts\": \"counted\", \"action\": \"finish\","
            + " \"action_input\": {\"final\": \"42 lines\"}}";

    private AgentLoopProperties properties;
    private LlmPort llmPort;
    private ReasoningManager reasoningManager;
    private List<StatusUpdate> statuses;
    private List<Object> published;
    private SimpleMeterRegistry meterRegistry;
    private StubTool readFile;
    private ToolRegistry tools;
    private AgentState state;
    private TurnOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new AgentLoopProperties();
        llmPort = mock(LlmPort.class);
        reasoningManager = mock(ReasoningManager.class);
        statuses = new ArrayList<>();
        published = new ArrayList<>();
        meterRegistry = new SimpleMeterRegistry();
        readFile = StubTool.withSchema("read_file", SCHEMA, "line1\nline2");
        tools = ToolRegistry.of(List.of(readFile));
        state = AgentState.builder().agentId(AGENT_ID).goal(GOAL).build();
        orchestrator = newOrchestrator(published::add);
    }

    private TurnOrchestrator newOrchestrator(ApplicationEventPublisher eventPublisher) {
        AgentMetrics metrics = new AgentMetrics(meterRegistry);
        ResilientResponseParser parser = new ResilientResponseParser(AgentLoopConfiguration.objectMapper(),
                properties);
        ToolCallExecutionService executionService = new ToolCallExecutionService(new IdempotencyCache(CLOCK),
                new ToolCallFingerprinter(AgentLoopConfiguration.objectMapper()), properties, CLOCK, metrics);
        return new TurnOrchestrator(llmPort, parser, executionService, new LoopBreaker(properties, CLOCK, metrics),
                new DefaultPromptBuilder(AgentLoopConfiguration.objectMapper(), properties),
                new StatusEventService(CLOCK, properties, List.of(statuses::add)), reasoningManager, metrics,
                eventPublisher, properties, CLOCK);
    }

    // ==================== decisions ====================

    @Test
    void shouldStopOnFinish() {
        llmAnswers(FINISH);

        StepResult result = orchestrator.executeStep(state, tools);

        assertFalse(result.isContinueRun());
        assertEquals("42 lines", result.getFinalOutput());
        assertEquals(1, state.getTurns().size());
        assertEquals(AgentAction.FINISH, state.getTurns().get(0).getLlmMessage().getAction());
        StatusUpdate last = statuses.get(statuses.size() - 1);
        assertEquals("Task completed", last.getStatusTitle());
        assertEquals(100, last.getProgressPct());
    }

    @Test
    void shouldRecordPlanAndAnnounceIt() {
        llmAnswers("{\"thoughts\": \"think first\", \"action\": \"plan\","
                + " \"action_input\": {\"summary\": \"open the file\"}}");

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.isContinueRun());
        assertFalse(result.isExecutedTool());
        assertEquals(1, state.getTurns().size());
        assertEquals("Planning", statuses.get(0).getStatusTitle());
        assertEquals("open the file", statuses.get(0).getStatusDetails());
    }

    @Test
    void shouldForwardModelStatusInsteadOfDefault() {
        llmAnswers("{\"thoughts\": \"think\", \"action\": \"plan\", \"action_input\": {},"
                + " \"status_title\": \"Reading docs\", \"progress_pct\": 30}");

        orchestrator.executeStep(state, tools);

        assertEquals(1, statuses.size());
        assertEquals("Reading docs", statuses.get(0).getStatusTitle());
        assertEquals(30, statuses.get(0).getProgressPct());
    }

    // ==================== tool calls ====================

    @Test
    void shouldExecuteRequestedTool() {
        llmAnswers(READ_CALL);

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.isContinueRun());
        assertTrue(result.isExecutedTool());
        assertTrue(result.getToolResult().isSuccess());
        assertNull(result.getError());
        AgentTurn turn = state.getTurns().get(0);
        assertEquals("turn-agent-1-0", turn.getTurnId());
        assertEquals("read_file", turn.getToolCall().getTool());
        assertEquals(Map.of("path", "notes.txt"), turn.getToolCall().getParams());
        assertEquals("line1\nline2", turn.getToolResult().getOutput());
        assertEquals("Executing read_file", statuses.get(0).getStatusTitle());
    }

    @Test
    void shouldAppendControllerHintAfterFailure() {
        readFile.failingWith(new IllegalStateException("permission denied"));
        llmAnswers(READ_CALL);

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.isContinueRun());
        assertEquals("Tool execution failed: permission denied", result.getError());
        assertEquals(2, state.getTurns().size());
        AgentTurn hint = state.getTurns().get(1);
        assertEquals(1, hint.getIndex());
        assertEquals(AgentAction.RETRY, hint.getLlmMessage().getAction());
        assertEquals(TurnOrchestrator.CONTROLLER_RETRY_THOUGHTS, hint.getLlmMessage().getThoughts());
    }

    @Test
    void shouldWarnAboutRepeatedFailingCall() {
        readFile.failingWith(new IllegalStateException("permission denied"));
        llmAnswers(READ_CALL);

        orchestrator.executeStep(state, tools);
        orchestrator.executeStep(state, tools);
        assertEquals(4, state.getTurns().size());

        orchestrator.executeStep(state, tools);

        assertEquals(7, state.getTurns().size());
        assertEquals(TurnOrchestrator.CONTROLLER_LOOP_THOUGHTS,
                state.getLastTurn().getLlmMessage().getThoughts());
        assertEquals(3, readFile.callCount());
    }

    @Test
    void shouldAnnounceLoopBreakerOnlyWhenRepeatedFailureIsDetected() {
        readFile.failingWith(new IllegalStateException("permission denied"));
        llmAnswers(READ_CALL);

        orchestrator.executeStep(state, tools);
        orchestrator.executeStep(state, tools);
        assertTrue(statuses.stream().noneMatch(s -> TurnOrchestrator.LOOP_STATUS_TITLE.equals(s.getStatusTitle())));

        orchestrator.executeStep(state, tools);

        StatusUpdate loop = statuses.get(statuses.size() - 1);
        assertEquals("Loop breaker triggered", loop.getStatusTitle());
        assertEquals("Repeated failures detected", loop.getStatusDetails());
        assertEquals("Will try different approach", loop.getNextStepHint());
        assertEquals(4, loop.getTurnIndex());
        assertEquals(AGENT_ID, loop.getAgentId());
    }

    @Test
    void shouldHardStopOnIdenticalCallsWhenConfigured() {
        properties.getLoopBreaker().setHardStopThreshold(2);
        llmAnswers(READ_CALL);

        StepResult first = orchestrator.executeStep(state, tools);
        StepResult second = orchestrator.executeStep(state, tools);

        assertTrue(first.isContinueRun());
        assertFalse(second.isContinueRun());
        assertEquals("Loop detected: tool 'read_file' called 2 times in a row with identical params",
                second.getError());
        assertEquals(1, readFile.callCount());
    }

    @Test
    void shouldRecordMissingToolAsFailedTurn() {
        llmAnswers("{\"thoughts\": \"try\", \"action\": \"tool_call\", \"action_input\": {\"tool\": \"rm_rf\"}}");

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.isContinueRun());
        assertEquals(ToolFailureKind.NOT_FOUND, result.getToolResult().getFailureKind());
        assertEquals("Unknown tool: rm_rf. Available tools: read_file", result.getError());
    }

    // ==================== llm failures ====================

    @Test
    void shouldRecordLlmDeadlineAsFailedTurn() {
        properties.getTurn().setLlmTimeout(Duration.ofMillis(50));
        when(llmPort.complete(anyList())).thenReturn(new CompletableFuture<>());

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.isContinueRun());
        assertEquals("LLM call deadline exceeded after PT0.05S", result.getError());
        AgentTurn turn = state.getTurns().get(0);
        assertNull(turn.getLlmMessage());
        assertEquals(ToolFailureKind.DEADLINE_EXCEEDED, turn.getToolResult().getFailureKind());
    }

    @Test
    void shouldRecordInvalidJsonAsFailedTurn() {
        llmAnswers("{\"action\": \"finish\", \"action_input\": {\"final\": \"x\"}}");

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.isContinueRun());
        assertEquals("Invalid LLM JSON: thoughts: is required", result.getError());
        assertEquals(ToolFailureKind.VALIDATION_FAILED, state.getTurns().get(0).getToolResult().getFailureKind());
    }

    @Test
    void shouldRecordTransportFailureAsFailedTurn() {
        when(llmPort.complete(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection reset")));

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.isContinueRun());
        assertEquals("LLM call failed: connection reset", result.getError());
        assertTrue(state.getTurns().get(0).hasFailedToolResult());
    }

    @Test
    void shouldPropagateCancellationWithoutRecordingTurn() {
        CompletableFuture<LlmCompletion> cancelled = new CompletableFuture<>();
        cancelled.cancel(true);
        when(llmPort.complete(anyList())).thenReturn(cancelled);

        assertThrows(AgentCancelledException.class, () -> orchestrator.executeStep(state, tools));

        assertTrue(state.getTurns().isEmpty());
    }

    @Test
    void shouldRefuseToStartWhenInterrupted() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(AgentCancelledException.class, () -> orchestrator.executeStep(state, tools));
        } finally {
            Thread.interrupted();
        }
        verify(llmPort, never()).complete(anyList());
    }

    // ==================== lifecycle events ====================

    @Test
    void shouldPublishStepLlmAndToolEventsInOrder() {
        llmAnswers(READ_CALL);

        orchestrator.executeStep(state, tools);

        assertEquals(List.of(AgentStepStartedEvent.class, AgentLlmCallStartedEvent.class,
                AgentLlmCallCompletedEvent.class, AgentToolCallStartedEvent.class, AgentToolCallCompletedEvent.class,
                AgentStepCompletedEvent.class), published.stream().map(Object::getClass).toList());
        AgentLlmCallCompletedEvent llmCall = (AgentLlmCallCompletedEvent) published.get(2);
        assertEquals(AgentAction.TOOL_CALL, llmCall.message().getAction());
        assertNull(llmCall.error());
        AgentToolCallCompletedEvent toolCall = (AgentToolCallCompletedEvent) published.get(4);
        assertEquals("read_file", toolCall.toolName());
        assertTrue(toolCall.success());
        assertFalse(toolCall.fromCache());
        assertEquals("line1\nline2", toolCall.output());
        AgentStepCompletedEvent step = (AgentStepCompletedEvent) published.get(5);
        assertEquals(AGENT_ID, step.agentId());
        assertEquals(0, step.turnIndex());
        assertTrue(step.continueRun());
        assertTrue(step.executedTool());
    }

    @Test
    void shouldPublishLlmFailureWithoutToolEvents() {
        when(llmPort.complete(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection reset")));

        orchestrator.executeStep(state, tools);

        assertEquals(List.of(AgentStepStartedEvent.class, AgentLlmCallStartedEvent.class,
                AgentLlmCallCompletedEvent.class, AgentStepCompletedEvent.class),
                published.stream().map(Object::getClass).toList());
        AgentLlmCallCompletedEvent llmCall = (AgentLlmCallCompletedEvent) published.get(2);
        assertNull(llmCall.message());
        assertEquals("LLM call failed: connection reset", llmCall.error());
        assertEquals("LLM call failed: connection reset", ((AgentStepCompletedEvent) published.get(3)).error());
        assertEquals(1, meterRegistry.get("agent.llm.calls").tag("outcome", "execution_failed").timer().count());
    }

    @Test
    void shouldFinishStepWhenEventListenerFails() {
        orchestrator = newOrchestrator(event -> {
            throw new IllegalStateException("listener down");
        });
        llmAnswers(FINISH);

        StepResult result = orchestrator.executeStep(state, tools);

        assertEquals("42 lines", result.getFinalOutput());
        assertEquals(1, state.getTurns().size());
    }

    @Test
    void shouldRecordStepTokenAndReasoningMetrics() {
        properties.getReasoning().setType(ReasoningType.CHAIN_OF_THOUGHT);
        when(reasoningManager.reason(eq(ReasoningType.CHAIN_OF_THOUGHT), eq(GOAL), anyString(), anyList()))
                .thenReturn(ReasoningResult.builder().success(true).conclusion("Use wc -l").confidence(0.8)
                        .executionTime(Duration.ofMillis(5)).build());
        when(llmPort.complete(anyList())).thenReturn(CompletableFuture.completedFuture(LlmCompletion.builder()
                .content(FINISH)
                .usage(LlmUsage.builder().inputTokens(120).outputTokens(30).totalTokens(150).model("gpt-4o")
                        .build())
                .build()));

        orchestrator.executeStep(state, tools);

        assertEquals(120.0, meterRegistry.get("agent.llm.tokens").tags("direction", "input", "model", "gpt-4o")
                .counter().count());
        assertEquals(30.0, meterRegistry.get("agent.llm.tokens").tags("direction", "output", "model", "gpt-4o")
                .counter().count());
        assertEquals(1, meterRegistry.get("agent.llm.calls").tag("outcome", "success").timer().count());
        assertEquals(1, meterRegistry.get("agent.step").tags("tool", "false", "outcome", "success").timer().count());
        assertEquals(0.8, meterRegistry.get("agent.reasoning.confidence").tag("type", "chain_of_thought")
                .summary().totalAmount(), 1e-9);
    }

    // ==================== function calling ====================

    @Test
    void shouldUseNativeFunctionCallWhenSupported() {
        when(llmPort.supportsFunctionCalling()).thenReturn(true);
        when(llmPort.completeWithFunctions(anyList(), anyList())).thenReturn(CompletableFuture.completedFuture(
                FunctionCallResult.builder()
                        .functionName("read_file")
                        .argumentsJson("{\"path\": \"notes.txt\"}")
                        .build()));

        StepResult result = orchestrator.executeStep(state, tools);

        assertTrue(result.getToolResult().isSuccess());
        assertEquals("Calling read_file to advance the plan.", result.getLlmMessage().getThoughts());
        assertEquals(List.of(Map.of("path", "notes.txt")), readFile.calls());
        verify(llmPort, never()).complete(anyList());
    }

    @Test
    void shouldParseTextReplyInFunctionMode() {
        when(llmPort.supportsFunctionCalling()).thenReturn(true);
        when(llmPort.completeWithFunctions(anyList(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(FunctionCallResult.textOnly(FINISH)));

        StepResult result = orchestrator.executeStep(state, tools);

        assertEquals("42 lines", result.getFinalOutput());
    }

    @Test
    void shouldUseTextModeWhenFunctionCallingDisabled() {
        properties.getTurn().setUseFunctionCalling(false);
        when(llmPort.supportsFunctionCalling()).thenReturn(true);
        llmAnswers(FINISH);

        orchestrator.executeStep(state, tools);

        verify(llmPort, never()).completeWithFunctions(anyList(), anyList());
    }

    // ==================== reasoning ====================

    @Test
    void shouldFoldReasoningConclusionIntoGoal() {
        properties.getReasoning().setType(ReasoningType.CHAIN_OF_THOUGHT);
        ReasoningChain chain = new ReasoningChain(GOAL);
        when(reasoningManager.reason(eq(ReasoningType.CHAIN_OF_THOUGHT), eq(GOAL), anyString(), anyList()))
                .thenReturn(ReasoningResult.builder().success(true).conclusion("Use wc -l").chain(chain).build());
        llmAnswers(FINISH);

        StepResult result = orchestrator.executeStep(state, tools);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LlmMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(llmPort).complete(captor.capture());
        assertTrue(captor.getValue().get(1).getContent().contains(GOAL + "\n\nReasoning Insights: Use wc -l"));
        assertSame(chain, result.getLlmMessage().getReasoningChain());
    }

    @Test
    void shouldSkipReasoningWhenDisabled() {
        llmAnswers(FINISH);

        orchestrator.executeStep(state, tools);

        verify(reasoningManager, never()).reason(any(), any(), any(), any());
    }

    @Test
    void shouldReasonOnFirstTurnAndEveryThirdFailingTurn() {
        AgentState failing = AgentState.builder().agentId(AGENT_ID).goal(GOAL).build();
        for (int i = 0; i < 3; i++) {
            failing.addTurn(AgentTurn.builder()
                    .index(i)
                    .toolResult(ToolExecutionResult.builder().success(i != 2).build())
                    .build());
        }
        AgentState succeeding = AgentState.builder().agentId(AGENT_ID).goal(GOAL).build();
        for (int i = 0; i < 3; i++) {
            succeeding.addTurn(AgentTurn.builder()
                    .index(i)
                    .toolResult(ToolExecutionResult.builder().success(true).build())
                    .build());
        }

        assertTrue(TurnOrchestrator.shouldReason(state, 0));
        assertTrue(TurnOrchestrator.shouldReason(failing, 3));
        assertFalse(TurnOrchestrator.shouldReason(succeeding, 3));
        assertFalse(TurnOrchestrator.shouldReason(failing, 2));
    }

    private void llmAnswers(String content) {
        when(llmPort.complete(anyList()))
                .thenReturn(CompletableFuture.completedFuture(LlmCompletion.builder().content(content).build()));
    }
}
