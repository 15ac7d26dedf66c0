package me.golemcore.agentloop.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.ActionInput;
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
import me.golemcore.agentloop.domain.model.FunctionSpec;
import me.golemcore.agentloop.domain.model.LlmCompletion;
import me.golemcore.agentloop.domain.model.LlmMessage;
import me.golemcore.agentloop.domain.model.ModelMessage;
import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.StepResult;
import me.golemcore.agentloop.domain.model.ToolCallRequest;
import me.golemcore.agentloop.domain.model.ToolExecutionResult;
import me.golemcore.agentloop.domain.model.ToolFailureKind;
import me.golemcore.agentloop.domain.parser.ResilientResponseParser;
import me.golemcore.agentloop.domain.parser.ResponseValidationException;
import me.golemcore.agentloop.domain.reasoning.ReasoningManager;
import me.golemcore.agentloop.domain.service.AgentCancelledException;
import me.golemcore.agentloop.domain.service.AgentMetrics;
import me.golemcore.agentloop.domain.service.CallDeadlines;
import me.golemcore.agentloop.domain.service.DeadlineExceededException;
import me.golemcore.agentloop.domain.service.PromptBuilder;
import me.golemcore.agentloop.domain.service.StatusEventService;
import me.golemcore.agentloop.domain.service.ToolCallExecutionService;
import me.golemcore.agentloop.domain.service.ToolInvocation;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.port.outbound.LlmPort;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Locale;
import java.util.Map;

/**
 * Executes one agent turn: optional reasoning, one LLM decision, and the
 * action it asks for.
 *
 * <p>
 * Every outcome except caller cancellation is recorded in the agent state as a
 * turn: LLM deadline, transport and parse failures become failed turns, a
 * failed tool call is followed by a controller hint, and a repeated failing
 * call gets an extra corrective turn from the {@link LoopBreaker}.
 * {@link AgentCancelledException} is the only exception that leaves
 * {@link #executeStep}.
 *
 * <p>
 * Step, LLM call and tool call lifecycle events are published through the
 * {@link ApplicationEventPublisher}; listener failures are logged and never
 * fail the step.
 */
@Slf4j
public class TurnOrchestrator {

    static final String CONTROLLER_RETRY_THOUGHTS = "Controller: The last tool call failed. "
            + "Use the TOOL CATALOG and retry with required params.";
    static final String CONTROLLER_LOOP_THOUGHTS = "Controller: You're repeating the same failing call. "
            + "Change the parameters or choose a different tool.";
    static final String REASONING_INSIGHTS_PREFIX = "\n\nReasoning Insights: ";
    static final String LOOP_STATUS_TITLE = "Loop breaker triggered";
    static final String LOOP_STATUS_DETAILS = "Repeated failures detected";
    static final String LOOP_STATUS_HINT = "Will try different approach";
    private static final int REASONING_RETRY_INTERVAL = 3;

    private final LlmPort llmPort;
    private final ResilientResponseParser parser;
    private final ToolCallExecutionService toolExecutionService;
    private final LoopBreaker loopBreaker;
    private final PromptBuilder promptBuilder;
    private final StatusEventService statusEvents;
    private final ReasoningManager reasoningManager;
    private final AgentMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final AgentLoopProperties properties;
    private final Clock clock;

    public TurnOrchestrator(LlmPort llmPort, ResilientResponseParser parser,
            ToolCallExecutionService toolExecutionService, LoopBreaker loopBreaker, PromptBuilder promptBuilder,
            StatusEventService statusEvents, ReasoningManager reasoningManager, AgentMetrics metrics,
            ApplicationEventPublisher eventPublisher, AgentLoopProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.parser = parser;
        this.toolExecutionService = toolExecutionService;
        this.loopBreaker = loopBreaker;
        this.promptBuilder = promptBuilder;
        this.statusEvents = statusEvents;
        this.reasoningManager = reasoningManager;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs one turn and appends its turns to {@code state}.
     *
     * @throws AgentCancelledException
     *             when the calling thread is interrupted or the LLM call is
     *             cancelled
     */
    public StepResult executeStep(AgentState state, ToolRegistry tools) {
        if (Thread.currentThread().isInterrupted()) {
            throw new AgentCancelledException("Step cancelled for agent " + state.getAgentId());
        }
        String agentId = state.getAgentId();
        int turnIndex = state.getNextTurnIndex();
        Instant started = clock.instant();
        publish(new AgentStepStartedEvent(agentId, turnIndex, started));

        StepResult result = runStep(state, tools, turnIndex);

        metrics.recordStep(result.isExecutedTool(), result.getError() == null,
                Duration.between(started, clock.instant()));
        publish(new AgentStepCompletedEvent(agentId, turnIndex, result.isContinueRun(), result.isExecutedTool(),
                result.getFinalOutput(), result.getError(), clock.instant()));
        return result;
    }

    private StepResult runStep(AgentState state, ToolRegistry tools, int turnIndex) {
        ReasoningResult reasoning = reasonIfNeeded(state, tools, turnIndex);
        String goal = state.getGoal();
        if (reasoning != null && reasoning.isSuccess() && reasoning.getConclusion() != null) {
            goal = goal + REASONING_INSIGHTS_PREFIX + reasoning.getConclusion();
        }

        List<LlmMessage> messages = promptBuilder.buildMessages(state, goal, tools);
        Duration llmTimeout = properties.getTurn().getLlmTimeout();
        ModelMessage message;
        Instant llmStarted = clock.instant();
        publish(new AgentLlmCallStartedEvent(state.getAgentId(), turnIndex, llmStarted));
        try {
            message = decide(messages, tools, llmTimeout);
        } catch (AgentCancelledException e) {
            log.info("[Turn] Agent {} cancelled while waiting for the LLM", state.getAgentId());
            llmCallCompleted(state, turnIndex, llmStarted, "cancelled", null, e.getMessage());
            throw e;
        } catch (DeadlineExceededException e) {
            return recordLlmFailure(state, turnIndex, llmStarted, ToolFailureKind.DEADLINE_EXCEEDED,
                    "LLM call deadline exceeded after " + llmTimeout);
        } catch (ResponseValidationException e) {
            return recordLlmFailure(state, turnIndex, llmStarted, ToolFailureKind.VALIDATION_FAILED,
                    "Invalid LLM JSON: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Turn] LLM call failed for agent {}", state.getAgentId(), e);
            return recordLlmFailure(state, turnIndex, llmStarted, ToolFailureKind.EXECUTION_FAILED,
                    "LLM call failed: " + CallDeadlines.safeCauseMessage(e));
        }
        llmCallCompleted(state, turnIndex, llmStarted, "success", message, null);

        if (reasoning != null && reasoning.isSuccess()) {
            message.setReasoningChain(reasoning.getChain());
            message.setReasoningTree(reasoning.getTree());
        }
        if (message.hasStatus()) {
            statusEvents.emit(state.getAgentId(), turnIndex, message.getStatusTitle(), message.getStatusDetails(),
                    message.getNextStepHint(), message.getProgressPct());
        }
        log.debug("[Turn] Agent {} turn {} -> {}", state.getAgentId(), turnIndex, message.getAction());

        return switch (message.getAction()) {
        case PLAN, RETRY -> recordDecision(state, turnIndex, message);
        case FINISH -> recordFinish(state, turnIndex, message);
        case TOOL_CALL -> executeToolCall(state, tools, turnIndex, message);
        };
    }

    // ==================== decision ====================

    private ModelMessage decide(List<LlmMessage> messages, ToolRegistry tools, Duration llmTimeout) {
        List<FunctionSpec> functions = tools.functionSpecs();
        if (properties.getTurn().isUseFunctionCalling() && llmPort.supportsFunctionCalling()
                && !functions.isEmpty()) {
            FunctionCallResult response = CallDeadlines.await(llmPort.completeWithFunctions(messages, functions),
                    llmTimeout);
            if (response != null) {
                metrics.recordTokenUsage(response.getUsage());
            }
            if (response != null && response.hasFunctionCall()) {
                return fromFunctionCall(response);
            }
            return parser.parseStrict(response != null ? response.getAssistantContent() : null);
        }
        LlmCompletion completion = CallDeadlines.await(llmPort.complete(messages), llmTimeout);
        if (completion != null && completion.getUsage() != null) {
            log.debug("[Turn] LLM usage: {} tokens", completion.getUsage().getTotalTokens());
            metrics.recordTokenUsage(completion.getUsage());
        }
        return parser.parseStrict(completion != null ? completion.getContent() : null);
    }

    private ModelMessage fromFunctionCall(FunctionCallResult response) {
        String function = response.getFunctionName();
        Map<String, Object> params = parser.parseArguments(response.getArgumentsJson());
        String thoughts = response.getAssistantContent() != null && !response.getAssistantContent().isBlank()
                ? response.getAssistantContent()
                : "Calling " + function + " to advance the plan.";
        return ModelMessage.builder()
                .thoughts(thoughts)
                .action(AgentAction.TOOL_CALL)
                .actionInput(ActionInput.builder()
                        .tool(function)
                        .params(params)
                        .summary("Execute " + function + " and continue with the results.")
                        .build())
                .build();
    }

    // ==================== actions ====================

    private StepResult recordDecision(AgentState state, int turnIndex, ModelMessage message) {
        appendTurn(state, turnIndex, message, null, null);
        if (!message.hasStatus()) {
            statusEvents.emit(state.getAgentId(), turnIndex, "Planning", summaryOf(message), null, null);
        }
        return StepResult.builder()
                .continueRun(true)
                .llmMessage(message)
                .state(state)
                .build();
    }

    private StepResult recordFinish(AgentState state, int turnIndex, ModelMessage message) {
        appendTurn(state, turnIndex, message, null, null);
        String finalOutput = message.getActionInput() != null ? message.getActionInput().getFinalText() : null;
        statusEvents.emit(state.getAgentId(), turnIndex, "Task completed", null, null, 100);
        log.info("[Turn] Agent {} finished at turn {}", state.getAgentId(), turnIndex);
        return StepResult.builder()
                .continueRun(false)
                .finalOutput(finalOutput)
                .llmMessage(message)
                .state(state)
                .build();
    }

    private StepResult executeToolCall(AgentState state, ToolRegistry tools, int turnIndex, ModelMessage message) {
        String agentId = state.getAgentId();
        ActionInput input = message.getActionInput();
        String toolName = input.getTool();
        Map<String, Object> params = input.getParams() != null ? new LinkedHashMap<>(input.getParams())
                : new LinkedHashMap<>();
        ToolCallRequest call = ToolCallRequest.builder()
                .tool(toolName)
                .params(params)
                .turnId(AgentTurn.turnId(agentId, turnIndex))
                .createdAt(clock.instant())
                .build();

        if (!message.hasStatus()) {
            statusEvents.emit(agentId, turnIndex, "Executing " + toolName, null, null, null);
        }
        publish(new AgentToolCallStartedEvent(agentId, turnIndex, toolName, params, clock.instant()));
        ToolInvocation invocation = toolExecutionService.execute(call, tools);
        ToolExecutionResult result = invocation.result();
        publish(new AgentToolCallCompletedEvent(agentId, turnIndex, toolName, result.isSuccess(),
                invocation.fromCache(), result.getOutput(), result.getError(), result.getExecutionTime(),
                clock.instant()));
        appendTurn(state, turnIndex, message, call, result);
        loopBreaker.record(agentId, toolName, invocation.fingerprint(), result.isSuccess());

        if (!result.isSuccess()) {
            log.info("[Turn] Tool '{}' failed for agent {}: {}", toolName, agentId, result.getError());
            appendControllerTurn(state, CONTROLLER_RETRY_THOUGHTS,
                    "Retry " + toolName + " including all required params.");
            if (loopBreaker.detectRepeatedFailures(agentId, toolName, invocation.fingerprint())) {
                statusEvents.emit(agentId, turnIndex, LOOP_STATUS_TITLE, LOOP_STATUS_DETAILS, LOOP_STATUS_HINT,
                        null);
                appendControllerTurn(state, CONTROLLER_LOOP_THOUGHTS,
                        "Stop repeating " + toolName + " with the same params.");
            }
        }

        if (loopBreaker.shouldHardStop(agentId, toolName, invocation.fingerprint())) {
            String error = "Loop detected: tool '" + toolName + "' called "
                    + properties.getLoopBreaker().getHardStopThreshold() + " times in a row with identical params";
            log.warn("[Turn] {} (agent {})", error, agentId);
            return StepResult.builder()
                    .continueRun(false)
                    .executedTool(true)
                    .llmMessage(message)
                    .toolResult(result)
                    .error(error)
                    .state(state)
                    .build();
        }

        return StepResult.builder()
                .continueRun(true)
                .executedTool(true)
                .llmMessage(message)
                .toolResult(result)
                .error(result.isSuccess() ? null : result.getError())
                .state(state)
                .build();
    }

    private StepResult recordLlmFailure(AgentState state, int turnIndex, Instant llmStarted, ToolFailureKind kind,
            String error) {
        log.warn("[Turn] Agent {} turn {}: {}", state.getAgentId(), turnIndex, error);
        llmCallCompleted(state, turnIndex, llmStarted, kind.name().toLowerCase(Locale.ROOT), null, error);
        String turnId = AgentTurn.turnId(state.getAgentId(), turnIndex);
        ToolExecutionResult failure = ToolExecutionResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .turnId(turnId)
                .executionTime(Duration.ZERO)
                .createdAt(clock.instant())
                .build();
        appendTurn(state, turnIndex, null, null, failure);
        return StepResult.builder()
                .continueRun(true)
                .toolResult(failure)
                .error(error)
                .state(state)
                .build();
    }

    // ==================== reasoning ====================

    private ReasoningResult reasonIfNeeded(AgentState state, ToolRegistry tools, int turnIndex) {
        ReasoningType type = properties.getReasoning().getType();
        if (reasoningManager == null || type == null || type == ReasoningType.NONE
                || !shouldReason(state, turnIndex)) {
            return null;
        }
        ReasoningResult result = reasoningManager.reason(type, state.getGoal(),
                promptBuilder.summarizeHistory(state), tools.definitions());
        metrics.recordReasoning(type, result);
        if (!result.isSuccess()) {
            log.info("[Turn] Reasoning for agent {} was not successful: {}", state.getAgentId(), result.getError());
        }
        return result;
    }

    /**
     * Reasoning runs on the first turn, and on every third turn while the
     * latest tool call is failing.
     */
    static boolean shouldReason(AgentState state, int turnIndex) {
        if (turnIndex == 0) {
            return true;
        }
        return turnIndex % REASONING_RETRY_INTERVAL == 0 && latestToolCallFailed(state);
    }

    private static boolean latestToolCallFailed(AgentState state) {
        ListIterator<AgentTurn> turns = state.getTurns().listIterator(state.getTurns().size());
        while (turns.hasPrevious()) {
            AgentTurn turn = turns.previous();
            if (turn.getToolResult() != null) {
                return !turn.getToolResult().isSuccess();
            }
        }
        return false;
    }

    // ==================== events ====================

    private void llmCallCompleted(AgentState state, int turnIndex, Instant llmStarted, String outcome,
            ModelMessage message, String error) {
        metrics.recordLlmCall(outcome, Duration.between(llmStarted, clock.instant()));
        publish(new AgentLlmCallCompletedEvent(state.getAgentId(), turnIndex, message, error, clock.instant()));
    }

    private void publish(Object event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("[Turn] Failed to publish {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    // ==================== history ====================

    private void appendTurn(AgentState state, int turnIndex, ModelMessage message, ToolCallRequest call,
            ToolExecutionResult result) {
        state.addTurn(AgentTurn.builder()
                .index(turnIndex)
                .turnId(AgentTurn.turnId(state.getAgentId(), turnIndex))
                .llmMessage(message)
                .toolCall(call)
                .toolResult(result)
                .createdAt(clock.instant())
                .build());
        state.setUpdatedAt(clock.instant());
    }

    private void appendControllerTurn(AgentState state, String thoughts, String summary) {
        ModelMessage hint = ModelMessage.builder()
                .thoughts(thoughts)
                .action(AgentAction.RETRY)
                .actionInput(ActionInput.builder().summary(summary).build())
                .build();
        appendTurn(state, state.getNextTurnIndex(), hint, null, null);
    }

    private static String summaryOf(ModelMessage message) {
        return message.getActionInput() != null ? message.getActionInput().getSummary() : null;
    }
}
