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
import me.golemcore.agentloop.domain.component.ToolComponent;
import me.golemcore.agentloop.domain.model.AgentResult;
import me.golemcore.agentloop.domain.model.AgentRunCompletedEvent;
import me.golemcore.agentloop.domain.model.AgentRunStartedEvent;
import me.golemcore.agentloop.domain.model.AgentState;
import me.golemcore.agentloop.domain.model.AgentTurn;
import me.golemcore.agentloop.domain.model.StepResult;
import me.golemcore.agentloop.domain.service.AgentCancelledException;
import me.golemcore.agentloop.domain.service.AgentMetrics;
import me.golemcore.agentloop.domain.service.StatusEventService;
import me.golemcore.agentloop.domain.service.ToolRegistry;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.port.outbound.AgentStateStorePort;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Drives an agent to completion: load or create its state, step through
 * {@link TurnOrchestrator} and persist after every step.
 *
 * <p>
 * A run ends when a step stops the loop (finish or hard loop stop) or when
 * {@code maxTurns} steps have been taken. Every run that returns a result
 * publishes an {@link AgentRunStartedEvent} and an
 * {@link AgentRunCompletedEvent}.
 */
@Slf4j
public class AgentLoop {

    static final String STOPPED_WITHOUT_OUTPUT = "Stopped without final output";

    private final TurnOrchestrator orchestrator;
    private final AgentStateStorePort stateStore;
    private final StatusEventService statusEvents;
    private final AgentMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final AgentLoopProperties properties;
    private final Clock clock;
    private final Executor executor;

    public AgentLoop(TurnOrchestrator orchestrator, AgentStateStorePort stateStore, StatusEventService statusEvents,
            AgentMetrics metrics, ApplicationEventPublisher eventPublisher, AgentLoopProperties properties,
            Clock clock, Executor executor) {
        this.orchestrator = orchestrator;
        this.stateStore = stateStore;
        this.statusEvents = statusEvents;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Runs the agent until it finishes, a hard stop is requested or the turn
     * ceiling is reached.
     *
     * @throws AgentCancelledException
     *             when the calling thread is interrupted
     */
    public AgentResult run(String agentId, String goal, Collection<? extends ToolComponent> tools) {
        requireAgentId(agentId);
        ToolRegistry registry = ToolRegistry.of(tools);
        AgentState state = loadOrCreate(agentId, goal);
        int maxTurns = properties.getTurn().getMaxTurns();
        log.info("[Turn] Starting agent {} with {} tools, max {} turns", agentId, registry.names().size(),
                maxTurns);
        Instant started = clock.instant();
        publish(new AgentRunStartedEvent(agentId, state.getGoal(), started));

        for (int i = 0; i < maxTurns; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AgentCancelledException("Run cancelled for agent " + agentId);
            }
            statusEvents.emit(agentId, state.getNextTurnIndex(), "Working",
                    "Step " + (i + 1) + " of " + maxTurns, null, i * 100 / maxTurns);

            StepResult step = orchestrator.executeStep(state, registry);
            save(agentId, state);

            if (!step.isContinueRun()) {
                if (step.getFinalOutput() != null) {
                    log.info("[Turn] Agent {} completed after {} steps", agentId, i + 1);
                    return completed(agentId, AgentResult.success(step.getFinalOutput(), state), i + 1, started);
                }
                String error = step.getError() != null ? step.getError() : STOPPED_WITHOUT_OUTPUT;
                log.warn("[Turn] Agent {} stopped: {}", agentId, error);
                return completed(agentId, AgentResult.failure(error, state), i + 1, started);
            }
        }

        StringBuilder error = new StringBuilder("Max turns ").append(maxTurns).append(" reached without finish.");
        lastToolError(state).ifPresent(last -> error.append(" Last error: ").append(last));
        log.warn("[Turn] Agent {}: {}", agentId, error);
        return completed(agentId, AgentResult.failure(error.toString(), state), maxTurns, started);
    }

    /**
     * Runs exactly one step and persists the state.
     */
    public StepResult step(String agentId, String goal, Collection<? extends ToolComponent> tools) {
        requireAgentId(agentId);
        AgentState state = loadOrCreate(agentId, goal);
        StepResult result = orchestrator.executeStep(state, ToolRegistry.of(tools));
        save(agentId, state);
        return result;
    }

    public CompletableFuture<AgentResult> runAsync(String agentId, String goal,
            Collection<? extends ToolComponent> tools) {
        return CompletableFuture.supplyAsync(() -> run(agentId, goal, tools), executor);
    }

    public CompletableFuture<StepResult> stepAsync(String agentId, String goal,
            Collection<? extends ToolComponent> tools) {
        return CompletableFuture.supplyAsync(() -> step(agentId, goal, tools), executor);
    }

    private AgentResult completed(String agentId, AgentResult result, int steps, Instant started) {
        metrics.recordRun(result.isSucceeded(), steps, Duration.between(started, clock.instant()));
        publish(new AgentRunCompletedEvent(agentId, result.isSucceeded(), result.getFinalOutput(), result.getError(),
                steps, clock.instant()));
        return result;
    }

    private void publish(Object event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("[Turn] Failed to publish {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    private AgentState loadOrCreate(String agentId, String goal) {
        Optional<AgentState> stored = stateStore.load(agentId).join();
        if (stored.isPresent()) {
            AgentState state = stored.get();
            if (state.getGoal() == null || state.getGoal().isBlank()) {
                state.setGoal(goal);
            }
            if (state.getAgentId() == null) {
                state.setAgentId(agentId);
            }
            log.debug("[Turn] Resuming agent {} at turn {}", agentId, state.getNextTurnIndex());
            return state;
        }
        return AgentState.builder()
                .agentId(agentId)
                .goal(goal)
                .updatedAt(clock.instant())
                .build();
    }

    private void save(String agentId, AgentState state) {
        state.setUpdatedAt(clock.instant());
        stateStore.save(agentId, state).join();
    }

    private static Optional<String> lastToolError(AgentState state) {
        List<AgentTurn> turns = state.getTurns();
        ListIterator<AgentTurn> iterator = turns.listIterator(turns.size());
        while (iterator.hasPrevious()) {
            AgentTurn turn = iterator.previous();
            if (turn.hasFailedToolResult()) {
                return Optional.ofNullable(turn.getToolResult().getError());
            }
        }
        return Optional.empty();
    }

    private static void requireAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
    }
}
