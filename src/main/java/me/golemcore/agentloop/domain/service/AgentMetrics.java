package me.golemcore.agentloop.domain.service;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.golemcore.agentloop.domain.model.LlmUsage;
import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.ToolExecutionResult;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for runs, steps, LLM calls, tool calls, deduplication,
 * loop detection and reasoning.
 *
 * <p>
 * Meter names:
 * <ul>
 * <li>{@code agent.run} timer, tag {@code outcome}; {@code agent.run.turns}
 * summary</li>
 * <li>{@code agent.step} timer, tags {@code tool} and {@code outcome}</li>
 * <li>{@code agent.llm.calls} timer, tag {@code outcome}</li>
 * <li>{@code agent.llm.tokens} counter, tags {@code direction} and
 * {@code model}</li>
 * <li>{@code agent.tool.calls} timer, tags {@code tool} and
 * {@code outcome}</li>
 * <li>{@code agent.dedupe} counter, tags {@code tool} and {@code result}</li>
 * <li>{@code agent.loop.detections} counter, tag {@code type}</li>
 * <li>{@code agent.reasoning} timer and {@code agent.reasoning.confidence}
 * summary, tag {@code type}</li>
 * </ul>
 */
public class AgentMetrics {

    public static final String LOOP_REPEATED_FAILURE = "repeated_failure";
    public static final String LOOP_HARD_STOP = "hard_stop";

    private static final String OUTCOME = "outcome";
    private static final String SUCCESS = "success";
    private static final String FAILURE = "failure";
    private static final String UNKNOWN = "unknown";

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(boolean succeeded, int turns, Duration duration) {
        Timer.builder("agent.run")
                .description("Agent run duration")
                .tags(OUTCOME, succeeded ? SUCCESS : FAILURE)
                .register(registry)
                .record(orZero(duration));
        DistributionSummary.builder("agent.run.turns")
                .description("Steps taken per run")
                .register(registry)
                .record(turns);
    }

    public void recordStep(boolean executedTool, boolean succeeded, Duration duration) {
        Timer.builder("agent.step")
                .description("Agent step duration")
                .tags("tool", String.valueOf(executedTool), OUTCOME, succeeded ? SUCCESS : FAILURE)
                .register(registry)
                .record(orZero(duration));
    }

    public void recordLlmCall(String outcome, Duration duration) {
        Timer.builder("agent.llm.calls")
                .description("Decision LLM call duration")
                .tags(OUTCOME, outcome)
                .register(registry)
                .record(orZero(duration));
    }

    public void recordTokenUsage(LlmUsage usage) {
        if (usage == null) {
            return;
        }
        String model = orUnknown(usage.getModel());
        tokens("input", model).increment(Math.max(0, usage.getInputTokens()));
        tokens("output", model).increment(Math.max(0, usage.getOutputTokens()));
    }

    public void recordToolCall(String tool, ToolExecutionResult result) {
        Timer.builder("agent.tool.calls")
                .description("Tool invocation duration")
                .tags("tool", orUnknown(tool), OUTCOME, outcomeOf(result))
                .register(registry)
                .record(orZero(result.getExecutionTime()));
    }

    public void recordDedupe(String tool, boolean hit) {
        Counter.builder("agent.dedupe")
                .description("Idempotency cache lookups")
                .tags("tool", orUnknown(tool), "result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordLoopDetection(String type) {
        Counter.builder("agent.loop.detections")
                .description("Repeated tool call detections")
                .tags("type", type)
                .register(registry)
                .increment();
    }

    public void recordReasoning(ReasoningType type, ReasoningResult result) {
        String typeTag = type.name().toLowerCase(Locale.ROOT);
        Timer.builder("agent.reasoning")
                .description("Reasoning duration")
                .tags("type", typeTag, OUTCOME, result.isSuccess() ? SUCCESS : FAILURE)
                .register(registry)
                .record(orZero(result.getExecutionTime()));
        if (result.isSuccess()) {
            DistributionSummary.builder("agent.reasoning.confidence")
                    .description("Confidence of successful reasoning")
                    .tags("type", typeTag)
                    .register(registry)
                    .record(result.getConfidence());
        }
    }

    private Counter tokens(String direction, String model) {
        return Counter.builder("agent.llm.tokens")
                .description("LLM tokens consumed")
                .tags("direction", direction, "model", model)
                .register(registry);
    }

    private static String outcomeOf(ToolExecutionResult result) {
        if (result.isSuccess()) {
            return SUCCESS;
        }
        return result.getFailureKind() != null ? result.getFailureKind().name().toLowerCase(Locale.ROOT) : FAILURE;
    }

    private static String orUnknown(String value) {
        return value != null && !value.isBlank() ? value : UNKNOWN;
    }

    private static Duration orZero(Duration duration) {
        return duration != null ? duration : Duration.ZERO;
    }
}
