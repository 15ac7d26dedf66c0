package me.golemcore.agentloop.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ReasoningType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the agent loop, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link TurnProperties} - turn ceiling and per-call deadlines</li>
 * <li>{@link LimitsProperties} - field length caps and prompt history
 * sizing</li>
 * <li>{@link DedupeProperties} - idempotency cache</li>
 * <li>{@link LoopBreakerProperties} - repeated-call detection</li>
 * <li>{@link StatusProperties} - public status broadcast</li>
 * <li>{@link ReasoningProperties} - chain/tree reasoning</li>
 * <li>{@link StorageProperties} - agent state persistence</li>
 * <li>{@link LlmProperties} - langchain4j provider settings</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentLoopProperties {

    private TurnProperties turn = new TurnProperties();
    private LimitsProperties limits = new LimitsProperties();
    private DedupeProperties dedupe = new DedupeProperties();
    private LoopBreakerProperties loopBreaker = new LoopBreakerProperties();
    private StatusProperties status = new StatusProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();
    private StorageProperties storage = new StorageProperties();
    private LlmProperties llm = new LlmProperties();

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        /** Turn ceiling for a run-to-completion loop. */
        private int maxTurns = 100;

        /** Deadline for a single LLM call. */
        private Duration llmTimeout = Duration.ofMinutes(5);

        /** Deadline for a single tool invocation. */
        private Duration toolTimeout = Duration.ofMinutes(2);

        /**
         * Use native function calling when the provider supports it and at least
         * one tool has an input schema.
         */
        private boolean useFunctionCalling = true;
    }

    // ==================== LIMITS ====================

    @Data
    public static class LimitsProperties {
        private int maxThoughtsLength = 20000;
        private int maxSummaryLength = 40000;
        private int maxFinalLength = 50000;

        /** Turns rendered in full in the prompt; older ones are summarised. */
        private int maxRecentTurns = 10;

        /** Serialized tool outputs longer than this are replaced by a preview. */
        private int maxToolOutputSize = 2000;
    }

    // ==================== DEDUPE ====================

    @Data
    public static class DedupeProperties {
        private boolean enabled = true;

        /** Default TTL of cached tool results when the tool sets none. */
        private Duration defaultTtl = Duration.ofMinutes(5);
    }

    // ==================== LOOP BREAKER ====================

    @Data
    public static class LoopBreakerProperties {
        /** Rolling window of remembered tool calls per agent. */
        private int maxToolCallHistory = 20;

        /** Identical failing calls needed to flag a loop. */
        private int consecutiveFailureThreshold = 3;

        /**
         * Identical calls (any outcome) after which the run is stopped. 0 keeps the
         * detector soft: it only injects corrective turns.
         */
        private int hardStopThreshold = 0;

        /** Idle time after which an agent's call history is forgotten. */
        private Duration historyTtl = Duration.ofHours(24);

        private int maxTrackedAgents = 100;
    }

    // ==================== STATUS ====================

    @Data
    public static class StatusProperties {
        private boolean emitPublicStatus = true;
    }

    // ==================== REASONING ====================

    @Data
    public static class ReasoningProperties {
        private ReasoningType type = ReasoningType.NONE;
        private int maxReasoningSteps = 10;
        private int maxTreeDepth = 5;
        private int maxTreeNodes = 50;
        private ExplorationStrategyType explorationStrategy = ExplorationStrategyType.BEST_FIRST;
        private boolean enableValidation = true;
        private double minConfidence = 0.7;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        /** "file" or "memory". */
        private String type = "file";
        private String basePath = "${user.home}/.golemcore/agents";
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** "openai" (any OpenAI-compatible endpoint) or "anthropic". */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private Double temperature;
        private int maxTokens = 4096;
        private long timeoutMs = 300000;
    }
}
