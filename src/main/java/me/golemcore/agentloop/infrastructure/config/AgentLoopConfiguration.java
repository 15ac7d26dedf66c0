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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.adapter.outbound.llm.Langchain4jLlmAdapter;
import me.golemcore.agentloop.adapter.outbound.storage.FileAgentStateStore;
import me.golemcore.agentloop.adapter.outbound.storage.InMemoryAgentStateStore;
import me.golemcore.agentloop.domain.cache.IdempotencyCache;
import me.golemcore.agentloop.domain.cache.ToolCallFingerprinter;
import me.golemcore.agentloop.domain.loop.AgentLoop;
import me.golemcore.agentloop.domain.loop.LoopBreaker;
import me.golemcore.agentloop.domain.loop.TurnOrchestrator;
import me.golemcore.agentloop.domain.parser.ResilientResponseParser;
import me.golemcore.agentloop.domain.reasoning.ChainOfThoughtEngine;
import me.golemcore.agentloop.domain.reasoning.HybridReasoningEngine;
import me.golemcore.agentloop.domain.reasoning.ReasoningEngine;
import me.golemcore.agentloop.domain.reasoning.ReasoningLlmClient;
import me.golemcore.agentloop.domain.reasoning.ReasoningManager;
import me.golemcore.agentloop.domain.reasoning.TreeOfThoughtsEngine;
import me.golemcore.agentloop.domain.service.AgentMetrics;
import me.golemcore.agentloop.domain.service.DefaultPromptBuilder;
import me.golemcore.agentloop.domain.service.PromptBuilder;
import me.golemcore.agentloop.domain.service.StatusEventService;
import me.golemcore.agentloop.domain.service.ToolCallExecutionService;
import me.golemcore.agentloop.port.outbound.AgentStateStorePort;
import me.golemcore.agentloop.port.outbound.LlmPort;
import me.golemcore.agentloop.port.outbound.StatusListener;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring wiring for the agent loop: domain services are plain classes and get
 * their collaborators here.
 *
 * <p>
 * The state store is chosen by {@code agent.storage.type} ({@code file} or
 * {@code memory}).
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AgentLoopConfiguration {

    private static final String STORAGE_MEMORY = "memory";

    private final AgentLoopProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Random reasoningRandom() {
        return new SecureRandom();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentLoopExecutor() {
        return Executors.newCachedThreadPool();
    }

    @PostConstruct
    public void init() {
        log.info("LLM Provider: {}, model: {}", properties.getLlm().getProvider(), properties.getLlm().getModel());
        log.info("Storage: {} ({})", properties.getStorage().getType(), properties.getStorage().getBasePath());
        log.info("Reasoning: {}, strategy: {}", properties.getReasoning().getType(),
                properties.getReasoning().getExplorationStrategy());
    }

    // ==================== ADAPTERS ====================

    @Bean
    public LlmPort llmPort() {
        return new Langchain4jLlmAdapter(properties);
    }

    @Bean
    public AgentStateStorePort agentStateStore(ObjectMapper objectMapper, Clock clock) {
        if (STORAGE_MEMORY.equalsIgnoreCase(properties.getStorage().getType())) {
            return new InMemoryAgentStateStore(objectMapper);
        }
        return new FileAgentStateStore(properties.getStorage().getBasePath(), objectMapper, clock);
    }

    // ==================== METRICS ====================

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public AgentMetrics agentMetrics(MeterRegistry meterRegistry) {
        return new AgentMetrics(meterRegistry);
    }

    // ==================== TOOLS ====================

    @Bean
    public IdempotencyCache idempotencyCache(Clock clock) {
        return new IdempotencyCache(clock);
    }

    @Bean
    public ToolCallExecutionService toolCallExecutionService(IdempotencyCache cache,
            ToolCallFingerprinter fingerprinter, Clock clock, AgentMetrics agentMetrics) {
        return new ToolCallExecutionService(cache, fingerprinter, properties, clock, agentMetrics);
    }

    @Bean
    public LoopBreaker loopBreaker(Clock clock, AgentMetrics agentMetrics) {
        return new LoopBreaker(properties, clock, agentMetrics);
    }

    // ==================== PROMPT / STATUS ====================

    @Bean
    public PromptBuilder promptBuilder(ObjectMapper objectMapper) {
        return new DefaultPromptBuilder(objectMapper, properties);
    }

    @Bean
    public StatusEventService statusEventService(Clock clock, ObjectProvider<StatusListener> listeners) {
        return new StatusEventService(clock, properties, listeners.orderedStream().toList());
    }

    // ==================== REASONING ====================

    @Bean
    public ReasoningLlmClient reasoningLlmClient(LlmPort llmPort, ResilientResponseParser parser) {
        return new ReasoningLlmClient(llmPort, parser, properties);
    }

    @Bean
    public ChainOfThoughtEngine chainOfThoughtEngine(ReasoningLlmClient reasoningLlmClient, Clock clock) {
        return new ChainOfThoughtEngine(reasoningLlmClient, properties, clock);
    }

    @Bean
    public TreeOfThoughtsEngine treeOfThoughtsEngine(ReasoningLlmClient reasoningLlmClient, Clock clock,
            Random reasoningRandom) {
        return new TreeOfThoughtsEngine(reasoningLlmClient, properties, clock, reasoningRandom);
    }

    @Bean
    public HybridReasoningEngine hybridReasoningEngine(ChainOfThoughtEngine chainOfThoughtEngine,
            TreeOfThoughtsEngine treeOfThoughtsEngine, ExecutorService agentLoopExecutor, Clock clock) {
        return new HybridReasoningEngine(chainOfThoughtEngine, treeOfThoughtsEngine, agentLoopExecutor, clock);
    }

    @Bean
    public ReasoningManager reasoningManager(List<ReasoningEngine> engines) {
        return new ReasoningManager(engines);
    }

    // ==================== LOOP ====================

    @Bean
    public TurnOrchestrator turnOrchestrator(LlmPort llmPort, ResilientResponseParser parser,
            ToolCallExecutionService toolCallExecutionService, LoopBreaker loopBreaker, PromptBuilder promptBuilder,
            StatusEventService statusEventService, ReasoningManager reasoningManager, AgentMetrics agentMetrics,
            ApplicationEventPublisher eventPublisher, Clock clock) {
        return new TurnOrchestrator(llmPort, parser, toolCallExecutionService, loopBreaker, promptBuilder,
                statusEventService, reasoningManager, agentMetrics, eventPublisher, properties, clock);
    }

    @Bean
    public AgentLoop agentLoop(TurnOrchestrator turnOrchestrator, AgentStateStorePort agentStateStore,
            StatusEventService statusEventService, AgentMetrics agentMetrics,
            ApplicationEventPublisher eventPublisher, Clock clock, ExecutorService agentLoopExecutor) {
        return new AgentLoop(turnOrchestrator, agentStateStore, statusEventService, agentMetrics, eventPublisher,
                properties, clock, agentLoopExecutor);
    }
}
