package me.golemcore.agentloop.adapter.outbound.llm;

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

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.FunctionCallResult;
import me.golemcore.agentloop.domain.model.FunctionSpec;
import me.golemcore.agentloop.domain.model.LlmCompletion;
import me.golemcore.agentloop.domain.model.LlmMessage;
import me.golemcore.agentloop.domain.model.LlmUsage;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.port.outbound.LlmPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link LlmPort} backed by langchain4j.
 *
 * <p>
 * Supports Anthropic and any OpenAI-compatible endpoint, selected by
 * {@code agent.llm.provider}. The chat model is created lazily on the first
 * call so the application starts without credentials. Rate-limit errors are
 * retried with exponential backoff; every other failure completes the future
 * exceptionally.
 */
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final AgentLoopProperties.LlmProperties settings;

    private volatile ChatModel chatModel;

    public Langchain4jLlmAdapter(AgentLoopProperties properties) {
        this.settings = properties.getLlm();
    }

    // Visible for testing
    Langchain4jLlmAdapter(AgentLoopProperties properties, ChatModel chatModel) {
        this.settings = properties.getLlm();
        this.chatModel = chatModel;
    }

    @Override
    public CompletableFuture<LlmCompletion> complete(List<LlmMessage> messages) {
        return CompletableFuture.supplyAsync(() -> {
            List<ChatMessage> converted = convertMessages(messages);
            ChatResponse response = withRetry(() -> model().chat(converted));
            AiMessage aiMessage = response.aiMessage();
            return LlmCompletion.builder()
                    .content(aiMessage != null ? aiMessage.text() : null)
                    .usage(convertUsage(response))
                    .build();
        });
    }

    @Override
    public CompletableFuture<FunctionCallResult> completeWithFunctions(List<LlmMessage> messages,
            List<FunctionSpec> functions) {
        return CompletableFuture.supplyAsync(() -> {
            List<ChatMessage> converted = convertMessages(messages);
            List<ToolSpecification> tools = functions.stream()
                    .map(this::convertFunction)
                    .toList();
            log.trace("[LLM] Calling model with {} functions", tools.size());
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(converted)
                    .toolSpecifications(tools)
                    .build();
            ChatResponse response = withRetry(() -> model().chat(chatRequest));
            return convertFunctionResponse(response);
        });
    }

    @Override
    public boolean supportsFunctionCalling() {
        return true;
    }

    private ChatModel model() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = createModel();
                    log.info("[LLM] Langchain4j model initialized: provider={}, model={}", settings.getProvider(),
                            settings.getModel());
                }
                model = chatModel;
            }
        }
        return model;
    }

    private ChatModel createModel() {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new IllegalStateException("LLM provider not configured. Set agent.llm.api-key");
        }
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(settings.getProvider())) {
            return createAnthropicModel();
        }
        return createOpenAiModel();
    }

    private ChatModel createAnthropicModel() {
        var builder = AnthropicChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .maxRetries(0)
                .maxTokens(settings.getMaxTokens())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));
        if (settings.getBaseUrl() != null) {
            builder.baseUrl(settings.getBaseUrl());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel() {
        var builder = OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .maxRetries(0)
                .maxTokens(settings.getMaxTokens())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));
        if (settings.getBaseUrl() != null) {
            builder.baseUrl(settings.getBaseUrl());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }

    private ChatResponse withRetry(Supplier<ChatResponse> call) {
        for (int attempt = 0;; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!isRateLimitError(e) || attempt >= MAX_RETRIES) {
                    log.warn("[LLM] Chat failed: {}", e.getMessage());
                    throw e;
                }
                long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1, MAX_RETRIES,
                        backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
                }
            }
        }
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    List<ChatMessage> convertMessages(List<LlmMessage> messages) {
        List<ChatMessage> converted = new ArrayList<>();
        for (LlmMessage msg : messages) {
            String role = msg.getRole() != null ? msg.getRole() : LlmMessage.ROLE_USER;
            String content = msg.getContent();
            if (content == null || content.isBlank()) {
                log.debug("[LLM] Skipping empty {} message", role);
                continue;
            }
            switch (role) {
            case LlmMessage.ROLE_SYSTEM -> converted.add(SystemMessage.from(content));
            case LlmMessage.ROLE_ASSISTANT -> converted.add(AiMessage.from(content));
            case LlmMessage.ROLE_USER -> converted.add(UserMessage.from(content));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", role);
                converted.add(UserMessage.from(content));
            }
            }
        }
        return converted;
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertFunction(FunctionSpec function) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(function.getName())
                .description(function.getDescription());

        Map<String, Object> schema = function.getParametersSchema();
        if (schema != null) {
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");
            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        boolean described = description != null && !description.isBlank();
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            Object items = paramSchema.get("items");
            builder.items(items instanceof Map<?, ?> itemSchema
                    ? toJsonSchemaElement((Map<String, Object>) itemSchema)
                    : JsonStringSchema.builder().build());
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            Object nested = paramSchema.get(SCHEMA_KEY_PROPERTIES);
            if (nested instanceof Map<?, ?> nestedProps) {
                for (Map.Entry<?, ?> entry : nestedProps.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private FunctionCallResult convertFunctionResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        LlmUsage usage = convertUsage(response);
        if (aiMessage == null) {
            return FunctionCallResult.builder().usage(usage).build();
        }
        if (aiMessage.hasToolExecutionRequests()) {
            List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
            if (requests.size() > 1) {
                log.debug("[LLM] Model requested {} functions, using the first", requests.size());
            }
            ToolExecutionRequest first = requests.get(0);
            return FunctionCallResult.builder()
                    .functionName(first.name())
                    .argumentsJson(first.arguments())
                    .assistantContent(aiMessage.text())
                    .usage(usage)
                    .build();
        }
        return FunctionCallResult.builder()
                .assistantContent(aiMessage.text())
                .usage(usage)
                .build();
    }

    private LlmUsage convertUsage(ChatResponse response) {
        if (response.tokenUsage() == null) {
            return null;
        }
        Integer input = response.tokenUsage().inputTokenCount();
        Integer output = response.tokenUsage().outputTokenCount();
        Integer total = response.tokenUsage().totalTokenCount();
        return LlmUsage.builder()
                .inputTokens(input != null ? input : 0)
                .outputTokens(output != null ? output : 0)
                .totalTokens(total != null ? total : 0)
                .model(settings.getModel())
                .build();
    }
}
