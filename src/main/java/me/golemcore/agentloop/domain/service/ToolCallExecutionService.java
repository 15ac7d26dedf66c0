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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.cache.CachedToolCall;
import me.golemcore.agentloop.domain.cache.IdempotencyCache;
import me.golemcore.agentloop.domain.cache.ToolCallFingerprinter;
import me.golemcore.agentloop.domain.component.DedupeControl;
import me.golemcore.agentloop.domain.component.ToolComponent;
import me.golemcore.agentloop.domain.model.ToolCallRequest;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.model.ToolExecutionResult;
import me.golemcore.agentloop.domain.model.ToolFailureKind;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Tool-call execution: lookup, required-parameter validation, deduplication,
 * invocation under the tool deadline and failure classification.
 *
 * <p>
 * Does NOT mutate agent state. Only successful results are cached.
 */
@Slf4j
public class ToolCallExecutionService {

    private final IdempotencyCache cache;
    private final ToolCallFingerprinter fingerprinter;
    private final AgentLoopProperties properties;
    private final Clock clock;
    private final AgentMetrics metrics;

    public ToolCallExecutionService(IdempotencyCache cache, ToolCallFingerprinter fingerprinter,
            AgentLoopProperties properties, Clock clock, AgentMetrics metrics) {
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    public ToolInvocation execute(ToolCallRequest call, ToolRegistry tools) {
        Map<String, Object> params = call.getParams() != null ? call.getParams() : new LinkedHashMap<>();
        String fingerprint = fingerprinter.fingerprint(call.getTool(), params);

        ToolComponent tool = tools.get(call.getTool());
        if (tool == null) {
            String available = String.join(", ", tools.names());
            log.warn("[Tools] Unknown tool requested: {}", call.getTool());
            return completed(call, ToolExecutionResult.failure(call, ToolFailureKind.NOT_FOUND,
                    "Unknown tool: " + call.getTool() + ". Available tools: " + available, null), fingerprint);
        }

        ToolExecutionResult invalid = validate(call, tool.getDefinition(), params);
        if (invalid != null) {
            return completed(call, invalid, fingerprint);
        }

        boolean dedupe = isDedupeAllowed(tool);
        if (dedupe) {
            Optional<CachedToolCall> cached = cache.lookup(fingerprint);
            metrics.recordDedupe(call.getTool(), cached.isPresent());
            if (cached.isPresent()) {
                log.debug("[Dedupe] Reusing result of {} for '{}'", cached.get().turnId(), call.getTool());
                return new ToolInvocation(cached.get().result(), fingerprint, true);
            }
        }

        ToolExecutionResult result = invoke(call, tool, params);
        if (dedupe && result.isSuccess()) {
            cache.putIfAbsent(fingerprint, call.getTurnId(), result, resolveTtl(tool));
        }
        return completed(call, result, fingerprint);
    }

    private ToolInvocation completed(ToolCallRequest call, ToolExecutionResult result, String fingerprint) {
        metrics.recordToolCall(call.getTool(), result);
        return new ToolInvocation(result, fingerprint, false);
    }

    private ToolExecutionResult invoke(ToolCallRequest call, ToolComponent tool, Map<String, Object> params) {
        Duration timeout = properties.getTurn().getToolTimeout();
        Instant started = clock.instant();
        try {
            CompletableFuture<Object> future = tool.execute(params);
            Object output = CallDeadlines.await(future, timeout);
            log.debug("[Tools] '{}' completed in {}", call.getTool(), Duration.between(started, clock.instant()));
            return ToolExecutionResult.builder()
                    .success(true)
                    .output(output)
                    .tool(call.getTool())
                    .params(params)
                    .turnId(call.getTurnId())
                    .executionTime(Duration.between(started, clock.instant()))
                    .createdAt(clock.instant())
                    .build();
        } catch (DeadlineExceededException e) {
            log.warn("[Tools] '{}' exceeded deadline of {}", call.getTool(), timeout);
            return failed(call, started, ToolFailureKind.DEADLINE_EXCEEDED,
                    "Tool " + call.getTool() + " call deadline exceeded after " + timeout,
                    Map.of("type", "timeout", "timeout_ms", timeout.toMillis()));
        } catch (AgentCancelledException e) {
            log.info("[Tools] '{}' was cancelled", call.getTool());
            return failed(call, started, ToolFailureKind.CANCELLED,
                    "Tool " + call.getTool() + " call was cancelled by user", null);
        } catch (RuntimeException e) {
            String message = CallDeadlines.safeCauseMessage(e);
            log.error("[Tools] Tool execution failed: {}", call.getTool(), e);
            return failed(call, started, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + message,
                    Map.of("type", "tool_error", "message", message));
        }
    }

    private ToolExecutionResult failed(ToolCallRequest call, Instant started, ToolFailureKind kind, String error,
            Object output) {
        return ToolExecutionResult.failure(call, kind, error, output).toBuilder()
                .executionTime(Duration.between(started, clock.instant()))
                .createdAt(clock.instant())
                .build();
    }

    // ==================== validation ====================

    private ToolExecutionResult validate(ToolCallRequest call, ToolDefinition definition, Map<String, Object> params) {
        if (definition == null) {
            return null;
        }
        List<String> missing = new ArrayList<>();
        for (String name : definition.requiredParams()) {
            if (params.get(name) == null) {
                missing.add(name);
            }
        }
        List<String> errors = typeErrors(definition, params);
        if (missing.isEmpty() && errors.isEmpty()) {
            return null;
        }

        List<String> problems = new ArrayList<>();
        if (!missing.isEmpty()) {
            problems.add("Missing required parameters: " + String.join(", ", missing));
        }
        problems.addAll(errors);
        log.info("[Tools] Rejected call to '{}': {}", call.getTool(), problems);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("type", "validation_error");
        output.put("missing", missing);
        output.put("errors", errors);
        return ToolExecutionResult.failure(call, ToolFailureKind.VALIDATION_FAILED,
                "Invalid parameters for " + call.getTool() + ": " + String.join("; ", problems), output)
                .toBuilder()
                .createdAt(clock.instant())
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<String> typeErrors(ToolDefinition definition, Map<String, Object> params) {
        List<String> errors = new ArrayList<>();
        if (!definition.hasInputSchema()
                || !(definition.getInputSchema().get("properties") instanceof Map<?, ?> properties)) {
            return errors;
        }
        for (Map.Entry<String, Object> param : params.entrySet()) {
            Object schema = properties.get(param.getKey());
            if (!(schema instanceof Map<?, ?> propertySchema) || param.getValue() == null) {
                continue;
            }
            Object type = ((Map<String, Object>) propertySchema).get("type");
            if (type instanceof String expected && !matchesType(expected, param.getValue())) {
                errors.add("Parameter '" + param.getKey() + "' must be of type " + expected);
            }
        }
        return errors;
    }

    private static boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> value instanceof Integer || value instanceof Long || value instanceof BigInteger;
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof List<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    // ==================== dedupe ====================

    private boolean isDedupeAllowed(ToolComponent tool) {
        if (!properties.getDedupe().isEnabled()) {
            return false;
        }
        return !(tool instanceof DedupeControl control) || control.allowDedupe();
    }

    private Duration resolveTtl(ToolComponent tool) {
        if (tool instanceof DedupeControl control && control.customTtl() != null) {
            return control.customTtl();
        }
        return properties.getDedupe().getDefaultTtl();
    }
}
