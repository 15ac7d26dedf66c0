package me.golemcore.agentloop.domain.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.agentloop.domain.cache.IdempotencyCache;
import me.golemcore.agentloop.domain.cache.ToolCallFingerprinter;
import me.golemcore.agentloop.domain.model.ToolCallRequest;
import me.golemcore.agentloop.domain.model.ToolExecutionResult;
import me.golemcore.agentloop.domain.model.ToolFailureKind;
import me.golemcore.agentloop.infrastructure.config.AgentLoopConfiguration;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallExecutionServiceTest {

    private static final String TOOL_NAME = "web_search";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "query", Map.of("type", "string"),
                    "limit", Map.of("type", "integer")),
            "required", List.of("query"));

    private AgentLoopProperties properties;
    private IdempotencyCache cache;
    private ToolCallFingerprinter fingerprinter;
    private SimpleMeterRegistry meterRegistry;
    private ToolCallExecutionService service;
    private StubTool tool;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new AgentLoopProperties();
        cache = new IdempotencyCache(CLOCK);
        fingerprinter = new ToolCallFingerprinter(AgentLoopConfiguration.objectMapper());
        meterRegistry = new SimpleMeterRegistry();
        service = new ToolCallExecutionService(cache, fingerprinter, properties, CLOCK,
                new AgentMetrics(meterRegistry));
        tool = StubTool.withSchema(TOOL_NAME, SCHEMA, "3 results");
        registry = ToolRegistry.of(List.of(tool));
    }

    // ==================== happy path ====================

    @Test
    void shouldExecuteToolAndCacheSuccess() {
        ToolInvocation invocation = service.execute(call("turn-1", Map.of("query", "jdk 17")), registry);

        assertTrue(invocation.succeeded());
        assertFalse(invocation.fromCache());
        assertEquals("3 results", invocation.result().getOutput());
        assertEquals("turn-1", invocation.result().getTurnId());
        assertEquals(TOOL_NAME, invocation.result().getTool());
        assertEquals(NOW, invocation.result().getCreatedAt());
        assertEquals(fingerprinter.fingerprint(TOOL_NAME, Map.of("query", "jdk 17")), invocation.fingerprint());
        assertEquals(1, cache.size());
        assertEquals(List.of(Map.of("query", "jdk 17")), tool.calls());
    }

    @Test
    void shouldServeIdenticalCallFromCache() {
        service.execute(call("turn-1", Map.of("query", "jdk 17", "limit", 5)), registry);
        Map<String, Object> reordered = new LinkedHashMap<>();
        reordered.put("limit", 5);
        reordered.put("query", "jdk 17");

        ToolInvocation second = service.execute(call("turn-2", reordered), registry);

        assertTrue(second.fromCache());
        assertTrue(second.succeeded());
        assertEquals("turn-1", second.result().getTurnId());
        assertEquals(1, tool.callCount());
    }

    @Test
    void shouldExecuteAgainWhenParamsDiffer() {
        service.execute(call("turn-1", Map.of("query", "jdk 17")), registry);

        ToolInvocation second = service.execute(call("turn-2", Map.of("query", "jdk 21")), registry);

        assertFalse(second.fromCache());
        assertEquals(2, tool.callCount());
    }

    // ==================== dedupe control ====================

    @Test
    void shouldSkipCacheForToolsThatOptOut() {
        tool.withoutDedupe();

        service.execute(call("turn-1", Map.of("query", "send")), registry);
        ToolInvocation second = service.execute(call("turn-2", Map.of("query", "send")), registry);

        assertFalse(second.fromCache());
        assertEquals(2, tool.callCount());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldSkipCacheWhenDedupeDisabled() {
        properties.getDedupe().setEnabled(false);

        service.execute(call("turn-1", Map.of("query", "q")), registry);
        service.execute(call("turn-2", Map.of("query", "q")), registry);

        assertEquals(2, tool.callCount());
    }

    @Test
    void shouldApplyToolSpecificTtl() {
        tool.withTtl(Duration.ofSeconds(30));

        ToolInvocation invocation = service.execute(call("turn-1", Map.of("query", "q")), registry);

        assertEquals(NOW.plusSeconds(30), cache.lookup(invocation.fingerprint()).orElseThrow().expiresAt());
    }

    // ==================== metrics ====================

    @Test
    void shouldCountDedupeHitsAndMisses() {
        service.execute(call("turn-1", Map.of("query", "q")), registry);
        service.execute(call("turn-2", Map.of("query", "q")), registry);
        service.execute(call("turn-3", Map.of("query", "q")), registry);

        assertEquals(1.0, meterRegistry.get("agent.dedupe").tags("tool", TOOL_NAME, "result", "miss")
                .counter().count());
        assertEquals(2.0, meterRegistry.get("agent.dedupe").tags("tool", TOOL_NAME, "result", "hit")
                .counter().count());
        assertEquals(1, meterRegistry.get("agent.tool.calls").tags("tool", TOOL_NAME, "outcome", "success")
                .timer().count());
    }

    @Test
    void shouldTimeFailedCallsByFailureKind() {
        service.execute(ToolCallRequest.builder().tool("nope").turnId("turn-1").build(), registry);
        service.execute(call("turn-2", Map.of("limit", "ten")), registry);

        assertEquals(1, meterRegistry.get("agent.tool.calls").tags("tool", "nope", "outcome", "not_found")
                .timer().count());
        assertEquals(1, meterRegistry.get("agent.tool.calls").tags("tool", TOOL_NAME, "outcome", "validation_failed")
                .timer().count());
        assertTrue(meterRegistry.find("agent.dedupe").counters().isEmpty());
    }

    // ==================== failures ====================

    @Test
    void shouldReportUnknownTool() {
        ToolInvocation missing = service.execute(ToolCallRequest.builder().tool("nope").turnId("turn-1").build(),
                registry);

        assertFalse(missing.succeeded());
        assertEquals(ToolFailureKind.NOT_FOUND, missing.result().getFailureKind());
        assertEquals("Unknown tool: nope. Available tools: web_search", missing.result().getError());
        assertNotNull(missing.fingerprint());
    }

    @Test
    void shouldRejectMissingAndMistypedParams() {
        ToolInvocation invocation = service.execute(call("turn-1", Map.of("limit", "ten")), registry);

        ToolExecutionResult result = invocation.result();
        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertEquals("Invalid parameters for web_search: Missing required parameters: query; "
                + "Parameter 'limit' must be of type integer", result.getError());
        Map<?, ?> output = (Map<?, ?>) result.getOutput();
        assertEquals("validation_error", output.get("type"));
        assertEquals(List.of("query"), output.get("missing"));
        assertEquals(0, tool.callCount());
    }

    @Test
    void shouldReportDeadlineAndCancelPendingCall() {
        properties.getTurn().setToolTimeout(Duration.ofMillis(50));
        CompletableFuture<Object> pending = new CompletableFuture<>();
        tool.respondWith(params -> pending);

        ToolInvocation invocation = service.execute(call("turn-1", Map.of("query", "slow")), registry);

        assertEquals(ToolFailureKind.DEADLINE_EXCEEDED, invocation.result().getFailureKind());
        assertEquals("Tool web_search call deadline exceeded after PT0.05S", invocation.result().getError());
        assertTrue(pending.isCancelled());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldReportCancellation() {
        tool.respondWith(params -> {
            CompletableFuture<Object> cancelled = new CompletableFuture<>();
            cancelled.cancel(true);
            return cancelled;
        });

        ToolInvocation invocation = service.execute(call("turn-1", Map.of("query", "q")), registry);

        assertEquals(ToolFailureKind.CANCELLED, invocation.result().getFailureKind());
        assertEquals("Tool web_search call was cancelled by user", invocation.result().getError());
    }

    @Test
    void shouldReportExecutionFailureAndNotCacheIt() {
        tool.failingWith(new IllegalStateException("quota exhausted"));

        ToolInvocation first = service.execute(call("turn-1", Map.of("query", "q")), registry);
        ToolInvocation second = service.execute(call("turn-2", Map.of("query", "q")), registry);

        assertEquals(ToolFailureKind.EXECUTION_FAILED, first.result().getFailureKind());
        assertEquals("Tool execution failed: quota exhausted", first.result().getError());
        assertFalse(second.fromCache());
        assertEquals("turn-2", second.result().getTurnId());
        assertEquals(2, tool.callCount());
    }

    @Test
    void shouldReportSynchronousThrow() {
        tool.respondWith(params -> {
            throw new IllegalArgumentException("bad input");
        });

        ToolInvocation invocation = service.execute(call("turn-1", Map.of("query", "q")), registry);

        assertEquals(ToolFailureKind.EXECUTION_FAILED, invocation.result().getFailureKind());
        assertEquals("Tool execution failed: bad input", invocation.result().getError());
    }

    private static ToolCallRequest call(String turnId, Map<String, Object> params) {
        return ToolCallRequest.builder()
                .tool(TOOL_NAME)
                .params(params)
                .turnId(turnId)
                .createdAt(NOW)
                .build();
    }
}
