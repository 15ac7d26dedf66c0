package me.golemcore.agentloop.testsupport;

import me.golemcore.agentloop.domain.component.DedupeControl;
import me.golemcore.agentloop.domain.component.ToolComponent;
import me.golemcore.agentloop.domain.model.ToolDefinition;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scriptable in-memory tool for unit tests.
 * <p>
 * Every invocation is captured; the answer comes from a responder that tests
 * can swap at any time.
 */
public final class StubTool implements ToolComponent, DedupeControl {

    private final ToolDefinition definition;
    private final List<Map<String, Object>> calls = new CopyOnWriteArrayList<>();
    private volatile Function<Map<String, Object>, CompletableFuture<Object>> responder;
    private volatile boolean enabled = true;
    private volatile boolean dedupeAllowed = true;
    private volatile Duration ttl;

    private StubTool(ToolDefinition definition, Function<Map<String, Object>, CompletableFuture<Object>> responder) {
        this.definition = definition;
        this.responder = responder;
    }

    public static StubTool returning(String name, Object output) {
        return new StubTool(ToolDefinition.builder().name(name).description("Stub " + name).build(),
                params -> CompletableFuture.completedFuture(output));
    }

    public static StubTool withSchema(String name, Map<String, Object> inputSchema, Object output) {
        return new StubTool(ToolDefinition.builder()
                .name(name)
                .description("Stub " + name)
                .inputSchema(inputSchema)
                .build(),
                params -> CompletableFuture.completedFuture(output));
    }

    public StubTool respondWith(Function<Map<String, Object>, CompletableFuture<Object>> responder) {
        this.responder = responder;
        return this;
    }

    public StubTool failingWith(RuntimeException error) {
        return respondWith(params -> CompletableFuture.failedFuture(error));
    }

    public StubTool disabled() {
        this.enabled = false;
        return this;
    }

    public StubTool withoutDedupe() {
        this.dedupeAllowed = false;
        return this;
    }

    public StubTool withTtl(Duration ttl) {
        this.ttl = ttl;
        return this;
    }

    public int callCount() {
        return calls.size();
    }

    public List<Map<String, Object>> calls() {
        return calls;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<Object> execute(Map<String, Object> parameters) {
        calls.add(parameters);
        return responder.apply(parameters);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean allowDedupe() {
        return dedupeAllowed;
    }

    @Override
    public Duration customTtl() {
        return ttl;
    }
}
