package me.golemcore.agentloop.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.AgentState;
import me.golemcore.agentloop.port.outbound.AgentStateStorePort;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. States are kept as JSON trees, so callers never share
 * mutable instances with the store.
 */
@Slf4j
public class InMemoryAgentStateStore implements AgentStateStorePort {

    private final ObjectMapper objectMapper;
    private final Map<String, String> states = new ConcurrentHashMap<>();

    public InMemoryAgentStateStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<Optional<AgentState>> load(String agentId) {
        String json = states.get(agentId);
        if (json == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return CompletableFuture.completedFuture(Optional.of(objectMapper.readValue(json, AgentState.class)));
        } catch (Exception e) {
            log.error("[Storage] Failed to read in-memory state for agent {}: {}", agentId, e.getMessage());
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    @Override
    public CompletableFuture<Void> save(String agentId, AgentState state) {
        try {
            states.put(agentId, objectMapper.writeValueAsString(state));
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Failed to store state for agent " + agentId, e));
        }
    }

    public int size() {
        return states.size();
    }
}
