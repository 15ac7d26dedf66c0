package me.golemcore.agentloop.domain.model;

import java.time.Instant;
import java.util.Map;

public record AgentToolCallStartedEvent(String agentId, int turnIndex, String toolName, Map<String, Object> params,
        Instant timestamp) {
}
