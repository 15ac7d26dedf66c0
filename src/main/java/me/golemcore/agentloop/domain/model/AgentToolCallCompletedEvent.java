package me.golemcore.agentloop.domain.model;

import java.time.Duration;
import java.time.Instant;

public record AgentToolCallCompletedEvent(String agentId, int turnIndex, String toolName, boolean success,
        boolean fromCache, Object output, String error, Duration executionTime, Instant timestamp) {
}
