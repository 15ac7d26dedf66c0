package me.golemcore.agentloop.domain.model;

import java.time.Instant;

/**
 * Published once per {@code AgentLoop.run} that returns a result.
 */
public record AgentRunCompletedEvent(String agentId, boolean succeeded, String finalOutput, String error,
        int totalTurns, Instant timestamp) {
}
