package me.golemcore.agentloop.domain.model;

import java.time.Instant;

/**
 * Published when {@code AgentLoop.run} starts driving an agent.
 */
public record AgentRunStartedEvent(String agentId, String goal, Instant timestamp) {
}
