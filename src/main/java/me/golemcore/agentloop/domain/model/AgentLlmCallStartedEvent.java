package me.golemcore.agentloop.domain.model;

import java.time.Instant;

public record AgentLlmCallStartedEvent(String agentId, int turnIndex, Instant timestamp) {
}
