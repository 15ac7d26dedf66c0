package me.golemcore.agentloop.domain.model;

import java.time.Instant;

public record AgentStepStartedEvent(String agentId, int turnIndex, Instant timestamp) {
}
