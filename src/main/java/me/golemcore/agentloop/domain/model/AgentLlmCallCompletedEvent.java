package me.golemcore.agentloop.domain.model;

import java.time.Instant;

/**
 * Published after the decision call returns. Exactly one of
 * {@code message} and {@code error} is set.
 */
public record AgentLlmCallCompletedEvent(String agentId, int turnIndex, ModelMessage message, String error,
        Instant timestamp) {
}
