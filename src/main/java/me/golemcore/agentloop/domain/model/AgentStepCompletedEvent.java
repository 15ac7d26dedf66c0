package me.golemcore.agentloop.domain.model;

import java.time.Instant;

public record AgentStepCompletedEvent(String agentId, int turnIndex, boolean continueRun, boolean executedTool,
        String finalOutput, String error, Instant timestamp) {
}
