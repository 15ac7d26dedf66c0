package me.golemcore.agentloop.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated outcome of a run-to-completion loop.
 */
@Value
@Builder
public class AgentResult {

    boolean succeeded;
    String finalOutput;
    String error;
    AgentState state;

    public static AgentResult success(String finalOutput, AgentState state) {
        return AgentResult.builder()
                .succeeded(true)
                .finalOutput(finalOutput)
                .state(state)
                .build();
    }

    public static AgentResult failure(String error, AgentState state) {
        return AgentResult.builder()
                .succeeded(false)
                .error(error)
                .state(state)
                .build();
    }
}
