package me.golemcore.agentloop.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a single orchestrator step.
 *
 * <p>
 * {@code continueRun} is false once the model finished or the loop breaker
 * requested a hard stop; {@code error} is populated for turn-level failures,
 * which do not stop the run on their own.
 */
@Value
@Builder
public class StepResult {

    boolean continueRun;
    boolean executedTool;
    String finalOutput;
    ModelMessage llmMessage;
    ToolExecutionResult toolResult;
    String error;
    AgentState state;
}
