package me.golemcore.agentloop.domain.reasoning;

import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.ToolDefinition;

import java.util.List;

/**
 * A structured reasoning strategy run before an agent decision.
 */
public interface ReasoningEngine {

    ReasoningType getType();

    /**
     * Reasons about the goal. Failures are reported through
     * {@link ReasoningResult#isSuccess()}; this method does not throw.
     *
     * @param goal
     *            what the agent is trying to achieve
     * @param context
     *            digest of what happened so far
     * @param tools
     *            tools the agent can use
     */
    ReasoningResult reason(String goal, String context, List<ToolDefinition> tools);
}
