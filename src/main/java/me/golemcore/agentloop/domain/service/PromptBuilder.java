package me.golemcore.agentloop.domain.service;

import me.golemcore.agentloop.domain.model.AgentState;
import me.golemcore.agentloop.domain.model.LlmMessage;

import java.util.List;

/**
 * Builds the request-time prompt for one agent decision.
 */
public interface PromptBuilder {

    List<LlmMessage> buildMessages(AgentState state, String goal, ToolRegistry tools);

    /**
     * Compact plain-text digest of the history, used as reasoning context.
     */
    String summarizeHistory(AgentState state);
}
