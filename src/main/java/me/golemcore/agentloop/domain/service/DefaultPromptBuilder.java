package me.golemcore.agentloop.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.AgentState;
import me.golemcore.agentloop.domain.model.AgentTurn;
import me.golemcore.agentloop.domain.model.LlmMessage;
import me.golemcore.agentloop.domain.model.ModelMessage;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.model.ToolExecutionResult;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default prompt layout: system contract, goal, tool catalog, optional status
 * instructions and the turn history.
 *
 * <p>
 * The most recent {@code maxRecentTurns} turns are rendered in full; older
 * turns collapse to one summary line each. Tool outputs larger than
 * {@code maxToolOutputSize} characters are replaced by a truncation marker
 * with a preview.
 */
@Slf4j
public class DefaultPromptBuilder implements PromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are an autonomous agent working toward a goal one step at a time.
            Every reply is a single JSON object with exactly these fields:
              "thoughts": your reasoning for this step,
              "action": one of "plan", "tool_call", "finish", "retry",
              "action_input": an object that depends on the action:
                tool_call -> {"tool": "<tool name>", "params": {...}}
                finish    -> {"final": "<final answer>"}
                plan      -> {"summary": "<what you plan to do next>"}
                retry     -> {"summary": "<what you will do differently>"}
            Only call tools listed in the TOOL CATALOG and always send their required params.""";

    private static final String NO_HISTORY = "(no previous turns)";
    private static final int SUMMARY_THOUGHTS_LENGTH = 100;
    private static final int SUMMARY_ERROR_LENGTH = 50;
    private static final int PREVIEW_MARGIN = 20;

    private final ObjectMapper objectMapper;
    private final AgentLoopProperties properties;

    public DefaultPromptBuilder(ObjectMapper objectMapper, AgentLoopProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public List<LlmMessage> buildMessages(AgentState state, String goal, ToolRegistry tools) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("GOAL:\n").append(goal != null ? goal : "").append("\n\n");

        prompt.append("TOOL CATALOG:\n").append(renderCatalog(tools)).append('\n');

        if (properties.getStatus().isEmitPublicStatus()) {
            prompt.append("STATUS UPDATES:\n")
                    .append("Optionally add \"status_title\" (max 60 chars), \"status_details\" (max 160 chars), ")
                    .append("\"next_step_hint\" (max 60 chars) and \"progress_pct\" (0-100) ")
                    .append("to tell the user what you are doing. Keep internal reasoning out of them.\n\n");
        }

        prompt.append("HISTORY:\n").append(renderHistory(state)).append("\n\n");
        prompt.append("IMPORTANT: Respond with one JSON object only. ")
                .append("No markdown fences and no text before or after the JSON.");

        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.system(SYSTEM_PROMPT));
        messages.add(LlmMessage.user(prompt.toString()));
        return messages;
    }

    @Override
    public String summarizeHistory(AgentState state) {
        List<AgentTurn> turns = turnsOf(state);
        if (turns.isEmpty()) {
            return NO_HISTORY;
        }
        int from = Math.max(0, turns.size() - properties.getLimits().getMaxRecentTurns());
        List<String> lines = new ArrayList<>();
        for (AgentTurn turn : turns.subList(from, turns.size())) {
            lines.add(summaryLine(turn));
        }
        return String.join("\n", lines);
    }

    // ==================== catalog ====================

    private String renderCatalog(ToolRegistry tools) {
        if (tools == null || tools.isEmpty()) {
            return "(no tools available)\n";
        }
        StringBuilder catalog = new StringBuilder();
        for (ToolDefinition definition : tools.definitions()) {
            catalog.append("- ").append(definition.getName());
            if (definition.getDescription() != null && !definition.getDescription().isBlank()) {
                catalog.append(": ").append(definition.getDescription());
            }
            catalog.append('\n');
            if (definition.hasInputSchema()) {
                catalog.append("  params schema: ").append(toJson(definition.getInputSchema())).append('\n');
            }
            List<String> required = definition.requiredParams();
            if (!required.isEmpty()) {
                catalog.append("  required params: ").append(String.join(", ", required)).append('\n');
            }
        }
        return catalog.toString();
    }

    // ==================== history ====================

    private String renderHistory(AgentState state) {
        List<AgentTurn> turns = turnsOf(state);
        if (turns.isEmpty()) {
            return NO_HISTORY;
        }
        int recentFrom = Math.max(0, turns.size() - properties.getLimits().getMaxRecentTurns());
        StringBuilder history = new StringBuilder();
        if (recentFrom > 0) {
            history.append("Earlier turns (summarized):\n");
            for (AgentTurn turn : turns.subList(0, recentFrom)) {
                history.append(summaryLine(turn)).append('\n');
            }
            history.append("Recent turns:\n");
        }
        for (AgentTurn turn : turns.subList(recentFrom, turns.size())) {
            history.append(toJson(fullTurn(turn))).append('\n');
        }
        return history.toString().stripTrailing();
    }

    private Map<String, Object> fullTurn(AgentTurn turn) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("index", turn.getIndex());
        ModelMessage message = turn.getLlmMessage();
        if (message != null) {
            view.put("thoughts", message.getThoughts());
            view.put("action", message.getAction() != null ? message.getAction().getWireName() : null);
            view.put("action_input", message.getActionInput());
        }
        if (turn.getToolCall() != null) {
            Map<String, Object> call = new LinkedHashMap<>();
            call.put("tool", turn.getToolCall().getTool());
            call.put("params", turn.getToolCall().getParams());
            view.put("tool_call", call);
        }
        ToolExecutionResult result = turn.getToolResult();
        if (result != null) {
            Map<String, Object> rendered = new LinkedHashMap<>();
            rendered.put("success", result.isSuccess());
            if (result.getOutput() != null) {
                rendered.put("output", truncateOutput(result.getOutput()));
            }
            if (result.getError() != null) {
                rendered.put("error", result.getError());
            }
            view.put("tool_result", rendered);
        }
        return view;
    }

    String summaryLine(AgentTurn turn) {
        StringBuilder line = new StringBuilder("[").append(turn.getIndex()).append("] ");
        ModelMessage message = turn.getLlmMessage();
        if (message != null) {
            line.append("LLM: ")
                    .append(message.getAction() != null ? message.getAction().getWireName() : "?")
                    .append(" - ")
                    .append(abbreviate(message.getThoughts(), SUMMARY_THOUGHTS_LENGTH));
        }
        if (turn.getToolCall() != null) {
            line.append(" | TOOL: ").append(turn.getToolCall().getTool());
        }
        ToolExecutionResult result = turn.getToolResult();
        if (result != null) {
            line.append(" | RESULT: ");
            if (result.isSuccess()) {
                line.append("SUCCESS");
            } else {
                line.append("FAILED (").append(abbreviate(result.getError(), SUMMARY_ERROR_LENGTH)).append(')');
            }
        }
        return line.toString();
    }

    /**
     * Replaces an output whose JSON rendering exceeds the configured size with
     * {@code {truncated, original_size, preview}}.
     */
    Object truncateOutput(Object output) {
        int maxSize = properties.getLimits().getMaxToolOutputSize();
        String rendered = output instanceof String text ? text : toJson(output);
        if (maxSize <= 0 || rendered.length() <= maxSize) {
            return output;
        }
        log.debug("[Turn] Truncating tool output for prompt: {} chars -> {} chars", rendered.length(), maxSize);
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("truncated", true);
        marker.put("original_size", rendered.length());
        marker.put("preview", rendered.substring(0, Math.max(0, maxSize - PREVIEW_MARGIN)) + "...");
        return marker;
    }

    // ==================== helpers ====================

    private static List<AgentTurn> turnsOf(AgentState state) {
        if (state == null || state.getTurns() == null) {
            return List.of();
        }
        return state.getTurns();
    }

    private static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String singleLine = text.replace('\n', ' ');
        if (singleLine.length() <= maxLength) {
            return singleLine;
        }
        return singleLine.substring(0, maxLength) + "...";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[Turn] Failed to render value as JSON, falling back to toString", e);
            return String.valueOf(value);
        }
    }
}
