package me.golemcore.agentloop.domain.parser;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.ActionInput;
import me.golemcore.agentloop.domain.model.AgentAction;
import me.golemcore.agentloop.domain.model.ModelMessage;
import me.golemcore.agentloop.domain.model.ThoughtType;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw model text into strictly typed results: {@link JsonRepair} first,
 * then shape validation.
 *
 * <p>
 * Required constraints raise {@link ResponseValidationException}. Optional
 * status fields never do: they are truncated to their caps, and wrong-typed or
 * out-of-range values are dropped.
 */
@Component
@Slf4j
public class ResilientResponseParser {

    static final int MAX_STATUS_TITLE_LENGTH = 60;
    static final int MAX_STATUS_DETAILS_LENGTH = 160;
    static final int MAX_NEXT_STEP_HINT_LENGTH = 60;

    private static final double DEFAULT_CONFIDENCE = 0.5;
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final AgentLoopProperties.LimitsProperties limits;

    public ResilientResponseParser(ObjectMapper objectMapper, AgentLoopProperties properties) {
        this.objectMapper = objectMapper;
        this.limits = properties.getLimits();
    }

    // ==================== agent turn ====================

    /**
     * Repairs and validates an agent decision.
     *
     * @throws ResponseValidationException
     *             naming the first required field that is missing or invalid
     */
    public ModelMessage parseStrict(String raw) {
        JsonNode root = readObject(raw);

        String thoughts = requireText(root, "thoughts");
        if (thoughts.isBlank()) {
            throw new ResponseValidationException("thoughts", "must not be empty");
        }
        checkLength("thoughts", thoughts, limits.getMaxThoughtsLength());

        JsonNode actionNode = root.get("action");
        if (actionNode == null || actionNode.isNull() || !actionNode.isTextual()) {
            throw new ResponseValidationException("action", "is required");
        }
        AgentAction action = AgentAction.fromWire(actionNode.asText());
        if (action == null) {
            throw new ResponseValidationException("action",
                    "must be one of plan, tool_call, finish, retry but was '" + actionNode.asText() + "'");
        }

        JsonNode inputNode = root.get("action_input");
        if (inputNode == null || !inputNode.isObject()) {
            throw new ResponseValidationException("action_input", "is required and must be an object");
        }

        ActionInput actionInput = switch (action) {
        case TOOL_CALL -> toolCallInput(inputNode);
        case FINISH -> finishInput(inputNode);
        case PLAN, RETRY -> freeformInput(inputNode);
        };

        return ModelMessage.builder()
                .thoughts(thoughts)
                .action(action)
                .actionInput(actionInput)
                .statusTitle(optionalText(root, "status_title", MAX_STATUS_TITLE_LENGTH))
                .statusDetails(optionalText(root, "status_details", MAX_STATUS_DETAILS_LENGTH))
                .nextStepHint(optionalText(root, "next_step_hint", MAX_NEXT_STEP_HINT_LENGTH))
                .progressPct(optionalProgress(root))
                .build();
    }

    private ActionInput toolCallInput(JsonNode inputNode) {
        JsonNode toolNode = inputNode.get("tool");
        if (toolNode == null || !toolNode.isTextual() || toolNode.asText().isBlank()) {
            throw new ResponseValidationException("action_input.tool", "is required for tool_call");
        }
        Map<String, Object> params;
        JsonNode paramsNode = inputNode.get("params");
        if (paramsNode == null || paramsNode.isNull()) {
            params = new LinkedHashMap<>();
        } else if (paramsNode.isObject()) {
            params = objectMapper.convertValue(paramsNode, PARAMS_TYPE);
        } else {
            throw new ResponseValidationException("action_input.params", "must be an object");
        }
        return ActionInput.builder()
                .tool(toolNode.asText())
                .params(params)
                .summary(summary(inputNode))
                .build();
    }

    private ActionInput finishInput(JsonNode inputNode) {
        JsonNode finalNode = inputNode.get("final");
        if (finalNode == null || finalNode.isNull() || !finalNode.isTextual()) {
            throw new ResponseValidationException("action_input.final", "is required for finish");
        }
        checkLength("action_input.final", finalNode.asText(), limits.getMaxFinalLength());
        return ActionInput.builder()
                .finalText(finalNode.asText())
                .summary(summary(inputNode))
                .build();
    }

    private ActionInput freeformInput(JsonNode inputNode) {
        ActionInput input = ActionInput.builder().summary(summary(inputNode)).build();
        JsonNode toolNode = inputNode.get("tool");
        if (toolNode != null && toolNode.isTextual()) {
            input.setTool(toolNode.asText());
        }
        JsonNode paramsNode = inputNode.get("params");
        if (paramsNode != null && paramsNode.isObject()) {
            input.setParams(objectMapper.convertValue(paramsNode, PARAMS_TYPE));
        }
        return input;
    }

    private String summary(JsonNode inputNode) {
        JsonNode summaryNode = inputNode.get("summary");
        if (summaryNode == null || !summaryNode.isTextual()) {
            return null;
        }
        checkLength("action_input.summary", summaryNode.asText(), limits.getMaxSummaryLength());
        return summaryNode.asText();
    }

    private static String optionalText(JsonNode root, String field, int maxLength) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            return null;
        }
        return truncateCodePoints(node.asText(), maxLength);
    }

    /**
     * Cuts {@code value} to at most {@code maxLength} code points, never
     * between the halves of a surrogate pair.
     */
    static String truncateCodePoints(String value, int maxLength) {
        if (value.codePointCount(0, value.length()) <= maxLength) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, maxLength));
    }

    private static Integer optionalProgress(JsonNode root) {
        JsonNode node = root.get("progress_pct");
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        if (value < 0 || value > 100) {
            return null;
        }
        return (int) Math.round(value);
    }

    // ==================== reasoning ====================

    /**
     * Parses a chain-of-thought phase answer. Missing fields fall back to
     * defaults; only an unparseable body is an error.
     */
    public ChainOfThoughtResponse parseChainResponse(String raw) {
        JsonNode root = readObject(raw);
        return ChainOfThoughtResponse.builder()
                .reasoning(textOr(root, "reasoning", ""))
                .confidence(clampedNumber(root, "confidence", DEFAULT_CONFIDENCE))
                .insights(textList(root.get("insights")))
                .conclusion(textOr(root, "conclusion", null))
                .valid(!root.has("is_valid") || root.get("is_valid").asBoolean(true))
                .error(textOr(root, "error", null))
                .build();
    }

    /**
     * Parses a tree-of-thoughts answer (root thought, children, evaluation or
     * conclusion).
     */
    public TreeOfThoughtsResponse parseTreeResponse(String raw) {
        return treeResponse(readObject(raw));
    }

    private TreeOfThoughtsResponse treeResponse(JsonNode node) {
        List<TreeOfThoughtsResponse> children = new ArrayList<>();
        JsonNode childrenNode = node.get("children");
        if (childrenNode != null && childrenNode.isArray()) {
            for (JsonNode child : childrenNode) {
                if (child.isObject()) {
                    children.add(treeResponse(child));
                }
            }
        }
        return TreeOfThoughtsResponse.builder()
                .thought(textOr(node, "thought", null))
                .thoughtType(ThoughtType.fromWire(textOr(node, "thought_type", null)))
                .estimatedScore(nullableNumber(node, "estimated_score"))
                .children(children)
                .score(nullableNumber(node, "score"))
                .reasoning(textOr(node, "reasoning", null))
                .conclusion(textOr(node, "conclusion", null))
                .build();
    }

    // ==================== serialization ====================

    /**
     * Parses native function-call arguments. Blank arguments mean no
     * parameters.
     *
     * @throws ResponseValidationException
     *             with field {@code arguments} when the text is not a JSON
     *             object
     */
    public Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return new LinkedHashMap<>();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(JsonRepair.repair(raw));
        } catch (JsonProcessingException e) {
            throw new ResponseValidationException("arguments", "is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ResponseValidationException("arguments", "must be a JSON object");
        }
        return objectMapper.convertValue(root, PARAMS_TYPE);
    }

    /**
     * Serialises the contract fields of a message (reasoning attachments are
     * left out) with the same names {@link #parseStrict} reads.
     */
    public String toJson(ModelMessage message) {
        ModelMessage contract = ModelMessage.builder()
                .thoughts(message.getThoughts())
                .action(message.getAction())
                .actionInput(message.getActionInput())
                .statusTitle(message.getStatusTitle())
                .statusDetails(message.getStatusDetails())
                .nextStepHint(message.getNextStepHint())
                .progressPct(message.getProgressPct())
                .build();
        try {
            return objectMapper.writeValueAsString(contract);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize model message", e);
        }
    }

    // ==================== helpers ====================

    private JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseValidationException("response", "is empty");
        }
        String repaired = JsonRepair.repair(raw);
        if (!repaired.equals(raw) && log.isDebugEnabled()) {
            log.debug("[Parser] Repaired model output: {} chars -> {} chars", raw.length(), repaired.length());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(repaired);
        } catch (JsonProcessingException e) {
            throw new ResponseValidationException("response", "is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ResponseValidationException("response", "must be a JSON object");
        }
        return root;
    }

    private static String requireText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isTextual()) {
            throw new ResponseValidationException(field, "is required");
        }
        return node.asText();
    }

    private static void checkLength(String field, String value, int maxLength) {
        if (maxLength > 0 && value.length() > maxLength) {
            throw new ResponseValidationException(field, "exceeds maximum length of " + maxLength);
        }
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }

    private static Double nullableNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static double clampedNumber(JsonNode node, String field, double fallback) {
        Double value = nullableNumber(node, field);
        if (value == null || value.isNaN()) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
