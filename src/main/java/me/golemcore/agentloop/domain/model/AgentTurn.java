package me.golemcore.agentloop.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One orchestrator decision cycle: the model message plus the optional tool
 * call and its result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentTurn {

    private int index;

    @JsonProperty("turn_id")
    private String turnId;

    @JsonProperty("llm_message")
    private ModelMessage llmMessage;

    @JsonProperty("tool_call")
    private ToolCallRequest toolCall;

    @JsonProperty("tool_result")
    private ToolExecutionResult toolResult;

    @JsonProperty("created_at")
    private Instant createdAt;

    /**
     * Derives the turn id from the agent and the turn position so replays of
     * the same state produce the same ids.
     */
    public static String turnId(String agentId, int index) {
        return "turn-" + agentId + "-" + index;
    }

    public boolean hasFailedToolResult() {
        return toolResult != null && !toolResult.isSuccess();
    }
}
