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

/**
 * Decision returned by the model for a single turn, after repair and strict
 * validation. Status fields are public-facing hints for UIs and are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelMessage {

    private String thoughts;
    private AgentAction action;

    @JsonProperty("action_input")
    private ActionInput actionInput;

    @JsonProperty("reasoning_chain")
    private ReasoningChain reasoningChain;

    @JsonProperty("reasoning_tree")
    private ReasoningTree reasoningTree;

    @JsonProperty("status_title")
    private String statusTitle;

    @JsonProperty("status_details")
    private String statusDetails;

    @JsonProperty("next_step_hint")
    private String nextStepHint;

    @JsonProperty("progress_pct")
    private Integer progressPct;

    public boolean hasStatus() {
        return statusTitle != null && !statusTitle.isBlank();
    }
}
