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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent history of one agent. Owned by a single step at a time and saved
 * through {@code AgentStateStorePort} between steps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentState {

    @JsonProperty("agent_id")
    private String agentId;

    private String goal;

    @Builder.Default
    private List<AgentTurn> turns = new ArrayList<>();

    @JsonProperty("updated_at")
    private Instant updatedAt;

    /**
     * Index the next appended turn will get.
     */
    @JsonIgnore
    public int getNextTurnIndex() {
        return turns == null ? 0 : turns.size();
    }

    @JsonIgnore
    public AgentTurn getLastTurn() {
        if (turns == null || turns.isEmpty()) {
            return null;
        }
        return turns.get(turns.size() - 1);
    }

    public void addTurn(AgentTurn turn) {
        if (turns == null) {
            turns = new ArrayList<>();
        }
        turns.add(turn);
    }
}
