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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vertex of a {@link ReasoningTree}. Relations are stored as ids only; the
 * owning tree is the single place that mutates nodes.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class ThoughtNode {

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("parent_id")
    private String parentId;

    @Getter(AccessLevel.NONE)
    @JsonProperty("child_ids")
    private List<String> childIds = new ArrayList<>();

    private int depth;
    private String thought;

    @JsonProperty("thought_type")
    private ThoughtType thoughtType;

    private Double score;

    @JsonProperty("estimated_score")
    private Double estimatedScore;

    private ThoughtNodeState state = ThoughtNodeState.PENDING;

    @JsonProperty("evaluated_at")
    private Instant evaluatedAt;

    @JsonProperty("created_at")
    private Instant createdAt;

    ThoughtNode(String nodeId, String parentId, int depth, String thought, ThoughtType thoughtType,
            Instant createdAt) {
        this.nodeId = nodeId;
        this.parentId = parentId;
        this.depth = depth;
        this.thought = thought;
        this.thoughtType = thoughtType != null ? thoughtType : ThoughtType.HYPOTHESIS;
        this.createdAt = createdAt;
    }

    public List<String> getChildIds() {
        return Collections.unmodifiableList(childIds);
    }

    void addChildId(String childId) {
        childIds.add(childId);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isLeaf() {
        return childIds.isEmpty();
    }

    public boolean isPruned() {
        return state == ThoughtNodeState.PRUNED;
    }

    public boolean isScored() {
        return score != null;
    }

    /**
     * Evaluated score, falling back to the generator's estimate and then to the
     * given default.
     */
    public double scoreOr(double fallback) {
        if (score != null) {
            return score;
        }
        if (estimatedScore != null) {
            return estimatedScore;
        }
        return fallback;
    }
}
