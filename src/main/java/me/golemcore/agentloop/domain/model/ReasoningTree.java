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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree of candidate thoughts stored as an arena: one map of node id to node,
 * with children referenced by id. All structural mutations go through this
 * class so the limits hold at all times.
 *
 * <p>
 * Invariants:
 * <ul>
 * <li>at most one root, created once</li>
 * <li>node count never exceeds {@code maxNodes}</li>
 * <li>node depth never exceeds {@code maxDepth}</li>
 * <li>pruning a node prunes its whole subtree</li>
 * <li>once completed, the tree stays completed</li>
 * </ul>
 *
 * <p>
 * Not thread-safe. A tree is mutated by one explorer at a time.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class ReasoningTree {

    private String goal;

    @JsonProperty("root_id")
    private String rootId;

    @JsonProperty("max_depth")
    private int maxDepth;

    @JsonProperty("max_nodes")
    private int maxNodes;

    @JsonProperty("exploration_strategy")
    private ExplorationStrategyType explorationStrategy;

    @Getter(AccessLevel.NONE)
    private Map<String, ThoughtNode> nodes = new LinkedHashMap<>();

    private boolean complete;

    @Getter(AccessLevel.NONE)
    @JsonProperty("best_path")
    private List<String> bestPath = new ArrayList<>();

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @Getter(AccessLevel.NONE)
    @JsonProperty("next_node_seq")
    private long nextNodeSeq = 1;

    @Getter(AccessLevel.NONE)
    @JsonIgnore
    private transient Clock clock = Clock.systemUTC();

    public ReasoningTree(String goal, int maxDepth, int maxNodes, ExplorationStrategyType explorationStrategy) {
        this(goal, maxDepth, maxNodes, explorationStrategy, Clock.systemUTC());
    }

    // Visible for testing
    public ReasoningTree(String goal, int maxDepth, int maxNodes, ExplorationStrategyType explorationStrategy,
            Clock clock) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be >= 1");
        }
        this.goal = goal;
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
        this.explorationStrategy = explorationStrategy;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    // ==================== mutation ====================

    /**
     * Creates the root node.
     *
     * @throws ReasoningTreeException
     *             if a root already exists
     */
    public ThoughtNode createRoot(String thought, ThoughtType thoughtType) {
        if (rootId != null) {
            throw new ReasoningTreeException("Root node already exists: " + rootId);
        }
        ThoughtNode root = new ThoughtNode(nextNodeId(), null, 0, thought, thoughtType, now());
        nodes.put(root.getNodeId(), root);
        rootId = root.getNodeId();
        return root;
    }

    public ThoughtNode addChild(String parentId, String thought, ThoughtType thoughtType) {
        return addChild(parentId, thought, thoughtType, null);
    }

    /**
     * Adds a child under {@code parentId}. The tree is left untouched when the
     * call fails.
     *
     * @throws ReasoningTreeException
     *             if the parent is unknown, the child would exceed
     *             {@code maxDepth}, or the tree already holds {@code maxNodes}
     */
    public ThoughtNode addChild(String parentId, String thought, ThoughtType thoughtType, Double estimatedScore) {
        ThoughtNode parent = nodes.get(parentId);
        if (parent == null) {
            throw new ReasoningTreeException("Parent node not found: " + parentId);
        }
        if (parent.getDepth() + 1 > maxDepth) {
            throw new ReasoningTreeException("Maximum depth " + maxDepth + " reached at node " + parentId);
        }
        if (nodes.size() >= maxNodes) {
            throw new ReasoningTreeException("Maximum node count " + maxNodes + " reached");
        }
        ThoughtNode child = new ThoughtNode(nextNodeId(), parentId, parent.getDepth() + 1, thought, thoughtType,
                now());
        if (estimatedScore != null) {
            child.setEstimatedScore(clampScore(estimatedScore));
        }
        nodes.put(child.getNodeId(), child);
        parent.addChildId(child.getNodeId());
        return child;
    }

    /**
     * Records a score (clamped to [0,1]) and marks the node evaluated. A pruned
     * node keeps its state.
     */
    public ThoughtNode evaluateNode(String nodeId, double score) {
        ThoughtNode node = requireNode(nodeId);
        node.setScore(clampScore(score));
        if (!node.isPruned()) {
            node.setState(ThoughtNodeState.EVALUATED);
        }
        node.setEvaluatedAt(now());
        return node;
    }

    /**
     * Marks the node and every transitive descendant as pruned.
     */
    public void pruneNode(String nodeId) {
        ThoughtNode node = requireNode(nodeId);
        node.setState(ThoughtNodeState.PRUNED);
        for (ThoughtNode descendant : getDescendants(nodeId)) {
            descendant.setState(ThoughtNodeState.PRUNED);
        }
    }

    /**
     * Stores the best path and marks its known nodes; unknown ids are kept in
     * the path but otherwise ignored.
     */
    public void complete(List<String> path) {
        bestPath = path != null ? new ArrayList<>(path) : new ArrayList<>();
        for (String nodeId : bestPath) {
            ThoughtNode node = nodes.get(nodeId);
            if (node != null) {
                node.setState(ThoughtNodeState.BEST_PATH);
            }
        }
        complete = true;
        completedAt = now();
    }

    // ==================== traversal ====================

    public ThoughtNode getNode(String nodeId) {
        return nodeId == null ? null : nodes.get(nodeId);
    }

    public ThoughtNode getRoot() {
        return getNode(rootId);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public boolean hasCapacity() {
        return nodes.size() < maxNodes;
    }

    /**
     * True when {@code nodeId} exists, is not pruned, and may still receive a
     * child.
     */
    public boolean canExpand(String nodeId) {
        ThoughtNode node = nodes.get(nodeId);
        return node != null && !node.isPruned() && node.getDepth() < maxDepth && hasCapacity();
    }

    public List<ThoughtNode> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public List<ThoughtNode> getChildren(String nodeId) {
        ThoughtNode node = nodes.get(nodeId);
        if (node == null) {
            return List.of();
        }
        List<ThoughtNode> children = new ArrayList<>();
        for (String childId : node.getChildIds()) {
            ThoughtNode child = nodes.get(childId);
            if (child != null) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * All transitive descendants in depth-first order; empty for unknown ids.
     */
    public List<ThoughtNode> getDescendants(String nodeId) {
        ThoughtNode start = nodes.get(nodeId);
        if (start == null) {
            return List.of();
        }
        List<ThoughtNode> result = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        pushChildrenReversed(start, stack);
        while (!stack.isEmpty()) {
            ThoughtNode current = nodes.get(stack.pop());
            if (current == null) {
                continue;
            }
            result.add(current);
            pushChildrenReversed(current, stack);
        }
        return result;
    }

    /**
     * Nodes from the root down to {@code nodeId}; empty for unknown ids.
     */
    public List<ThoughtNode> getPathToNode(String nodeId) {
        List<ThoughtNode> path = new ArrayList<>();
        ThoughtNode current = nodes.get(nodeId);
        while (current != null) {
            path.add(current);
            current = current.getParentId() != null ? nodes.get(current.getParentId()) : null;
        }
        Collections.reverse(path);
        return path;
    }

    public List<String> getBestPath() {
        return Collections.unmodifiableList(bestPath);
    }

    public int getMaxDepthReached() {
        return nodes.values().stream().mapToInt(ThoughtNode::getDepth).max().orElse(0);
    }

    private void pushChildrenReversed(ThoughtNode node, Deque<String> stack) {
        List<String> childIds = node.getChildIds();
        for (int i = childIds.size() - 1; i >= 0; i--) {
            stack.push(childIds.get(i));
        }
    }

    private ThoughtNode requireNode(String nodeId) {
        ThoughtNode node = nodes.get(nodeId);
        if (node == null) {
            throw new ReasoningTreeException("Node not found: " + nodeId);
        }
        return node;
    }

    private String nextNodeId() {
        String id = "node-" + nextNodeSeq;
        nextNodeSeq++;
        return id;
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }

    private static double clampScore(double score) {
        return ReasoningChain.clamp(score);
    }
}
