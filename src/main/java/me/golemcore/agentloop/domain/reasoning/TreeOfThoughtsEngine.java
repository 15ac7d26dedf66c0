package me.golemcore.agentloop.domain.reasoning;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.ExplorationResult;
import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningTree;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.ThoughtNode;
import me.golemcore.agentloop.domain.model.ThoughtType;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.parser.TreeOfThoughtsResponse;
import me.golemcore.agentloop.domain.reasoning.strategy.ExplorationStrategies;
import me.golemcore.agentloop.domain.reasoning.strategy.ExplorationStrategy;
import me.golemcore.agentloop.domain.reasoning.strategy.ThoughtExpander;
import me.golemcore.agentloop.domain.service.AgentCancelledException;
import me.golemcore.agentloop.domain.service.CallDeadlines;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Branching reasoning over a {@link ReasoningTree}: an LLM-proposed root,
 * exploration with the configured strategy, then a conclusion drawn from the
 * best path.
 *
 * <p>
 * Every run works on its own tree, so one engine can serve concurrent runs.
 * The tree primitives ({@code createRoot}, {@code addChild},
 * {@code evaluateNode}, {@code pruneNode}, {@code complete}) live on
 * {@link ReasoningTree} and enforce the depth and node limits themselves.
 */
@Slf4j
public class TreeOfThoughtsEngine implements ReasoningEngine {

    static final String NO_PATH_CONCLUSION = "No viable solution path found.";
    static final String CONCLUSION_FAILED = "Failed to generate conclusion from best path.";

    private final ReasoningLlmClient llm;
    private final AgentLoopProperties.ReasoningProperties settings;
    private final Clock clock;
    private final Random random;

    public TreeOfThoughtsEngine(ReasoningLlmClient llm, AgentLoopProperties properties, Clock clock, Random random) {
        this.llm = llm;
        this.settings = properties.getReasoning();
        this.clock = clock;
        this.random = random;
    }

    @Override
    public ReasoningType getType() {
        return ReasoningType.TREE_OF_THOUGHTS;
    }

    /**
     * Creates an empty tree with the configured limits and strategy.
     */
    public ReasoningTree newTree(String goal) {
        return new ReasoningTree(goal, settings.getMaxTreeDepth(), settings.getMaxTreeNodes(),
                settings.getExplorationStrategy(), clock);
    }

    public ExplorationResult explore(ReasoningTree tree, ExplorationStrategyType strategyType,
            ThoughtExpander expander) {
        ExplorationStrategy strategy = ExplorationStrategies.forType(strategyType, clock, random);
        return strategy.explore(tree, expander);
    }

    @Override
    public ReasoningResult reason(String goal, String context, List<ToolDefinition> tools) {
        Instant started = clock.instant();
        ReasoningTree tree = newTree(goal);
        try {
            TreeOfThoughtsResponse rootResponse = llm.askTree(ReasoningPrompts.treeRoot(goal, context, tools));
            String rootThought = rootResponse.getThought() != null && !rootResponse.getThought().isBlank()
                    ? rootResponse.getThought()
                    : goal;
            ThoughtType rootType = rootResponse.getThoughtType() != null ? rootResponse.getThoughtType()
                    : ThoughtType.HYPOTHESIS;
            tree.createRoot(rootThought, rootType);

            ExplorationResult exploration = explore(tree, settings.getExplorationStrategy(),
                    new LlmThoughtExpander(llm, goal, context));
            if (!exploration.isSuccess() || exploration.getBestPath().isEmpty()) {
                tree.complete(List.of());
                ReasoningResult result = failure(tree,
                        exploration.getError() != null ? exploration.getError() : NO_PATH_CONCLUSION, started);
                result.setConclusion(NO_PATH_CONCLUSION);
                return result;
            }

            String conclusion = conclude(goal, tree, exploration.getBestPath());
            tree.complete(exploration.getBestPath());

            ReasoningResult result = ReasoningResult.builder()
                    .success(true)
                    .conclusion(conclusion)
                    .confidence(exploration.getBestPathScore())
                    .tree(tree)
                    .executionTime(Duration.between(started, clock.instant()))
                    .build();
            result.getMetadata().put("nodes_explored", exploration.getNodesExplored());
            result.getMetadata().put("max_depth_reached", exploration.getMaxDepthReached());
            result.getMetadata().put("best_path_score", exploration.getBestPathScore());
            result.getMetadata().put("reasoning_type", "TreeOfThoughts");
            log.debug("[Reasoning] Tree explored {} nodes, best path score {}", exploration.getNodesExplored(),
                    exploration.getBestPathScore());
            return result;
        } catch (AgentCancelledException e) {
            return failure(tree, "Reasoning cancelled", started);
        } catch (RuntimeException e) {
            log.warn("[Reasoning] Tree of thoughts failed: {}", CallDeadlines.safeCauseMessage(e));
            return failure(tree, "Tree of thoughts failed: " + CallDeadlines.safeCauseMessage(e), started);
        }
    }

    private String conclude(String goal, ReasoningTree tree, List<String> bestPath) {
        List<ThoughtNode> path = new ArrayList<>();
        for (String nodeId : bestPath) {
            ThoughtNode node = tree.getNode(nodeId);
            if (node != null) {
                path.add(node);
            }
        }
        try {
            TreeOfThoughtsResponse response = llm.askTree(ReasoningPrompts.treeConclusion(goal, path));
            if (response.getConclusion() != null && !response.getConclusion().isBlank()) {
                return response.getConclusion();
            }
        } catch (AgentCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Reasoning] Conclusion call failed: {}", CallDeadlines.safeCauseMessage(e));
        }
        return CONCLUSION_FAILED;
    }

    private ReasoningResult failure(ReasoningTree tree, String error, Instant started) {
        ReasoningResult result = ReasoningResult.failure(error, Duration.between(started, clock.instant()));
        result.setTree(tree);
        return result;
    }
}
