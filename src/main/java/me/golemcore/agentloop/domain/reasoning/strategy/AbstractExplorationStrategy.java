package me.golemcore.agentloop.domain.reasoning.strategy;

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
import me.golemcore.agentloop.domain.model.ReasoningTree;
import me.golemcore.agentloop.domain.model.ThoughtNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared bookkeeping for the strategies: evaluation counting, bounded
 * expansion and best-path selection.
 *
 * <p>
 * The best path ends at the highest-scored node that is evaluated and not
 * pruned; ties prefer the deeper node, then the earlier one.
 */
@Slf4j
public abstract class AbstractExplorationStrategy implements ExplorationStrategy {

    protected static final double DEFAULT_SCORE = 0.5;

    private final Clock clock;

    protected AbstractExplorationStrategy(Clock clock) {
        this.clock = clock;
    }

    @Override
    public final ExplorationResult explore(ReasoningTree tree, ThoughtExpander expander) {
        Instant started = clock.instant();
        ThoughtNode root = tree.getRoot();
        if (root == null) {
            return ExplorationResult.builder()
                    .success(false)
                    .error("Tree has no root")
                    .executionTime(Duration.ZERO)
                    .build();
        }

        Exploration run = new Exploration(tree, expander);
        search(run, root);

        ThoughtNode best = selectBest(tree);
        Duration elapsed = Duration.between(started, clock.instant());
        log.debug("[Reasoning] {} explored {} nodes, tree size {}", getType(), run.explored(), tree.getNodeCount());
        if (best == null) {
            return ExplorationResult.builder()
                    .success(false)
                    .error("No thought was evaluated")
                    .nodesExplored(run.explored())
                    .maxDepthReached(tree.getMaxDepthReached())
                    .executionTime(elapsed)
                    .build();
        }

        List<String> path = new ArrayList<>();
        for (ThoughtNode node : tree.getPathToNode(best.getNodeId())) {
            path.add(node.getNodeId());
        }
        return ExplorationResult.builder()
                .success(true)
                .bestPath(path)
                .bestPathScore(best.getScore())
                .nodesExplored(run.explored())
                .maxDepthReached(tree.getMaxDepthReached())
                .executionTime(elapsed)
                .build();
    }

    /**
     * Runs the search policy starting at the root.
     */
    protected abstract void search(Exploration run, ThoughtNode root);

    static ThoughtNode selectBest(ReasoningTree tree) {
        ThoughtNode best = null;
        for (ThoughtNode node : tree.getNodes()) {
            if (!node.isScored() || node.isPruned()) {
                continue;
            }
            if (best == null || node.getScore() > best.getScore()
                    || (node.getScore().equals(best.getScore()) && node.getDepth() > best.getDepth())) {
                best = node;
            }
        }
        return best;
    }

    /**
     * State of one exploration pass.
     */
    protected static final class Exploration {

        private final ReasoningTree tree;
        private final ThoughtExpander expander;
        private int explored;
        private double bestScore = -1.0;

        Exploration(ReasoningTree tree, ThoughtExpander expander) {
            this.tree = tree;
            this.expander = expander;
        }

        public ReasoningTree tree() {
            return tree;
        }

        public int explored() {
            return explored;
        }

        /**
         * Highest score seen so far, or -1 before the first evaluation.
         */
        public double bestScore() {
            return bestScore;
        }

        /**
         * Scores the node through the expander and records it. Pruned nodes
         * are left alone.
         */
        public double evaluate(ThoughtNode node) {
            if (node.isPruned()) {
                return node.scoreOr(0.0);
            }
            double score = expander.evaluate(tree, node);
            tree.evaluateNode(node.getNodeId(), score);
            explored++;
            bestScore = Math.max(bestScore, node.getScore());
            return node.getScore();
        }

        /**
         * Adds the expander's candidates as children while the tree allows
         * it.
         */
        public List<ThoughtNode> expand(ThoughtNode node) {
            if (!tree.canExpand(node.getNodeId())) {
                return new ArrayList<>();
            }
            return addChildren(node, expander.expand(tree, node));
        }

        /**
         * Like {@link #expand} but creates the candidates last to first, so
         * the first proposal becomes the newest child.
         */
        public List<ThoughtNode> expandInReverse(ThoughtNode node) {
            if (!tree.canExpand(node.getNodeId())) {
                return new ArrayList<>();
            }
            List<ThoughtCandidate> candidates = new ArrayList<>(expander.expand(tree, node));
            Collections.reverse(candidates);
            return addChildren(node, candidates);
        }

        private List<ThoughtNode> addChildren(ThoughtNode node, List<ThoughtCandidate> candidates) {
            List<ThoughtNode> children = new ArrayList<>();
            for (ThoughtCandidate candidate : candidates) {
                if (!tree.canExpand(node.getNodeId())) {
                    break;
                }
                if (candidate.thought() == null || candidate.thought().isBlank()) {
                    continue;
                }
                children.add(tree.addChild(node.getNodeId(), candidate.thought(), candidate.thoughtType(),
                        candidate.estimatedScore()));
            }
            return children;
        }
    }
}
