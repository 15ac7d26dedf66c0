package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ExplorationResult;
import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ReasoningTree;

/**
 * Search policy over a {@link ReasoningTree} that already has a root.
 */
public interface ExplorationStrategy {

    ExplorationStrategyType getType();

    /**
     * Grows and scores the tree until the policy stops or the tree is full.
     * The tree's depth and node limits are never exceeded.
     */
    ExplorationResult explore(ReasoningTree tree, ThoughtExpander expander);
}
