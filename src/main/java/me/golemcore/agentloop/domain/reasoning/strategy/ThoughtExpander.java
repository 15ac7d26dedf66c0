package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ReasoningTree;
import me.golemcore.agentloop.domain.model.ThoughtNode;

import java.util.List;

/**
 * Source of new thoughts and scores for an exploration strategy.
 */
public interface ThoughtExpander {

    /**
     * Proposes children for {@code node}. An empty list means the node is a
     * dead end.
     */
    List<ThoughtCandidate> expand(ReasoningTree tree, ThoughtNode node);

    /**
     * Scores {@code node} in [0, 1].
     */
    double evaluate(ReasoningTree tree, ThoughtNode node);
}
