package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ThoughtNode;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Follows the newest thought first, descending to the depth limit before
 * backtracking. Siblings are visited in the order the generator proposed
 * them.
 */
public class DepthFirstStrategy extends AbstractExplorationStrategy {

    public DepthFirstStrategy(Clock clock) {
        super(clock);
    }

    @Override
    public ExplorationStrategyType getType() {
        return ExplorationStrategyType.DEPTH_FIRST;
    }

    @Override
    protected void search(Exploration run, ThoughtNode root) {
        Deque<ThoughtNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ThoughtNode node = stack.pop();
            if (node.isPruned()) {
                continue;
            }
            run.evaluate(node);
            // newest child on top: the first proposal is explored next
            for (ThoughtNode child : run.expandInReverse(node)) {
                stack.push(child);
            }
        }
    }
}
