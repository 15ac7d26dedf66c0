package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ThoughtNode;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Level-order exploration: every thought at one depth is evaluated and
 * expanded before the next depth.
 */
public class BreadthFirstStrategy extends AbstractExplorationStrategy {

    public BreadthFirstStrategy(Clock clock) {
        super(clock);
    }

    @Override
    public ExplorationStrategyType getType() {
        return ExplorationStrategyType.BREADTH_FIRST;
    }

    @Override
    protected void search(Exploration run, ThoughtNode root) {
        Deque<ThoughtNode> queue = new ArrayDeque<>();
        queue.addLast(root);
        while (!queue.isEmpty()) {
            ThoughtNode node = queue.pollFirst();
            if (node.isPruned()) {
                continue;
            }
            run.evaluate(node);
            for (ThoughtNode child : run.expand(node)) {
                queue.addLast(child);
            }
        }
    }
}
