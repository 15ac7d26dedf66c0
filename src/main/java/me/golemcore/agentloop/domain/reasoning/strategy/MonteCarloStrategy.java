package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ThoughtNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Randomised rollouts from the root. Each step picks a child with probability
 * proportional to its score (expanding the node first when it has none) and
 * continues with probability 0.7.
 */
public class MonteCarloStrategy extends AbstractExplorationStrategy {

    public static final int DEFAULT_ROLLOUTS = 10;

    static final double STOP_PROBABILITY = 0.3;
    private static final double MIN_WEIGHT = 0.01;

    private final Random random;
    private final int rollouts;

    public MonteCarloStrategy(Clock clock, Random random) {
        this(clock, random, DEFAULT_ROLLOUTS);
    }

    public MonteCarloStrategy(Clock clock, Random random, int rollouts) {
        super(clock);
        this.random = random;
        this.rollouts = rollouts;
    }

    @Override
    public ExplorationStrategyType getType() {
        return ExplorationStrategyType.MONTE_CARLO;
    }

    @Override
    protected void search(Exploration run, ThoughtNode root) {
        run.evaluate(root);
        for (int rollout = 0; rollout < rollouts; rollout++) {
            ThoughtNode current = root;
            while (true) {
                List<ThoughtNode> children = liveChildren(run, current);
                if (children.isEmpty()) {
                    children = run.expand(current);
                }
                if (children.isEmpty()) {
                    break;
                }
                ThoughtNode next = sample(children);
                if (!next.isScored()) {
                    run.evaluate(next);
                }
                current = next;
                if (random.nextDouble() <= STOP_PROBABILITY) {
                    break;
                }
            }
        }
    }

    private static List<ThoughtNode> liveChildren(Exploration run, ThoughtNode node) {
        List<ThoughtNode> live = new ArrayList<>();
        for (ThoughtNode child : run.tree().getChildren(node.getNodeId())) {
            if (!child.isPruned()) {
                live.add(child);
            }
        }
        return live;
    }

    ThoughtNode sample(List<ThoughtNode> candidates) {
        double total = 0.0;
        for (ThoughtNode candidate : candidates) {
            total += weight(candidate);
        }
        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        for (ThoughtNode candidate : candidates) {
            cumulative += weight(candidate);
            if (target < cumulative) {
                return candidate;
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    private static double weight(ThoughtNode node) {
        return Math.max(MIN_WEIGHT, node.scoreOr(DEFAULT_SCORE));
    }
}
