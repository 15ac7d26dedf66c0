package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ThoughtNode;

import java.time.Clock;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Always expands the most promising open thought, ranked by evaluated score
 * and otherwise by the generator's estimate. Stops once a thought scores above
 * 0.8, or above 0.6 after 15 evaluations.
 */
public class BestFirstStrategy extends AbstractExplorationStrategy {

    static final double EXCELLENT_SCORE = 0.8;
    static final double GOOD_SCORE = 0.6;
    static final int GOOD_ENOUGH_AFTER = 15;

    private record Candidate(ThoughtNode node, double priority, long order) {
    }

    public BestFirstStrategy(Clock clock) {
        super(clock);
    }

    @Override
    public ExplorationStrategyType getType() {
        return ExplorationStrategyType.BEST_FIRST;
    }

    @Override
    protected void search(Exploration run, ThoughtNode root) {
        PriorityQueue<Candidate> frontier = new PriorityQueue<>(
                Comparator.comparingDouble((Candidate candidate) -> -candidate.priority())
                        .thenComparingLong(Candidate::order));
        long order = 0;
        frontier.add(new Candidate(root, DEFAULT_SCORE, order++));

        while (!frontier.isEmpty()) {
            ThoughtNode node = frontier.poll().node();
            if (node.isPruned()) {
                continue;
            }
            double score = run.evaluate(node);
            if (run.bestScore() > EXCELLENT_SCORE
                    || (run.explored() >= GOOD_ENOUGH_AFTER && run.bestScore() > GOOD_SCORE)) {
                return;
            }
            for (ThoughtNode child : run.expand(node)) {
                frontier.add(new Candidate(child, child.scoreOr(score), order++));
            }
        }
    }
}
