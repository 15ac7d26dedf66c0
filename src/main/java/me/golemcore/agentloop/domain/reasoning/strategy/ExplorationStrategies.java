package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ExplorationStrategyType;

import java.time.Clock;
import java.util.Random;

/**
 * Factory for the built-in strategies.
 */
public final class ExplorationStrategies {

    private ExplorationStrategies() {
    }

    public static ExplorationStrategy forType(ExplorationStrategyType type, Clock clock, Random random) {
        return switch (type) {
        case BEST_FIRST -> new BestFirstStrategy(clock);
        case BREADTH_FIRST -> new BreadthFirstStrategy(clock);
        case DEPTH_FIRST -> new DepthFirstStrategy(clock);
        case BEAM_SEARCH -> new BeamSearchStrategy(clock);
        case MONTE_CARLO -> new MonteCarloStrategy(clock, random);
        };
    }
}
