package me.golemcore.agentloop.domain.model;

public enum ExplorationStrategyType {
    BEST_FIRST, BREADTH_FIRST, DEPTH_FIRST, BEAM_SEARCH, MONTE_CARLO
}
