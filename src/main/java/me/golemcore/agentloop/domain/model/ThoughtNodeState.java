package me.golemcore.agentloop.domain.model;

/**
 * Lifecycle of a {@link ThoughtNode}.
 */
public enum ThoughtNodeState {

    /**
     * Created but not scored yet.
     */
    PENDING,

    /**
     * Scored by the evaluator.
     */
    EVALUATED,

    /**
     * Removed from consideration together with its whole subtree.
     */
    PRUNED,

    /**
     * Part of the path the tree was completed with.
     */
    BEST_PATH
}
