package me.golemcore.agentloop.domain.model;

/**
 * Deliberation mode run before the orchestrator commits an action.
 */
public enum ReasoningType {
    NONE, CHAIN_OF_THOUGHT, TREE_OF_THOUGHTS, HYBRID
}
