package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ThoughtType;

/**
 * A proposed child thought before it is added to the tree.
 */
public record ThoughtCandidate(String thought, ThoughtType thoughtType, Double estimatedScore) {
}
