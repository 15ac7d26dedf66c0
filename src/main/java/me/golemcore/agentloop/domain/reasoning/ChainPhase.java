package me.golemcore.agentloop.domain.reasoning;

import me.golemcore.agentloop.domain.model.ReasoningStepType;

/**
 * Phases of a chain-of-thought run, in execution order.
 */
enum ChainPhase {

    ANALYSIS(ReasoningStepType.ANALYSIS),

    PLANNING(ReasoningStepType.PLANNING),

    STRATEGY(ReasoningStepType.DECISION),

    EVALUATION(ReasoningStepType.EVALUATION);

    private final ReasoningStepType stepType;

    ChainPhase(ReasoningStepType stepType) {
        this.stepType = stepType;
    }

    ReasoningStepType stepType() {
        return stepType;
    }
}
