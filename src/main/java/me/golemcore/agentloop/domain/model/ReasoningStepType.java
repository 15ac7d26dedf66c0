package me.golemcore.agentloop.domain.model;

public enum ReasoningStepType {
    ANALYSIS, PLANNING, DECISION, EVALUATION, OBSERVATION, SYNTHESIS
}
