package me.golemcore.agentloop.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Public progress event broadcast while an agent runs. Carries no internal
 * reasoning.
 */
@Value
@Builder
public class StatusUpdate {

    String agentId;
    int turnIndex;
    String statusTitle;
    String statusDetails;
    String nextStepHint;
    Integer progressPct;
    Instant timestamp;
}
