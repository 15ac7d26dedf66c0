package me.golemcore.agentloop.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one tree exploration pass.
 */
@Data
@Builder
public class ExplorationResult {

    private boolean success;

    @Builder.Default
    private List<String> bestPath = new ArrayList<>();

    private double bestPathScore;
    private int nodesExplored;
    private int maxDepthReached;
    private Duration executionTime;
    private String error;
}
