package me.golemcore.agentloop.domain.reasoning.strategy;

import me.golemcore.agentloop.domain.model.ExplorationStrategyType;
import me.golemcore.agentloop.domain.model.ThoughtNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps the {@code beamWidth} best thoughts of each depth and prunes the rest
 * (with their subtrees) before going one level deeper.
 */
public class BeamSearchStrategy extends AbstractExplorationStrategy {

    public static final int DEFAULT_BEAM_WIDTH = 3;

    private final int beamWidth;

    public BeamSearchStrategy(Clock clock) {
        this(clock, DEFAULT_BEAM_WIDTH);
    }

    public BeamSearchStrategy(Clock clock, int beamWidth) {
        super(clock);
        if (beamWidth < 1) {
            throw new IllegalArgumentException("beamWidth must be >= 1");
        }
        this.beamWidth = beamWidth;
    }

    @Override
    public ExplorationStrategyType getType() {
        return ExplorationStrategyType.BEAM_SEARCH;
    }

    @Override
    protected void search(Exploration run, ThoughtNode root) {
        run.evaluate(root);
        List<ThoughtNode> beam = List.of(root);

        while (!beam.isEmpty()) {
            List<ThoughtNode> level = new ArrayList<>();
            for (ThoughtNode node : beam) {
                for (ThoughtNode child : run.expand(node)) {
                    run.evaluate(child);
                    level.add(child);
                }
            }
            if (level.isEmpty()) {
                return;
            }

            // stable sort: equal scores keep creation order
            level.sort(Comparator.comparingDouble((ThoughtNode node) -> -node.scoreOr(0.0)));
            int keep = Math.min(beamWidth, level.size());
            for (ThoughtNode dropped : level.subList(keep, level.size())) {
                run.tree().pruneNode(dropped.getNodeId());
            }
            beam = new ArrayList<>(level.subList(0, keep));
        }
    }
}
