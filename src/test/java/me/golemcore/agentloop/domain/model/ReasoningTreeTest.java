package me.golemcore.agentloop.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReasoningTreeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private ReasoningTree tree;
    private ThoughtNode root;

    @BeforeEach
    void setUp() {
        tree = new ReasoningTree("goal", 3, 10, ExplorationStrategyType.BEST_FIRST, CLOCK);
        root = tree.createRoot("root", ThoughtType.HYPOTHESIS);
    }

    // ==================== construction ====================

    @Test
    void shouldCreateRootAtDepthZero() {
        assertEquals(root, tree.getRoot());
        assertEquals(0, root.getDepth());
        assertTrue(root.isRoot());
        assertEquals(ThoughtNodeState.PENDING, root.getState());
        assertEquals(1, tree.getNodeCount());
    }

    @Test
    void shouldRejectSecondRoot() {
        assertThrows(ReasoningTreeException.class, () -> tree.createRoot("again", ThoughtType.HYPOTHESIS));
        assertEquals(1, tree.getNodeCount());
    }

    @Test
    void shouldRejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReasoningTree("g", -1, 10, ExplorationStrategyType.BEST_FIRST, CLOCK));
        assertThrows(IllegalArgumentException.class,
                () -> new ReasoningTree("g", 3, 0, ExplorationStrategyType.BEST_FIRST, CLOCK));
    }

    // ==================== addChild ====================

    @Test
    void shouldLinkChildToParent() {
        ThoughtNode child = tree.addChild(root.getNodeId(), "child", ThoughtType.ANALYSIS, 0.4);

        assertEquals(root.getNodeId(), child.getParentId());
        assertEquals(1, child.getDepth());
        assertEquals(List.of(child.getNodeId()), root.getChildIds());
        assertEquals(0.4, child.getEstimatedScore());
        assertNull(child.getScore());
    }

    @Test
    void shouldRefuseChildBeyondMaxDepthWithoutChangingTree() {
        ReasoningTree shallow = new ReasoningTree("g", 1, 10, ExplorationStrategyType.BEST_FIRST, CLOCK);
        ThoughtNode top = shallow.createRoot("r", ThoughtType.HYPOTHESIS);
        ThoughtNode child = shallow.addChild(top.getNodeId(), "c", ThoughtType.HYPOTHESIS);

        assertThrows(ReasoningTreeException.class,
                () -> shallow.addChild(child.getNodeId(), "too deep", ThoughtType.HYPOTHESIS));

        assertEquals(2, shallow.getNodeCount());
        assertTrue(child.getChildIds().isEmpty());
        assertFalse(shallow.canExpand(child.getNodeId()));
    }

    @Test
    void shouldRefuseChildBeyondMaxNodesWithoutChangingTree() {
        ReasoningTree small = new ReasoningTree("g", 5, 2, ExplorationStrategyType.BEST_FIRST, CLOCK);
        ThoughtNode top = small.createRoot("r", ThoughtType.HYPOTHESIS);
        small.addChild(top.getNodeId(), "c1", ThoughtType.HYPOTHESIS);

        assertThrows(ReasoningTreeException.class,
                () -> small.addChild(top.getNodeId(), "c2", ThoughtType.HYPOTHESIS));

        assertEquals(2, small.getNodeCount());
        assertEquals(1, top.getChildIds().size());
        assertFalse(small.hasCapacity());
    }

    @Test
    void shouldRefuseUnknownParent() {
        assertThrows(ReasoningTreeException.class,
                () -> tree.addChild("node-404", "orphan", ThoughtType.HYPOTHESIS));
        assertEquals(1, tree.getNodeCount());
    }

    @Test
    void shouldClampEstimatedScore() {
        ThoughtNode child = tree.addChild(root.getNodeId(), "c", ThoughtType.HYPOTHESIS, 3.0);

        assertEquals(1.0, child.getEstimatedScore());
    }

    // ==================== evaluate / prune ====================

    @Test
    void shouldEvaluateWithClampedScore() {
        tree.evaluateNode(root.getNodeId(), 1.5);

        assertEquals(1.0, root.getScore());
        assertEquals(ThoughtNodeState.EVALUATED, root.getState());
        assertEquals(CLOCK.instant(), root.getEvaluatedAt());
    }

    @Test
    void shouldPruneWholeSubtree() {
        ThoughtNode a = tree.addChild(root.getNodeId(), "a", ThoughtType.HYPOTHESIS);
        ThoughtNode b = tree.addChild(a.getNodeId(), "b", ThoughtType.HYPOTHESIS);
        ThoughtNode c = tree.addChild(b.getNodeId(), "c", ThoughtType.HYPOTHESIS);
        ThoughtNode d = tree.addChild(a.getNodeId(), "d", ThoughtType.HYPOTHESIS);
        ThoughtNode sibling = tree.addChild(root.getNodeId(), "sibling", ThoughtType.HYPOTHESIS);

        tree.pruneNode(a.getNodeId());

        assertTrue(a.isPruned());
        assertTrue(b.isPruned());
        assertTrue(c.isPruned());
        assertTrue(d.isPruned());
        assertFalse(sibling.isPruned());
        assertFalse(root.isPruned());
        assertFalse(tree.canExpand(b.getNodeId()));
    }

    @Test
    void shouldKeepPrunedStateWhenScoredLater() {
        ThoughtNode a = tree.addChild(root.getNodeId(), "a", ThoughtType.HYPOTHESIS);
        tree.pruneNode(a.getNodeId());

        tree.evaluateNode(a.getNodeId(), 0.9);

        assertTrue(a.isPruned());
        assertEquals(0.9, a.getScore());
    }

    @Test
    void shouldPruneLowScoredChildAndKeepHighScoredOne() {
        ThoughtNode good = tree.addChild(root.getNodeId(), "good", ThoughtType.HYPOTHESIS);
        ThoughtNode weak = tree.addChild(root.getNodeId(), "weak", ThoughtType.HYPOTHESIS);
        tree.evaluateNode(good.getNodeId(), 0.8);
        tree.evaluateNode(weak.getNodeId(), 0.3);

        tree.pruneNode(weak.getNodeId());

        assertEquals(ThoughtNodeState.PRUNED, weak.getState());
        assertEquals(ThoughtNodeState.EVALUATED, good.getState());
    }

    // ==================== traversal ====================

    @Test
    void shouldListDescendantsDepthFirst() {
        ThoughtNode a = tree.addChild(root.getNodeId(), "a", ThoughtType.HYPOTHESIS);
        ThoughtNode a1 = tree.addChild(a.getNodeId(), "a1", ThoughtType.HYPOTHESIS);
        ThoughtNode b = tree.addChild(root.getNodeId(), "b", ThoughtType.HYPOTHESIS);

        assertEquals(List.of(a, a1, b), tree.getDescendants(root.getNodeId()));
        assertTrue(tree.getDescendants("missing").isEmpty());
    }

    @Test
    void shouldReturnPathFromRoot() {
        ThoughtNode a = tree.addChild(root.getNodeId(), "a", ThoughtType.HYPOTHESIS);
        ThoughtNode a1 = tree.addChild(a.getNodeId(), "a1", ThoughtType.HYPOTHESIS);

        assertEquals(List.of(root, a, a1), tree.getPathToNode(a1.getNodeId()));
        assertEquals(2, tree.getMaxDepthReached());
    }

    @Test
    void shouldReturnChildrenInInsertionOrder() {
        ThoughtNode a = tree.addChild(root.getNodeId(), "a", ThoughtType.HYPOTHESIS);
        ThoughtNode b = tree.addChild(root.getNodeId(), "b", ThoughtType.HYPOTHESIS);

        assertEquals(List.of(a, b), tree.getChildren(root.getNodeId()));
    }

    // ==================== complete ====================

    @Test
    void shouldMarkBestPathOnComplete() {
        ThoughtNode a = tree.addChild(root.getNodeId(), "a", ThoughtType.HYPOTHESIS);
        ThoughtNode b = tree.addChild(root.getNodeId(), "b", ThoughtType.HYPOTHESIS);

        tree.complete(List.of(root.getNodeId(), a.getNodeId(), "ghost"));

        assertTrue(tree.isComplete());
        assertEquals(CLOCK.instant(), tree.getCompletedAt());
        assertEquals(List.of(root.getNodeId(), a.getNodeId(), "ghost"), tree.getBestPath());
        assertEquals(ThoughtNodeState.BEST_PATH, root.getState());
        assertEquals(ThoughtNodeState.BEST_PATH, a.getState());
        assertEquals(ThoughtNodeState.PENDING, b.getState());
    }
}
