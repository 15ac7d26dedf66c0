package me.golemcore.agentloop.domain.reasoning;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.ReasoningTree;
import me.golemcore.agentloop.domain.model.ThoughtNode;
import me.golemcore.agentloop.domain.parser.TreeOfThoughtsResponse;
import me.golemcore.agentloop.domain.reasoning.strategy.ThoughtCandidate;
import me.golemcore.agentloop.domain.reasoning.strategy.ThoughtExpander;
import me.golemcore.agentloop.domain.service.AgentCancelledException;
import me.golemcore.agentloop.domain.service.CallDeadlines;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the LLM for child thoughts and scores. A failed call yields no
 * children or the neutral score 0.5; cancellation propagates.
 */
@Slf4j
class LlmThoughtExpander implements ThoughtExpander {

    static final int MAX_CHILDREN = 3;
    static final double DEFAULT_SCORE = 0.5;

    private final ReasoningLlmClient llm;
    private final String goal;
    private final String context;

    LlmThoughtExpander(ReasoningLlmClient llm, String goal, String context) {
        this.llm = llm;
        this.goal = goal;
        this.context = context;
    }

    @Override
    public List<ThoughtCandidate> expand(ReasoningTree tree, ThoughtNode node) {
        TreeOfThoughtsResponse response;
        try {
            response = llm.askTree(ReasoningPrompts.treeChildren(goal, context,
                    tree.getPathToNode(node.getNodeId())));
        } catch (AgentCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Reasoning] Failed to expand {}: {}", node.getNodeId(), CallDeadlines.safeCauseMessage(e));
            return List.of();
        }

        List<ThoughtCandidate> candidates = new ArrayList<>();
        for (TreeOfThoughtsResponse child : response.getChildren()) {
            if (candidates.size() >= MAX_CHILDREN) {
                break;
            }
            if (child.getThought() != null && !child.getThought().isBlank()) {
                candidates.add(new ThoughtCandidate(child.getThought(), child.getThoughtType(),
                        child.getEstimatedScore()));
            }
        }
        return candidates;
    }

    @Override
    public double evaluate(ReasoningTree tree, ThoughtNode node) {
        try {
            TreeOfThoughtsResponse response = llm.askTree(ReasoningPrompts.treeEvaluation(goal,
                    tree.getPathToNode(node.getNodeId())));
            return response.getScore() != null ? response.getScore() : DEFAULT_SCORE;
        } catch (AgentCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Reasoning] Failed to evaluate {}: {}", node.getNodeId(), CallDeadlines.safeCauseMessage(e));
            return DEFAULT_SCORE;
        }
    }
}
