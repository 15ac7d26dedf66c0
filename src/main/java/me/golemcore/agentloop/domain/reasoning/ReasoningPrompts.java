package me.golemcore.agentloop.domain.reasoning;

import me.golemcore.agentloop.domain.model.ReasoningChain;
import me.golemcore.agentloop.domain.model.ReasoningStep;
import me.golemcore.agentloop.domain.model.ThoughtNode;
import me.golemcore.agentloop.domain.model.ToolDefinition;

import java.util.List;
import java.util.Locale;

/**
 * Prompt templates for the reasoning engines. Every template names the JSON
 * shape the parser expects back.
 */
final class ReasoningPrompts {

    private static final String CHAIN_SHAPE = """
            Respond with JSON: {"reasoning": "<your reasoning>", "confidence": <0.0-1.0>, \
            "insights": ["<short insight>", ...]}""";

    private ReasoningPrompts() {
    }

    // ==================== chain of thought ====================

    static String chainPhase(ChainPhase phase, String goal, String context, List<ToolDefinition> tools,
            List<String> previousInsights) {
        StringBuilder prompt = header(goal, context, tools);
        if (!previousInsights.isEmpty()) {
            prompt.append("INSIGHTS SO FAR:\n");
            for (String insight : previousInsights) {
                prompt.append("- ").append(insight).append('\n');
            }
            prompt.append('\n');
        }
        prompt.append(switch (phase) {
        case ANALYSIS -> "Analyse the problem: what is being asked, what is known, what is missing?\n";
        case PLANNING -> "Plan the approach: which steps lead to the goal, in what order?\n";
        case STRATEGY -> "Choose a strategy: which tools or actions should be used first, and why?\n";
        case EVALUATION -> "Evaluate the plan: is it sound, what could fail, and what is the conclusion?\n";
        });
        if (phase == ChainPhase.EVALUATION) {
            prompt.append("""
                    Respond with JSON: {"reasoning": "<your reasoning>", "confidence": <0.0-1.0>, \
                    "insights": ["<short insight>", ...], "conclusion": "<final recommendation>"}""");
        } else {
            prompt.append(CHAIN_SHAPE);
        }
        return prompt.toString();
    }

    static String chainValidation(ReasoningChain chain) {
        StringBuilder prompt = new StringBuilder("Review this reasoning for logical errors.\n\nGOAL:\n")
                .append(chain.getGoal()).append("\n\nSTEPS:\n");
        for (ReasoningStep step : chain.getSteps()) {
            prompt.append(step.getStepNumber()).append(". [").append(step.getStepType()).append("] ")
                    .append(step.getContent()).append('\n');
        }
        prompt.append("\nCONCLUSION:\n").append(chain.getFinalConclusion()).append("\n\n")
                .append("""
                        Respond with JSON: {"is_valid": true|false, "confidence": <0.0-1.0>, \
                        "reasoning": "<why>"}""");
        return prompt.toString();
    }

    // ==================== tree of thoughts ====================

    static String treeRoot(String goal, String context, List<ToolDefinition> tools) {
        return header(goal, context, tools)
                .append("State the initial thought that frames how to approach this goal.\n")
                .append("""
                        Respond with JSON: {"thought": "<initial thought>", \
                        "thought_type": "hypothesis|observation|decision|analysis|conclusion|question|alternative"}""")
                .toString();
    }

    static String treeChildren(String goal, String context, List<ThoughtNode> path) {
        StringBuilder prompt = new StringBuilder("GOAL:\n").append(goal).append("\n\n");
        appendContext(prompt, context);
        prompt.append("CURRENT LINE OF THOUGHT:\n");
        appendPath(prompt, path);
        prompt.append("""

                Propose 2-3 distinct next thoughts that continue this line toward the goal.
                Respond with JSON: {"children": [{"thought": "<next thought>", "thought_type": "<type>", \
                "estimated_score": <0.0-1.0>}, ...]}""");
        return prompt.toString();
    }

    static String treeEvaluation(String goal, List<ThoughtNode> path) {
        StringBuilder prompt = new StringBuilder("GOAL:\n").append(goal).append("\n\nLINE OF THOUGHT:\n");
        appendPath(prompt, path);
        prompt.append("""

                Rate how promising the last thought is for reaching the goal.
                Respond with JSON: {"score": <0.0-1.0>, "reasoning": "<why>"}""");
        return prompt.toString();
    }

    static String treeConclusion(String goal, List<ThoughtNode> path) {
        StringBuilder prompt = new StringBuilder("GOAL:\n").append(goal).append("\n\nBEST LINE OF THOUGHT:\n");
        appendPath(prompt, path);
        prompt.append("""

                Summarise this line of thought into a concrete conclusion the agent can act on.
                Respond with JSON: {"conclusion": "<conclusion>"}""");
        return prompt.toString();
    }

    // ==================== helpers ====================

    private static StringBuilder header(String goal, String context, List<ToolDefinition> tools) {
        StringBuilder prompt = new StringBuilder("GOAL:\n").append(goal).append("\n\n");
        appendContext(prompt, context);
        if (tools != null && !tools.isEmpty()) {
            prompt.append("AVAILABLE TOOLS:\n");
            for (ToolDefinition tool : tools) {
                prompt.append("- ").append(tool.getName());
                if (tool.getDescription() != null && !tool.getDescription().isBlank()) {
                    prompt.append(": ").append(tool.getDescription());
                }
                prompt.append('\n');
            }
            prompt.append('\n');
        }
        return prompt;
    }

    private static void appendContext(StringBuilder prompt, String context) {
        if (context != null && !context.isBlank()) {
            prompt.append("CONTEXT:\n").append(context).append("\n\n");
        }
    }

    private static void appendPath(StringBuilder prompt, List<ThoughtNode> path) {
        for (ThoughtNode node : path) {
            prompt.append("  ".repeat(node.getDepth()))
                    .append("- (").append(node.getThoughtType().getWireName());
            if (node.isScored()) {
                prompt.append(String.format(Locale.ROOT, ", score %.2f", node.getScore()));
            }
            prompt.append(") ").append(node.getThought()).append('\n');
        }
    }
}
