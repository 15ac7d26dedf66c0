package me.golemcore.agentloop.domain.model;

/**
 * Raised when a tree mutation would break one of the tree's structural limits
 * (single root, known parent, depth and node caps).
 */
public class ReasoningTreeException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ReasoningTreeException(String message) {
        super(message);
    }
}
