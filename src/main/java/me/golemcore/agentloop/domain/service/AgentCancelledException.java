package me.golemcore.agentloop.domain.service;

/**
 * The caller cancelled the work (thread interrupt or a cancelled future). This
 * is the only failure that leaves an orchestrator step; everything else is
 * recorded as a failed turn.
 */
public class AgentCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AgentCancelledException(String message) {
        super(message);
    }

    public AgentCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
