package me.golemcore.agentloop.domain.service;

import java.time.Duration;

/**
 * An external call did not complete before its deadline. Distinct from
 * {@link AgentCancelledException}, which means the caller gave up.
 */
public class DeadlineExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Duration deadline;

    public DeadlineExceededException(Duration deadline) {
        super("Deadline of " + deadline + " exceeded");
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
