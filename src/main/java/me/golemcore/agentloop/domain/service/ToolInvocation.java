package me.golemcore.agentloop.domain.service;

import me.golemcore.agentloop.domain.model.ToolExecutionResult;

/**
 * Result of routing one tool call through {@link ToolCallExecutionService}.
 *
 * @param result
 *            the executed or cached result
 * @param fingerprint
 *            canonical fingerprint of the call
 * @param fromCache
 *            whether the result was served by the idempotency cache
 */
public record ToolInvocation(ToolExecutionResult result, String fingerprint, boolean fromCache) {

    public boolean succeeded() {
        return result != null && result.isSuccess();
    }
}
