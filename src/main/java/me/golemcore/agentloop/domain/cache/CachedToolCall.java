package me.golemcore.agentloop.domain.cache;

import me.golemcore.agentloop.domain.model.ToolExecutionResult;

import java.time.Instant;

/**
 * Idempotency cache entry.
 *
 * @param turnId
 *            turn that originally executed the call
 * @param result
 *            result to reuse for identical calls
 * @param expiresAt
 *            instant after which the entry is ignored and removed
 */
public record CachedToolCall(String turnId, ToolExecutionResult result, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
