package me.golemcore.agentloop.domain.component;

import java.time.Duration;

/**
 * Optional tool capability controlling reuse of cached results for identical
 * calls.
 */
public interface DedupeControl {

    /**
     * Whether an identical earlier call may be served from the idempotency
     * cache. Tools with side effects that must happen every time return false.
     */
    default boolean allowDedupe() {
        return true;
    }

    /**
     * TTL for cached results of this tool, or {@code null} for the configured
     * default.
     */
    default Duration customTtl() {
        return null;
    }
}
