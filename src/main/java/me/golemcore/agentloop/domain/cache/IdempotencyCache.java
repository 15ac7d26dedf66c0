package me.golemcore.agentloop.domain.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.ToolExecutionResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fingerprint to tool result store with per-entry expiry.
 *
 * <p>
 * One instance belongs to one orchestrator; it is never a process-wide
 * singleton. Every read and write goes through a single lock so concurrent
 * steps cannot lose an insert on the insert-if-absent path. Expired entries
 * are removed lazily when looked up.
 */
@Slf4j
public class IdempotencyCache {

    private final Map<String, CachedToolCall> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public IdempotencyCache() {
        this(Clock.systemUTC());
    }

    // Visible for testing
    public IdempotencyCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the live entry for {@code key}, dropping it first if it has
     * expired.
     */
    public Optional<CachedToolCall> lookup(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(liveEntry(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the result unless a live entry already exists.
     *
     * @return the entry that is in the cache after the call
     */
    public CachedToolCall putIfAbsent(String key, String turnId, ToolExecutionResult result, Duration ttl) {
        lock.lock();
        try {
            CachedToolCall existing = liveEntry(key);
            if (existing != null) {
                return existing;
            }
            CachedToolCall entry = new CachedToolCall(turnId, result, clock.instant().plus(ttl));
            entries.put(key, entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the result, replacing any existing entry.
     */
    public void put(String key, String turnId, ToolExecutionResult result, Duration ttl) {
        lock.lock();
        try {
            entries.put(key, new CachedToolCall(turnId, result, clock.instant().plus(ttl)));
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(String key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<CachedToolCall> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().isExpired(now)) {
                    iterator.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("[Dedupe] Evicted {} expired entries", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private CachedToolCall liveEntry(String key) {
        CachedToolCall entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }
}
