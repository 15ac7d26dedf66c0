package me.golemcore.agentloop.domain.loop;

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
import me.golemcore.agentloop.domain.service.AgentMetrics;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks recent tool calls per agent and recognises the agent repeating the
 * same failing call.
 *
 * <p>
 * Detection is soft: callers append a corrective turn and keep going. A
 * positive {@code hardStopThreshold} additionally lets callers stop the run
 * when the same call (any outcome) repeats back to back that many times.
 */
@Slf4j
public class LoopBreaker {

    record ToolCallRecord(String tool, String fingerprint, boolean success) {
    }

    private static final class AgentHistory {
        private final Deque<ToolCallRecord> calls = new ArrayDeque<>();
        private Instant lastActivity;
    }

    private final AgentLoopProperties.LoopBreakerProperties settings;
    private final Clock clock;
    private final AgentMetrics metrics;
    // access order, least recently active first
    private final Map<String, AgentHistory> histories = new LinkedHashMap<>(16, 0.75f, true);

    public LoopBreaker(AgentLoopProperties properties, Clock clock, AgentMetrics metrics) {
        this.settings = properties.getLoopBreaker();
        this.clock = clock;
        this.metrics = metrics;
    }

    public synchronized void record(String agentId, String tool, String fingerprint, boolean success) {
        Instant now = clock.instant();
        evictStale(now);
        AgentHistory history = histories.computeIfAbsent(agentId, id -> new AgentHistory());
        history.calls.addLast(new ToolCallRecord(tool, fingerprint, success));
        while (history.calls.size() > Math.max(1, settings.getMaxToolCallHistory())) {
            history.calls.removeFirst();
        }
        history.lastActivity = now;
        evictOverflow();
    }

    /**
     * Whether the agent failed the identical call at least
     * {@code consecutiveFailureThreshold} times since that tool last
     * succeeded.
     */
    public synchronized boolean detectRepeatedFailures(String agentId, String tool, String fingerprint) {
        AgentHistory history = histories.get(agentId);
        if (history == null) {
            return false;
        }
        int threshold = settings.getConsecutiveFailureThreshold();
        int failures = 0;
        Iterator<ToolCallRecord> newestFirst = history.calls.descendingIterator();
        while (newestFirst.hasNext()) {
            ToolCallRecord call = newestFirst.next();
            if (!call.tool().equals(tool)) {
                continue;
            }
            if (call.success()) {
                break;
            }
            if (call.fingerprint().equals(fingerprint)) {
                failures++;
                if (failures >= threshold) {
                    log.warn("[LoopBreaker] Agent {} repeated failing call to '{}' {} times", agentId, tool,
                            failures);
                    metrics.recordLoopDetection(AgentMetrics.LOOP_REPEATED_FAILURE);
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whether the newest calls are the same call repeated at least
     * {@code hardStopThreshold} times. Always false while the threshold is 0.
     */
    public synchronized boolean shouldHardStop(String agentId, String tool, String fingerprint) {
        int threshold = settings.getHardStopThreshold();
        if (threshold <= 0) {
            return false;
        }
        AgentHistory history = histories.get(agentId);
        if (history == null) {
            return false;
        }
        int repeats = 0;
        Iterator<ToolCallRecord> newestFirst = history.calls.descendingIterator();
        while (newestFirst.hasNext()) {
            ToolCallRecord call = newestFirst.next();
            if (!call.tool().equals(tool) || !call.fingerprint().equals(fingerprint)) {
                break;
            }
            repeats++;
        }
        if (repeats < threshold) {
            return false;
        }
        metrics.recordLoopDetection(AgentMetrics.LOOP_HARD_STOP);
        return true;
    }

    public synchronized int historySize(String agentId) {
        AgentHistory history = histories.get(agentId);
        return history == null ? 0 : history.calls.size();
    }

    public synchronized int trackedAgents() {
        return histories.size();
    }

    public synchronized void reset(String agentId) {
        histories.remove(agentId);
    }

    private void evictStale(Instant now) {
        Instant cutoff = now.minus(settings.getHistoryTtl());
        histories.values().removeIf(history -> history.lastActivity.isBefore(cutoff));
    }

    private void evictOverflow() {
        int max = Math.max(1, settings.getMaxTrackedAgents());
        Iterator<String> leastRecent = histories.keySet().iterator();
        while (histories.size() > max && leastRecent.hasNext()) {
            String agentId = leastRecent.next();
            leastRecent.remove();
            log.debug("[LoopBreaker] Evicted history of agent {}", agentId);
        }
    }
}
