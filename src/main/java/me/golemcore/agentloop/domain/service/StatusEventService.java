package me.golemcore.agentloop.domain.service;

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
import me.golemcore.agentloop.domain.model.StatusUpdate;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.port.outbound.StatusListener;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Broadcasts public progress updates to registered listeners and to a hot
 * {@link Flux}. Delivery is best-effort: a failing listener is logged and the
 * agent keeps running.
 */
@Slf4j
public class StatusEventService {

    private final Clock clock;
    private final AgentLoopProperties properties;
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Sinks.Many<StatusUpdate> sink = Sinks.many().multicast().directBestEffort();

    public StatusEventService(Clock clock, AgentLoopProperties properties, List<StatusListener> listeners) {
        this.clock = clock;
        this.properties = properties;
        if (listeners != null) {
            for (StatusListener listener : listeners) {
                if (listener != null) {
                    this.listeners.add(listener);
                }
            }
        }
    }

    public void addListener(StatusListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(StatusListener listener) {
        listeners.remove(listener);
    }

    /**
     * Hot stream of updates; subscribers only see updates emitted after they
     * subscribe.
     */
    public Flux<StatusUpdate> updates() {
        return sink.asFlux();
    }

    public StatusUpdate emit(String agentId, int turnIndex, String title, String details, String nextStepHint,
            Integer progressPct) {
        if (!properties.getStatus().isEmitPublicStatus()) {
            return null;
        }
        StatusUpdate update = StatusUpdate.builder()
                .agentId(agentId)
                .turnIndex(turnIndex)
                .statusTitle(title)
                .statusDetails(details)
                .nextStepHint(nextStepHint)
                .progressPct(progressPct)
                .timestamp(Instant.now(clock))
                .build();

        for (StatusListener listener : listeners) {
            try {
                listener.onStatusUpdate(update);
            } catch (RuntimeException e) {
                log.warn("[Status] Listener {} failed for agent {}", listener.getClass().getSimpleName(), agentId,
                        e);
            }
        }

        Sinks.EmitResult result = sink.tryEmitNext(update);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[Status] Dropped update for agent {}: {}", agentId, result);
        }
        return update;
    }
}
