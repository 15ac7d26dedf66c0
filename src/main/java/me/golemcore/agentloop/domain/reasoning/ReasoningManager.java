package me.golemcore.agentloop.domain.reasoning;

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
import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.ToolDefinition;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches reasoning requests to the engine registered for the type.
 * {@link ReasoningType#NONE} and types without an engine produce an
 * unsuccessful result.
 */
@Slf4j
public class ReasoningManager {

    private final Map<ReasoningType, ReasoningEngine> engines = new EnumMap<>(ReasoningType.class);

    public ReasoningManager(List<ReasoningEngine> engines) {
        for (ReasoningEngine engine : engines) {
            if (this.engines.putIfAbsent(engine.getType(), engine) != null) {
                log.warn("[Reasoning] Duplicate engine for {}, keeping the first", engine.getType());
            }
        }
    }

    public ReasoningResult reason(ReasoningType type, String goal, String context, List<ToolDefinition> tools) {
        ReasoningEngine engine = type != null ? engines.get(type) : null;
        if (engine == null) {
            return ReasoningResult.failure("Unsupported reasoning type: " + type, Duration.ZERO);
        }
        log.debug("[Reasoning] Running {} reasoning", type);
        ReasoningResult result = engine.reason(goal, context, tools);
        log.info("[Reasoning] {} finished: success={}, confidence={}", type, result.isSuccess(),
                result.getConfidence());
        return result;
    }

    public boolean supports(ReasoningType type) {
        return type != null && engines.containsKey(type);
    }
}
