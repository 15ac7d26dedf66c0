package me.golemcore.agentloop.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of decisions the model can take on a turn. Consumers switch over
 * this enum exhaustively, so adding a constant is a compile-time checked
 * change.
 */
public enum AgentAction {

    /**
     * Model is still planning; no side effects.
     */
    PLAN("plan"),

    /**
     * Model wants a tool invoked with the supplied params.
     */
    TOOL_CALL("tool_call"),

    /**
     * Model considers the goal reached and provides the final text.
     */
    FINISH("finish"),

    /**
     * Model asks for another attempt after a failure.
     */
    RETRY("retry");

    private final String wireName;

    AgentAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup by wire name.
     *
     * @return the matching action or {@code null} when nothing matches
     */
    @JsonCreator
    public static AgentAction fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentAction action : values()) {
            if (action.wireName.equals(normalized)) {
                return action;
            }
        }
        return null;
    }
}
