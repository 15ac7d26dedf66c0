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

import lombok.Builder;
import lombok.Data;

/**
 * Chat message sent to an LLM provider.
 */
@Data
@Builder
public class LlmMessage {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;
    private String content;

    public static LlmMessage system(String content) {
        return LlmMessage.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static LlmMessage user(String content) {
        return LlmMessage.builder().role(ROLE_USER).content(content).build();
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }
}
