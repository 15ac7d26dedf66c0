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

import me.golemcore.agentloop.domain.model.LlmCompletion;
import me.golemcore.agentloop.domain.model.LlmMessage;
import me.golemcore.agentloop.domain.parser.ChainOfThoughtResponse;
import me.golemcore.agentloop.domain.parser.ResilientResponseParser;
import me.golemcore.agentloop.domain.parser.TreeOfThoughtsResponse;
import me.golemcore.agentloop.domain.service.CallDeadlines;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import me.golemcore.agentloop.port.outbound.LlmPort;

import java.util.List;

/**
 * Single-shot LLM calls for reasoning engines: one system plus one user
 * message, awaited under the LLM deadline, parsed leniently.
 */
public class ReasoningLlmClient {

    static final String SYSTEM_PROMPT = "You are a careful reasoning assistant. "
            + "Answer with a single JSON object in the requested shape and nothing else.";

    private final LlmPort llmPort;
    private final ResilientResponseParser parser;
    private final AgentLoopProperties properties;

    public ReasoningLlmClient(LlmPort llmPort, ResilientResponseParser parser, AgentLoopProperties properties) {
        this.llmPort = llmPort;
        this.parser = parser;
        this.properties = properties;
    }

    public ChainOfThoughtResponse askChain(String prompt) {
        return parser.parseChainResponse(complete(prompt));
    }

    public TreeOfThoughtsResponse askTree(String prompt) {
        return parser.parseTreeResponse(complete(prompt));
    }

    private String complete(String prompt) {
        List<LlmMessage> messages = List.of(LlmMessage.system(SYSTEM_PROMPT), LlmMessage.user(prompt));
        LlmCompletion completion = CallDeadlines.await(llmPort.complete(messages),
                properties.getTurn().getLlmTimeout());
        return completion != null ? completion.getContent() : null;
    }
}
