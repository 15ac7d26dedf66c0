package me.golemcore.agentloop.port.outbound;

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

import me.golemcore.agentloop.domain.model.FunctionCallResult;
import me.golemcore.agentloop.domain.model.FunctionSpec;
import me.golemcore.agentloop.domain.model.LlmCompletion;
import me.golemcore.agentloop.domain.model.LlmMessage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for integrating with LLM providers. Provides plain completion and,
 * where the provider supports it, native function calling.
 *
 * <p>
 * Deadlines are applied by callers; implementations should not block the
 * calling thread.
 */
public interface LlmPort {

    /**
     * Executes a plain chat completion.
     */
    CompletableFuture<LlmCompletion> complete(List<LlmMessage> messages);

    /**
     * Executes a completion offering the given functions. Default
     * implementation throws UnsupportedOperationException; providers should
     * override together with {@link #supportsFunctionCalling()}.
     */
    default CompletableFuture<FunctionCallResult> completeWithFunctions(List<LlmMessage> messages,
            List<FunctionSpec> functions) {
        throw new UnsupportedOperationException("Function calling not supported by this provider");
    }

    /**
     * Checks if this provider supports native function calling.
     */
    default boolean supportsFunctionCalling() {
        return false;
    }
}
