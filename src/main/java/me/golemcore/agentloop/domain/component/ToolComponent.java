package me.golemcore.agentloop.domain.component;

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

import me.golemcore.agentloop.domain.model.ToolDefinition;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executable tool the model can call by name. The tool's business logic is
 * opaque to the orchestrator: a completed future is a success, an
 * exceptionally completed one is a failure.
 *
 * <p>
 * Tools may additionally implement {@link DedupeControl} to opt out of result
 * reuse or to set their own cache TTL.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition. The input schema inside it is optional.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future with the tool output (any JSON-serialisable value)
     */
    CompletableFuture<Object> execute(Map<String, Object> parameters);

    /**
     * Returns the unique, case-sensitive name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
