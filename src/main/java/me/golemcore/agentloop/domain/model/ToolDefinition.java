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

import java.util.List;
import java.util.Map;

/**
 * Tool description shown to the model. The input schema is optional; tools
 * without one get no required-field validation and are not offered through
 * native function calling.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    public boolean hasInputSchema() {
        return inputSchema != null && !inputSchema.isEmpty();
    }

    /**
     * Names listed in the schema's {@code required} array.
     */
    public List<String> requiredParams() {
        if (inputSchema == null) {
            return List.of();
        }
        Object required = inputSchema.get("required");
        if (!(required instanceof List<?> names)) {
            return List.of();
        }
        return names.stream()
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .toList();
    }
}
