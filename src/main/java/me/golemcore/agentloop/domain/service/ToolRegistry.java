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
import me.golemcore.agentloop.domain.component.ToolComponent;
import me.golemcore.agentloop.domain.model.FunctionSpec;
import me.golemcore.agentloop.domain.model.ToolDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable name to tool lookup for one run. Names are matched exactly,
 * case included; disabled tools are skipped.
 */
@Slf4j
public final class ToolRegistry {

    private final Map<String, ToolComponent> tools;

    private ToolRegistry(Map<String, ToolComponent> tools) {
        this.tools = Collections.unmodifiableMap(tools);
    }

    public static ToolRegistry of(Collection<? extends ToolComponent> components) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        if (components != null) {
            for (ToolComponent tool : components) {
                if (tool == null || !tool.isEnabled()) {
                    continue;
                }
                String name = tool.getToolName();
                if (name == null || name.isBlank()) {
                    log.warn("[Tools] Skipping tool without a name: {}", tool.getClass().getSimpleName());
                    continue;
                }
                if (byName.putIfAbsent(name, tool) != null) {
                    log.warn("[Tools] Duplicate tool name '{}', keeping the first registration", name);
                }
            }
        }
        return new ToolRegistry(byName);
    }

    public static ToolRegistry empty() {
        return new ToolRegistry(new LinkedHashMap<>());
    }

    public ToolComponent get(String name) {
        return name == null ? null : tools.get(name);
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public Collection<ToolComponent> all() {
        return tools.values();
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    /**
     * Function specs for the tools that expose an input schema.
     */
    public List<FunctionSpec> functionSpecs() {
        return tools.values().stream()
                .map(ToolComponent::getDefinition)
                .filter(ToolDefinition::hasInputSchema)
                .map(FunctionSpec::fromDefinition)
                .toList();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }
}
