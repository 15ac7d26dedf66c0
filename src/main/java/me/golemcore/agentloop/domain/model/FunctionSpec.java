package me.golemcore.agentloop.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Native function-calling declaration built from a tool's input schema.
 */
@Data
@Builder
public class FunctionSpec {

    private String name;
    private String description;
    private Map<String, Object> parametersSchema;

    public static FunctionSpec fromDefinition(ToolDefinition definition) {
        return FunctionSpec.builder()
                .name(definition.getName())
                .description(definition.getDescription())
                .parametersSchema(definition.getInputSchema())
                .build();
    }
}
