package me.golemcore.agentloop.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a function-calling completion. Without a function name the model
 * answered in plain text, held in {@code assistantContent}.
 */
@Data
@Builder
public class FunctionCallResult {

    private String functionName;
    private String argumentsJson;
    private String assistantContent;
    private LlmUsage usage;

    public boolean hasFunctionCall() {
        return functionName != null && !functionName.isBlank();
    }

    public static FunctionCallResult textOnly(String assistantContent) {
        return FunctionCallResult.builder()
                .assistantContent(assistantContent)
                .build();
    }
}
