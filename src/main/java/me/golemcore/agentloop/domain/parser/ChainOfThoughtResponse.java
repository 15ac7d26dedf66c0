package me.golemcore.agentloop.domain.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One chain-of-thought phase answer.
 */
@Value
@Builder
public class ChainOfThoughtResponse {

    String reasoning;
    double confidence;
    List<String> insights;
    String conclusion;
    boolean valid;
    String error;

    public boolean hasConclusion() {
        return conclusion != null && !conclusion.isBlank();
    }
}
