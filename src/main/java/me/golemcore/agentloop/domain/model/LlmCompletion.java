package me.golemcore.agentloop.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Plain completion returned by {@code LlmPort#complete}.
 */
@Data
@Builder
public class LlmCompletion {

    private String content;
    private LlmUsage usage;
}
