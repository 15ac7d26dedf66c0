package me.golemcore.agentloop.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasoningStep {

    @JsonProperty("step_number")
    private int stepNumber;

    private String content;

    @JsonProperty("step_type")
    private ReasoningStepType stepType;

    private double confidence;

    @Builder.Default
    private List<String> insights = new ArrayList<>();

    @JsonProperty("execution_time")
    private Duration executionTime;
}
