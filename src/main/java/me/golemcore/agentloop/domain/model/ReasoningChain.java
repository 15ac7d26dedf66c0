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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Linear reasoning record. Steps are append-only and numbered from 1.
 */
@Data
@NoArgsConstructor
public class ReasoningChain {

    private String goal;
    private List<ReasoningStep> steps = new ArrayList<>();

    @JsonProperty("complete")
    private boolean complete;

    @JsonProperty("final_conclusion")
    private String finalConclusion;

    @JsonProperty("final_confidence")
    private double finalConfidence;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("total_execution_time")
    private Duration totalExecutionTime = Duration.ZERO;

    public ReasoningChain(String goal) {
        this.goal = goal;
    }

    /**
     * Appends a step with the next sequential number and a clamped confidence.
     */
    public ReasoningStep addStep(String content, ReasoningStepType stepType, double confidence,
            List<String> insights, Duration executionTime) {
        ReasoningStep step = ReasoningStep.builder()
                .stepNumber(steps.size() + 1)
                .content(content)
                .stepType(stepType)
                .confidence(clamp(confidence))
                .insights(insights != null ? new ArrayList<>(insights) : new ArrayList<>())
                .executionTime(executionTime != null ? executionTime : Duration.ZERO)
                .build();
        steps.add(step);
        return step;
    }

    public void complete(String conclusion, double confidence, Instant completedAt) {
        this.finalConclusion = conclusion;
        this.finalConfidence = clamp(confidence);
        this.completedAt = completedAt;
        this.complete = true;
        this.totalExecutionTime = steps.stream()
                .map(ReasoningStep::getExecutionTime)
                .reduce(Duration.ZERO, Duration::plus);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
