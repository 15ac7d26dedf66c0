package me.golemcore.agentloop.domain.reasoning;

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
import me.golemcore.agentloop.domain.model.ReasoningChain;
import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningStep;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.parser.ChainOfThoughtResponse;
import me.golemcore.agentloop.domain.service.AgentCancelledException;
import me.golemcore.agentloop.domain.service.CallDeadlines;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Linear reasoning: analysis, planning, strategy and evaluation, one LLM call
 * each.
 *
 * <p>
 * Every phase runs unless {@code maxReasoningSteps} is reached first; only the
 * evaluation phase may supply the conclusion. Without one the last step's
 * content is used. Final confidence is the mean of the
 * step confidences. With validation enabled, an extra call reviews the chain
 * and a rejected low-confidence chain fails the run.
 */
@Slf4j
public class ChainOfThoughtEngine implements ReasoningEngine {

    private static final double NO_STEPS_CONFIDENCE = 0.5;

    private final ReasoningLlmClient llm;
    private final AgentLoopProperties.ReasoningProperties settings;
    private final Clock clock;

    public ChainOfThoughtEngine(ReasoningLlmClient llm, AgentLoopProperties properties, Clock clock) {
        this.llm = llm;
        this.settings = properties.getReasoning();
        this.clock = clock;
    }

    @Override
    public ReasoningType getType() {
        return ReasoningType.CHAIN_OF_THOUGHT;
    }

    @Override
    public ReasoningResult reason(String goal, String context, List<ToolDefinition> tools) {
        Instant started = clock.instant();
        ReasoningChain chain = new ReasoningChain(goal);
        try {
            List<String> insights = new ArrayList<>();
            String conclusion = null;

            for (ChainPhase phase : ChainPhase.values()) {
                if (chain.getSteps().size() >= settings.getMaxReasoningSteps()) {
                    break;
                }
                Instant phaseStarted = clock.instant();
                ChainOfThoughtResponse response = llm.askChain(
                        ReasoningPrompts.chainPhase(phase, goal, context, tools, insights));
                chain.addStep(response.getReasoning(), phase.stepType(), response.getConfidence(),
                        response.getInsights(), Duration.between(phaseStarted, clock.instant()));
                insights.addAll(response.getInsights());
                log.debug("[Reasoning] Chain phase {} done, confidence {}", phase, response.getConfidence());

                if (phase == ChainPhase.EVALUATION && response.hasConclusion()) {
                    conclusion = response.getConclusion();
                    break;
                }
            }

            if (chain.getSteps().isEmpty()) {
                return failure(chain, "No reasoning steps completed", started);
            }
            if (conclusion == null) {
                conclusion = chain.getSteps().get(chain.getSteps().size() - 1).getContent();
            }

            double confidence = averageConfidence(chain.getSteps());
            chain.complete(conclusion, confidence, clock.instant());

            if (settings.isEnableValidation() && !passesValidation(chain, confidence)) {
                String error = String.format(Locale.ROOT, "Reasoning confidence %.2f below threshold %.2f",
                        confidence, settings.getMinConfidence());
                log.info("[Reasoning] Chain rejected: {}", error);
                return failure(chain, error, started);
            }

            ReasoningResult result = ReasoningResult.builder()
                    .success(true)
                    .conclusion(conclusion)
                    .confidence(confidence)
                    .chain(chain)
                    .executionTime(Duration.between(started, clock.instant()))
                    .build();
            result.getMetadata().put("steps_completed", chain.getSteps().size());
            result.getMetadata().put("total_insights", insights.size());
            result.getMetadata().put("reasoning_type", "ChainOfThought");
            return result;
        } catch (AgentCancelledException e) {
            return failure(chain, "Reasoning cancelled", started);
        } catch (RuntimeException e) {
            log.warn("[Reasoning] Chain of thought failed: {}", CallDeadlines.safeCauseMessage(e));
            return failure(chain, "Chain of thought failed: " + CallDeadlines.safeCauseMessage(e), started);
        }
    }

    private boolean passesValidation(ReasoningChain chain, double confidence) {
        ChainOfThoughtResponse review;
        try {
            review = llm.askChain(ReasoningPrompts.chainValidation(chain));
        } catch (AgentCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Reasoning] Validation call failed, accepting chain: {}", CallDeadlines.safeCauseMessage(e));
            return true;
        }
        return review.isValid() || confidence >= settings.getMinConfidence();
    }

    private static double averageConfidence(List<ReasoningStep> steps) {
        return steps.stream()
                .mapToDouble(ReasoningStep::getConfidence)
                .average()
                .orElse(NO_STEPS_CONFIDENCE);
    }

    private ReasoningResult failure(ReasoningChain chain, String error, Instant started) {
        ReasoningResult result = ReasoningResult.failure(error, Duration.between(started, clock.instant()));
        result.setChain(chain);
        return result;
    }
}
