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
import me.golemcore.agentloop.domain.model.ReasoningResult;
import me.golemcore.agentloop.domain.model.ReasoningType;
import me.golemcore.agentloop.domain.model.ToolDefinition;
import me.golemcore.agentloop.domain.service.CallDeadlines;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs chain-of-thought and tree-of-thoughts concurrently and merges them.
 * Each side builds its own chain or tree, so nothing is shared between the two
 * tasks.
 *
 * <p>
 * Combined confidence is {@code 0.6 * chain + 0.4 * tree}; when only one side
 * succeeds its result is used alone.
 */
@Slf4j
public class HybridReasoningEngine implements ReasoningEngine {

    static final double CHAIN_WEIGHT = 0.6;
    static final double TREE_WEIGHT = 0.4;

    private final ChainOfThoughtEngine chainEngine;
    private final TreeOfThoughtsEngine treeEngine;
    private final Executor executor;
    private final Clock clock;

    public HybridReasoningEngine(ChainOfThoughtEngine chainEngine, TreeOfThoughtsEngine treeEngine,
            Executor executor, Clock clock) {
        this.chainEngine = chainEngine;
        this.treeEngine = treeEngine;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public ReasoningType getType() {
        return ReasoningType.HYBRID;
    }

    @Override
    public ReasoningResult reason(String goal, String context, List<ToolDefinition> tools) {
        Instant started = clock.instant();
        CompletableFuture<ReasoningResult> chainFuture = CompletableFuture
                .supplyAsync(() -> chainEngine.reason(goal, context, tools), executor);
        CompletableFuture<ReasoningResult> treeFuture = CompletableFuture
                .supplyAsync(() -> treeEngine.reason(goal, context, tools), executor);

        ReasoningResult chain = join(chainFuture, started);
        ReasoningResult tree = join(treeFuture, started);
        return combine(chain, tree, Duration.between(started, clock.instant()));
    }

    private ReasoningResult join(CompletableFuture<ReasoningResult> future, Instant started) {
        try {
            return future.join();
        } catch (CompletionException e) {
            log.warn("[Reasoning] Hybrid branch failed: {}", CallDeadlines.safeCauseMessage(e));
            return ReasoningResult.failure(CallDeadlines.safeCauseMessage(e),
                    Duration.between(started, clock.instant()));
        }
    }

    ReasoningResult combine(ReasoningResult chain, ReasoningResult tree, Duration elapsed) {
        String conclusion;
        double confidence;
        if (chain.isSuccess() && tree.isSuccess()) {
            conclusion = "Analysis: " + chain.getConclusion() + "\n\nExploration: " + tree.getConclusion();
            confidence = CHAIN_WEIGHT * chain.getConfidence() + TREE_WEIGHT * tree.getConfidence();
        } else if (chain.isSuccess()) {
            conclusion = "Analysis: " + chain.getConclusion();
            confidence = chain.getConfidence();
        } else if (tree.isSuccess()) {
            conclusion = "Exploration: " + tree.getConclusion();
            confidence = tree.getConfidence();
        } else {
            ReasoningResult failed = ReasoningResult.failure(
                    "Both reasoning methods failed: chain=" + chain.getError() + ", tree=" + tree.getError(),
                    elapsed);
            failed.setChain(chain.getChain());
            failed.setTree(tree.getTree());
            addMetadata(failed, chain, tree, 0.0);
            return failed;
        }

        ReasoningResult result = ReasoningResult.builder()
                .success(true)
                .conclusion(conclusion)
                .confidence(confidence)
                .chain(chain.getChain())
                .tree(tree.getTree())
                .executionTime(elapsed)
                .build();
        addMetadata(result, chain, tree, confidence);
        return result;
    }

    private static void addMetadata(ReasoningResult result, ReasoningResult chain, ReasoningResult tree,
            double combined) {
        result.getMetadata().put("method", "hybrid");
        result.getMetadata().put("chain_confidence", chain.getConfidence());
        result.getMetadata().put("tree_confidence", tree.getConfidence());
        result.getMetadata().put("combined_confidence", combined);
        result.getMetadata().put("chain_success", chain.isSuccess());
        result.getMetadata().put("tree_success", tree.isSuccess());
    }
}
