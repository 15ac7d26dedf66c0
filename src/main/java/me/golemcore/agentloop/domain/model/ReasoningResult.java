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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a reasoning engine run. Engines report failures through
 * {@code success=false} and {@code error} instead of throwing.
 */
@Data
@Builder
public class ReasoningResult {

    private boolean success;
    private String conclusion;
    private double confidence;
    private Duration executionTime;
    private ReasoningChain chain;
    private ReasoningTree tree;
    private String error;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static ReasoningResult failure(String error, Duration executionTime) {
        return ReasoningResult.builder()
                .success(false)
                .error(error)
                .executionTime(executionTime)
                .build();
    }
}
