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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a tool invocation (real or served from the idempotency cache).
 * Treated as immutable once it is stored in a turn.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolExecutionResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private Object output;
    private String error;

    @JsonProperty("failure_kind")
    private ToolFailureKind failureKind;

    private String tool;
    private Map<String, Object> params;

    @JsonProperty("turn_id")
    private String turnId;

    @JsonProperty("execution_time")
    private Duration executionTime;

    @JsonProperty("created_at")
    private Instant createdAt;

    /**
     * Creates a failed result for a call that never reached the tool.
     */
    public static ToolExecutionResult failure(ToolCallRequest call, ToolFailureKind kind, String error,
            Object output) {
        return ToolExecutionResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .output(output)
                .tool(call.getTool())
                .params(call.getParams())
                .turnId(call.getTurnId())
                .executionTime(Duration.ZERO)
                .build();
    }
}
