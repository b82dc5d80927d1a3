/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.agentflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Per-task entry of an {@link ExecutionMetrics} summary.
 *
 * @param taskName the task name
 * @param status the terminal status of the task
 * @param duration time between first attempt start and terminal state
 * @param attempts number of attempts made
 * @param retries number of retries scheduled
 * @param outputSize length of the produced output, 0 when none
 * @param failureReason the last error message for failed tasks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskMetrics(
        @JsonIgnore String taskName,
        @JsonProperty("status") TaskStatus status,
        @JsonIgnore Duration duration,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("retries") int retries,
        @JsonProperty("output_size") int outputSize,
        @JsonProperty("failure_reason") String failureReason
) {

    /**
     * Duration in seconds, as exported to logging and telemetry collaborators.
     */
    @JsonProperty("duration")
    public double durationSeconds() {
        return duration != null ? duration.toMillis() / 1000.0 : 0.0;
    }
}
