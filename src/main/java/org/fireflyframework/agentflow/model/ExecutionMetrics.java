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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate performance and outcome summary of one workflow run.
 * <p>
 * Serializes with Jackson to a flat record:
 * <pre>
 * {
 *   "run_id": "...", "total_duration": 12.5, "total_tasks": 6,
 *   "success_count": 5, "failure_count": 1, "cancelled_count": 0,
 *   "total_retries": 2, "success_rate": 0.833,
 *   "per_task": { "overview": { "duration": 3.1, "attempts": 1, ... } }
 * }
 * </pre>
 * {@code totalTasks} counts the tasks that were actually started, so
 * {@code successCount + failureCount == totalTasks} always holds.
 */
@JsonPropertyOrder({"run_id", "total_duration", "total_tasks", "success_count", "failure_count",
        "cancelled_count", "total_retries", "success_rate", "per_task"})
public record ExecutionMetrics(
        @JsonProperty("run_id") String runId,
        @JsonIgnore Instant startedAt,
        @JsonIgnore Instant endedAt,
        @JsonIgnore Duration totalDuration,
        @JsonProperty("total_tasks") int totalTasks,
        @JsonProperty("success_count") int successCount,
        @JsonProperty("failure_count") int failureCount,
        @JsonProperty("cancelled_count") int cancelledCount,
        @JsonProperty("total_retries") int totalRetries,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("per_task") Map<String, TaskMetrics> perTask
) {

    public ExecutionMetrics {
        perTask = perTask == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perTask));
    }

    /**
     * Computes the success rate, defined as 0 when no task ran.
     *
     * @param successCount the number of succeeded tasks
     * @param totalTasks the number of started tasks
     * @return success ratio in [0, 1]
     */
    public static double successRate(int successCount, int totalTasks) {
        return totalTasks == 0 ? 0.0 : (double) successCount / totalTasks;
    }

    /**
     * Total duration in seconds, as exported to logging and telemetry collaborators.
     */
    @JsonProperty("total_duration")
    public double totalDurationSeconds() {
        return totalDuration != null ? totalDuration.toMillis() / 1000.0 : 0.0;
    }

    /**
     * Converts the summary into a flat map with the same keys as the JSON form.
     *
     * @return ordered map view of this summary
     */
    public Map<String, Object> toFlatMap() {
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("run_id", runId);
        flat.put("total_duration", totalDurationSeconds());
        flat.put("total_tasks", totalTasks);
        flat.put("success_count", successCount);
        flat.put("failure_count", failureCount);
        flat.put("cancelled_count", cancelledCount);
        flat.put("total_retries", totalRetries);
        flat.put("success_rate", successRate);

        Map<String, Object> tasks = new LinkedHashMap<>();
        perTask.forEach((name, metrics) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("duration", metrics.durationSeconds());
            entry.put("attempts", metrics.attempts());
            entry.put("retries", metrics.retries());
            entry.put("output_size", metrics.outputSize());
            entry.put("status", metrics.status() != null ? metrics.status().name() : null);
            if (metrics.failureReason() != null) {
                entry.put("failure_reason", metrics.failureReason());
            }
            tasks.put(name, entry);
        });
        flat.put("per_task", tasks);
        return flat;
    }
}
