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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of a completed workflow run.
 * <p>
 * {@code results} holds exactly one entry per planned task, in plan order,
 * whatever the outcome of the individual tasks.
 *
 * @param runId the run identifier
 * @param results task name to final task result
 * @param metrics the aggregate metrics of the run
 */
public record WorkflowReport(
        String runId,
        Map<String, TaskResult> results,
        ExecutionMetrics metrics
) {

    public WorkflowReport {
        Objects.requireNonNull(runId, "runId cannot be null");
        Objects.requireNonNull(metrics, "metrics cannot be null");
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public Optional<TaskResult> result(String taskName) {
        return Optional.ofNullable(results.get(taskName));
    }

    /**
     * Gets the output of a succeeded task.
     *
     * @param taskName the task name
     * @return the output, or empty if the task did not succeed
     */
    public Optional<String> output(String taskName) {
        return result(taskName)
                .filter(TaskResult::isSucceeded)
                .map(TaskResult::output);
    }

    /**
     * Gets the text to render for a task, substituting a placeholder for tasks
     * that did not produce output.
     *
     * @param taskName the task name
     * @return output or placeholder text
     */
    public String outputOrPlaceholder(String taskName) {
        return result(taskName)
                .map(TaskResult::outputOrPlaceholder)
                .orElse("[generation skipped]");
    }

    public List<String> failedTasks() {
        return results.values().stream()
                .filter(TaskResult::isFailed)
                .map(TaskResult::taskName)
                .toList();
    }

    public boolean allSucceeded() {
        return results.values().stream().allMatch(TaskResult::isSucceeded);
    }
}
