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

package org.fireflyframework.agentflow.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.exception.AgentflowException;
import org.fireflyframework.agentflow.model.ExecutionMetrics;
import org.fireflyframework.agentflow.model.TaskMetrics;

import java.util.Map;

/**
 * Renders run summaries for logs and telemetry collaborators.
 */
@Slf4j
public class MetricsReporter {

    private final ObjectMapper objectMapper;

    public MetricsReporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes a summary to its flat JSON form.
     *
     * @param metrics the summary
     * @return JSON text
     */
    public String toJson(ExecutionMetrics metrics) {
        try {
            return objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new AgentflowException("Failed to serialize metrics for run " + metrics.runId(), e);
        }
    }

    /**
     * Logs the per-task table and the totals of a run.
     *
     * @param metrics the summary
     */
    public void logSummary(ExecutionMetrics metrics) {
        log.info("RUN_SUMMARY: runId={}, totalDuration={}s, tasks={}, succeeded={}, failed={}, cancelled={}, retries={}, successRate={}",
                metrics.runId(),
                String.format("%.2f", metrics.totalDurationSeconds()),
                metrics.totalTasks(),
                metrics.successCount(),
                metrics.failureCount(),
                metrics.cancelledCount(),
                metrics.totalRetries(),
                String.format("%.1f%%", metrics.successRate() * 100));

        for (Map.Entry<String, TaskMetrics> entry : metrics.perTask().entrySet()) {
            TaskMetrics task = entry.getValue();
            log.info("  {} status={}, duration={}s, attempts={}, outputSize={}{}",
                    entry.getKey(),
                    task.status(),
                    String.format("%.2f", task.durationSeconds()),
                    task.attempts(),
                    task.outputSize(),
                    task.failureReason() != null ? ", reason=" + task.failureReason() : "");
        }
    }
}
