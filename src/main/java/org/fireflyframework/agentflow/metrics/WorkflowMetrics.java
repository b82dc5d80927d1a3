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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.model.ExecutionMetrics;
import org.fireflyframework.agentflow.model.TaskStatus;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publishes agent workflow activity to Micrometer.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>run.started</b> - Counter of runs started</li>
 *   <li><b>run.completed</b> - Counter of runs completed (tags: outcome)</li>
 *   <li><b>run.duration</b> - Timer for run duration (tags: outcome)</li>
 *   <li><b>run.active</b> - Gauge of runs in progress</li>
 *   <li><b>task.started</b> - Counter of tasks started (tags: task)</li>
 *   <li><b>task.completed</b> - Counter of tasks finished (tags: task, status)</li>
 *   <li><b>task.duration</b> - Timer for task duration (tags: task, status)</li>
 *   <li><b>task.retries</b> - Counter of retries (tags: task)</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.agentflow.".
 */
@Slf4j
public class WorkflowMetrics {

    private static final String METRIC_PREFIX = "firefly.agentflow.";

    private static final String TAG_TASK = "task";
    private static final String TAG_STATUS = "status";
    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeRuns = new AtomicInteger();

    public WorkflowMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(METRIC_PREFIX + "run.active", activeRuns, AtomicInteger::get)
                .description("Number of workflow runs in progress")
                .register(meterRegistry);
        log.info("WorkflowMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    // ==================== Run Metrics ====================

    public void recordRunStarted() {
        Counter.builder(METRIC_PREFIX + "run.started")
                .description("Number of workflow runs started")
                .register(meterRegistry)
                .increment();
        activeRuns.incrementAndGet();
    }

    /**
     * Records a finished run from its summary.
     *
     * @param metrics the run summary
     */
    public void recordRunCompleted(ExecutionMetrics metrics) {
        String outcome = outcomeOf(metrics);

        Counter.builder(METRIC_PREFIX + "run.completed")
                .description("Number of workflow runs completed")
                .tag(TAG_OUTCOME, outcome)
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "run.duration")
                .description("Workflow run duration")
                .tag(TAG_OUTCOME, outcome)
                .register(meterRegistry)
                .record(metrics.totalDuration());

        activeRuns.updateAndGet(current -> current > 0 ? current - 1 : 0);

        log.debug("METRIC: run.completed runId={}, outcome={}, durationMs={}",
                metrics.runId(), outcome, metrics.totalDuration().toMillis());
    }

    // ==================== Task Metrics ====================

    public void recordTaskStarted(String taskName) {
        Counter.builder(METRIC_PREFIX + "task.started")
                .description("Number of tasks started")
                .tag(TAG_TASK, taskName)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Records a task reaching a terminal state.
     *
     * @param taskName the task name
     * @param status the terminal status
     * @param duration the task duration
     */
    public void recordTaskCompleted(String taskName, TaskStatus status, Duration duration) {
        String statusTag = status.name().toLowerCase();

        Counter.builder(METRIC_PREFIX + "task.completed")
                .description("Number of tasks finished")
                .tag(TAG_TASK, taskName)
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "task.duration")
                .description("Task duration including retries")
                .tag(TAG_TASK, taskName)
                .tag(TAG_STATUS, statusTag)
                .register(meterRegistry)
                .record(duration != null ? duration : Duration.ZERO);

        log.debug("METRIC: task.completed task={}, status={}", taskName, status);
    }

    public void recordTaskRetry(String taskName, int attempt) {
        Counter.builder(METRIC_PREFIX + "task.retries")
                .description("Number of task retry attempts")
                .tag(TAG_TASK, taskName)
                .register(meterRegistry)
                .increment();

        log.debug("METRIC: task.retry task={}, attempt={}", taskName, attempt);
    }

    private String outcomeOf(ExecutionMetrics metrics) {
        if (metrics.cancelledCount() > 0) {
            return "cancelled";
        }
        if (metrics.failureCount() == 0) {
            return "succeeded";
        }
        return metrics.successCount() == 0 ? "failed" : "partial";
    }
}
