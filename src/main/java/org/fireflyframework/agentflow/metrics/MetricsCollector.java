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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.model.ExecutionMetrics;
import org.fireflyframework.agentflow.model.TaskMetrics;
import org.fireflyframework.agentflow.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects timing and outcome data for the tasks of one workflow run.
 * <p>
 * This is the shared mutable state of a run: tasks of the same stage report
 * concurrently, so every operation takes the collector's lock.
 */
@Slf4j
public class MetricsCollector {

    private final String runId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TaskRecord> tasks = new LinkedHashMap<>();
    private Instant startedAt;
    private Instant endedAt;
    private int totalRetries;

    public MetricsCollector(String runId) {
        this.runId = runId;
    }

    /**
     * Marks the start of the run.
     */
    public void start() {
        lock.lock();
        try {
            startedAt = Instant.now();
            endedAt = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of the run; the summary duration is frozen from here on.
     */
    public void finish() {
        lock.lock();
        try {
            endedAt = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    public void recordStart(String taskName) {
        lock.lock();
        try {
            TaskRecord record = tasks.computeIfAbsent(taskName, n -> new TaskRecord());
            record.startedAt = Instant.now();
            record.status = TaskStatus.RUNNING;
        } finally {
            lock.unlock();
        }
        log.debug("METRIC: task.start runId={}, task={}", runId, taskName);
    }

    public void recordRetry(String taskName) {
        lock.lock();
        try {
            tasks.computeIfAbsent(taskName, n -> new TaskRecord()).retries++;
            totalRetries++;
        } finally {
            lock.unlock();
        }
        log.debug("METRIC: task.retry runId={}, task={}", runId, taskName);
    }

    public void recordEnd(String taskName, int outputSize) {
        recordEnd(taskName, outputSize, 0);
    }

    /**
     * Records a successful task.
     *
     * @param taskName the task name
     * @param outputSize length of the produced output
     * @param attempts attempts made, or 0 to derive them from the recorded retries
     */
    public void recordEnd(String taskName, int outputSize, int attempts) {
        lock.lock();
        try {
            TaskRecord record = tasks.computeIfAbsent(taskName, n -> new TaskRecord());
            record.endedAt = Instant.now();
            record.outputSize = outputSize;
            record.attempts = attempts;
            record.status = TaskStatus.SUCCEEDED;
        } finally {
            lock.unlock();
        }
        log.debug("METRIC: task.end runId={}, task={}, outputSize={}", runId, taskName, outputSize);
    }

    public void recordFailure(String taskName, String reason) {
        recordFailure(taskName, reason, 0);
    }

    /**
     * Records a task that failed for good.
     *
     * @param taskName the task name
     * @param reason the failure reason
     * @param attempts attempts made, or 0 to derive them from the recorded retries
     */
    public void recordFailure(String taskName, String reason, int attempts) {
        lock.lock();
        try {
            TaskRecord record = tasks.computeIfAbsent(taskName, n -> new TaskRecord());
            record.endedAt = Instant.now();
            record.failureReason = reason;
            record.attempts = attempts;
            record.status = TaskStatus.FAILED;
        } finally {
            lock.unlock();
        }
        log.debug("METRIC: task.failure runId={}, task={}, reason={}", runId, taskName, reason);
    }

    /**
     * Records a task that never started because the run was cancelled.
     *
     * @param taskName the task name
     */
    public void recordCancelled(String taskName) {
        lock.lock();
        try {
            tasks.computeIfAbsent(taskName, n -> new TaskRecord()).status = TaskStatus.CANCELLED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builds the aggregate summary. Before {@link #finish()} the duration runs up to now.
     *
     * @return execution metrics
     */
    public ExecutionMetrics summary() {
        lock.lock();
        try {
            Map<String, TaskMetrics> perTask = new LinkedHashMap<>();
            int started = 0;
            int succeeded = 0;
            int failed = 0;
            int cancelled = 0;

            for (Map.Entry<String, TaskRecord> entry : tasks.entrySet()) {
                TaskRecord record = entry.getValue();
                if (record.status == TaskStatus.CANCELLED) {
                    cancelled++;
                } else if (record.startedAt != null) {
                    started++;
                    if (record.status == TaskStatus.SUCCEEDED) {
                        succeeded++;
                    } else if (record.status == TaskStatus.FAILED) {
                        failed++;
                    }
                }
                perTask.put(entry.getKey(), record.toMetrics(entry.getKey()));
            }

            Instant end = endedAt != null ? endedAt : Instant.now();
            Duration total = startedAt != null ? Duration.between(startedAt, end) : Duration.ZERO;

            return new ExecutionMetrics(runId, startedAt, endedAt, total, started, succeeded, failed,
                    cancelled, totalRetries, ExecutionMetrics.successRate(succeeded, started), perTask);
        } finally {
            lock.unlock();
        }
    }

    private static final class TaskRecord {
        private Instant startedAt;
        private Instant endedAt;
        private int attempts;
        private int retries;
        private int outputSize;
        private String failureReason;
        private TaskStatus status = TaskStatus.PENDING;

        private TaskMetrics toMetrics(String taskName) {
            Duration duration = null;
            if (startedAt != null) {
                duration = Duration.between(startedAt, endedAt != null ? endedAt : Instant.now());
            }
            int attemptCount = attempts > 0 ? attempts : (startedAt != null ? retries + 1 : 0);
            return new TaskMetrics(taskName, status, duration, attemptCount, retries, outputSize, failureReason);
        }
    }
}
