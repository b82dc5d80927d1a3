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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The outcome record of one task within a workflow run.
 * <p>
 * Each transition produces a new copy; the engine keeps the latest copy per task
 * and hands out snapshots. {@code output} is only present when the task succeeded,
 * {@code error} only when it failed or is waiting to retry.
 */
public record TaskResult(
        String taskName,
        TaskStatus status,
        int attempts,
        String output,
        String error,
        String errorType,
        Instant startedAt,
        Instant endedAt
) {

    public TaskResult {
        Objects.requireNonNull(taskName, "taskName cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
    }

    /**
     * Creates a pending result for a planned task.
     *
     * @param taskName the task name
     * @return new pending result
     */
    public static TaskResult pending(String taskName) {
        return new TaskResult(taskName, TaskStatus.PENDING, 0, null, null, null, null, null);
    }

    /**
     * Creates a copy in running state for the given attempt.
     * The start time is recorded on the first attempt only.
     *
     * @param attempt the attempt number (1-based)
     * @return updated result
     */
    public TaskResult start(int attempt) {
        return new TaskResult(taskName, TaskStatus.RUNNING, attempt, null, null, null,
                startedAt != null ? startedAt : Instant.now(), null);
    }

    /**
     * Creates a copy waiting for the next attempt after a failure.
     *
     * @param failure the error of the failed attempt
     * @return updated result
     */
    public TaskResult retrying(Throwable failure) {
        return new TaskResult(taskName, TaskStatus.RETRYING, attempts, null,
                describe(failure), failure.getClass().getName(), startedAt, null);
    }

    public TaskResult succeed(String output, int attempts) {
        return new TaskResult(taskName, TaskStatus.SUCCEEDED, attempts, output, null, null,
                startedAt != null ? startedAt : Instant.now(), Instant.now());
    }

    public TaskResult fail(Throwable failure, int attempts) {
        return new TaskResult(taskName, TaskStatus.FAILED, attempts, null,
                describe(failure), failure.getClass().getName(),
                startedAt != null ? startedAt : Instant.now(), Instant.now());
    }

    public TaskResult cancel() {
        return new TaskResult(taskName, TaskStatus.CANCELLED, attempts, null, null, null, startedAt, Instant.now());
    }

    public boolean isSucceeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }

    /**
     * Gets the wall-clock duration of the task.
     *
     * @return duration, or null if the task never started
     */
    public Duration duration() {
        if (startedAt == null) {
            return null;
        }
        Instant end = endedAt != null ? endedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    /**
     * Gets the text a document renderer should use for this task.
     *
     * @return the output, or a placeholder describing why there is none
     */
    public String outputOrPlaceholder() {
        return switch (status) {
            case SUCCEEDED -> output;
            case FAILED -> "[generation failed: " + error + "]";
            case CANCELLED -> "[generation cancelled]";
            default -> "[generation pending]";
        };
    }

    private static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
