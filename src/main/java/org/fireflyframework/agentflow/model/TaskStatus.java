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

/**
 * Represents the status of a task within a workflow run.
 */
public enum TaskStatus {

    /**
     * Task is planned but has not started yet.
     */
    PENDING,

    /**
     * Task is executing an attempt.
     */
    RUNNING,

    /**
     * Task failed an attempt and is waiting for its backoff before the next one.
     */
    RETRYING,

    /**
     * Task produced its output.
     */
    SUCCEEDED,

    /**
     * Task failed after exhausting its attempts or on a non-retryable error.
     */
    FAILED,

    /**
     * Task never started because the run was cancelled.
     */
    CANCELLED;

    /**
     * Checks if the task is in a terminal state.
     *
     * @return true if the task has ended
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the task is currently active.
     *
     * @return true if the task is running or waiting to retry
     */
    public boolean isActive() {
        return this == RUNNING || this == RETRYING;
    }
}
