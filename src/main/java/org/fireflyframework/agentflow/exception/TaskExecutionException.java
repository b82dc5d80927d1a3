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

package org.fireflyframework.agentflow.exception;

/**
 * Exception raised by task handlers to report a failed attempt.
 * <p>
 * The {@code retryable} flag is an explicit classification: the retry wrapper
 * inspects it instead of matching exception types. Handlers that call remote
 * content generators typically wrap transport errors with {@link #retryable}
 * and reject unusable input with {@link #nonRetryable}.
 */
public class TaskExecutionException extends AgentflowException {

    private final String taskName;
    private final boolean retryable;

    public TaskExecutionException(String taskName, String message, boolean retryable) {
        super(formatMessage(taskName, message));
        this.taskName = taskName;
        this.retryable = retryable;
    }

    public TaskExecutionException(String taskName, String message, boolean retryable, Throwable cause) {
        super(formatMessage(taskName, message), cause);
        this.taskName = taskName;
        this.retryable = retryable;
    }

    public static TaskExecutionException retryable(String taskName, String message, Throwable cause) {
        return new TaskExecutionException(taskName, message, true, cause);
    }

    public static TaskExecutionException nonRetryable(String taskName, String message) {
        return new TaskExecutionException(taskName, message, false);
    }

    public String getTaskName() {
        return taskName;
    }

    public boolean isRetryable() {
        return retryable;
    }

    private static String formatMessage(String taskName, String message) {
        return taskName != null ? "Task '" + taskName + "' failed: " + message : message;
    }
}
