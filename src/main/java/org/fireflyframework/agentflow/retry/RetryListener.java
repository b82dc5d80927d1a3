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

package org.fireflyframework.agentflow.retry;

import java.time.Duration;

/**
 * Callbacks from the retry wrapper, used by a workflow run to keep its task
 * results, metrics and progress in step with each attempt.
 */
public interface RetryListener {

    RetryListener NOOP = new RetryListener() {
    };

    default void onAttemptStarted(String taskName, int attempt) {
    }

    default void onRetryScheduled(String taskName, int failedAttempt, Throwable error, Duration delay) {
    }
}
