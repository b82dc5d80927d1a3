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

/**
 * Result of running a task through the retry wrapper.
 * <p>
 * Exactly one of {@code output} and {@code error} is set.
 *
 * @param output the produced text on success
 * @param attempts number of attempts made
 * @param error the last error on failure
 */
public record RetryOutcome(String output, int attempts, Throwable error) {

    public static RetryOutcome success(String output, int attempts) {
        return new RetryOutcome(output, attempts, null);
    }

    public static RetryOutcome failure(Throwable error, int attempts) {
        return new RetryOutcome(null, attempts, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
