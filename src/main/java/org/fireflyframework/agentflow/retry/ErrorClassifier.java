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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.exception.TaskExecutionException;
import reactor.core.Exceptions;

import java.util.Collection;
import java.util.Set;

/**
 * Decides whether a failed attempt may be retried.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>{@link TaskExecutionException} carries an explicit retryable flag</li>
 *   <li>{@link IllegalArgumentException} and configured exception class names
 *       (matched against the whole class hierarchy) are non-retryable</li>
 *   <li>Everything else, timeouts and I/O errors included, is retryable</li>
 * </ol>
 */
@Slf4j
public class ErrorClassifier {

    private final Set<String> nonRetryableExceptions;

    public ErrorClassifier() {
        this(Set.of());
    }

    public ErrorClassifier(Collection<String> nonRetryableExceptions) {
        this.nonRetryableExceptions = Set.copyOf(nonRetryableExceptions);
    }

    /**
     * Classifies an error raised by a task attempt.
     *
     * @param error the error
     * @return the error kind
     */
    public ErrorKind classify(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);

        if (cause instanceof TaskExecutionException taskError) {
            return taskError.isRetryable() ? ErrorKind.RETRYABLE : ErrorKind.NON_RETRYABLE;
        }
        if (cause instanceof IllegalArgumentException) {
            return ErrorKind.NON_RETRYABLE;
        }
        for (Class<?> type = cause.getClass(); type != null; type = type.getSuperclass()) {
            if (nonRetryableExceptions.contains(type.getName())) {
                log.debug("Error type {} configured as non-retryable", type.getName());
                return ErrorKind.NON_RETRYABLE;
            }
        }
        return ErrorKind.RETRYABLE;
    }

    public boolean isRetryable(Throwable error) {
        return classify(error) == ErrorKind.RETRYABLE;
    }
}
