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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.core.TaskInvocation;
import org.fireflyframework.agentflow.exception.TaskExecutionException;
import org.fireflyframework.agentflow.model.TaskSpec;
import org.fireflyframework.agentflow.resilience.WorkflowResilience;
import org.springframework.lang.Nullable;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Runs a task handler with a per-attempt timeout and retries failed attempts
 * according to a {@link BackoffPolicy}.
 * <p>
 * Attempt {@code k} (1-based) is given {@link TaskSpec#perAttemptTimeout()}; a timeout
 * is a retryable failure. After a failed attempt the task is retried only while
 * {@code k < maxAttempts}, the policy classifies the error as retryable and the
 * caller has not cancelled. The delay before attempt {@code k + 1} is
 * {@link BackoffPolicy#delayFor(int) delayFor(k)}.
 * <p>
 * The returned Mono never errors for handler failures: the last error is carried
 * by the {@link RetryOutcome}.
 */
@Slf4j
public class RetryExecutor {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final BackoffPolicy policy;
    private final ObjectMapper objectMapper;
    private final WorkflowResilience resilience;

    public RetryExecutor(BackoffPolicy policy) {
        this(policy, new ObjectMapper().findAndRegisterModules(), null);
    }

    public RetryExecutor(BackoffPolicy policy, ObjectMapper objectMapper, @Nullable WorkflowResilience resilience) {
        this.policy = policy;
        this.objectMapper = objectMapper;
        this.resilience = resilience;
    }

    /**
     * Runs a task to its terminal outcome.
     *
     * @param spec the task
     * @param input the task input
     * @param context the dependency context, or null when the task has no dependencies
     * @return the outcome, never an error signal
     */
    public Mono<RetryOutcome> execute(TaskSpec spec, @Nullable Object input, @Nullable String context) {
        return execute(spec, input, context, RetryListener.NOOP, NEVER_CANCELLED);
    }

    /**
     * Runs a task to its terminal outcome, reporting attempts to a listener.
     *
     * @param spec the task
     * @param input the task input
     * @param context the dependency context, or null when the task has no dependencies
     * @param listener notified before each attempt and each scheduled retry
     * @param cancelled checked before scheduling a retry and after the backoff delay
     * @return the outcome, never an error signal
     */
    public Mono<RetryOutcome> execute(TaskSpec spec, @Nullable Object input, @Nullable String context,
                                      RetryListener listener, BooleanSupplier cancelled) {
        return attempt(spec, input, context, 1, listener, cancelled);
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    private Mono<RetryOutcome> attempt(TaskSpec spec, Object input, String context, int attempt,
                                       RetryListener listener, BooleanSupplier cancelled) {
        return Mono.defer(() -> {
                    listener.onAttemptStarted(spec.name(), attempt);
                    return invokeHandler(spec, input, context, attempt);
                })
                .map(output -> RetryOutcome.success(output, attempt))
                .onErrorResume(error -> handleFailure(spec, input, context, attempt, listener, cancelled,
                        Exceptions.unwrap(error)));
    }

    private Mono<String> invokeHandler(TaskSpec spec, Object input, String context, int attempt) {
        TaskInvocation invocation = new TaskInvocation(spec.name(), input, context, attempt, objectMapper);
        Duration timeout = spec.perAttemptTimeout();

        Mono<String> execution = Mono.defer(() -> spec.handler().generate(invocation))
                .switchIfEmpty(Mono.error(() -> TaskExecutionException.retryable(
                        spec.name(), "handler completed without output", null)))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> TaskExecutionException.retryable(
                        spec.name(), "attempt " + attempt + " timed out after " + timeout, e));

        if (resilience != null && resilience.isEnabled()) {
            execution = resilience.decorateTask(spec.name(), execution);
        }
        return execution;
    }

    private Mono<RetryOutcome> handleFailure(TaskSpec spec, Object input, String context, int attempt,
                                             RetryListener listener, BooleanSupplier cancelled, Throwable error) {
        if (attempt >= spec.maxAttempts()) {
            log.warn("TASK_RETRIES_EXHAUSTED: task={}, attempts={}, error={}", spec.name(), attempt, error.getMessage());
            return Mono.just(RetryOutcome.failure(error, attempt));
        }
        if (!policy.shouldRetry(error, attempt)) {
            log.warn("TASK_NOT_RETRYABLE: task={}, attempt={}, errorType={}, error={}",
                    spec.name(), attempt, error.getClass().getSimpleName(), error.getMessage());
            return Mono.just(RetryOutcome.failure(error, attempt));
        }
        if (cancelled.getAsBoolean()) {
            log.info("TASK_RETRY_SKIPPED: task={}, attempt={}, reason=cancelled", spec.name(), attempt);
            return Mono.just(RetryOutcome.failure(error, attempt));
        }

        Duration delay = policy.delayFor(attempt);
        log.info("TASK_RETRY: task={}, failedAttempt={}, nextAttempt={}, delayMs={}, error={}",
                spec.name(), attempt, attempt + 1, delay.toMillis(), error.getMessage());
        listener.onRetryScheduled(spec.name(), attempt, error, delay);

        return Mono.delay(delay)
                .then(Mono.defer(() -> {
                    if (cancelled.getAsBoolean()) {
                        log.info("TASK_RETRY_SKIPPED: task={}, attempt={}, reason=cancelled", spec.name(), attempt + 1);
                        return Mono.just(RetryOutcome.failure(error, attempt));
                    }
                    return attempt(spec, input, context, attempt + 1, listener, cancelled);
                }));
    }
}
