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

package org.fireflyframework.agentflow.resilience;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.properties.AgentflowProperties;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides Resilience4j decorators for task attempts.
 * <p>
 * A single bulkhead and a single rate limiter are shared by every task of every run,
 * capping the load put on the content-generation collaborator. Circuit breakers are
 * kept per task. Rejections surface as errors of the attempt and are retried like
 * any other transient failure.
 */
@Slf4j
public class WorkflowResilience {

    static final String SHARED_NAME = "agentflow";

    private final AgentflowProperties.ResilienceConfig config;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final BulkheadRegistry bulkheadRegistry;

    private final Map<String, CircuitBreaker> taskCircuitBreakers = new ConcurrentHashMap<>();
    private volatile Bulkhead bulkhead;
    private volatile RateLimiter rateLimiter;

    public WorkflowResilience(AgentflowProperties properties) {
        this.config = properties.getResilience();
        this.circuitBreakerRegistry = createCircuitBreakerRegistry();
        this.rateLimiterRegistry = createRateLimiterRegistry();
        this.bulkheadRegistry = createBulkheadRegistry();

        log.info("RESILIENCE_INIT: enabled={}, circuitBreaker={}, rateLimiter={}, bulkhead={}",
                config.isEnabled(),
                config.getCircuitBreaker().isEnabled(),
                config.getRateLimiter().isEnabled(),
                config.getBulkhead().isEnabled());
    }

    /**
     * Decorates one task attempt with all enabled resilience patterns.
     *
     * @param taskName the task name
     * @param attempt the attempt to decorate
     * @param <T> the result type
     * @return the decorated attempt
     */
    public <T> Mono<T> decorateTask(String taskName, Mono<T> attempt) {
        if (!config.isEnabled()) {
            return attempt;
        }

        Mono<T> decorated = attempt;

        if (config.getBulkhead().isEnabled()) {
            decorated = decorated.transformDeferred(BulkheadOperator.of(getBulkhead()));
        }

        if (config.getRateLimiter().isEnabled()) {
            decorated = decorated.transformDeferred(RateLimiterOperator.of(getRateLimiter()));
        }

        // Apply circuit breaker (outermost)
        if (config.getCircuitBreaker().isEnabled()) {
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(getOrCreateCircuitBreaker(taskName)));
        }

        return decorated;
    }

    /**
     * Gets or creates the circuit breaker of a task.
     */
    public CircuitBreaker getOrCreateCircuitBreaker(String taskName) {
        return taskCircuitBreakers.computeIfAbsent(taskName, n -> {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(n);
            cb.getEventPublisher()
                    .onStateTransition(event ->
                            log.info("CIRCUIT_BREAKER_STATE: task={}, from={}, to={}",
                                    event.getCircuitBreakerName(),
                                    event.getStateTransition().getFromState(),
                                    event.getStateTransition().getToState()))
                    .onCallNotPermitted(event ->
                            log.warn("CIRCUIT_BREAKER_REJECTED: task={}", event.getCircuitBreakerName()));
            return cb;
        });
    }

    /**
     * Gets the bulkhead shared by all tasks.
     */
    public Bulkhead getBulkhead() {
        if (bulkhead == null) {
            synchronized (this) {
                if (bulkhead == null) {
                    Bulkhead bh = bulkheadRegistry.bulkhead(SHARED_NAME);
                    bh.getEventPublisher()
                            .onCallRejected(event ->
                                    log.warn("BULKHEAD_REJECTED: name={}", event.getBulkheadName()));
                    bulkhead = bh;
                }
            }
        }
        return bulkhead;
    }

    /**
     * Gets the rate limiter shared by all tasks.
     */
    public RateLimiter getRateLimiter() {
        if (rateLimiter == null) {
            synchronized (this) {
                if (rateLimiter == null) {
                    RateLimiter rl = rateLimiterRegistry.rateLimiter(SHARED_NAME);
                    rl.getEventPublisher()
                            .onFailure(event ->
                                    log.warn("RATE_LIMITER_REJECTED: name={}", event.getRateLimiterName()));
                    rateLimiter = rl;
                }
            }
        }
        return rateLimiter;
    }

    /**
     * Gets the circuit breaker state of a task, or null if the task never ran decorated.
     */
    public CircuitBreaker.State getCircuitBreakerState(String taskName) {
        CircuitBreaker cb = taskCircuitBreakers.get(taskName);
        return cb != null ? cb.getState() : null;
    }

    public void resetCircuitBreaker(String taskName) {
        CircuitBreaker cb = taskCircuitBreakers.get(taskName);
        if (cb != null) {
            cb.reset();
            log.info("CIRCUIT_BREAKER_RESET: task={}", taskName);
        }
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    // ==================== Registry Creation ====================

    private CircuitBreakerRegistry createCircuitBreakerRegistry() {
        var cbConfig = config.getCircuitBreaker();

        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(cbConfig.getFailureRateThreshold())
                .minimumNumberOfCalls(cbConfig.getMinimumNumberOfCalls())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cbConfig.getSlidingWindowSize())
                .waitDurationInOpenState(cbConfig.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(cbConfig.getPermittedNumberOfCallsInHalfOpenState())
                .build();

        return CircuitBreakerRegistry.of(defaultConfig);
    }

    private RateLimiterRegistry createRateLimiterRegistry() {
        var rlConfig = config.getRateLimiter();

        RateLimiterConfig defaultConfig = RateLimiterConfig.custom()
                .limitForPeriod(rlConfig.getLimitForPeriod())
                .limitRefreshPeriod(rlConfig.getLimitRefreshPeriod())
                .timeoutDuration(rlConfig.getTimeoutDuration())
                .build();

        return RateLimiterRegistry.of(defaultConfig);
    }

    private BulkheadRegistry createBulkheadRegistry() {
        var bhConfig = config.getBulkhead();

        BulkheadConfig defaultConfig = BulkheadConfig.custom()
                .maxConcurrentCalls(bhConfig.getMaxConcurrentCalls())
                .maxWaitDuration(bhConfig.getMaxWaitDuration())
                .build();

        return BulkheadRegistry.of(defaultConfig);
    }

    public CircuitBreakerRegistry getCircuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }

    public RateLimiterRegistry getRateLimiterRegistry() {
        return rateLimiterRegistry;
    }

    public BulkheadRegistry getBulkheadRegistry() {
        return bulkheadRegistry;
    }
}
