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

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.fireflyframework.agentflow.properties.AgentflowProperties;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for WorkflowResilience.
 */
class WorkflowResilienceTest {

    @Test
    void shouldLeaveAttemptUntouchedWhenDisabled() {
        WorkflowResilience resilience = new WorkflowResilience(new AgentflowProperties());
        Mono<String> attempt = Mono.just("text");

        assertThat(resilience.isEnabled()).isFalse();
        assertThat(resilience.decorateTask("overview", attempt)).isSameAs(attempt);
    }

    @Test
    void shouldOpenCircuitAfterRepeatedFailures() {
        AgentflowProperties properties = enabledProperties();
        AgentflowProperties.CircuitBreakerConfig cb = properties.getResilience().getCircuitBreaker();
        cb.setEnabled(true);
        cb.setMinimumNumberOfCalls(2);
        cb.setSlidingWindowSize(2);
        WorkflowResilience resilience = new WorkflowResilience(properties);

        for (int i = 0; i < 2; i++) {
            StepVerifier.create(resilience.decorateTask("overview", Mono.<String>error(new IOException("down"))))
                    .expectError(IOException.class)
                    .verify();
        }

        assertThat(resilience.getCircuitBreakerState("overview")).isEqualTo(CircuitBreaker.State.OPEN);
        StepVerifier.create(resilience.decorateTask("overview", Mono.just("text")))
                .expectError(CallNotPermittedException.class)
                .verify();

        assertThat(resilience.getCircuitBreakerState("risks")).isNull();

        resilience.resetCircuitBreaker("overview");
        assertThat(resilience.getCircuitBreakerState("overview")).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void shouldRejectAttemptsBeyondSharedBulkhead() {
        AgentflowProperties properties = enabledProperties();
        AgentflowProperties.BulkheadConfig bulkhead = properties.getResilience().getBulkhead();
        bulkhead.setEnabled(true);
        bulkhead.setMaxConcurrentCalls(1);
        bulkhead.setMaxWaitDuration(Duration.ZERO);
        WorkflowResilience resilience = new WorkflowResilience(properties);

        Disposable inFlight = resilience.decorateTask("overview", Mono.<String>never()).subscribe();
        try {
            StepVerifier.create(resilience.decorateTask("risks", Mono.just("text")))
                    .expectError(BulkheadFullException.class)
                    .verify();
        } finally {
            inFlight.dispose();
        }

        assertThat(resilience.getBulkhead().getName()).isEqualTo(WorkflowResilience.SHARED_NAME);
        assertThat(resilience.getBulkhead()).isSameAs(resilience.getBulkhead());
    }

    @Test
    void shouldPassThroughRateLimiterWithinLimit() {
        AgentflowProperties properties = enabledProperties();
        properties.getResilience().getRateLimiter().setEnabled(true);
        WorkflowResilience resilience = new WorkflowResilience(properties);

        StepVerifier.create(resilience.decorateTask("overview", Mono.just("text")))
                .expectNext("text")
                .verifyComplete();

        assertThat(resilience.getRateLimiter().getName()).isEqualTo(WorkflowResilience.SHARED_NAME);
    }

    private static AgentflowProperties enabledProperties() {
        AgentflowProperties properties = new AgentflowProperties();
        properties.getResilience().setEnabled(true);
        return properties;
    }
}
