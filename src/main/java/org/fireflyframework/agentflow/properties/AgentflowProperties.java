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

package org.fireflyframework.agentflow.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.fireflyframework.agentflow.model.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the agent workflow engine.
 * <p>
 * Example:
 * <pre>
 * firefly:
 *   agentflow:
 *     default-max-attempts: 3
 *     stages:
 *       - [overview]
 *       - [architecture, risks]
 *     tasks:
 *       architecture:
 *         display-name: System Architecture
 *         depends-on: [overview]
 *         timeout: 90s
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.agentflow")
@Validated
@Data
public class AgentflowProperties {

    /**
     * Whether the agent workflow engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Default number of attempts per task, the first one included.
     */
    @Min(1)
    private int defaultMaxAttempts = 3;

    /**
     * Default timeout of a single task attempt.
     */
    @NotNull
    private Duration defaultTaskTimeout = Duration.ofSeconds(120);

    /**
     * Whether to publish Micrometer metrics when a MeterRegistry is available.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to log every task state transition.
     */
    private boolean logProgress = true;

    /**
     * Static workflow plan: one list of task names per stage, in execution order.
     * When empty, the plan is derived from the task dependencies.
     */
    private List<List<String>> stages = new ArrayList<>();

    /**
     * Per-task overrides keyed by task name.
     */
    @Valid
    private Map<String, TaskConfig> tasks = new LinkedHashMap<>();

    /**
     * Retry configuration.
     */
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    /**
     * Dependency context configuration.
     */
    @Valid
    @NotNull
    private ContextConfig context = new ContextConfig();

    /**
     * Stage execution configuration.
     */
    @Valid
    @NotNull
    private ExecutionConfig execution = new ExecutionConfig();

    /**
     * Resilience configuration.
     */
    @Valid
    @NotNull
    private ResilienceConfig resilience = new ResilienceConfig();

    /**
     * Retry backoff configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Delay after the first failed attempt.
         */
        @NotNull
        private Duration backoffBase = Duration.ofSeconds(2);

        /**
         * Ceiling for any backoff delay.
         */
        @NotNull
        private Duration backoffMax = Duration.ofSeconds(30);

        /**
         * Growth factor between consecutive delays.
         */
        @DecimalMin("1.0")
        private double multiplier = 2.0;

        /**
         * Relative jitter applied to each delay, 0.2 meaning a uniform +/-20%.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.0;

        /**
         * Fully qualified exception class names that are never retried.
         */
        private List<String> nonRetryableExceptions = new ArrayList<>();
    }

    @Data
    public static class ContextConfig {

        /**
         * Number of characters taken from each dependency output.
         */
        @Min(1)
        private int excerptLength = 500;
    }

    @Data
    public static class ExecutionConfig {

        /**
         * How the tasks of a multi-task stage are scheduled.
         */
        @NotNull
        private ExecutionMode mode = ExecutionMode.PARALLEL;

        /**
         * Maximum tasks of one stage running at the same time, 0 for no limit.
         */
        @Min(0)
        private int maxConcurrency = 0;
    }

    /**
     * Per-task configuration.
     */
    @Data
    public static class TaskConfig {

        /**
         * Human readable name used in context labels and progress messages.
         */
        private String displayName;

        /**
         * Name of the TaskHandler bean; defaults to the task name.
         */
        private String handlerBean;

        /**
         * Attempts for this task; defaults to default-max-attempts.
         */
        @Min(1)
        private Integer maxAttempts;

        /**
         * Timeout of a single attempt; defaults to default-task-timeout.
         */
        private Duration timeout;

        /**
         * Names of the tasks whose output this task receives as context.
         */
        private List<String> dependsOn = new ArrayList<>();

        /**
         * Position within a derived stage.
         */
        private int order = 0;
    }

    @Data
    public static class ResilienceConfig {

        /**
         * Whether resilience decoration of task attempts is enabled.
         */
        private boolean enabled = false;

        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        @Valid
        @NotNull
        private RateLimiterConfig rateLimiter = new RateLimiterConfig();

        @Valid
        @NotNull
        private BulkheadConfig bulkhead = new BulkheadConfig();
    }

    /**
     * Circuit breaker configuration, one breaker per task.
     */
    @Data
    public static class CircuitBreakerConfig {

        private boolean enabled = false;

        /**
         * Failure rate threshold percentage (0-100) to open the circuit.
         */
        @Min(1)
        private int failureRateThreshold = 50;

        /**
         * Minimum number of calls before calculating failure rate.
         */
        @Min(1)
        private int minimumNumberOfCalls = 10;

        /**
         * Sliding window size in calls.
         */
        @Min(1)
        private int slidingWindowSize = 50;

        /**
         * Wait duration in open state before transitioning to half-open.
         */
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);

        @Min(1)
        private int permittedNumberOfCallsInHalfOpenState = 5;
    }

    /**
     * Rate limiter configuration, shared by all tasks.
     */
    @Data
    public static class RateLimiterConfig {

        private boolean enabled = false;

        /**
         * Number of calls permitted during one refresh period.
         */
        @Min(1)
        private int limitForPeriod = 10;

        @NotNull
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);

        /**
         * Maximum time a call waits for permission.
         */
        @NotNull
        private Duration timeoutDuration = Duration.ofSeconds(30);
    }

    /**
     * Bulkhead configuration, shared by all tasks of all runs.
     */
    @Data
    public static class BulkheadConfig {

        private boolean enabled = false;

        /**
         * Maximum calls to the content generator in flight at the same time.
         */
        @Min(1)
        private int maxConcurrentCalls = 8;

        /**
         * Maximum time a call waits for a free slot.
         */
        @NotNull
        private Duration maxWaitDuration = Duration.ofSeconds(60);
    }
}
