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

package org.fireflyframework.agentflow.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.agentflow.model.ExecutionMetrics;
import org.fireflyframework.agentflow.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for WorkflowMetrics.
 */
class WorkflowMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private WorkflowMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new WorkflowMetrics(meterRegistry);
    }

    @Test
    void shouldTrackActiveRuns() {
        metrics.recordRunStarted();
        metrics.recordRunStarted();

        assertThat(meterRegistry.get("firefly.agentflow.run.active").gauge().value()).isEqualTo(2.0);
        assertThat(meterRegistry.get("firefly.agentflow.run.started").counter().count()).isEqualTo(2.0);

        metrics.recordRunCompleted(summary(2, 2, 0, 0));

        assertThat(meterRegistry.get("firefly.agentflow.run.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void shouldTagRunOutcome() {
        metrics.recordRunStarted();
        metrics.recordRunCompleted(summary(3, 3, 0, 0));
        metrics.recordRunStarted();
        metrics.recordRunCompleted(summary(3, 2, 1, 0));
        metrics.recordRunStarted();
        metrics.recordRunCompleted(summary(2, 0, 2, 0));
        metrics.recordRunStarted();
        metrics.recordRunCompleted(summary(1, 1, 0, 2));

        assertThat(completedRuns("succeeded")).isEqualTo(1.0);
        assertThat(completedRuns("partial")).isEqualTo(1.0);
        assertThat(completedRuns("failed")).isEqualTo(1.0);
        assertThat(completedRuns("cancelled")).isEqualTo(1.0);
        assertThat(meterRegistry.get("firefly.agentflow.run.duration").tag("outcome", "succeeded").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1500.0);
    }

    @Test
    void shouldRecordTaskLifecycle() {
        metrics.recordTaskStarted("overview");
        metrics.recordTaskRetry("overview", 2);
        metrics.recordTaskRetry("overview", 3);
        metrics.recordTaskCompleted("overview", TaskStatus.SUCCEEDED, Duration.ofMillis(250));

        assertThat(meterRegistry.get("firefly.agentflow.task.started").tag("task", "overview").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("firefly.agentflow.task.retries").tag("task", "overview").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("firefly.agentflow.task.completed")
                .tag("task", "overview").tag("status", "succeeded").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("firefly.agentflow.task.duration")
                .tag("task", "overview").tag("status", "succeeded").timer().count())
                .isEqualTo(1L);
    }

    @Test
    void shouldAcceptMissingTaskDuration() {
        metrics.recordTaskCompleted("summary", TaskStatus.CANCELLED, null);

        assertThat(meterRegistry.get("firefly.agentflow.task.duration")
                .tag("status", "cancelled").timer().totalTime(TimeUnit.MILLISECONDS))
                .isZero();
    }

    private double completedRuns(String outcome) {
        return meterRegistry.get("firefly.agentflow.run.completed").tag("outcome", outcome).counter().count();
    }

    private static ExecutionMetrics summary(int total, int succeeded, int failed, int cancelled) {
        Instant start = Instant.parse("2026-01-01T10:00:00Z");
        Instant end = start.plusMillis(1500);
        return new ExecutionMetrics("run", start, end, Duration.between(start, end), total, succeeded, failed,
                cancelled, 0, ExecutionMetrics.successRate(succeeded, total), Map.of());
    }
}
