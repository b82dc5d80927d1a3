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

package org.fireflyframework.agentflow.core;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.agentflow.exception.TaskNotFoundException;
import org.fireflyframework.agentflow.exception.WorkflowValidationException;
import org.fireflyframework.agentflow.metrics.WorkflowMetrics;
import org.fireflyframework.agentflow.model.ExecutionMode;
import org.fireflyframework.agentflow.model.ExecutionOptions;
import org.fireflyframework.agentflow.model.Stage;
import org.fireflyframework.agentflow.model.TaskResult;
import org.fireflyframework.agentflow.model.TaskSpec;
import org.fireflyframework.agentflow.model.TaskStatus;
import org.fireflyframework.agentflow.model.WorkflowPlan;
import org.fireflyframework.agentflow.model.WorkflowReport;
import org.fireflyframework.agentflow.progress.ProgressEvent;
import org.fireflyframework.agentflow.progress.ProgressListener;
import org.fireflyframework.agentflow.retry.BackoffPolicy;
import org.fireflyframework.agentflow.retry.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for WorkflowEngine.
 */
class WorkflowEngineTest {

    private TaskRegistry registry;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        registry = new TaskRegistry();
        engine = createEngine(null, List.of());
    }

    @Test
    void shouldRunStagesWithRetriesAndBestEffortFailures() {
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("A output")));
        registry.register(TaskSpec.of("taskB", failingTimes(2, "B output", new AtomicInteger())));
        registry.register(TaskSpec.of("taskC", failingTimes(Integer.MAX_VALUE, "never", new AtomicInteger())));

        WorkflowPlan plan = WorkflowPlan.of(Stage.of("taskA"), Stage.of("taskB", "taskC"));

        StepVerifier.create(engine.execute(plan, Map.of()))
                .assertNext(report -> {
                    TaskResult a = report.results().get("taskA");
                    TaskResult b = report.results().get("taskB");
                    TaskResult c = report.results().get("taskC");

                    assertThat(report.results()).containsOnlyKeys("taskA", "taskB", "taskC");
                    assertThat(a.status()).isEqualTo(TaskStatus.SUCCEEDED);
                    assertThat(a.attempts()).isEqualTo(1);
                    assertThat(b.status()).isEqualTo(TaskStatus.SUCCEEDED);
                    assertThat(b.attempts()).isEqualTo(3);
                    assertThat(b.output()).isEqualTo("B output");
                    assertThat(c.status()).isEqualTo(TaskStatus.FAILED);
                    assertThat(c.attempts()).isEqualTo(3);
                    assertThat(c.output()).isNull();
                    assertThat(c.error()).contains("transient failure");

                    assertThat(b.startedAt()).isAfterOrEqualTo(a.endedAt());
                    assertThat(c.startedAt()).isAfterOrEqualTo(a.endedAt());

                    assertThat(report.metrics().totalTasks()).isEqualTo(3);
                    assertThat(report.metrics().successCount()).isEqualTo(2);
                    assertThat(report.metrics().failureCount()).isEqualTo(1);
                    assertThat(report.metrics().totalRetries()).isEqualTo(4);
                    assertThat(report.metrics().successRate()).isEqualTo(2.0 / 3.0);
                    assertThat(report.failedTasks()).containsExactly("taskC");
                })
                .verifyComplete();
    }

    @Test
    void shouldPassDependencyOutputAsContext() {
        AtomicReference<String> contextSeen = new AtomicReference<>();
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("X")));
        registry.register(TaskSpec.of("taskB", invocation -> {
            contextSeen.set(invocation.getContext());
            return Mono.just("B");
        }).withDependencies("taskA"));

        WorkflowPlan plan = WorkflowPlan.of(Stage.of("taskA"), Stage.of("taskB"));

        StepVerifier.create(engine.execute(plan, Map.of()))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(contextSeen.get()).contains("X").startsWith("## taskA\n");
    }

    @Test
    void shouldPassNullContextToTaskWithoutDependencies() {
        AtomicBoolean hadNullContext = new AtomicBoolean();
        registry.register(TaskSpec.of("taskA", invocation -> {
            hadNullContext.set(invocation.getContext() == null);
            return Mono.just("A");
        }));

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("taskA")), Map.of()))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(hadNullContext).isTrue();
    }

    @Test
    void shouldOmitFailedDependencyFromContext() {
        AtomicReference<String> contextSeen = new AtomicReference<>("unset");
        registry.register(TaskSpec.of("taskA", invocation -> Mono.<String>error(new IOException("down")))
                .withMaxAttempts(1));
        registry.register(TaskSpec.of("taskB", invocation -> {
            contextSeen.set(invocation.getContext());
            return Mono.just("B");
        }).withDependencies("taskA"));

        WorkflowPlan plan = WorkflowPlan.of(Stage.of("taskA"), Stage.of("taskB"));

        StepVerifier.create(engine.execute(plan, Map.of()))
                .assertNext(report -> assertThat(report.results().get("taskB").isSucceeded()).isTrue())
                .verifyComplete();

        assertThat(contextSeen.get()).isEmpty();
    }

    @Test
    void shouldReturnEmptyReportForEmptyPlan() {
        StepVerifier.create(engine.execute(WorkflowPlan.EMPTY, Map.of()))
                .assertNext(report -> {
                    assertThat(report.results()).isEmpty();
                    assertThat(report.metrics().totalTasks()).isZero();
                    assertThat(report.metrics().successRate()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void shouldRouteInputsByTaskName() {
        Map<String, Object> seen = new ConcurrentHashMap<>();
        TaskHandler recording = invocation -> {
            seen.put(invocation.getTaskName(), invocation.getInput());
            return Mono.just("ok");
        };
        registry.register(TaskSpec.of("overview", recording));
        registry.register(TaskSpec.of("budget", recording));

        WorkflowPlan plan = WorkflowPlan.of(Stage.of("overview", "budget"));

        StepVerifier.create(engine.execute(plan, Map.of("overview", "brief", "budget", List.of(1, 2))))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(seen).containsEntry("overview", "brief").containsEntry("budget", List.of(1, 2));
    }

    @Test
    void shouldThrowForUnknownTaskBeforeExecution() {
        assertThatThrownBy(() -> engine.execute(WorkflowPlan.of(Stage.of("missing")), Map.of()))
                .isInstanceOf(TaskNotFoundException.class);
    }

    @Test
    void shouldThrowForBrokenStageOrdering() {
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("A")));
        registry.register(TaskSpec.of("taskB", invocation -> Mono.just("B")).withDependencies("taskA"));

        assertThatThrownBy(() -> engine.execute(WorkflowPlan.of(Stage.of("taskA", "taskB")), Map.of()))
                .isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    void shouldCancelTasksThatHaveNotStarted() {
        AtomicReference<WorkflowRun> runRef = new AtomicReference<>();
        AtomicInteger laterInvocations = new AtomicInteger();
        registry.register(TaskSpec.of("taskA", invocation -> {
            runRef.get().cancel();
            return Mono.just("A");
        }));
        registry.register(TaskSpec.of("taskB", invocation -> {
            laterInvocations.incrementAndGet();
            return Mono.just("B");
        }));
        registry.register(TaskSpec.of("taskC", invocation -> {
            laterInvocations.incrementAndGet();
            return Mono.just("C");
        }));

        WorkflowPlan plan = WorkflowPlan.of(Stage.of("taskA"), Stage.of("taskB", "taskC"));
        WorkflowRun run = engine.prepare(plan, Map.of(), ExecutionOptions.defaults());
        runRef.set(run);

        StepVerifier.create(run.execute())
                .assertNext(report -> {
                    assertThat(report.results().get("taskA").status()).isEqualTo(TaskStatus.SUCCEEDED);
                    assertThat(report.results().get("taskB").status()).isEqualTo(TaskStatus.CANCELLED);
                    assertThat(report.results().get("taskC").status()).isEqualTo(TaskStatus.CANCELLED);
                    assertThat(report.metrics().totalTasks()).isEqualTo(1);
                    assertThat(report.metrics().cancelledCount()).isEqualTo(2);
                    assertThat(report.metrics().successRate()).isEqualTo(1.0);
                    assertThat(report.outputOrPlaceholder("taskB")).isEqualTo("[generation cancelled]");
                })
                .verifyComplete();

        assertThat(laterInvocations).hasValue(0);
        assertThat(run.isCancelled()).isTrue();
    }

    @Test
    void shouldStopRetryingOnceCancelled() {
        AtomicReference<WorkflowRun> runRef = new AtomicReference<>();
        AtomicInteger invocations = new AtomicInteger();
        registry.register(TaskSpec.of("taskA", invocation -> {
            invocations.incrementAndGet();
            runRef.get().cancel();
            return Mono.<String>error(new IOException("down"));
        }).withMaxAttempts(5));

        WorkflowRun run = engine.prepare(WorkflowPlan.of(Stage.of("taskA")), Map.of(), ExecutionOptions.defaults());
        runRef.set(run);

        StepVerifier.create(run.execute())
                .assertNext(report -> {
                    TaskResult a = report.results().get("taskA");
                    assertThat(a.status()).isEqualTo(TaskStatus.FAILED);
                    assertThat(a.attempts()).isEqualTo(1);
                })
                .verifyComplete();

        assertThat(invocations).hasValue(1);
    }

    @Test
    void shouldRunOnlySelectedTasks() {
        AtomicInteger invocations = new AtomicInteger();
        TaskHandler counting = invocation -> {
            invocations.incrementAndGet();
            return Mono.just(invocation.getTaskName());
        };
        registry.register(TaskSpec.of("taskA", counting));
        registry.register(TaskSpec.of("taskB", counting).withDependencies("taskA"));
        registry.register(TaskSpec.of("taskC", counting));

        WorkflowPlan plan = WorkflowPlan.of(Stage.of("taskA"), Stage.of("taskB", "taskC"));
        ExecutionOptions options = ExecutionOptions.defaults().withSelectedTasks("taskB", "taskC");

        StepVerifier.create(engine.execute(plan, Map.of(), options))
                .assertNext(report -> {
                    assertThat(report.results()).containsOnlyKeys("taskB", "taskC");
                    assertThat(report.allSucceeded()).isTrue();
                    assertThat(report.outputOrPlaceholder("taskA")).isEqualTo("[generation skipped]");
                })
                .verifyComplete();

        assertThat(invocations).hasValue(2);
    }

    @Test
    void shouldRunStageTasksConcurrentlyInParallelMode() {
        AtomicInteger maxActive = registerSlowTasks("t1", "t2", "t3");

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("t1", "t2", "t3")), Map.of()))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(maxActive).hasValue(3);
    }

    @Test
    void shouldBoundConcurrencyWithinStage() {
        AtomicInteger maxActive = registerSlowTasks("t1", "t2", "t3");
        ExecutionOptions options = ExecutionOptions.defaults().withMaxConcurrency(2);

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("t1", "t2", "t3")), Map.of(), options))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(maxActive.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void shouldRunStageTasksOneByOneInSequentialMode() {
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicInteger maxActive = registerSlowTasks(order, "t1", "t2", "t3");
        ExecutionOptions options = ExecutionOptions.defaults().withMode(ExecutionMode.SEQUENTIAL);

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("t1", "t2", "t3")), Map.of(), options))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(maxActive).hasValue(1);
        assertThat(order).containsExactly("t1", "t2", "t3");
    }

    @Test
    void shouldEmitOrderedProgressEventsPerTask() {
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();
        registry.register(TaskSpec.of("taskB", failingTimes(2, "B", new AtomicInteger())));
        ExecutionOptions options = ExecutionOptions.defaults().withListener(events::add);

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("taskB")), Map.of(), options))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(events).extracting(ProgressEvent::toState).containsExactly(
                TaskStatus.RUNNING, TaskStatus.RETRYING, TaskStatus.RETRYING, TaskStatus.SUCCEEDED);
        assertThat(events).extracting(ProgressEvent::attempt).containsExactly(1, 1, 2, 0);
        assertThat(events.get(3).completedSteps()).isEqualTo(1);
    }

    @Test
    void shouldNotifyEngineWideListeners() {
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();
        engine = createEngine(null, List.of(events::add));
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("A")));

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("taskA")), Map.of()))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(events).extracting(ProgressEvent::toState)
                .containsExactly(TaskStatus.RUNNING, TaskStatus.SUCCEEDED);
    }

    @Test
    void shouldSubstitutePlaceholderForFailedTask() {
        registry.register(TaskSpec.of("taskA", invocation -> Mono.<String>error(new IOException("quota exceeded")))
                .withMaxAttempts(1));

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("taskA")), Map.of()))
                .assertNext(report -> {
                    assertThat(report.output("taskA")).isEmpty();
                    assertThat(report.outputOrPlaceholder("taskA")).isEqualTo("[generation failed: quota exceeded]");
                })
                .verifyComplete();
    }

    @Test
    void shouldExposeSnapshotBeforeAndAfterExecution() {
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("A")));
        WorkflowRun run = engine.prepare(WorkflowPlan.of(Stage.of("taskA")), Map.of(), ExecutionOptions.defaults());

        assertThat(run.snapshot().get("taskA").status()).isEqualTo(TaskStatus.PENDING);

        StepVerifier.create(run.execute())
                .expectNextCount(1)
                .verifyComplete();

        assertThat(run.snapshot().get("taskA").status()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(run.progress().isDone()).isTrue();
        assertThat(run.progress().percentComplete()).isEqualTo(100.0);
    }

    @Test
    void shouldRejectSecondExecutionOfSameRun() {
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("A")));
        WorkflowRun run = engine.prepare(WorkflowPlan.of(Stage.of("taskA")), Map.of(), ExecutionOptions.defaults());

        StepVerifier.create(run.execute()).expectNextCount(1).verifyComplete();
        StepVerifier.create(run.execute()).expectError(IllegalStateException.class).verify();
    }

    @Test
    void shouldDeriveConfiguredPlanFromDependencies() {
        registry.register(TaskSpec.of("overview", invocation -> Mono.just("O")));
        registry.register(TaskSpec.of("summary", invocation -> Mono.just("S")).withDependencies("overview"));

        assertThat(engine.resolveConfiguredPlan().stages()).extracting(Stage::taskNames)
                .containsExactly(List.of("overview"), List.of("summary"));

        StepVerifier.create(engine.executeConfigured(Map.of()))
                .assertNext(report -> assertThat(report.allSucceeded()).isTrue())
                .verifyComplete();
    }

    @Test
    void shouldPublishMicrometerMetrics() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        engine = createEngine(new WorkflowMetrics(meterRegistry), List.of());
        registry.register(TaskSpec.of("taskB", failingTimes(1, "B", new AtomicInteger())));

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("taskB")), Map.of()))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(meterRegistry.get("firefly.agentflow.task.retries").tag("task", "taskB").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("firefly.agentflow.task.completed")
                .tag("task", "taskB").tag("status", "succeeded").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("firefly.agentflow.run.completed").tag("outcome", "succeeded").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldFinishRunInBackgroundWhenSubscriberCancels() throws InterruptedException {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        engine = createEngine(new WorkflowMetrics(meterRegistry), List.of());
        AtomicBoolean attemptFinished = new AtomicBoolean();
        List<String> events = new CopyOnWriteArrayList<>();
        registry.register(TaskSpec.of("slow", invocation -> Mono.delay(Duration.ofMillis(300))
                .thenReturn("slow output")
                .doOnNext(output -> attemptFinished.set(true))));
        registry.register(TaskSpec.of("next", invocation -> Mono.just("next output")));

        ExecutionOptions options = ExecutionOptions.defaults()
                .withListener(event -> events.add(event.taskName() + ":" + event.toState()));
        WorkflowRun run = engine.prepare(WorkflowPlan.of(Stage.of("slow"), Stage.of("next")), Map.of(), options);

        Disposable subscription = run.execute().subscribe();
        Thread.sleep(100);
        subscription.dispose();

        WorkflowReport report = awaitReport(run);

        assertThat(run.isCancelled()).isTrue();
        assertThat(attemptFinished).isTrue();
        assertThat(report.results().get("slow").status()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(report.results().get("next").status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(events).containsExactly("slow:RUNNING", "slow:SUCCEEDED", "next:CANCELLED");
        assertThat(meterRegistry.get("firefly.agentflow.run.active").gauge().value()).isZero();
        assertThat(meterRegistry.get("firefly.agentflow.run.completed").tag("outcome", "cancelled").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldUseTaskDefinitionsResolvedWhenPrepared() {
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("original A")));
        registry.register(TaskSpec.of("taskB", invocation -> Mono.just("B")));
        WorkflowRun run = engine.prepare(WorkflowPlan.of(Stage.of("taskA"), Stage.of("taskB")), Map.of(),
                ExecutionOptions.defaults());

        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("replacement A")));
        registry.unregister("taskB");

        StepVerifier.create(run.execute())
                .assertNext(report -> {
                    assertThat(report.output("taskA")).contains("original A");
                    assertThat(report.output("taskB")).contains("B");
                    assertThat(report.metrics().totalTasks()).isEqualTo(2);
                    assertThat(report.metrics().successCount()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    void shouldStartNextStageOnlyAfterEveryTaskOfPreviousStageTerminates() {
        registry.register(TaskSpec.of("t1", invocation -> Mono.delay(Duration.ofMillis(10)).thenReturn("t1")));
        registry.register(TaskSpec.of("t2", invocation -> Mono.delay(Duration.ofMillis(80)).thenReturn("t2")));
        registry.register(TaskSpec.of("t3", invocation -> Mono.delay(Duration.ofMillis(30))
                .then(Mono.<String>error(new IOException("upstream reset")))).withMaxAttempts(2));
        registry.register(TaskSpec.of("t4", invocation -> Mono.just("t4")));

        WorkflowPlan plan = WorkflowPlan.of(Stage.of("t1", "t2", "t3"), Stage.of("t4"));

        StepVerifier.create(engine.execute(plan, Map.of()))
                .assertNext(report -> {
                    TaskResult t4 = report.results().get("t4");
                    assertThat(report.results().get("t3").status()).isEqualTo(TaskStatus.FAILED);
                    assertThat(t4.status()).isEqualTo(TaskStatus.SUCCEEDED);
                    for (String name : List.of("t1", "t2", "t3")) {
                        assertThat(t4.startedAt())
                                .as("t4 start vs end of %s", name)
                                .isAfterOrEqualTo(report.results().get(name).endedAt());
                    }
                })
                .verifyComplete();
    }

    @Test
    void shouldCountUnexpectedTaskErrorAsStartedFailure() {
        ContextBuilder brokenContext = new ContextBuilder(registry) {
            @Override
            public Optional<String> build(TaskSpec spec, Map<String, TaskResult> results) {
                throw new IllegalStateException("context store unavailable");
            }
        };
        engine = new WorkflowEngine(registry, new StagePlanner(), brokenContext,
                new RetryExecutor(BackoffPolicy.exponential(Duration.ofMillis(5), Duration.ofMillis(20))),
                ExecutionOptions.defaults(), null, null, List.of());
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();
        registry.register(TaskSpec.of("taskA", invocation -> Mono.just("A")));

        StepVerifier.create(engine.execute(WorkflowPlan.of(Stage.of("taskA")), Map.of(),
                        ExecutionOptions.defaults().withListener(events::add)))
                .assertNext(report -> {
                    TaskResult a = report.results().get("taskA");
                    assertThat(a.status()).isEqualTo(TaskStatus.FAILED);
                    assertThat(a.error()).isEqualTo("context store unavailable");
                    assertThat(report.metrics().totalTasks()).isEqualTo(1);
                    assertThat(report.metrics().failureCount()).isEqualTo(1);
                })
                .verifyComplete();

        assertThat(events).extracting(ProgressEvent::toState)
                .containsExactly(TaskStatus.RUNNING, TaskStatus.FAILED);
    }

    private WorkflowEngine createEngine(WorkflowMetrics metrics,
                                        List<ProgressListener> listeners) {
        RetryExecutor retryExecutor = new RetryExecutor(
                BackoffPolicy.exponential(Duration.ofMillis(5), Duration.ofMillis(20)));
        return new WorkflowEngine(registry, new StagePlanner(), new ContextBuilder(registry), retryExecutor,
                ExecutionOptions.defaults(), null, metrics, listeners);
    }

    private static WorkflowReport awaitReport(WorkflowRun run) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (run.report().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(run.report()).as("run report").isPresent();
        return run.report().get();
    }

    private static TaskHandler failingTimes(int failures, String output, AtomicInteger calls) {
        return invocation -> {
            if (calls.incrementAndGet() <= failures) {
                return Mono.error(new IOException("transient failure " + calls.get()));
            }
            return Mono.just(output);
        };
    }

    private AtomicInteger registerSlowTasks(String... names) {
        return registerSlowTasks(new ArrayList<>(), names);
    }

    private AtomicInteger registerSlowTasks(List<String> order, String... names) {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        for (String name : names) {
            registry.register(TaskSpec.of(name, invocation -> Mono.defer(() -> {
                order.add(invocation.getTaskName());
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                return Mono.delay(Duration.ofMillis(50))
                        .thenReturn(invocation.getTaskName())
                        .doFinally(signal -> active.decrementAndGet());
            })));
        }
        return maxActive;
    }
}
