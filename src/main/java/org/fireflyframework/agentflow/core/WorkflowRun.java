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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.metrics.MetricsCollector;
import org.fireflyframework.agentflow.metrics.WorkflowMetrics;
import org.fireflyframework.agentflow.model.ExecutionMetrics;
import org.fireflyframework.agentflow.model.ExecutionMode;
import org.fireflyframework.agentflow.model.ExecutionOptions;
import org.fireflyframework.agentflow.model.Stage;
import org.fireflyframework.agentflow.model.TaskResult;
import org.fireflyframework.agentflow.model.TaskSpec;
import org.fireflyframework.agentflow.model.TaskStatus;
import org.fireflyframework.agentflow.model.WorkflowPlan;
import org.fireflyframework.agentflow.model.WorkflowReport;
import org.fireflyframework.agentflow.progress.ProgressListener;
import org.fireflyframework.agentflow.progress.ProgressState;
import org.fireflyframework.agentflow.progress.ProgressTracker;
import org.fireflyframework.agentflow.retry.RetryExecutor;
import org.fireflyframework.agentflow.retry.RetryListener;
import org.fireflyframework.agentflow.retry.RetryOutcome;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One execution of a workflow plan.
 * <p>
 * A run owns its task results, metrics collector and progress tracker, so several
 * runs of the same engine never share mutable state. Stages run strictly one after
 * another; the tasks of a multi-task stage run concurrently (or one by one in
 * {@link ExecutionMode#SEQUENTIAL} mode) and the stage completes only when every
 * task has reached a terminal state. A failed task never aborts the run.
 * <p>
 * A run executes once. Call {@link #cancel()} to stop it early: tasks that have not
 * started become {@link TaskStatus#CANCELLED}, in-flight attempts finish and no
 * further retries are scheduled. Cancelling the subscription of {@link #execute()}
 * has the same effect: the run keeps going in the background until every task is
 * terminal, so its results, metrics and progress always complete.
 * <p>
 * Task definitions are resolved when the run is prepared; later changes to the
 * {@link TaskRegistry} do not affect a prepared run.
 */
@Slf4j
public class WorkflowRun {

    private final String runId;
    private final WorkflowPlan plan;
    private final Map<String, Object> inputs;
    private final ExecutionOptions options;
    private final Map<String, TaskSpec> specs;
    private final ContextBuilder contextBuilder;
    private final RetryExecutor retryExecutor;
    private final WorkflowMetrics workflowMetrics;

    private final Map<String, TaskResult> results = new ConcurrentHashMap<>();
    private final MetricsCollector metrics;
    private final ProgressTracker progress = new ProgressTracker();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicReference<WorkflowReport> report = new AtomicReference<>();

    WorkflowRun(String runId,
                WorkflowPlan plan,
                Map<String, Object> inputs,
                ExecutionOptions options,
                Map<String, TaskSpec> specs,
                ContextBuilder contextBuilder,
                RetryExecutor retryExecutor,
                @Nullable WorkflowMetrics workflowMetrics,
                List<ProgressListener> engineListeners) {
        this.runId = runId;
        this.plan = plan;
        this.inputs = inputs;
        this.options = options;
        this.specs = Map.copyOf(specs);
        this.contextBuilder = contextBuilder;
        this.retryExecutor = retryExecutor;
        this.workflowMetrics = workflowMetrics;
        this.metrics = new MetricsCollector(runId);

        plan.taskNames().forEach(name -> results.put(name, TaskResult.pending(name)));
        engineListeners.forEach(progress::registerCallback);
        options.listeners().forEach(progress::registerCallback);
    }

    /**
     * Executes the plan.
     * <p>
     * The run is driven by its own subscription. Cancelling the returned Mono
     * requests cancellation of the run but does not interrupt in-flight attempts.
     *
     * @return a Mono emitting the report once every planned task has terminated
     */
    public Mono<WorkflowReport> execute() {
        return Mono.defer(() -> {
                    if (!started.compareAndSet(false, true)) {
                        return Mono.error(new IllegalStateException("Workflow run " + runId + " was already executed"));
                    }
                    metrics.start();
                    progress.start(plan.taskNames());
                    if (workflowMetrics != null) {
                        workflowMetrics.recordRunStarted();
                    }
                    log.info("RUN_START: runId={}, stages={}, tasks={}, mode={}",
                            runId, plan.stages().size(), plan.taskCount(), options.mode());

                    Sinks.One<WorkflowReport> outcome = Sinks.one();
                    executeStages(0)
                            .onErrorResume(error -> {
                                log.error("RUN_ERROR: runId={}, error={}", runId, error.getMessage(), error);
                                return Mono.empty();
                            })
                            .then(Mono.fromCallable(this::complete))
                            .subscribe(outcome::tryEmitValue, outcome::tryEmitError);
                    return outcome.asMono();
                })
                .doOnCancel(this::cancel);
    }

    /**
     * Requests cancellation of the run.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("RUN_CANCEL_REQUESTED: runId={}", runId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getRunId() {
        return runId;
    }

    public WorkflowPlan getPlan() {
        return plan;
    }

    /**
     * Gets a copy of the current task results, in plan order.
     *
     * @return immutable snapshot of the results
     */
    public Map<String, TaskResult> snapshot() {
        Map<String, TaskResult> copy = new LinkedHashMap<>();
        for (String name : plan.taskNames()) {
            copy.put(name, results.get(name));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Gets the report of a finished run.
     *
     * @return the report, or empty while the run is still executing
     */
    public Optional<WorkflowReport> report() {
        return Optional.ofNullable(report.get());
    }

    public ProgressState progress() {
        return progress.snapshot();
    }

    /**
     * Gets the metrics collected so far.
     */
    public ExecutionMetrics metrics() {
        return metrics.summary();
    }

    // ==================== Stage Execution ====================

    private Mono<Void> executeStages(int stageIndex) {
        if (stageIndex >= plan.stages().size()) {
            return Mono.empty();
        }

        Stage stage = plan.stages().get(stageIndex);
        log.debug("STAGE_START: runId={}, stage={}, tasks={}", runId, stageIndex, stage.taskNames());

        return executeStage(stage)
                .doOnTerminate(() -> log.debug("STAGE_COMPLETE: runId={}, stage={}", runId, stageIndex))
                .then(Mono.defer(() -> executeStages(stageIndex + 1)));
    }

    private Mono<Void> executeStage(Stage stage) {
        if (stage.isEmpty()) {
            return Mono.empty();
        }

        if (stage.size() == 1) {
            // Single task - execute directly
            return executeTask(stage.taskNames().get(0));
        }

        if (options.mode() == ExecutionMode.SEQUENTIAL) {
            return Flux.fromIterable(stage.taskNames())
                    .concatMap(this::executeTask)
                    .then();
        }

        return Flux.fromIterable(stage.taskNames())
                .flatMap(this::executeTask, options.concurrencyFor(stage.size()))
                .then();
    }

    // ==================== Task Execution ====================

    private Mono<Void> executeTask(String taskName) {
        return Mono.defer(() -> {
                    TaskSpec spec = specs.get(taskName);
                    if (cancelled.get()) {
                        markCancelled(spec);
                        return Mono.<Void>empty();
                    }

                    String context = contextBuilder.build(spec, results).orElse(null);
                    Object input = inputs.get(taskName);

                    metrics.recordStart(taskName);
                    progress.stepStart(taskName, spec.displayName());
                    if (workflowMetrics != null) {
                        workflowMetrics.recordTaskStarted(taskName);
                    }
                    log.info("TASK_START: runId={}, task={}, hasContext={}, maxAttempts={}",
                            runId, taskName, context != null, spec.maxAttempts());

                    return retryExecutor.execute(spec, input, context, new RunRetryListener(), cancelled::get)
                            .doOnNext(outcome -> recordOutcome(spec, outcome))
                            .then();
                })
                .onErrorResume(error -> {
                    log.error("TASK_FAILED: runId={}, task={}, unexpected error={}", runId, taskName, error.getMessage(), error);
                    if (results.get(taskName).status() == TaskStatus.PENDING) {
                        metrics.recordStart(taskName);
                        progress.stepStart(taskName);
                    }
                    recordFailure(taskName, error, Math.max(1, results.get(taskName).attempts()));
                    return Mono.empty();
                });
    }

    private void recordOutcome(TaskSpec spec, RetryOutcome outcome) {
        if (outcome.isSuccess()) {
            String output = outcome.output();
            TaskResult result = results.compute(spec.name(), (name, current) -> current.succeed(output, outcome.attempts()));
            metrics.recordEnd(spec.name(), output.length(), outcome.attempts());
            progress.stepComplete(spec.name());
            if (workflowMetrics != null) {
                workflowMetrics.recordTaskCompleted(spec.name(), TaskStatus.SUCCEEDED, result.duration());
            }
            log.info("TASK_COMPLETE: runId={}, task={}, attempts={}, outputSize={}, durationMs={}",
                    runId, spec.name(), outcome.attempts(), output.length(), result.duration().toMillis());
        } else {
            recordFailure(spec.name(), outcome.error(), outcome.attempts());
        }
    }

    private void recordFailure(String taskName, Throwable error, int attempts) {
        TaskResult result = results.compute(taskName, (name, current) -> current.fail(error, attempts));
        metrics.recordFailure(taskName, result.error(), attempts);
        progress.stepFailed(taskName, result.error());
        if (workflowMetrics != null) {
            workflowMetrics.recordTaskCompleted(taskName, TaskStatus.FAILED, result.duration());
        }
        log.warn("TASK_FAILED: runId={}, task={}, attempts={}, errorType={}, error={}",
                runId, taskName, attempts, error.getClass().getSimpleName(), result.error());
    }

    private void markCancelled(TaskSpec spec) {
        results.computeIfPresent(spec.name(), (name, current) -> current.cancel());
        metrics.recordCancelled(spec.name());
        progress.stepCancelled(spec.name());
        if (workflowMetrics != null) {
            workflowMetrics.recordTaskCompleted(spec.name(), TaskStatus.CANCELLED, Duration.ZERO);
        }
        log.info("TASK_CANCELLED: runId={}, task={}", runId, spec.name());
    }

    private WorkflowReport complete() {
        for (String taskName : plan.taskNames()) {
            if (!results.get(taskName).status().isTerminal()) {
                log.warn("TASK_UNFINISHED: runId={}, task={}, status={}", runId, taskName, results.get(taskName).status());
                markCancelled(specs.get(taskName));
            }
        }
        metrics.finish();
        ExecutionMetrics summary = metrics.summary();
        if (workflowMetrics != null) {
            workflowMetrics.recordRunCompleted(summary);
        }
        log.info("RUN_COMPLETE: runId={}, durationMs={}, succeeded={}, failed={}, cancelled={}, retries={}",
                runId, summary.totalDuration().toMillis(), summary.successCount(), summary.failureCount(),
                summary.cancelledCount(), summary.totalRetries());
        WorkflowReport finished = new WorkflowReport(runId, snapshot(), summary);
        report.set(finished);
        return finished;
    }

    /**
     * Keeps the run's task results, metrics and progress in step with the retry loop.
     */
    private class RunRetryListener implements RetryListener {

        @Override
        public void onAttemptStarted(String taskName, int attempt) {
            results.computeIfPresent(taskName, (name, current) -> current.start(attempt));
        }

        @Override
        public void onRetryScheduled(String taskName, int failedAttempt, Throwable error, Duration delay) {
            TaskResult result = results.computeIfPresent(taskName, (name, current) -> current.retrying(error));
            metrics.recordRetry(taskName);
            progress.stepRetry(taskName, failedAttempt, result != null ? result.error() : error.getMessage());
            if (workflowMetrics != null) {
                workflowMetrics.recordTaskRetry(taskName, failedAttempt + 1);
            }
        }
    }
}
