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
import org.fireflyframework.agentflow.exception.WorkflowValidationException;
import org.fireflyframework.agentflow.metrics.WorkflowMetrics;
import org.fireflyframework.agentflow.model.ExecutionOptions;
import org.fireflyframework.agentflow.model.TaskSpec;
import org.fireflyframework.agentflow.model.WorkflowPlan;
import org.fireflyframework.agentflow.model.WorkflowReport;
import org.fireflyframework.agentflow.progress.ProgressListener;
import org.fireflyframework.agentflow.retry.BackoffPolicy;
import org.fireflyframework.agentflow.retry.RetryExecutor;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Main entry point for executing agent workflows.
 * <p>
 * The engine is stateless between runs: every call to {@link #prepare} or
 * {@link #execute} creates a new {@link WorkflowRun} that owns all state of that
 * execution, so one engine can serve concurrent runs.
 * <p>
 * Plans are validated before any task starts. A plan referencing an unregistered
 * task or violating the stage ordering fails with a {@link WorkflowValidationException}
 * thrown from the calling thread; task failures never fail the returned Mono.
 */
@Slf4j
public class WorkflowEngine {

    private final TaskRegistry registry;
    private final StagePlanner planner;
    private final ContextBuilder contextBuilder;
    private final RetryExecutor retryExecutor;
    private final ExecutionOptions defaultOptions;
    private final WorkflowPlan configuredPlan;
    private final WorkflowMetrics workflowMetrics;
    private final List<ProgressListener> listeners;

    public WorkflowEngine(TaskRegistry registry) {
        this(registry, new StagePlanner(), new ContextBuilder(registry), new RetryExecutor(BackoffPolicy.DEFAULT),
                ExecutionOptions.defaults(), null, null, List.of());
    }

    public WorkflowEngine(TaskRegistry registry,
                          StagePlanner planner,
                          ContextBuilder contextBuilder,
                          RetryExecutor retryExecutor,
                          ExecutionOptions defaultOptions,
                          @Nullable WorkflowPlan configuredPlan,
                          @Nullable WorkflowMetrics workflowMetrics,
                          List<ProgressListener> listeners) {
        this.registry = registry;
        this.planner = planner;
        this.contextBuilder = contextBuilder;
        this.retryExecutor = retryExecutor;
        this.defaultOptions = defaultOptions;
        this.configuredPlan = configuredPlan;
        this.workflowMetrics = workflowMetrics;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Executes a plan with the engine's default options.
     *
     * @param plan the workflow plan
     * @param inputs task name to task input
     * @return a Mono emitting the report of the run
     * @throws WorkflowValidationException if the plan is invalid
     */
    public Mono<WorkflowReport> execute(WorkflowPlan plan, Map<String, ?> inputs) {
        return execute(plan, inputs, defaultOptions);
    }

    /**
     * Executes a plan.
     *
     * @param plan the workflow plan
     * @param inputs task name to task input
     * @param options per-run options
     * @return a Mono emitting the report of the run
     * @throws WorkflowValidationException if the plan is invalid
     */
    public Mono<WorkflowReport> execute(WorkflowPlan plan, Map<String, ?> inputs, ExecutionOptions options) {
        return prepare(plan, inputs, options).execute();
    }

    /**
     * Executes the configured plan, or a plan derived from the task dependencies
     * when no stages are configured.
     *
     * @param inputs task name to task input
     * @return a Mono emitting the report of the run
     */
    public Mono<WorkflowReport> executeConfigured(Map<String, ?> inputs) {
        return execute(resolveConfiguredPlan(), inputs, defaultOptions);
    }

    /**
     * Validates a plan and creates a run without starting it. The caller keeps a
     * handle for status polling and cancellation.
     *
     * @param plan the workflow plan
     * @param inputs task name to task input
     * @param options per-run options
     * @return the prepared run
     * @throws WorkflowValidationException if the plan is invalid
     */
    public WorkflowRun prepare(WorkflowPlan plan, Map<String, ?> inputs, ExecutionOptions options) {
        planner.validate(plan, registry);

        WorkflowPlan effectivePlan = plan;
        if (options.hasSelection()) {
            Set<String> unknown = new LinkedHashSet<>(options.selectedTasks());
            unknown.removeAll(plan.taskNames());
            if (!unknown.isEmpty()) {
                log.warn("Selected tasks not in plan will be ignored: {}", unknown);
            }
            effectivePlan = plan.retain(options.selectedTasks());
        }

        String runId = UUID.randomUUID().toString();
        log.debug("Prepared run: runId={}, stages={}, tasks={}",
                runId, effectivePlan.stages().size(), effectivePlan.taskCount());

        Map<String, Object> runInputs = new HashMap<>();
        if (inputs != null) {
            runInputs.putAll(inputs);
        }
        Map<String, TaskSpec> specs = new HashMap<>();
        for (String taskName : effectivePlan.taskNames()) {
            specs.put(taskName, registry.require(taskName));
        }
        return new WorkflowRun(runId, effectivePlan, runInputs, options,
                specs, contextBuilder, retryExecutor, workflowMetrics, listeners);
    }

    /**
     * Gets the plan used by {@link #executeConfigured(Map)}.
     *
     * @return the configured plan, or the derived plan when none is configured
     */
    public WorkflowPlan resolveConfiguredPlan() {
        if (configuredPlan != null && !configuredPlan.isEmpty()) {
            return configuredPlan;
        }
        return planner.derive(registry);
    }

    public TaskRegistry getRegistry() {
        return registry;
    }

    public ExecutionOptions getDefaultOptions() {
        return defaultOptions;
    }
}
