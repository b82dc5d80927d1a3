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
import org.fireflyframework.agentflow.model.Stage;
import org.fireflyframework.agentflow.model.TaskSpec;
import org.fireflyframework.agentflow.model.WorkflowPlan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates workflow plans against the task registry and derives plans from the
 * dependency graph.
 * <p>
 * <b>Stage invariant:</b> for every task {@code t} in stage {@code i}, every
 * dependency of {@code t} that is part of the plan belongs to some stage
 * {@code j < i}. A dependency that is registered but not planned is allowed; it
 * never produces output, so it is simply absent from the task's context.
 * <p>
 * <b>Derived plans</b> are built with Kahn's algorithm:
 * <ul>
 *   <li>Stage 0 contains the tasks without planned dependencies</li>
 *   <li>Each subsequent stage contains the tasks whose dependencies are all in earlier stages</li>
 *   <li>Tasks within a stage are sorted by order, then by name</li>
 * </ul>
 */
@Slf4j
public class StagePlanner {

    private static final Comparator<TaskSpec> STAGE_ORDER =
            Comparator.comparingInt(TaskSpec::order).thenComparing(TaskSpec::name);

    /**
     * Validates a plan.
     *
     * @param plan the plan to validate
     * @param registry the registry holding the planned tasks
     * @throws org.fireflyframework.agentflow.exception.TaskNotFoundException if a stage references an unregistered task
     * @throws WorkflowValidationException if a dependency is unregistered or not planned in an earlier stage
     */
    public void validate(WorkflowPlan plan, TaskRegistry registry) {
        List<Stage> stages = plan.stages();
        for (int i = 0; i < stages.size(); i++) {
            for (String taskName : stages.get(i).taskNames()) {
                TaskSpec spec = registry.require(taskName);
                for (String dependency : spec.dependencies()) {
                    validateDependency(plan, registry, i, taskName, dependency);
                }
            }
        }
        log.debug("Plan validated: stages={}, tasks={}", stages.size(), plan.taskCount());
    }

    private void validateDependency(WorkflowPlan plan, TaskRegistry registry,
                                    int stageIndex, String taskName, String dependency) {
        if (!registry.contains(dependency)) {
            throw new WorkflowValidationException(String.format(
                    "Task '%s' depends on unregistered task '%s'", taskName, dependency));
        }
        int dependencyStage = plan.stageIndexOf(dependency);
        if (dependencyStage >= stageIndex) {
            throw new WorkflowValidationException(String.format(
                    "Task '%s' in stage %d depends on task '%s' in stage %d; dependencies must be planned in an earlier stage",
                    taskName, stageIndex, dependency, dependencyStage));
        }
    }

    /**
     * Derives a plan covering every registered task.
     *
     * @param registry the task registry
     * @return the derived plan
     * @throws WorkflowValidationException if the dependency graph is broken or cyclic
     */
    public WorkflowPlan derive(TaskRegistry registry) {
        return derive(registry, registry.getTaskNames());
    }

    /**
     * Derives a plan covering the given tasks. Dependencies outside the given set
     * do not constrain the layering.
     *
     * @param registry the task registry
     * @param taskNames the tasks to plan
     * @return the derived plan
     * @throws WorkflowValidationException if the dependency graph is broken or cyclic
     */
    public WorkflowPlan derive(TaskRegistry registry, Collection<String> taskNames) {
        Map<String, TaskSpec> specs = new LinkedHashMap<>();
        for (String name : taskNames) {
            specs.put(name, registry.require(name));
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (TaskSpec spec : specs.values()) {
            int degree = 0;
            for (String dependency : spec.dependencies()) {
                if (!registry.contains(dependency)) {
                    throw new WorkflowValidationException(String.format(
                            "Task '%s' depends on unregistered task '%s'", spec.name(), dependency));
                }
                if (specs.containsKey(dependency)) {
                    degree++;
                    dependents.computeIfAbsent(dependency, d -> new ArrayList<>()).add(spec.name());
                }
            }
            inDegree.put(spec.name(), degree);
        }

        List<Stage> stages = new ArrayList<>();
        int placed = 0;
        while (placed < specs.size()) {
            List<TaskSpec> ready = specs.values().stream()
                    .filter(spec -> inDegree.get(spec.name()) == 0)
                    .sorted(STAGE_ORDER)
                    .toList();

            if (ready.isEmpty()) {
                List<String> remaining = inDegree.entrySet().stream()
                        .filter(entry -> entry.getValue() > 0)
                        .map(Map.Entry::getKey)
                        .sorted()
                        .toList();
                log.error("Circular dependency detected among tasks: {}", remaining);
                throw new WorkflowValidationException("Circular dependency detected among tasks " + remaining);
            }

            List<String> stageNames = new ArrayList<>();
            for (TaskSpec spec : ready) {
                stageNames.add(spec.name());
                inDegree.put(spec.name(), -1);
                for (String dependent : dependents.getOrDefault(spec.name(), List.of())) {
                    inDegree.merge(dependent, -1, Integer::sum);
                }
            }
            stages.add(new Stage(stageNames));
            placed += stageNames.size();
        }

        WorkflowPlan plan = new WorkflowPlan(stages);
        log.debug("Derived plan: stages={}, tasks={}", stages.size(), plan.taskCount());
        return plan;
    }
}
