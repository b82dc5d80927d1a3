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

package org.fireflyframework.agentflow.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered list of stages covering all tasks of one execution.
 * <p>
 * Stage order is the only ordering contract of a run: no task of stage {@code i + 1}
 * starts before every task of stage {@code i} has terminated.
 *
 * @param stages the stages in execution order
 */
public record WorkflowPlan(List<Stage> stages) {

    public static final WorkflowPlan EMPTY = new WorkflowPlan(List.of());

    public WorkflowPlan {
        Objects.requireNonNull(stages, "stages cannot be null");
        stages = List.copyOf(stages);
        Set<String> seen = new LinkedHashSet<>();
        for (Stage stage : stages) {
            for (String name : stage.taskNames()) {
                if (!seen.add(name)) {
                    throw new IllegalArgumentException("Task '" + name + "' appears in more than one stage");
                }
            }
        }
    }

    public static WorkflowPlan of(Stage... stages) {
        return new WorkflowPlan(Arrays.asList(stages));
    }

    /**
     * Creates a plan from plain lists of task names, one list per stage.
     *
     * @param stages the stage task names
     * @return new plan
     */
    public static WorkflowPlan fromNames(Collection<? extends List<String>> stages) {
        List<Stage> converted = new ArrayList<>();
        for (List<String> names : stages) {
            converted.add(new Stage(names));
        }
        return new WorkflowPlan(converted);
    }

    /**
     * Gets all task names of the plan in stage order.
     *
     * @return ordered set of task names
     */
    public Set<String> taskNames() {
        Set<String> names = new LinkedHashSet<>();
        stages.forEach(stage -> names.addAll(stage.taskNames()));
        return Collections.unmodifiableSet(names);
    }

    public int taskCount() {
        return stages.stream().mapToInt(Stage::size).sum();
    }

    public boolean isEmpty() {
        return taskCount() == 0;
    }

    /**
     * Gets the index of the stage containing a task.
     *
     * @param taskName the task name
     * @return the stage index, or -1 if the task is not planned
     */
    public int stageIndexOf(String taskName) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).contains(taskName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Restricts the plan to the selected tasks, dropping stages that become empty.
     *
     * @param selected the task names to keep
     * @return the restricted plan
     */
    public WorkflowPlan retain(Set<String> selected) {
        return new WorkflowPlan(stages.stream()
                .map(stage -> stage.retain(selected))
                .filter(stage -> !stage.isEmpty())
                .toList());
    }
}
