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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A group of tasks that do not depend on each other and may run concurrently.
 * <p>
 * Stages reference tasks by name; the task specs themselves are owned by the
 * {@link org.fireflyframework.agentflow.core.TaskRegistry}.
 *
 * @param taskNames the names of the tasks in this stage, in declaration order
 */
public record Stage(List<String> taskNames) {

    public Stage {
        Objects.requireNonNull(taskNames, "taskNames cannot be null");
        taskNames = List.copyOf(taskNames);
        if (Set.copyOf(taskNames).size() != taskNames.size()) {
            throw new IllegalArgumentException("Stage contains duplicate task names: " + taskNames);
        }
    }

    public static Stage of(String... taskNames) {
        return new Stage(Arrays.asList(taskNames));
    }

    public int size() {
        return taskNames.size();
    }

    public boolean isEmpty() {
        return taskNames.isEmpty();
    }

    public boolean contains(String taskName) {
        return taskNames.contains(taskName);
    }

    /**
     * Returns a copy of this stage containing only the selected tasks.
     *
     * @param selected the task names to keep
     * @return filtered stage, possibly empty
     */
    public Stage retain(Set<String> selected) {
        return new Stage(taskNames.stream().filter(selected::contains).toList());
    }
}
