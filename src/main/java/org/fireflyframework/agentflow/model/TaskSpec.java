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

import org.fireflyframework.agentflow.core.TaskHandler;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable descriptor of a content-generating task.
 * <p>
 * A task spec is created once when the workflow plan is assembled and never mutated.
 * Dependencies keep their declaration order, which is also the order in which
 * dependency excerpts appear in the task's context.
 *
 * @param name unique task name
 * @param displayName human readable name used in context labels and progress messages
 * @param handler the function producing the task's text
 * @param dependencies names of tasks whose output this task consumes as context
 * @param maxAttempts maximum number of attempts (including the first one)
 * @param perAttemptTimeout timeout applied to each individual attempt
 * @param order position within its stage, used for deterministic logging only
 */
public record TaskSpec(
        String name,
        String displayName,
        TaskHandler handler,
        Set<String> dependencies,
        int maxAttempts,
        Duration perAttemptTimeout,
        int order
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public TaskSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        Objects.requireNonNull(perAttemptTimeout, "perAttemptTimeout cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 for task '" + name + "'");
        }
        if (perAttemptTimeout.isNegative() || perAttemptTimeout.isZero()) {
            throw new IllegalArgumentException("perAttemptTimeout must be positive for task '" + name + "'");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = name;
        }
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        if (dependencies.contains(name)) {
            throw new IllegalArgumentException("Task '" + name + "' cannot depend on itself");
        }
    }

    /**
     * Creates a task spec with default retry and timeout settings and no dependencies.
     *
     * @param name the task name
     * @param handler the task handler
     * @return new task spec
     */
    public static TaskSpec of(String name, TaskHandler handler) {
        return new TaskSpec(name, name, handler, Set.of(), DEFAULT_MAX_ATTEMPTS, DEFAULT_TIMEOUT, 0);
    }

    public TaskSpec withDisplayName(String displayName) {
        return new TaskSpec(name, displayName, handler, dependencies, maxAttempts, perAttemptTimeout, order);
    }

    public TaskSpec withDependencies(String... dependencies) {
        return withDependencies(new LinkedHashSet<>(Arrays.asList(dependencies)));
    }

    public TaskSpec withDependencies(Set<String> dependencies) {
        return new TaskSpec(name, displayName, handler, dependencies, maxAttempts, perAttemptTimeout, order);
    }

    public TaskSpec withMaxAttempts(int maxAttempts) {
        return new TaskSpec(name, displayName, handler, dependencies, maxAttempts, perAttemptTimeout, order);
    }

    public TaskSpec withTimeout(Duration perAttemptTimeout) {
        return new TaskSpec(name, displayName, handler, dependencies, maxAttempts, perAttemptTimeout, order);
    }

    public TaskSpec withOrder(int order) {
        return new TaskSpec(name, displayName, handler, dependencies, maxAttempts, perAttemptTimeout, order);
    }

    /**
     * Checks if this task consumes the output of other tasks.
     *
     * @return true if the task declares dependencies
     */
    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }
}
