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
import org.fireflyframework.agentflow.exception.TaskNotFoundException;
import org.fireflyframework.agentflow.model.TaskSpec;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of task specs.
 * <p>
 * The registry owns the task specs; stages and plans reference tasks by name.
 * Dependencies are only checked when a plan is validated by {@link StagePlanner},
 * so tasks may be registered in any order.
 */
@Slf4j
public class TaskRegistry {

    private final Map<String, TaskSpec> tasks = new ConcurrentHashMap<>();

    /**
     * Registers a task spec, replacing any previous spec with the same name.
     *
     * @param spec the task spec
     */
    public void register(TaskSpec spec) {
        TaskSpec previous = tasks.put(spec.name(), spec);
        if (previous != null) {
            log.info("Replaced task: name={}", spec.name());
        }
        log.info("Registered task: name={}, displayName={}, dependencies={}, maxAttempts={}, timeout={}",
                spec.name(), spec.displayName(), spec.dependencies(), spec.maxAttempts(), spec.perAttemptTimeout());
    }

    public void registerAll(Collection<TaskSpec> specs) {
        specs.forEach(this::register);
    }

    public boolean unregister(String taskName) {
        TaskSpec removed = tasks.remove(taskName);
        if (removed != null) {
            log.info("Unregistered task: {}", taskName);
            return true;
        }
        return false;
    }

    public Optional<TaskSpec> get(String taskName) {
        return Optional.ofNullable(tasks.get(taskName));
    }

    /**
     * Gets a task spec that must exist.
     *
     * @param taskName the task name
     * @return the task spec
     * @throws TaskNotFoundException if the task is not registered
     */
    public TaskSpec require(String taskName) {
        TaskSpec spec = tasks.get(taskName);
        if (spec == null) {
            throw new TaskNotFoundException(taskName);
        }
        return spec;
    }

    public boolean contains(String taskName) {
        return tasks.containsKey(taskName);
    }

    public Collection<TaskSpec> getAll() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public Set<String> getTaskNames() {
        return Collections.unmodifiableSet(tasks.keySet());
    }

    public int size() {
        return tasks.size();
    }
}
