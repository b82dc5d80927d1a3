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

import org.fireflyframework.agentflow.progress.ProgressListener;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-run execution options.
 *
 * @param selectedTasks tasks to run, or null to run the whole plan
 * @param mode how tasks of a multi-task stage are scheduled
 * @param maxConcurrency maximum tasks of one stage running at once, 0 for no limit
 * @param listeners progress listeners attached to this run only
 */
public record ExecutionOptions(
        Set<String> selectedTasks,
        ExecutionMode mode,
        int maxConcurrency,
        List<ProgressListener> listeners
) {

    public ExecutionOptions {
        Objects.requireNonNull(mode, "mode cannot be null");
        if (maxConcurrency < 0) {
            throw new IllegalArgumentException("maxConcurrency must be >= 0");
        }
        selectedTasks = selectedTasks == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(selectedTasks));
        listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(null, ExecutionMode.PARALLEL, 0, List.of());
    }

    public ExecutionOptions withSelectedTasks(String... taskNames) {
        return withSelectedTasks(new LinkedHashSet<>(Arrays.asList(taskNames)));
    }

    public ExecutionOptions withSelectedTasks(Set<String> taskNames) {
        return new ExecutionOptions(taskNames, mode, maxConcurrency, listeners);
    }

    public ExecutionOptions withMode(ExecutionMode mode) {
        return new ExecutionOptions(selectedTasks, mode, maxConcurrency, listeners);
    }

    public ExecutionOptions withMaxConcurrency(int maxConcurrency) {
        return new ExecutionOptions(selectedTasks, mode, maxConcurrency, listeners);
    }

    public ExecutionOptions withListener(ProgressListener listener) {
        List<ProgressListener> extended = new ArrayList<>(listeners);
        extended.add(listener);
        return new ExecutionOptions(selectedTasks, mode, maxConcurrency, extended);
    }

    public boolean hasSelection() {
        return selectedTasks != null;
    }

    /**
     * Gets the concurrency to use for a stage of the given size.
     *
     * @param stageSize number of tasks in the stage
     * @return effective concurrency, at least 1
     */
    public int concurrencyFor(int stageSize) {
        int limit = maxConcurrency == 0 ? stageSize : Math.min(maxConcurrency, stageSize);
        return Math.max(1, limit);
    }
}
