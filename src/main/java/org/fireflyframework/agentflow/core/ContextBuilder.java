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
import org.fireflyframework.agentflow.model.TaskResult;
import org.fireflyframework.agentflow.model.TaskSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the dependency context handed to a task.
 * <p>
 * Each succeeded dependency contributes a labelled excerpt:
 * <pre>
 * ## Project Overview
 * first N characters of the overview output
 * </pre>
 * Excerpts follow the declaration order of the dependencies and are separated by
 * a blank line. Failed, cancelled, missing and empty dependencies are left out.
 */
@Slf4j
public class ContextBuilder {

    public static final int DEFAULT_EXCERPT_LENGTH = 500;

    private final TaskRegistry registry;
    private final int excerptLength;

    public ContextBuilder(TaskRegistry registry) {
        this(registry, DEFAULT_EXCERPT_LENGTH);
    }

    public ContextBuilder(TaskRegistry registry, int excerptLength) {
        if (excerptLength < 1) {
            throw new IllegalArgumentException("excerptLength must be >= 1");
        }
        this.registry = registry;
        this.excerptLength = excerptLength;
    }

    /**
     * Builds the context for a task.
     *
     * @param spec the task about to run
     * @param results the results recorded so far in the run
     * @return empty if the task declares no dependencies, otherwise the context text
     *         (an empty string when no dependency produced output)
     */
    public Optional<String> build(TaskSpec spec, Map<String, TaskResult> results) {
        if (!spec.hasDependencies()) {
            return Optional.empty();
        }

        List<String> sections = new ArrayList<>();
        for (String dependency : spec.dependencies()) {
            TaskResult result = results.get(dependency);
            if (result == null || !result.isSucceeded()) {
                log.debug("CONTEXT_SKIP: task={}, dependency={}, status={}",
                        spec.name(), dependency, result != null ? result.status() : "ABSENT");
                continue;
            }
            String output = result.output();
            if (output == null || output.isEmpty()) {
                log.warn("CONTEXT_EMPTY_DEPENDENCY: task={}, dependency={} succeeded without output",
                        spec.name(), dependency);
                continue;
            }
            sections.add("## " + labelOf(dependency) + "\n" + excerpt(output) + "\n");
        }

        log.debug("CONTEXT_BUILT: task={}, sections={}/{}", spec.name(), sections.size(), spec.dependencies().size());
        return Optional.of(String.join("\n", sections));
    }

    public int getExcerptLength() {
        return excerptLength;
    }

    private String labelOf(String taskName) {
        return registry.get(taskName).map(TaskSpec::displayName).orElse(taskName);
    }

    private String excerpt(String output) {
        if (output.codePointCount(0, output.length()) <= excerptLength) {
            return output;
        }
        return output.substring(0, output.offsetByCodePoints(0, excerptLength));
    }
}
