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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.agentflow.exception.InvalidTaskInputException;
import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * The data handed to a {@link TaskHandler} for a single attempt.
 * <p>
 * The context is the concatenated excerpt of the task's succeeded dependencies.
 * It is {@code null} when the task declares no dependencies and may be an empty
 * string when it does but none of them produced output.
 */
public class TaskInvocation {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final String taskName;
    private final Object input;
    private final String context;
    private final int attempt;
    private final ObjectMapper objectMapper;

    public TaskInvocation(String taskName, @Nullable Object input, @Nullable String context, int attempt) {
        this(taskName, input, context, attempt, DEFAULT_MAPPER);
    }

    public TaskInvocation(String taskName, @Nullable Object input, @Nullable String context, int attempt,
                          ObjectMapper objectMapper) {
        this.taskName = Objects.requireNonNull(taskName, "taskName cannot be null");
        this.input = input;
        this.context = context;
        this.attempt = attempt;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public String getTaskName() {
        return taskName;
    }

    @Nullable
    public Object getInput() {
        return input;
    }

    @Nullable
    public String getContext() {
        return context;
    }

    /**
     * Gets the attempt number, starting at 1.
     */
    public int getAttempt() {
        return attempt;
    }

    public boolean hasContext() {
        return context != null && !context.isEmpty();
    }

    /**
     * Converts the input to the given type.
     *
     * @param type the target type
     * @param <T> the target type
     * @return the converted input
     * @throws InvalidTaskInputException if the input is missing or cannot be converted
     */
    public <T> T inputAs(Class<T> type) {
        if (input == null) {
            throw new InvalidTaskInputException(taskName, "no input provided");
        }
        if (type.isInstance(input)) {
            return type.cast(input);
        }
        try {
            return objectMapper.convertValue(input, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskInputException(taskName,
                    "cannot convert " + input.getClass().getSimpleName() + " to " + type.getSimpleName(), e);
        }
    }

    @Override
    public String toString() {
        return "TaskInvocation{taskName='" + taskName + "', attempt=" + attempt
                + ", hasContext=" + hasContext() + "}";
    }
}
