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

package org.fireflyframework.agentflow.exception;

/**
 * Exception thrown when a workflow plan or task registration is invalid.
 * <p>
 * This indicates a broken plan rather than a runtime failure and is raised
 * before any task runs:
 * <ul>
 *   <li>A stage references a task that is not registered</li>
 *   <li>A task depends on a task planned in the same or a later stage</li>
 *   <li>Circular dependencies are detected while deriving stages</li>
 *   <li>A task depends on a task that is not registered</li>
 * </ul>
 */
public class WorkflowValidationException extends AgentflowException {

    /**
     * Creates a new validation exception with the given message.
     *
     * @param message the error message
     */
    public WorkflowValidationException(String message) {
        super(message);
    }

    /**
     * Creates a new validation exception with the given message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public WorkflowValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
