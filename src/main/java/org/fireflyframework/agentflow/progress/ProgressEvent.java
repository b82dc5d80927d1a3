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

package org.fireflyframework.agentflow.progress;

import org.fireflyframework.agentflow.model.TaskStatus;

import java.time.Instant;

/**
 * Describes one task state transition.
 * <p>
 * Transient: handed to each {@link ProgressListener} and not retained by the tracker.
 *
 * @param taskName the task that changed state
 * @param fromState the state before the transition
 * @param toState the state after the transition
 * @param message optional human readable detail, such as a failure reason
 * @param attempt the attempt number the transition relates to, 0 if none
 * @param completedSteps number of tasks in a terminal state after this transition
 * @param totalSteps number of tasks tracked by the run
 * @param timestamp when the transition happened
 */
public record ProgressEvent(
        String taskName,
        TaskStatus fromState,
        TaskStatus toState,
        String message,
        int attempt,
        int completedSteps,
        int totalSteps,
        Instant timestamp
) {

    public boolean isTerminal() {
        return toState.isTerminal();
    }

    /**
     * Gets the share of finished tasks at the time of this event.
     *
     * @return percentage in [0, 100]
     */
    public double percentComplete() {
        return totalSteps == 0 ? 0.0 : completedSteps * 100.0 / totalSteps;
    }
}
