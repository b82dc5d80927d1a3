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

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time snapshot of a run's progress.
 *
 * @param totalSteps number of tracked tasks
 * @param completed number of succeeded tasks
 * @param failed number of failed tasks
 * @param cancelled number of cancelled tasks
 * @param running number of tasks running or waiting to retry
 * @param states current state per task, in registration order
 * @param startedAt when tracking started, null if not started
 * @param elapsed time since tracking started
 */
public record ProgressState(
        int totalSteps,
        int completed,
        int failed,
        int cancelled,
        int running,
        Map<String, TaskStatus> states,
        Instant startedAt,
        Duration elapsed
) {

    public int finished() {
        return completed + failed + cancelled;
    }

    public double percentComplete() {
        return totalSteps == 0 ? 0.0 : finished() * 100.0 / totalSteps;
    }

    public boolean isDone() {
        return finished() >= totalSteps;
    }
}
