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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks the state machine of every task of one run and notifies listeners.
 * <p>
 * Per task the allowed sequence is {@code PENDING -> RUNNING -> (RETRYING)* -> SUCCEEDED | FAILED},
 * or {@code PENDING -> CANCELLED} for tasks that never start. All {@code step*} calls are
 * serialized on the tracker's monitor and listeners run before the call returns, so events
 * of a single task reach every listener in the order they happened. Events of different
 * tasks of the same stage may interleave.
 */
@Slf4j
public class ProgressTracker {

    private final Object monitor = new Object();
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, TaskStatus> states = new LinkedHashMap<>();
    private int totalSteps;
    private Instant startedAt;

    /**
     * Starts tracking.
     *
     * @param totalSteps the number of tasks that will report progress
     */
    public void start(int totalSteps) {
        synchronized (monitor) {
            this.totalSteps = totalSteps;
            this.startedAt = Instant.now();
            this.states.clear();
        }
        log.debug("PROGRESS_START: totalSteps={}", totalSteps);
    }

    /**
     * Starts tracking the given tasks, all in PENDING state.
     *
     * @param taskNames the planned task names
     */
    public void start(Collection<String> taskNames) {
        synchronized (monitor) {
            start(taskNames.size());
            taskNames.forEach(name -> states.put(name, TaskStatus.PENDING));
        }
    }

    public void registerCallback(ProgressListener listener) {
        listeners.add(listener);
    }

    public void stepStart(String taskName) {
        stepStart(taskName, null);
    }

    public void stepStart(String taskName, String message) {
        transition(taskName, TaskStatus.RUNNING, message, 1);
    }

    /**
     * Reports that a failed attempt will be retried.
     *
     * @param taskName the task name
     * @param attempt the attempt that failed
     */
    public void stepRetry(String taskName, int attempt) {
        stepRetry(taskName, attempt, null);
    }

    public void stepRetry(String taskName, int attempt, String reason) {
        transition(taskName, TaskStatus.RETRYING, reason, attempt);
    }

    public void stepComplete(String taskName) {
        transition(taskName, TaskStatus.SUCCEEDED, null, 0);
    }

    public void stepFailed(String taskName, String reason) {
        transition(taskName, TaskStatus.FAILED, reason, 0);
    }

    public void stepCancelled(String taskName) {
        transition(taskName, TaskStatus.CANCELLED, "run cancelled", 0);
    }

    /**
     * Gets a snapshot of the current progress.
     *
     * @return progress state
     */
    public ProgressState snapshot() {
        synchronized (monitor) {
            int completed = 0;
            int failed = 0;
            int cancelled = 0;
            int running = 0;
            for (TaskStatus status : states.values()) {
                switch (status) {
                    case SUCCEEDED -> completed++;
                    case FAILED -> failed++;
                    case CANCELLED -> cancelled++;
                    case RUNNING, RETRYING -> running++;
                    default -> {
                    }
                }
            }
            Duration elapsed = startedAt != null ? Duration.between(startedAt, Instant.now()) : Duration.ZERO;
            return new ProgressState(totalSteps, completed, failed, cancelled, running,
                    Collections.unmodifiableMap(new LinkedHashMap<>(states)), startedAt, elapsed);
        }
    }

    private void transition(String taskName, TaskStatus to, String message, int attempt) {
        synchronized (monitor) {
            TaskStatus from = states.getOrDefault(taskName, TaskStatus.PENDING);
            if (from.isTerminal()) {
                log.warn("PROGRESS_IGNORED: task={} already {}, dropping transition to {}", taskName, from, to);
                return;
            }
            states.put(taskName, to);

            int finished = (int) states.values().stream().filter(TaskStatus::isTerminal).count();
            ProgressEvent event = new ProgressEvent(taskName, from, to, message, attempt,
                    finished, Math.max(totalSteps, states.size()), Instant.now());

            for (ProgressListener listener : listeners) {
                try {
                    listener.onProgress(event);
                } catch (RuntimeException e) {
                    log.warn("PROGRESS_LISTENER_FAILED: task={}, listener={}, error={}",
                            taskName, listener.getClass().getSimpleName(), e.getMessage(), e);
                }
            }
        }
    }
}
