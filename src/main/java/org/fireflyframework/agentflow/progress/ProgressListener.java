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

/**
 * Observer of task state transitions.
 * <p>
 * Listeners are invoked synchronously by the {@link ProgressTracker} on the thread
 * running the task, while the tracker holds its lock. A slow listener therefore
 * delays task completion and every other event of the run. Listeners that perform
 * I/O should hand events off, for example through {@link BufferedProgressListener}.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressEvent event);
}
