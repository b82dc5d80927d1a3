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

/**
 * Writes every progress event to the log, one line per transition.
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    @Override
    public void onProgress(ProgressEvent event) {
        String counter = String.format("[%d/%d %.0f%%]",
                event.completedSteps(), event.totalSteps(), event.percentComplete());

        if (event.toState() == TaskStatus.FAILED) {
            log.warn("{} {} failed: {}", counter, event.taskName(), event.message());
        } else if (event.toState() == TaskStatus.RETRYING) {
            log.warn("{} {} attempt {} failed, retrying: {}",
                    counter, event.taskName(), event.attempt(), event.message());
        } else if (event.toState() == TaskStatus.RUNNING) {
            log.info("{} {} started", counter, event.taskName());
        } else {
            log.info("{} {} {}", counter, event.taskName(), event.toState().name().toLowerCase());
        }
    }
}
