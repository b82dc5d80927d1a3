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
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Decouples a slow listener from task execution.
 * <p>
 * Events are buffered in an unbounded sink and delivered to the delegate on a
 * separate scheduler, in the order they were received.
 */
@Slf4j
public class BufferedProgressListener implements ProgressListener, AutoCloseable {

    private final Sinks.Many<ProgressEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable subscription;

    public BufferedProgressListener(ProgressListener delegate) {
        this(delegate, Schedulers.boundedElastic());
    }

    public BufferedProgressListener(ProgressListener delegate, Scheduler scheduler) {
        this.subscription = sink.asFlux()
                .publishOn(scheduler)
                .subscribe(event -> {
                    try {
                        delegate.onProgress(event);
                    } catch (RuntimeException e) {
                        log.warn("PROGRESS_LISTENER_FAILED: task={}, error={}", event.taskName(), e.getMessage(), e);
                    }
                });
    }

    /**
     * Queues an event. Emission is serialized so one instance can be shared by
     * concurrent runs.
     */
    @Override
    public synchronized void onProgress(ProgressEvent event) {
        sink.emitNext(event, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
    }

    /**
     * Completes the buffer; events already queued are still delivered.
     */
    @Override
    public synchronized void close() {
        sink.tryEmitComplete();
    }

    public boolean isDisposed() {
        return subscription.isDisposed();
    }
}
