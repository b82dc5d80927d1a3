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

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Interface for content-generating task handlers.
 * <p>
 * A handler wraps one call to a content-generation collaborator (usually an LLM
 * agent) and produces the text of one task. It is invoked once per attempt; the
 * engine owns retries, timeouts and context assembly.
 * <p>
 * Handlers signal failures by erroring the returned Mono. Throwing
 * {@link org.fireflyframework.agentflow.exception.TaskExecutionException} lets a
 * handler decide explicitly whether the failure is worth retrying.
 * <p>
 * Example implementation:
 * <pre>
 * {@code
 * @Component("overview")
 * public class OverviewHandler implements TaskHandler {
 *
 *     @Override
 *     public Mono<String> generate(TaskInvocation invocation) {
 *         ProjectBrief brief = invocation.inputAs(ProjectBrief.class);
 *         return agentClient.complete(prompts.overview(brief, invocation.getContext()));
 *     }
 * }
 * }
 * </pre>
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Produces the task's text for one attempt.
     *
     * @param invocation the task input, dependency context and attempt number
     * @return a Mono emitting the generated text
     */
    Mono<String> generate(TaskInvocation invocation);

    /**
     * Adapts a blocking generator, running it on Reactor's bounded elastic scheduler.
     *
     * @param handler the blocking generator
     * @return a non-blocking task handler
     */
    static TaskHandler blocking(BlockingTaskHandler handler) {
        return invocation -> Mono.fromCallable(() -> handler.generate(invocation))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * A handler that calls its collaborator synchronously.
     */
    @FunctionalInterface
    interface BlockingTaskHandler {

        String generate(TaskInvocation invocation) throws Exception;
    }
}
