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

package org.fireflyframework.agentflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.core.ContextBuilder;
import org.fireflyframework.agentflow.core.StagePlanner;
import org.fireflyframework.agentflow.core.TaskHandler;
import org.fireflyframework.agentflow.core.TaskRegistry;
import org.fireflyframework.agentflow.core.WorkflowEngine;
import org.fireflyframework.agentflow.exception.WorkflowValidationException;
import org.fireflyframework.agentflow.metrics.MetricsReporter;
import org.fireflyframework.agentflow.metrics.WorkflowMetrics;
import org.fireflyframework.agentflow.model.ExecutionOptions;
import org.fireflyframework.agentflow.model.TaskSpec;
import org.fireflyframework.agentflow.model.WorkflowPlan;
import org.fireflyframework.agentflow.progress.LoggingProgressListener;
import org.fireflyframework.agentflow.progress.ProgressListener;
import org.fireflyframework.agentflow.properties.AgentflowProperties;
import org.fireflyframework.agentflow.resilience.WorkflowResilience;
import org.fireflyframework.agentflow.retry.BackoffPolicy;
import org.fireflyframework.agentflow.retry.ErrorClassifier;
import org.fireflyframework.agentflow.retry.RetryExecutor;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Auto-configuration for the agent workflow engine.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>TaskRegistry - built from TaskHandler beans and {@code firefly.agentflow.tasks}</li>
 *   <li>ErrorClassifier and BackoffPolicy - retry decisions and delays</li>
 *   <li>RetryExecutor - runs task attempts with timeout and retry</li>
 *   <li>ContextBuilder and StagePlanner</li>
 *   <li>WorkflowMetrics - Micrometer metrics, when a MeterRegistry is present</li>
 *   <li>WorkflowResilience - Resilience4j decoration, when enabled</li>
 *   <li>WorkflowEngine - main orchestration facade</li>
 * </ul>
 * <p>
 * Tasks are taken from the configured stages and task overrides. Each task uses the
 * TaskHandler bean named by {@code handler-bean}, or the bean named like the task.
 * When nothing is configured, every TaskHandler bean becomes a task named after the bean.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(AgentflowProperties.class)
@ConditionalOnProperty(prefix = "firefly.agentflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentflowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TaskRegistry taskRegistry(AgentflowProperties properties, ListableBeanFactory beanFactory) {
        Map<String, TaskHandler> handlers = beanFactory.getBeansOfType(TaskHandler.class);
        log.info("Creating TaskRegistry from {} TaskHandler beans", handlers.size());

        TaskRegistry registry = new TaskRegistry();
        for (String taskName : configuredTaskNames(properties, handlers)) {
            registry.register(buildTaskSpec(taskName, properties, handlers));
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier(AgentflowProperties properties) {
        return new ErrorClassifier(properties.getRetry().getNonRetryableExceptions());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy backoffPolicy(AgentflowProperties properties, ErrorClassifier errorClassifier) {
        AgentflowProperties.RetryConfig retry = properties.getRetry();
        log.info("Creating BackoffPolicy: base={}, max={}, multiplier={}, jitter={}",
                retry.getBackoffBase(), retry.getBackoffMax(), retry.getMultiplier(), retry.getJitter());
        return new BackoffPolicy(retry.getBackoffBase(), retry.getBackoffMax(),
                retry.getMultiplier(), retry.getJitter(), errorClassifier);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.agentflow.resilience", name = "enabled", havingValue = "true")
    public WorkflowResilience workflowResilience(AgentflowProperties properties) {
        log.info("Creating WorkflowResilience with Resilience4j");
        return new WorkflowResilience(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(BackoffPolicy backoffPolicy,
                                       ObjectProvider<ObjectMapper> objectMapper,
                                       ObjectProvider<WorkflowResilience> resilience) {
        log.info("Creating RetryExecutor");
        return new RetryExecutor(backoffPolicy,
                objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules()),
                resilience.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextBuilder contextBuilder(TaskRegistry taskRegistry, AgentflowProperties properties) {
        return new ContextBuilder(taskRegistry, properties.getContext().getExcerptLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public StagePlanner stagePlanner() {
        return new StagePlanner();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.agentflow", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        log.info("Creating WorkflowMetrics");
        return new WorkflowMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsReporter metricsReporter(ObjectProvider<ObjectMapper> objectMapper) {
        return new MetricsReporter(objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules()));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.agentflow", name = "log-progress", havingValue = "true", matchIfMissing = true)
    public LoggingProgressListener loggingProgressListener() {
        return new LoggingProgressListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngine workflowEngine(TaskRegistry taskRegistry,
                                         StagePlanner stagePlanner,
                                         ContextBuilder contextBuilder,
                                         RetryExecutor retryExecutor,
                                         AgentflowProperties properties,
                                         ObjectProvider<WorkflowMetrics> workflowMetrics,
                                         ObjectProvider<ProgressListener> progressListeners) {
        AgentflowProperties.ExecutionConfig execution = properties.getExecution();
        ExecutionOptions defaults = ExecutionOptions.defaults()
                .withMode(execution.getMode())
                .withMaxConcurrency(execution.getMaxConcurrency());

        WorkflowPlan configuredPlan = WorkflowPlan.fromNames(properties.getStages());
        if (!configuredPlan.isEmpty()) {
            stagePlanner.validate(configuredPlan, taskRegistry);
        }

        List<ProgressListener> listeners = progressListeners.orderedStream().toList();
        log.info("Creating WorkflowEngine: tasks={}, configuredStages={}, mode={}, maxConcurrency={}, listeners={}",
                taskRegistry.size(), configuredPlan.stages().size(), execution.getMode(),
                execution.getMaxConcurrency(), listeners.size());

        return new WorkflowEngine(taskRegistry, stagePlanner, contextBuilder, retryExecutor, defaults,
                configuredPlan, workflowMetrics.getIfAvailable(), listeners);
    }

    private static Set<String> configuredTaskNames(AgentflowProperties properties, Map<String, TaskHandler> handlers) {
        Set<String> names = new LinkedHashSet<>();
        properties.getStages().forEach(names::addAll);
        names.addAll(properties.getTasks().keySet());
        if (names.isEmpty()) {
            names.addAll(handlers.keySet());
        }
        return names;
    }

    private static TaskSpec buildTaskSpec(String taskName, AgentflowProperties properties,
                                          Map<String, TaskHandler> handlers) {
        AgentflowProperties.TaskConfig config = properties.getTasks()
                .getOrDefault(taskName, new AgentflowProperties.TaskConfig());

        String handlerBean = config.getHandlerBean() != null ? config.getHandlerBean() : taskName;
        TaskHandler handler = handlers.get(handlerBean);
        if (handler == null) {
            throw new WorkflowValidationException(String.format(
                    "No TaskHandler bean named '%s' for task '%s'", handlerBean, taskName));
        }

        int maxAttempts = config.getMaxAttempts() != null ? config.getMaxAttempts() : properties.getDefaultMaxAttempts();
        return new TaskSpec(
                taskName,
                config.getDisplayName(),
                handler,
                new LinkedHashSet<>(config.getDependsOn()),
                maxAttempts,
                config.getTimeout() != null ? config.getTimeout() : properties.getDefaultTaskTimeout(),
                config.getOrder());
    }
}
