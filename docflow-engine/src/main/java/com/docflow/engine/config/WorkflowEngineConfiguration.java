package com.docflow.engine.config;

import com.docflow.action.ActionExecutor;
import com.docflow.action.ActionHandler;
import com.docflow.action.DefaultActionExecutor;
import com.docflow.action.ledger.ActionLedger;
import com.docflow.action.ledger.InMemoryActionLedger;
import com.docflow.action.sink.IntegrationGateway;
import com.docflow.action.sink.LoggingNotificationSink;
import com.docflow.action.sink.NotificationSink;
import com.docflow.core.codec.JsonSupport;
import com.docflow.core.event.WorkflowEventPublisher;
import com.docflow.core.model.guard.Actor;
import com.docflow.core.model.guard.NamedGuard;
import com.docflow.core.model.guard.Permission;
import com.docflow.core.repository.EventRepository;
import com.docflow.core.repository.WorkflowDefinitionRepository;
import com.docflow.core.repository.WorkflowInstanceStore;
import com.docflow.engine.coordinator.EntityResolver;
import com.docflow.engine.coordinator.WorkflowCoordinator;
import com.docflow.engine.event.EventLogPublisher;
import com.docflow.engine.guard.DefaultGuardEvaluator;
import com.docflow.engine.guard.GuardEvaluator;
import com.docflow.engine.history.ExecutionHistoryService;
import com.docflow.engine.metrics.WorkflowMetrics;
import com.docflow.engine.persistence.InMemoryEventRepository;
import com.docflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.docflow.engine.persistence.InMemoryWorkflowInstanceStore;
import com.docflow.scheduler.InMemoryTimerQueue;
import com.docflow.scheduler.TimerQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

/**
 * Wires the engine with in-memory stores, the logging notification sink and the event log.
 *
 * <p>
 * Every bean backs off when the application defines its own, so durable stores, real
 * notification channels or an entity lookup can be dropped in without touching the engine.
 * {@link NamedGuard} and {@link ActionHandler} beans are registered under their bean names.
 */
@AutoConfiguration
@EnableConfigurationProperties(WorkflowEngineProperties.class)
public class WorkflowEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock workflowClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper workflowObjectMapper() {
        return JsonSupport.newObjectMapper();
    }

    // ========== Stores ==========

    @Bean
    @ConditionalOnMissingBean
    public WorkflowDefinitionRepository workflowDefinitionRepository() {
        return new InMemoryWorkflowDefinitionRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowInstanceStore workflowInstanceStore() {
        return new InMemoryWorkflowInstanceStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventRepository eventRepository() {
        return new InMemoryEventRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionLedger actionLedger() {
        return new InMemoryActionLedger();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimerQueue timerQueue() {
        return new InMemoryTimerQueue();
    }

    // ========== Collaborators ==========

    @Bean
    @ConditionalOnMissingBean
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public IntegrationGateway integrationGateway() {
        return IntegrationGateway.unavailable();
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityResolver entityResolver() {
        return EntityResolver.ACCEPT_ALL;
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowMetrics workflowMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        WorkflowMetrics metrics = new WorkflowMetrics();
        meterRegistry.ifAvailable(metrics::bindTo);
        return metrics;
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardEvaluator guardEvaluator(@Nullable Map<String, NamedGuard> namedGuards) {
        Map<String, NamedGuard> guards = namedGuards == null ? Map.of() : namedGuards;
        if (!guards.isEmpty()) {
            log.info("Registered named guards: {}", guards.keySet());
        }
        return new DefaultGuardEvaluator(guards);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionExecutor actionExecutor(WorkflowEngineProperties properties,
                                         ActionLedger ledger,
                                         NotificationSink notificationSink,
                                         IntegrationGateway integrationGateway,
                                         WorkflowMetrics metrics,
                                         ObjectMapper objectMapper,
                                         Clock clock,
                                         @Nullable Map<String, ActionHandler> handlers) {
        return DefaultActionExecutor.builder()
            .ledger(ledger)
            .notificationSink(notificationSink)
            .integrationGateway(integrationGateway)
            .handlers(handlers == null ? Map.of() : handlers)
            .retryPolicy(properties.getRetry().toPolicy())
            .listener(metrics)
            .objectMapper(objectMapper)
            .clock(clock)
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEventPublisher workflowEventPublisher(EventRepository eventRepository) {
        return new EventLogPublisher(eventRepository);
    }

    // ========== Engine ==========

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public WorkflowCoordinator workflowCoordinator(WorkflowEngineProperties properties,
                                                   WorkflowDefinitionRepository definitionRepository,
                                                   WorkflowInstanceStore instanceStore,
                                                   WorkflowEventPublisher eventPublisher,
                                                   ActionExecutor actionExecutor,
                                                   GuardEvaluator guardEvaluator,
                                                   EntityResolver entityResolver,
                                                   WorkflowMetrics metrics,
                                                   TimerQueue timerQueue,
                                                   ObjectMapper objectMapper,
                                                   Clock clock) {
        WorkflowCoordinator coordinator = WorkflowCoordinator.builder()
            .definitionRepository(definitionRepository)
            .instanceStore(instanceStore)
            .eventPublisher(eventPublisher)
            .actionExecutor(actionExecutor)
            .guardEvaluator(guardEvaluator)
            .entityResolver(entityResolver)
            .metrics(metrics)
            .timerQueue(timerQueue)
            .schedulerSettings(properties.getScheduler().toSettings())
            .objectMapper(objectMapper)
            .clock(clock)
            .maxConflictRetries(properties.getMaxConflictRetries())
            .historySnapshotVariables(properties.getHistorySnapshotVariables())
            .systemActor(new Actor(properties.getDefaultActor(), Set.of(), Set.of(Permission.ADMIN.name())))
            .build();
        if (properties.getScheduler().isAutoStart()) {
            coordinator.start();
        }
        return coordinator;
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionHistoryService executionHistoryService(EventRepository eventRepository,
                                                           WorkflowInstanceStore instanceStore,
                                                           Clock clock) {
        return new ExecutionHistoryService(eventRepository, instanceStore, clock);
    }
}
