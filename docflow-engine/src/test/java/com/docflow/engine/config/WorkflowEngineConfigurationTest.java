package com.docflow.engine.config;

import com.docflow.action.RetryPolicy;
import com.docflow.core.model.guard.GuardResult;
import com.docflow.core.model.guard.NamedGuard;
import com.docflow.core.repository.WorkflowInstanceStore;
import com.docflow.engine.coordinator.WorkflowCoordinator;
import com.docflow.engine.guard.GuardEvaluator;
import com.docflow.engine.history.ExecutionHistoryService;
import com.docflow.engine.persistence.InMemoryWorkflowInstanceStore;
import com.docflow.scheduler.SchedulerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class WorkflowEngineConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(WorkflowEngineConfiguration.class))
        .withPropertyValues("docflow.engine.scheduler.auto-start=false");

    @Test
    @DisplayName("Default context wires the coordinator and history service")
    void context_shouldProvideEngineBeans() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(WorkflowCoordinator.class);
            assertThat(context).hasSingleBean(ExecutionHistoryService.class);
            assertThat(context).getBean(WorkflowInstanceStore.class).isInstanceOf(InMemoryWorkflowInstanceStore.class);
            assertThat(context.getBean(WorkflowCoordinator.class).getScheduler().isRunning()).isFalse();
        });
    }

    @Test
    @DisplayName("Retry and scheduler properties are bound")
    void properties_shouldBind() {
        runner.withPropertyValues(
                "docflow.engine.retry.max-attempts=7",
                "docflow.engine.retry.initial-backoff=50ms",
                "docflow.engine.scheduler.poll-interval=2s",
                "docflow.engine.scheduler.miss-threshold=30s",
                "docflow.engine.max-conflict-retries=5")
            .run(context -> {
                WorkflowEngineProperties properties = context.getBean(WorkflowEngineProperties.class);
                RetryPolicy policy = properties.getRetry().toPolicy();
                SchedulerSettings settings = properties.getScheduler().toSettings();

                assertThat(policy.maxAttempts()).isEqualTo(7);
                assertThat(policy.initialBackoff()).isEqualTo(Duration.ofMillis(50));
                assertThat(settings.pollInterval()).isEqualTo(Duration.ofSeconds(2));
                assertThat(settings.missThreshold()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.getMaxConflictRetries()).isEqualTo(5);
            });
    }

    @Test
    @DisplayName("Application store replaces the in-memory default")
    void store_shouldBackOff() {
        runner.withUserConfiguration(CustomStoreConfiguration.class).run(context -> {
            assertThat(context).hasSingleBean(WorkflowInstanceStore.class);
            assertThat(context.getBean(WorkflowInstanceStore.class))
                .isSameAs(context.getBean(CustomStoreConfiguration.class).store);
        });
    }

    @Test
    @DisplayName("Named guard beans are registered under their bean names")
    void namedGuards_shouldBeRegistered() {
        runner.withUserConfiguration(GuardConfiguration.class).run(context ->
            assertThat(context.getBean(GuardEvaluator.class).guardNames()).containsExactly("businessHoursOnly"));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfiguration {
        final InMemoryWorkflowInstanceStore store = new InMemoryWorkflowInstanceStore();

        @Bean
        WorkflowInstanceStore customInstanceStore() {
            return store;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class GuardConfiguration {

        @Bean
        NamedGuard businessHoursOnly() {
            return context -> GuardResult.allow();
        }
    }
}
