package com.ivamare.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.lifecycle.audit.JdbcAuditRecorder;
import com.ivamare.lifecycle.audit.LifecycleAuditRecorder;
import com.ivamare.lifecycle.audit.LoggingAuditRecorder;
import com.ivamare.lifecycle.coordinator.EntityStore;
import com.ivamare.lifecycle.coordinator.PublishCoordinator;
import com.ivamare.lifecycle.exception.GuardRejectedException;
import com.ivamare.lifecycle.version.EntityFamily;
import com.ivamare.lifecycle.version.RetentionPolicy;
import com.ivamare.lifecycle.version.VersionLedger;
import com.ivamare.lifecycle.workflow.TransitionInput;
import com.ivamare.lifecycle.workflow.WorkflowEngine;
import com.ivamare.lifecycle.workflow.guard.ActionInput;
import com.ivamare.lifecycle.workflow.guard.ActionOutput;
import com.ivamare.lifecycle.workflow.guard.ActionRegistry;
import com.ivamare.lifecycle.workflow.guard.TransitionHook;
import com.ivamare.lifecycle.workflow.guard.WorkflowAuthorizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("LifecycleAutoConfiguration")
class LifecycleAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(LifecycleAutoConfiguration.class));

    @Test
    @DisplayName("should create all beans when enabled")
    void shouldCreateAllBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(WorkflowEngine.class);
            assertThat(context).hasSingleBean(ActionRegistry.class);
            assertThat(context).hasSingleBean(EntityStore.class);
            assertThat(context).hasSingleBean(LoggingAuditRecorder.class);
            assertThat(context.getBeansOfType(VersionLedger.class))
                .containsOnlyKeys("contentVersionLedger", "pageVersionLedger", "blockVersionLedger");
            assertThat(context.getBeansOfType(PublishCoordinator.class))
                .containsOnlyKeys("contentPublishCoordinator", "pagePublishCoordinator", "blockPublishCoordinator");
        });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("lifecycle.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(WorkflowEngine.class);
                assertThat(context).doesNotHaveBean(PublishCoordinator.class);
            });
    }

    @Test
    @DisplayName("should register default workflows for every family")
    void shouldRegisterDefaultWorkflows() {
        contextRunner.run(context -> {
            WorkflowEngine engine = context.getBean(WorkflowEngine.class);

            assertThat(engine.registeredEntityTypes()).containsExactly("block", "content", "page");
            assertThat(engine.findDefinition("page").orElseThrow().transitions()).hasSize(14);
        });
    }

    @Test
    @DisplayName("should skip default workflows when disabled")
    void shouldSkipDefaultWorkflows() {
        contextRunner
            .withPropertyValues("lifecycle.workflow.register-defaults=false")
            .run(context -> assertThat(context.getBean(WorkflowEngine.class).registeredEntityTypes()).isEmpty());
    }

    @Test
    @DisplayName("should bind family settings to ledgers")
    void shouldBindFamilySettingsToLedgers() {
        contextRunner
            .withPropertyValues(
                "lifecycle.content.retention-limit=2",
                "lifecycle.content.retention-policy=evict-oldest")
            .run(context -> {
                VersionLedger content = context.getBean("contentVersionLedger", VersionLedger.class);
                VersionLedger page = context.getBean("pageVersionLedger", VersionLedger.class);

                assertThat(content.family()).isEqualTo(EntityFamily.CONTENT);
                assertThat(content.settings().retentionLimit()).isEqualTo(2);
                assertThat(content.settings().retentionPolicy()).isEqualTo(RetentionPolicy.EVICT_OLDEST);
                assertThat(page.settings().isBounded()).isFalse();
            });
    }

    @Test
    @DisplayName("should replace default workflow with configured definition")
    void shouldReplaceDefaultWithConfiguredDefinition() {
        contextRunner
            .withUserConfiguration(AuthorizerConfig.class)
            .withPropertyValues(
                "lifecycle.workflow.definitions[0].entity=page",
                "lifecycle.workflow.definitions[0].states[0].name=draft",
                "lifecycle.workflow.definitions[0].states[1].name=published",
                "lifecycle.workflow.definitions[0].transitions[0].name=publish",
                "lifecycle.workflow.definitions[0].transitions[0].from=draft",
                "lifecycle.workflow.definitions[0].transitions[0].to=published",
                "lifecycle.workflow.definitions[0].transitions[0].guard=editor")
            .run(context -> {
                WorkflowEngine engine = context.getBean(WorkflowEngine.class);

                assertThat(engine.findDefinition("page").orElseThrow().transitions()).hasSize(1);
                assertThatThrownBy(() -> engine.transition(
                    TransitionInput.named(UUID.randomUUID(), "page", "draft", "publish", UUID.randomUUID())))
                    .isInstanceOf(GuardRejectedException.class);
            });
    }

    @Test
    @DisplayName("should fail on duplicate configured definitions")
    void shouldFailOnDuplicateConfiguredDefinitions() {
        contextRunner
            .withPropertyValues(
                "lifecycle.workflow.definitions[0].entity=page",
                "lifecycle.workflow.definitions[0].states[0].name=draft",
                "lifecycle.workflow.definitions[1].entity=Page",
                "lifecycle.workflow.definitions[1].states[0].name=draft")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("should use JDBC audit recorder when configured")
    void shouldUseJdbcAuditRecorder() {
        contextRunner
            .withUserConfiguration(JdbcConfig.class)
            .withPropertyValues("lifecycle.audit.store=jdbc")
            .run(context -> {
                assertThat(context).hasSingleBean(LifecycleAuditRecorder.class);
                assertThat(context).hasSingleBean(JdbcAuditRecorder.class);
            });
    }

    @Test
    @DisplayName("should keep logging audit recorder without jdbc store")
    void shouldKeepLoggingAuditRecorder() {
        contextRunner
            .withUserConfiguration(JdbcConfig.class)
            .run(context -> assertThat(context).hasSingleBean(LoggingAuditRecorder.class));
    }

    @Test
    @DisplayName("should discover transition hooks and seal the registry")
    void shouldDiscoverTransitionHooks() {
        contextRunner
            .withUserConfiguration(HookConfig.class)
            .run(context -> {
                ActionRegistry registry = context.getBean(ActionRegistry.class);

                assertThat(registry.hasAction("page", "publish")).isTrue();
                assertThat(registry.isSealed()).isTrue();

                WorkflowEngine engine = context.getBean(WorkflowEngine.class);
                var result = engine.transition(
                    TransitionInput.named(UUID.randomUUID(), "page", "draft", "publish", null));
                assertThat(result.metadata()).containsEntry("indexed", true);
            });
    }

    @Test
    @DisplayName("should use custom ObjectMapper if provided")
    void shouldUseCustomObjectMapper() {
        contextRunner
            .withUserConfiguration(CustomObjectMapperConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(ObjectMapper.class);
                assertThat(context.getBean(ObjectMapper.class))
                    .isSameAs(context.getBean(CustomObjectMapperConfig.class).mapper);
            });
    }

    @Configuration(proxyBeanMethods = false)
    static class AuthorizerConfig {

        @Bean
        WorkflowAuthorizer rejectingAuthorizer() {
            return (input, guard) -> {
                throw new GuardRejectedException(guard, input.actorId(), "nobody is an editor");
            };
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class JdbcConfig {

        @Bean
        JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class HookConfig {

        @Bean
        PageHooks pageHooks() {
            return new PageHooks();
        }
    }

    public static class PageHooks {

        @TransitionHook(entityType = "page", transition = "publish")
        public ActionOutput onPublish(ActionInput input) {
            return ActionOutput.ofMetadata(Map.of("indexed", true));
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomObjectMapperConfig {

        final ObjectMapper mapper = new ObjectMapper();

        @Bean
        ObjectMapper customObjectMapper() {
            return mapper;
        }
    }
}
