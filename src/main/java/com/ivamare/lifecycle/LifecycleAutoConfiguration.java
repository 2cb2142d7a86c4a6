package com.ivamare.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.lifecycle.audit.JdbcAuditRecorder;
import com.ivamare.lifecycle.audit.LifecycleAuditRecorder;
import com.ivamare.lifecycle.audit.LoggingAuditRecorder;
import com.ivamare.lifecycle.coordinator.CoordinatorSettings;
import com.ivamare.lifecycle.coordinator.EntityStore;
import com.ivamare.lifecycle.coordinator.InMemoryEntityStore;
import com.ivamare.lifecycle.coordinator.PublishCoordinator;
import com.ivamare.lifecycle.version.EntityFamily;
import com.ivamare.lifecycle.version.InMemoryVersionLedger;
import com.ivamare.lifecycle.version.LedgerSettings;
import com.ivamare.lifecycle.version.SnapshotCodec;
import com.ivamare.lifecycle.version.VersionLedger;
import com.ivamare.lifecycle.workflow.DefaultWorkflows;
import com.ivamare.lifecycle.workflow.WorkflowDefinition;
import com.ivamare.lifecycle.workflow.WorkflowEngine;
import com.ivamare.lifecycle.workflow.guard.ActionRegistry;
import com.ivamare.lifecycle.workflow.guard.DefaultActionRegistry;
import com.ivamare.lifecycle.workflow.guard.GuardedWorkflowEngine;
import com.ivamare.lifecycle.workflow.guard.WorkflowAuthorizer;
import com.ivamare.lifecycle.workflow.impl.SimpleWorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for the lifecycle engine.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Workflow engine (guard and action adapter over the in-memory engine)</li>
 *   <li>Action registry</li>
 *   <li>Version ledgers (content, page, block)</li>
 *   <li>Publish coordinators (content, page, block)</li>
 *   <li>Entity store and audit recorder</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * lifecycle.enabled=false
 * </pre>
 */
@AutoConfiguration(after = JdbcTemplateAutoConfiguration.class)
@ConditionalOnProperty(prefix = "lifecycle", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LifecycleProperties.class)
public class LifecycleAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LifecycleAutoConfiguration.class);

    // --- Infrastructure ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper lifecycleObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock lifecycleClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotCodec snapshotCodec(ObjectMapper objectMapper) {
        return new SnapshotCodec(objectMapper);
    }

    // --- Workflow ---

    @Bean
    @ConditionalOnMissingBean(ActionRegistry.class)
    public static DefaultActionRegistry actionRegistry() {
        return new DefaultActionRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngine workflowEngine(LifecycleProperties properties,
                                         ObjectProvider<WorkflowAuthorizer> authorizer,
                                         ActionRegistry actionRegistry,
                                         Clock clock) {
        WorkflowEngine engine = new GuardedWorkflowEngine(
            new SimpleWorkflowEngine(clock),
            authorizer.getIfAvailable(),
            actionRegistry,
            clock
        );

        if (properties.getWorkflow().isRegisterDefaults()) {
            for (EntityFamily family : EntityFamily.values()) {
                engine.registerWorkflow(DefaultWorkflows.editorial(family.key()));
            }
        }
        List<WorkflowDefinition> configured = ConfiguredWorkflows.compile(properties.getWorkflow().getDefinitions());
        for (WorkflowDefinition definition : configured) {
            engine.registerWorkflow(definition);
        }
        log.info("Workflow engine ready with {}", engine.registeredEntityTypes());
        return engine;
    }

    // --- Persistence ---

    @Bean
    @ConditionalOnMissingBean
    public EntityStore entityStore() {
        return new InMemoryEntityStore();
    }

    /**
     * JDBC audit trail, enabled with {@code lifecycle.audit.store=jdbc}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "lifecycle.audit", name = "store", havingValue = "jdbc")
    static class JdbcAuditConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public LifecycleAuditRecorder jdbcAuditRecorder(JdbcTemplate jdbcTemplate, SnapshotCodec snapshotCodec) {
            return new JdbcAuditRecorder(jdbcTemplate, snapshotCodec);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public LifecycleAuditRecorder lifecycleAuditRecorder() {
        return new LoggingAuditRecorder();
    }

    // --- Version Ledgers ---

    @Bean
    @ConditionalOnMissingBean(name = "contentVersionLedger")
    public VersionLedger contentVersionLedger(LifecycleProperties properties, SnapshotCodec codec, Clock clock) {
        return ledger(EntityFamily.CONTENT, properties, codec, clock);
    }

    @Bean
    @ConditionalOnMissingBean(name = "pageVersionLedger")
    public VersionLedger pageVersionLedger(LifecycleProperties properties, SnapshotCodec codec, Clock clock) {
        return ledger(EntityFamily.PAGE, properties, codec, clock);
    }

    @Bean
    @ConditionalOnMissingBean(name = "blockVersionLedger")
    public VersionLedger blockVersionLedger(LifecycleProperties properties, SnapshotCodec codec, Clock clock) {
        return ledger(EntityFamily.BLOCK, properties, codec, clock);
    }

    // --- Publish Coordinators ---

    @Bean
    @ConditionalOnMissingBean(name = "contentPublishCoordinator")
    public PublishCoordinator contentPublishCoordinator(
            @Qualifier("contentVersionLedger") VersionLedger ledger,
            EntityStore entityStore,
            WorkflowEngine workflowEngine,
            LifecycleAuditRecorder auditRecorder,
            LifecycleProperties properties,
            Clock clock) {
        return coordinator(EntityFamily.CONTENT, ledger, entityStore, workflowEngine, auditRecorder, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean(name = "pagePublishCoordinator")
    public PublishCoordinator pagePublishCoordinator(
            @Qualifier("pageVersionLedger") VersionLedger ledger,
            EntityStore entityStore,
            WorkflowEngine workflowEngine,
            LifecycleAuditRecorder auditRecorder,
            LifecycleProperties properties,
            Clock clock) {
        return coordinator(EntityFamily.PAGE, ledger, entityStore, workflowEngine, auditRecorder, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean(name = "blockPublishCoordinator")
    public PublishCoordinator blockPublishCoordinator(
            @Qualifier("blockVersionLedger") VersionLedger ledger,
            EntityStore entityStore,
            WorkflowEngine workflowEngine,
            LifecycleAuditRecorder auditRecorder,
            LifecycleProperties properties,
            Clock clock) {
        return coordinator(EntityFamily.BLOCK, ledger, entityStore, workflowEngine, auditRecorder, properties, clock);
    }

    private static VersionLedger ledger(EntityFamily family, LifecycleProperties properties,
                                        SnapshotCodec codec, Clock clock) {
        LifecycleProperties.FamilyProperties props = properties.getFamily(family);
        return new InMemoryVersionLedger(
            new LedgerSettings(family, props.getRetentionLimit(), props.getRetentionPolicy()),
            codec,
            clock
        );
    }

    private static PublishCoordinator coordinator(EntityFamily family,
                                                  VersionLedger ledger,
                                                  EntityStore entityStore,
                                                  WorkflowEngine workflowEngine,
                                                  LifecycleAuditRecorder auditRecorder,
                                                  LifecycleProperties properties,
                                                  Clock clock) {
        LifecycleProperties.FamilyProperties props = properties.getFamily(family);
        return new PublishCoordinator(
            family,
            ledger,
            entityStore,
            workflowEngine,
            auditRecorder,
            clock,
            new CoordinatorSettings(
                props.isWorkflowCheck(),
                props.isRejectStaleBaseVersion(),
                props.getWorkflowEntityType()
            )
        );
    }
}
