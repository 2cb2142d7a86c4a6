package com.ivamare.lifecycle;

import com.ivamare.lifecycle.version.EntityFamily;
import com.ivamare.lifecycle.version.RetentionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the lifecycle engine.
 *
 * <p>Example configuration:
 * <pre>
 * lifecycle:
 *   enabled: true
 *   workflow:
 *     register-defaults: true
 *     definitions:
 *       - entity: page
 *         initial-state: draft
 *         states:
 *           - name: draft
 *           - name: review
 *           - name: published
 *         transitions:
 *           - name: submit
 *             from: draft
 *             to: review
 *           - name: publish
 *             from: review
 *             to: published
 *             guard: editor
 *   content:
 *     retention-limit: 20
 *     retention-policy: evict-oldest
 *   block:
 *     reject-stale-base-version: false
 *   audit:
 *     store: jdbc
 * </pre>
 */
@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleProperties {

    /**
     * Enable/disable lifecycle auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Workflow definitions.
     */
    private WorkflowProperties workflow = new WorkflowProperties();

    /**
     * Content family settings.
     */
    private FamilyProperties content = new FamilyProperties();

    /**
     * Page family settings.
     */
    private FamilyProperties page = new FamilyProperties();

    /**
     * Block family settings.
     */
    private FamilyProperties block = new FamilyProperties();

    /**
     * Audit trail settings.
     */
    private AuditProperties audit = new AuditProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public WorkflowProperties getWorkflow() {
        return workflow;
    }

    public void setWorkflow(WorkflowProperties workflow) {
        this.workflow = workflow;
    }

    public FamilyProperties getContent() {
        return content;
    }

    public void setContent(FamilyProperties content) {
        this.content = content;
    }

    public FamilyProperties getPage() {
        return page;
    }

    public void setPage(FamilyProperties page) {
        this.page = page;
    }

    public FamilyProperties getBlock() {
        return block;
    }

    public void setBlock(FamilyProperties block) {
        this.block = block;
    }

    public AuditProperties getAudit() {
        return audit;
    }

    public void setAudit(AuditProperties audit) {
        this.audit = audit;
    }

    /**
     * Get settings for a family.
     *
     * @param family Entity family
     * @return Family settings
     */
    public FamilyProperties getFamily(EntityFamily family) {
        return switch (family) {
            case CONTENT -> content;
            case PAGE -> page;
            case BLOCK -> block;
        };
    }

    /**
     * Workflow registration settings.
     */
    public static class WorkflowProperties {

        /**
         * Register the editorial workflow for content, page and block.
         */
        private boolean registerDefaults = true;

        /**
         * Additional definitions; these replace defaults for the same entity type.
         */
        private List<DefinitionProperties> definitions = new ArrayList<>();

        public boolean isRegisterDefaults() {
            return registerDefaults;
        }

        public void setRegisterDefaults(boolean registerDefaults) {
            this.registerDefaults = registerDefaults;
        }

        public List<DefinitionProperties> getDefinitions() {
            return definitions;
        }

        public void setDefinitions(List<DefinitionProperties> definitions) {
            this.definitions = definitions;
        }
    }

    /**
     * One configured workflow definition.
     */
    public static class DefinitionProperties {

        private String entity;
        private String initialState;
        private List<StateProperties> states = new ArrayList<>();
        private List<TransitionProperties> transitions = new ArrayList<>();

        public String getEntity() {
            return entity;
        }

        public void setEntity(String entity) {
            this.entity = entity;
        }

        public String getInitialState() {
            return initialState;
        }

        public void setInitialState(String initialState) {
            this.initialState = initialState;
        }

        public List<StateProperties> getStates() {
            return states;
        }

        public void setStates(List<StateProperties> states) {
            this.states = states;
        }

        public List<TransitionProperties> getTransitions() {
            return transitions;
        }

        public void setTransitions(List<TransitionProperties> transitions) {
            this.transitions = transitions;
        }
    }

    public static class StateProperties {

        private String name;
        private String description;

        /**
         * Marks the initial state when {@code initial-state} is not set.
         */
        private boolean initial;
        private boolean terminal;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public boolean isInitial() {
            return initial;
        }

        public void setInitial(boolean initial) {
            this.initial = initial;
        }

        public boolean isTerminal() {
            return terminal;
        }

        public void setTerminal(boolean terminal) {
            this.terminal = terminal;
        }
    }

    public static class TransitionProperties {

        private String name;
        private String description;
        private String from;
        private String to;
        private String guard;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public String getGuard() {
            return guard;
        }

        public void setGuard(String guard) {
            this.guard = guard;
        }
    }

    /**
     * Per-family ledger and coordinator settings.
     */
    public static class FamilyProperties {

        /**
         * Maximum versions kept per entity; 0 means unlimited.
         */
        private int retentionLimit = 0;

        /**
         * What happens when the retention limit is reached.
         */
        private RetentionPolicy retentionPolicy = RetentionPolicy.REJECT;

        /**
         * Check publish/unpublish/archive/restore against the workflow.
         */
        private boolean workflowCheck = true;

        /**
         * Reject drafts based on an outdated version instead of logging a warning.
         */
        private boolean rejectStaleBaseVersion = true;

        /**
         * Workflow entity type; defaults to the family key.
         */
        private String workflowEntityType;

        public int getRetentionLimit() {
            return retentionLimit;
        }

        public void setRetentionLimit(int retentionLimit) {
            this.retentionLimit = retentionLimit;
        }

        public RetentionPolicy getRetentionPolicy() {
            return retentionPolicy;
        }

        public void setRetentionPolicy(RetentionPolicy retentionPolicy) {
            this.retentionPolicy = retentionPolicy;
        }

        public boolean isWorkflowCheck() {
            return workflowCheck;
        }

        public void setWorkflowCheck(boolean workflowCheck) {
            this.workflowCheck = workflowCheck;
        }

        public boolean isRejectStaleBaseVersion() {
            return rejectStaleBaseVersion;
        }

        public void setRejectStaleBaseVersion(boolean rejectStaleBaseVersion) {
            this.rejectStaleBaseVersion = rejectStaleBaseVersion;
        }

        public String getWorkflowEntityType() {
            return workflowEntityType;
        }

        public void setWorkflowEntityType(String workflowEntityType) {
            this.workflowEntityType = workflowEntityType;
        }
    }

    /**
     * Audit trail settings.
     */
    public static class AuditProperties {

        /**
         * Where audit events go.
         */
        private AuditStore store = AuditStore.LOG;

        public AuditStore getStore() {
            return store;
        }

        public void setStore(AuditStore store) {
            this.store = store;
        }
    }

    public enum AuditStore {
        LOG,
        JDBC
    }
}
