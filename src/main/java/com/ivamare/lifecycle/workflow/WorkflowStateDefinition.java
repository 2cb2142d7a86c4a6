package com.ivamare.lifecycle.workflow;

/**
 * A state declared by a workflow definition.
 *
 * @param name State name
 * @param description Human readable description (nullable)
 * @param terminal Whether the state has no outgoing transitions
 */
public record WorkflowStateDefinition(
    String name,
    String description,
    boolean terminal
) {
    public static WorkflowStateDefinition of(String name) {
        return new WorkflowStateDefinition(name, null, false);
    }

    public static WorkflowStateDefinition of(String name, String description) {
        return new WorkflowStateDefinition(name, description, false);
    }

    public static WorkflowStateDefinition terminal(String name, String description) {
        return new WorkflowStateDefinition(name, description, true);
    }
}
