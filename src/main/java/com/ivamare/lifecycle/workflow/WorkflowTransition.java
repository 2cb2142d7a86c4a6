package com.ivamare.lifecycle.workflow;

/**
 * An allowed move between two states of a workflow.
 *
 * <p>{@code name} is unique per {@code (name, from)} pair within one definition,
 * so the same name may be declared from several source states.
 *
 * @param name Transition name (e.g., "publish")
 * @param description Human readable description (nullable)
 * @param from Source state
 * @param to Target state
 * @param guard Guard expression evaluated by the authorizer (nullable)
 */
public record WorkflowTransition(
    String name,
    String description,
    String from,
    String to,
    String guard
) {
    public static WorkflowTransition of(String name, String from, String to) {
        return new WorkflowTransition(name, null, from, to, null);
    }

    public static WorkflowTransition guarded(String name, String from, String to, String guard) {
        return new WorkflowTransition(name, null, from, to, guard);
    }

    public boolean hasGuard() {
        return guard != null && !guard.isBlank();
    }

    /**
     * Lookup key of this transition, {@code name::from}.
     */
    public String key() {
        return WorkflowIdentifiers.transitionKey(name, from);
    }
}
