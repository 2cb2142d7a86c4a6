package com.ivamare.lifecycle.workflow;

import java.util.List;

/**
 * State machine description for one entity type.
 *
 * @param entityType Entity type the workflow applies to (e.g., "page")
 * @param initialState Initial state; blank means the first declared state
 * @param states Declared states
 * @param transitions Allowed transitions
 */
public record WorkflowDefinition(
    String entityType,
    String initialState,
    List<WorkflowStateDefinition> states,
    List<WorkflowTransition> transitions
) {
    public WorkflowDefinition {
        states = states != null ? List.copyOf(states) : List.of();
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
    }
}
