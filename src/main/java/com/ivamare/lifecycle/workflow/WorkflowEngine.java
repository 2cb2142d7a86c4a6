package com.ivamare.lifecycle.workflow;

import java.util.List;
import java.util.Optional;

/**
 * Coordinates lifecycle transitions for domain entities.
 */
public interface WorkflowEngine {

    /**
     * Install or replace the workflow for the definition's entity type.
     *
     * <p>Replacing fully swaps the compiled transition index; nothing is merged.
     *
     * @param definition Workflow definition
     * @throws IllegalArgumentException if the entity type is blank
     * @throws com.ivamare.lifecycle.exception.InvalidWorkflowDefinitionException if validation fails
     */
    void registerWorkflow(WorkflowDefinition definition);

    /**
     * Apply a transition.
     *
     * @param input Transition request
     * @return Transition result
     * @throws com.ivamare.lifecycle.exception.UnknownEntityTypeException if no workflow is registered
     * @throws com.ivamare.lifecycle.exception.InvalidTransitionException if nothing matches the request
     * @throws com.ivamare.lifecycle.exception.GuardRejectedException if a guard blocks the transition
     */
    TransitionResult transition(TransitionInput input);

    /**
     * List transitions leaving the queried state.
     *
     * @param query Entity type and state
     * @return Transitions in declaration order
     * @throws com.ivamare.lifecycle.exception.UnknownEntityTypeException if no workflow is registered
     */
    List<WorkflowTransition> availableTransitions(TransitionQuery query);

    /**
     * Get the normalized definition registered for an entity type.
     *
     * @param entityType Entity type (any casing)
     * @return Optional containing the definition if registered
     */
    Optional<WorkflowDefinition> findDefinition(String entityType);

    /**
     * Get the canonical names of all registered entity types.
     */
    List<String> registeredEntityTypes();
}
