package com.ivamare.lifecycle.workflow.guard;

import java.util.List;
import java.util.Optional;

/**
 * Registry of transition actions.
 *
 * <p>Maps {@code (entityType, transitionName)} pairs to actions. The registry is
 * filled while the application starts and is read-only once sealed.
 */
public interface ActionRegistry {

    /** Entity type wildcard matching every entity type. */
    String ANY_ENTITY_TYPE = "*";

    /**
     * Register an action.
     *
     * @param entityType Entity type, or {@link #ANY_ENTITY_TYPE}
     * @param transitionName Transition name
     * @param action The action
     * @throws com.ivamare.lifecycle.exception.ActionAlreadyRegisteredException if the key is taken
     * @throws IllegalStateException if the registry is sealed
     */
    void register(String entityType, String transitionName, TransitionAction action);

    /**
     * Resolve the action for a transition. An entity-specific action wins over
     * a wildcard one.
     *
     * @param entityType Entity type
     * @param transitionName Transition name
     * @return Optional containing the action if registered
     */
    Optional<TransitionAction> resolve(String entityType, String transitionName);

    /**
     * Check if an action is registered for exactly this key (no wildcard fallback).
     */
    boolean hasAction(String entityType, String transitionName);

    /**
     * Get all registered keys.
     */
    List<ActionKey> registeredActions();

    /**
     * Scan a bean for {@link TransitionHook} methods and register them.
     *
     * @param bean The bean to scan
     * @return Keys registered for the bean
     */
    List<ActionKey> registerBean(Object bean);

    /**
     * Reject further registrations.
     */
    void seal();

    boolean isSealed();

    /**
     * Key for action lookup, in canonical form.
     *
     * @param entityType Entity type or wildcard
     * @param transitionName Transition name
     */
    record ActionKey(String entityType, String transitionName) {

        @Override
        public String toString() {
            return entityType + "::" + transitionName;
        }
    }
}
