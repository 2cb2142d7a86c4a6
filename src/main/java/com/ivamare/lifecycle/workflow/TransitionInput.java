package com.ivamare.lifecycle.workflow;

import java.util.Map;
import java.util.UUID;

/**
 * Request to move an entity through its workflow.
 *
 * <p>Either {@code transitionName} or {@code targetState} selects the transition.
 * When neither is given, or the target equals the current state and no name is
 * given, the request is a no-op.
 *
 * @param entityId Entity being transitioned
 * @param entityType Entity type selecting the workflow definition
 * @param currentState Current state; blank means the definition's initial state
 * @param transitionName Transition name (nullable)
 * @param targetState Target state (nullable)
 * @param actorId Actor requesting the transition (nullable)
 * @param metadata Caller supplied metadata (never null)
 */
public record TransitionInput(
    UUID entityId,
    String entityType,
    String currentState,
    String transitionName,
    String targetState,
    UUID actorId,
    Map<String, Object> metadata
) {
    public TransitionInput {
        metadata = Metadata.copyOf(metadata);
    }

    /**
     * Request a transition by name.
     */
    public static TransitionInput named(UUID entityId, String entityType, String currentState,
                                        String transitionName, UUID actorId) {
        return new TransitionInput(entityId, entityType, currentState, transitionName, null, actorId, Map.of());
    }

    /**
     * Request a transition by target state.
     */
    public static TransitionInput toState(UUID entityId, String entityType, String currentState,
                                          String targetState, UUID actorId) {
        return new TransitionInput(entityId, entityType, currentState, null, targetState, actorId, Map.of());
    }

    public TransitionInput withMetadata(Map<String, Object> newMetadata) {
        return new TransitionInput(entityId, entityType, currentState, transitionName, targetState,
            actorId, newMetadata);
    }

    /**
     * Copy with every identifier in canonical form.
     *
     * @param canonicalEntityType entity type as registered
     * @param initialState fallback for a blank current state
     */
    public TransitionInput normalized(String canonicalEntityType, String initialState) {
        return new TransitionInput(
            entityId,
            canonicalEntityType,
            WorkflowIdentifiers.stateOrDefault(currentState, initialState),
            WorkflowIdentifiers.normalize(transitionName),
            WorkflowIdentifiers.normalize(targetState),
            actorId,
            metadata
        );
    }

    /**
     * Copy bound to a resolved transition.
     */
    public TransitionInput resolvedTo(WorkflowTransition transition) {
        return new TransitionInput(entityId, entityType, currentState, transition.name(), transition.to(),
            actorId, metadata);
    }
}
