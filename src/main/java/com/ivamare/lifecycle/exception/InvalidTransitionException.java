package com.ivamare.lifecycle.exception;

/**
 * Thrown when the requested transition or target state is not reachable
 * from the current state.
 */
public class InvalidTransitionException extends LifecycleException {

    private final String entityType;
    private final String fromState;
    private final String requested;

    public InvalidTransitionException(String entityType, String fromState, String requested) {
        this(entityType, fromState, requested,
            "Transition '" + requested + "' not allowed from '" + fromState + "' for " + entityType);
    }

    public InvalidTransitionException(String entityType, String fromState, String requested, String message) {
        super(message);
        this.entityType = entityType;
        this.fromState = fromState;
        this.requested = requested;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getFromState() {
        return fromState;
    }

    /**
     * The transition name or target state that was requested.
     */
    public String getRequested() {
        return requested;
    }
}
