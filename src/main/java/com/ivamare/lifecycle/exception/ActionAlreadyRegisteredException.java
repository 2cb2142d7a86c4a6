package com.ivamare.lifecycle.exception;

/**
 * Thrown when attempting to register a second action hook for the same
 * entity type and transition.
 */
public class ActionAlreadyRegisteredException extends LifecycleException {

    private final String entityType;
    private final String transitionName;

    public ActionAlreadyRegisteredException(String entityType, String transitionName) {
        super("Action already registered for " + entityType + "::" + transitionName);
        this.entityType = entityType;
        this.transitionName = transitionName;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getTransitionName() {
        return transitionName;
    }
}
