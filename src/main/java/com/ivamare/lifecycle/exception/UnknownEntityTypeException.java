package com.ivamare.lifecycle.exception;

/**
 * Thrown when no workflow definition is registered for an entity type.
 */
public class UnknownEntityTypeException extends LifecycleException {

    private final String entityType;

    public UnknownEntityTypeException(String entityType) {
        super("No workflow registered for entity type '" + entityType + "'");
        this.entityType = entityType;
    }

    public String getEntityType() {
        return entityType;
    }
}
