package com.ivamare.lifecycle.exception;

import java.util.UUID;

/**
 * Thrown when a lifecycle-managed entity does not exist.
 */
public class EntityNotFoundException extends LifecycleException {

    private final String family;
    private final UUID entityId;

    public EntityNotFoundException(String family, UUID entityId) {
        super("Entity not found: " + family + "/" + entityId);
        this.family = family;
        this.entityId = entityId;
    }

    public String getFamily() {
        return family;
    }

    public UUID getEntityId() {
        return entityId;
    }
}
