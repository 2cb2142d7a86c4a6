package com.ivamare.lifecycle.exception;

import java.util.UUID;

/**
 * Thrown when a referenced version number does not exist for an entity.
 */
public class VersionNotFoundException extends LifecycleException {

    private final UUID entityId;
    private final int version;

    public VersionNotFoundException(UUID entityId, int version) {
        super("Version " + version + " not found for entity " + entityId);
        this.entityId = entityId;
        this.version = version;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public int getVersion() {
        return version;
    }
}
