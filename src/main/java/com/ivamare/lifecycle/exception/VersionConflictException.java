package com.ivamare.lifecycle.exception;

import java.util.UUID;

/**
 * Thrown when a draft is based on a version other than the latest one.
 */
public class VersionConflictException extends LifecycleException {

    private final UUID entityId;
    private final int baseVersion;
    private final int latestVersion;

    public VersionConflictException(UUID entityId, int baseVersion, int latestVersion) {
        super("Draft for entity " + entityId + " is based on version " + baseVersion
            + " but the latest version is " + latestVersion);
        this.entityId = entityId;
        this.baseVersion = baseVersion;
        this.latestVersion = latestVersion;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public int getBaseVersion() {
        return baseVersion;
    }

    public int getLatestVersion() {
        return latestVersion;
    }
}
