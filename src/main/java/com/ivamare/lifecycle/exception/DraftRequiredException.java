package com.ivamare.lifecycle.exception;

import com.ivamare.lifecycle.version.VersionStatus;

import java.util.UUID;

/**
 * Thrown when publishing a version that is not currently a draft.
 */
public class DraftRequiredException extends LifecycleException {

    private final UUID entityId;
    private final int version;
    private final VersionStatus actualStatus;

    public DraftRequiredException(UUID entityId, int version, VersionStatus actualStatus) {
        super("Version " + version + " of entity " + entityId + " is " + actualStatus + ", expected DRAFT");
        this.entityId = entityId;
        this.version = version;
        this.actualStatus = actualStatus;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public int getVersion() {
        return version;
    }

    public VersionStatus getActualStatus() {
        return actualStatus;
    }
}
