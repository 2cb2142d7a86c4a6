package com.ivamare.lifecycle.exception;

import java.util.UUID;

/**
 * Thrown when a new draft would exceed the retention limit and no version
 * can be evicted.
 */
public class RetentionExceededException extends LifecycleException {

    private final UUID entityId;
    private final int limit;

    public RetentionExceededException(UUID entityId, int limit) {
        super("Entity " + entityId + " already holds the maximum of " + limit + " retained versions");
        this.entityId = entityId;
        this.limit = limit;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public int getLimit() {
        return limit;
    }
}
