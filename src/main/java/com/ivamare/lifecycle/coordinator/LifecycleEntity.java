package com.ivamare.lifecycle.coordinator;

import com.ivamare.lifecycle.version.EntityFamily;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle pointers of a content, page or block entity.
 *
 * @param id Entity ID
 * @param family Entity family
 * @param status Workflow state (canonical)
 * @param currentVersion Highest version created through the coordinator, 0 if none
 * @param publishedVersion Published version (nullable)
 * @param publishedAt When the published version went live (nullable)
 * @param publishedBy Who published it (nullable)
 * @param updatedBy Last actor (nullable)
 * @param updatedAt Last change
 */
public record LifecycleEntity(
    UUID id,
    EntityFamily family,
    String status,
    int currentVersion,
    Integer publishedVersion,
    Instant publishedAt,
    UUID publishedBy,
    UUID updatedBy,
    Instant updatedAt
) {
    public static LifecycleEntity create(UUID id, EntityFamily family, String status, UUID createdBy, Instant now) {
        return new LifecycleEntity(id, family, status, 0, null, null, null, createdBy, now);
    }

    public LifecycleEntity withStatus(String newStatus) {
        return new LifecycleEntity(id, family, newStatus, currentVersion, publishedVersion,
            publishedAt, publishedBy, updatedBy, updatedAt);
    }

    public LifecycleEntity withCurrentVersion(int version) {
        return new LifecycleEntity(id, family, status, version, publishedVersion,
            publishedAt, publishedBy, updatedBy, updatedAt);
    }

    public LifecycleEntity withPublished(int version, Instant at, UUID by) {
        return new LifecycleEntity(id, family, status, currentVersion, version, at, by, updatedBy, updatedAt);
    }

    public LifecycleEntity withoutPublished() {
        return new LifecycleEntity(id, family, status, currentVersion, null, null, null, updatedBy, updatedAt);
    }

    public LifecycleEntity touchedBy(UUID actor, Instant at) {
        return new LifecycleEntity(id, family, status, currentVersion, publishedVersion,
            publishedAt, publishedBy, actor, at);
    }

    public boolean isPublished() {
        return publishedVersion != null;
    }
}
