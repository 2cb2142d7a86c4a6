package com.ivamare.lifecycle.version;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of one version of an entity.
 *
 * <p>Only the status flips after creation ({@code DRAFT -> PUBLISHED -> ARCHIVED}).
 *
 * @param entityId Owning entity
 * @param version Version number, starting at 1
 * @param status Current status
 * @param snapshot JSON-shaped payload
 * @param createdBy Actor that created the version (nullable)
 * @param publishedBy Actor that published the version (nullable)
 * @param baseVersion Version the draft was branched from, as reported by the caller (nullable)
 * @param createdAt When the version was created
 * @param publishedAt When the version was published (nullable)
 */
public record VersionRecord(
    UUID entityId,
    int version,
    VersionStatus status,
    Map<String, Object> snapshot,
    UUID createdBy,
    UUID publishedBy,
    Integer baseVersion,
    Instant createdAt,
    Instant publishedAt
) {
    public static VersionRecord draft(UUID entityId, int version, Map<String, Object> snapshot,
                                      UUID createdBy, Integer baseVersion, Instant createdAt) {
        return new VersionRecord(entityId, version, VersionStatus.DRAFT, snapshot, createdBy,
            null, baseVersion, createdAt, null);
    }

    public VersionRecord published(UUID by, Instant at) {
        return new VersionRecord(entityId, version, VersionStatus.PUBLISHED, snapshot, createdBy,
            by, baseVersion, createdAt, at);
    }

    public VersionRecord archived() {
        return new VersionRecord(entityId, version, VersionStatus.ARCHIVED, snapshot, createdBy,
            publishedBy, baseVersion, createdAt, publishedAt);
    }

    public VersionRecord withSnapshot(Map<String, Object> newSnapshot) {
        return new VersionRecord(entityId, version, status, newSnapshot, createdBy,
            publishedBy, baseVersion, createdAt, publishedAt);
    }

    public boolean isDraft() {
        return status == VersionStatus.DRAFT;
    }

    public boolean isPublished() {
        return status == VersionStatus.PUBLISHED;
    }
}
