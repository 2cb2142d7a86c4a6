package com.ivamare.lifecycle.version;

import java.time.Instant;
import java.util.UUID;

/**
 * Request to publish a draft version.
 *
 * @param entityId Entity owning the version
 * @param version Version number to publish
 * @param publishedBy Publishing actor (nullable)
 * @param publishedAt Publication time; null means now
 */
public record PublishDraftRequest(
    UUID entityId,
    int version,
    UUID publishedBy,
    Instant publishedAt
) {
    public static PublishDraftRequest of(UUID entityId, int version, UUID publishedBy) {
        return new PublishDraftRequest(entityId, version, publishedBy, null);
    }
}
