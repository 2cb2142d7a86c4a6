package com.ivamare.lifecycle.version;

import java.util.Map;
import java.util.UUID;

/**
 * Request to create a new draft version.
 *
 * <p>{@code baseVersion} is advisory. The ledger records it but never compares it;
 * stale-base detection is up to the caller.
 *
 * @param entityId Entity receiving the draft
 * @param snapshot Payload of the draft
 * @param createdBy Actor creating the draft (nullable)
 * @param baseVersion Version the caller branched from (nullable)
 */
public record CreateDraftRequest(
    UUID entityId,
    Map<String, Object> snapshot,
    UUID createdBy,
    Integer baseVersion
) {
    public static CreateDraftRequest of(UUID entityId, Map<String, Object> snapshot, UUID createdBy) {
        return new CreateDraftRequest(entityId, snapshot, createdBy, null);
    }
}
