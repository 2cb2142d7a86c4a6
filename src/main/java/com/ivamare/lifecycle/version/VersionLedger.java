package com.ivamare.lifecycle.version;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Version history of the entities of one family.
 *
 * <p>Guarantees per entity:
 * <ul>
 *   <li>version numbers are strictly increasing and never reused;</li>
 *   <li>at most one version is {@link VersionStatus#PUBLISHED};</li>
 *   <li>history is never rewritten: restore copies into a new draft.</li>
 * </ul>
 */
public interface VersionLedger {

    /**
     * The family this ledger serves.
     */
    EntityFamily family();

    LedgerSettings settings();

    /**
     * Create a draft at the next version number.
     *
     * @param request Draft request
     * @return The stored draft
     * @throws com.ivamare.lifecycle.exception.RetentionExceededException if the retention limit is reached
     *         and no version can be evicted
     */
    VersionRecord createDraft(CreateDraftRequest request);

    /**
     * Publish a draft. The previously published version, if any, becomes archived.
     *
     * @param request Publish request
     * @return The published version
     * @throws com.ivamare.lifecycle.exception.VersionNotFoundException if the version does not exist
     * @throws com.ivamare.lifecycle.exception.DraftRequiredException if the version is not a draft
     */
    VersionRecord publishDraft(PublishDraftRequest request);

    /**
     * Get retained versions ordered by ascending version number.
     *
     * @param entityId Entity ID
     * @return Versions (empty if the entity has none)
     */
    List<VersionRecord> listVersions(UUID entityId);

    /**
     * Copy a historical version into a new draft at the next version number.
     *
     * @param request Restore request
     * @return The new draft
     * @throws com.ivamare.lifecycle.exception.VersionNotFoundException if the version does not exist
     * @throws com.ivamare.lifecycle.exception.RetentionExceededException if no room is left for the draft
     */
    VersionRecord restoreVersion(RestoreVersionRequest request);

    /**
     * Archive the currently published version, if any.
     *
     * @param entityId Entity ID
     * @return The archived version, or empty if nothing was published
     */
    Optional<VersionRecord> archivePublished(UUID entityId);

    Optional<VersionRecord> findVersion(UUID entityId, int version);

    /**
     * Get a version, throwing if it does not exist.
     *
     * @throws com.ivamare.lifecycle.exception.VersionNotFoundException if not found
     */
    VersionRecord getVersion(UUID entityId, int version);

    Optional<VersionRecord> findPublished(UUID entityId);

    /**
     * Highest version number ever allocated for the entity, 0 if none.
     */
    int latestVersion(UUID entityId);
}
