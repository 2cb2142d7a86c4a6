package com.ivamare.lifecycle.version;

import java.util.UUID;

/**
 * Request to restore a historical version as a new draft.
 *
 * @param entityId Entity owning the version
 * @param version Version number to copy
 * @param restoredBy Actor restoring the version (nullable)
 */
public record RestoreVersionRequest(
    UUID entityId,
    int version,
    UUID restoredBy
) {}
