package com.ivamare.lifecycle.audit;

import com.ivamare.lifecycle.version.EntityFamily;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail entry for a lifecycle operation.
 *
 * @param family Entity family
 * @param entityId Entity the operation applied to
 * @param version Version affected by the operation
 * @param action Operation performed
 * @param actorId Acting user (nullable)
 * @param timestamp When the operation completed
 * @param details Additional context (nullable)
 */
public record LifecycleAuditEvent(
    EntityFamily family,
    UUID entityId,
    int version,
    LifecycleAuditAction action,
    UUID actorId,
    Instant timestamp,
    Map<String, Object> details
) {
    public LifecycleAuditEvent {
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}
