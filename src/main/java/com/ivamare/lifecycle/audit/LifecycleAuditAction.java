package com.ivamare.lifecycle.audit;

/**
 * Lifecycle operations that leave an audit trail.
 */
public enum LifecycleAuditAction {
    PUBLISHED,
    RESTORED,
    UNPUBLISHED,
    ARCHIVED
}
