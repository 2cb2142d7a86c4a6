package com.ivamare.lifecycle.audit;

/**
 * Sink for lifecycle audit events.
 *
 * <p>Recorders may throw; callers log the failure and carry on.
 */
@FunctionalInterface
public interface LifecycleAuditRecorder {

    /**
     * Record an audit event.
     *
     * @param event Event to record
     */
    void record(LifecycleAuditEvent event);
}
