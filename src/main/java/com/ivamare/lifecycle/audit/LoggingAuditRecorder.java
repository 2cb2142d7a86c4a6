package com.ivamare.lifecycle.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit recorder writing one INFO line per event.
 */
public class LoggingAuditRecorder implements LifecycleAuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(LoggingAuditRecorder.class);

    @Override
    public void record(LifecycleAuditEvent event) {
        log.info("{} {} {} v{} by {} at {} {}",
            event.action(),
            event.family().key(),
            event.entityId(),
            event.version(),
            event.actorId(),
            event.timestamp(),
            event.details());
    }
}
