package com.ivamare.lifecycle.workflow;

import java.time.Instant;
import java.util.Map;

/**
 * Domain event emitted while running a transition.
 *
 * @param name Event name
 * @param timestamp When the event was produced
 * @param payload Event payload (never null)
 */
public record WorkflowEvent(
    String name,
    Instant timestamp,
    Map<String, Object> payload
) {
    public WorkflowEvent {
        payload = Metadata.copyOf(payload);
    }
}
