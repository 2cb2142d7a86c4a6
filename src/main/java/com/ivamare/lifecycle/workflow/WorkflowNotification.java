package com.ivamare.lifecycle.workflow;

import java.util.Map;

/**
 * Downstream notification requested by a transition.
 *
 * @param channel Delivery channel (e.g., "email")
 * @param message Message text
 * @param data Extra data (never null)
 */
public record WorkflowNotification(
    String channel,
    String message,
    Map<String, Object> data
) {
    public WorkflowNotification {
        data = Metadata.copyOf(data);
    }
}
