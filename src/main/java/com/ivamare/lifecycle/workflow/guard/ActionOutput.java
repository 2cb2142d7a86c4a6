package com.ivamare.lifecycle.workflow.guard;

import com.ivamare.lifecycle.workflow.Metadata;
import com.ivamare.lifecycle.workflow.WorkflowEvent;
import com.ivamare.lifecycle.workflow.WorkflowNotification;

import java.util.List;
import java.util.Map;

/**
 * Side effects produced by a transition action.
 *
 * <p>Events and notifications are appended to the transition result; metadata
 * is merged over it.
 *
 * @param events Events to append (never null)
 * @param notifications Notifications to append (never null)
 * @param metadata Metadata to merge (never null)
 */
public record ActionOutput(
    List<WorkflowEvent> events,
    List<WorkflowNotification> notifications,
    Map<String, Object> metadata
) {
    private static final ActionOutput EMPTY = new ActionOutput(List.of(), List.of(), Map.of());

    public ActionOutput {
        events = events != null ? List.copyOf(events) : List.of();
        notifications = notifications != null ? List.copyOf(notifications) : List.of();
        metadata = Metadata.copyOf(metadata);
    }

    public static ActionOutput empty() {
        return EMPTY;
    }

    public static ActionOutput ofEvents(WorkflowEvent... events) {
        return new ActionOutput(List.of(events), List.of(), Map.of());
    }

    public static ActionOutput ofMetadata(Map<String, Object> metadata) {
        return new ActionOutput(List.of(), List.of(), metadata);
    }

    public boolean isEmpty() {
        return events.isEmpty() && notifications.isEmpty() && metadata.isEmpty();
    }
}
