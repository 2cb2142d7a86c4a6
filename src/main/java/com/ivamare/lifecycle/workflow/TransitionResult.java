package com.ivamare.lifecycle.workflow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of a workflow transition.
 *
 * @param entityId Entity that was transitioned
 * @param entityType Canonical entity type
 * @param transitionName Resolved transition name; empty for a no-op
 * @param fromState State before the transition
 * @param toState State after the transition
 * @param completedAt When the transition completed
 * @param actorId Actor that requested the transition (nullable)
 * @param metadata Metadata carried through and added by actions (never null)
 * @param events Events emitted by actions (never null)
 * @param notifications Notifications requested by actions (never null)
 */
public record TransitionResult(
    UUID entityId,
    String entityType,
    String transitionName,
    String fromState,
    String toState,
    Instant completedAt,
    UUID actorId,
    Map<String, Object> metadata,
    List<WorkflowEvent> events,
    List<WorkflowNotification> notifications
) {
    public TransitionResult {
        transitionName = transitionName != null ? transitionName : "";
        metadata = Metadata.copyOf(metadata);
        events = events != null ? List.copyOf(events) : List.of();
        notifications = notifications != null ? List.copyOf(notifications) : List.of();
    }

    /**
     * Result for a request whose target equals the current state.
     */
    public static TransitionResult noOp(TransitionInput input, Instant completedAt) {
        return new TransitionResult(
            input.entityId(), input.entityType(), "",
            input.currentState(), input.currentState(),
            completedAt, input.actorId(), input.metadata(), List.of(), List.of()
        );
    }

    public boolean isNoOp() {
        return transitionName.isEmpty();
    }

    /**
     * Append events and notifications and merge metadata (incoming keys win).
     */
    public TransitionResult withAdditions(List<WorkflowEvent> moreEvents,
                                          List<WorkflowNotification> moreNotifications,
                                          Map<String, Object> moreMetadata) {
        List<WorkflowEvent> mergedEvents = new ArrayList<>(events);
        if (moreEvents != null) {
            mergedEvents.addAll(moreEvents);
        }
        List<WorkflowNotification> mergedNotifications = new ArrayList<>(notifications);
        if (moreNotifications != null) {
            mergedNotifications.addAll(moreNotifications);
        }
        return new TransitionResult(
            entityId, entityType, transitionName, fromState, toState, completedAt, actorId,
            Metadata.merge(metadata, moreMetadata), mergedEvents, mergedNotifications
        );
    }
}
