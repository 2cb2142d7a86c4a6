package com.ivamare.lifecycle.workflow;

import java.util.Map;

/**
 * Query for the transitions available from a state.
 *
 * @param entityType Entity type selecting the workflow definition
 * @param state State to list transitions from; blank means the initial state
 * @param context Optional caller context (never null)
 */
public record TransitionQuery(
    String entityType,
    String state,
    Map<String, Object> context
) {
    public TransitionQuery {
        context = Metadata.copyOf(context);
    }

    public static TransitionQuery of(String entityType, String state) {
        return new TransitionQuery(entityType, state, Map.of());
    }
}
