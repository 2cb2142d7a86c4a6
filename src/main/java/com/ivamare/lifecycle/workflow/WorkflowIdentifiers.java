package com.ivamare.lifecycle.workflow;

import java.util.Locale;

/**
 * Canonical form of workflow identifiers.
 *
 * <p>Entity types, state names and transition names are compared
 * case-insensitively. Every public entry point normalizes once (trim and
 * lower-case) and only the canonical form is stored internally.
 */
public final class WorkflowIdentifiers {

    /** Separator used in compound lookup keys such as {@code name::from}. */
    public static final String KEY_SEPARATOR = "::";

    private WorkflowIdentifiers() {
    }

    /**
     * Normalize an identifier. Blank or null input yields an empty string.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalize a state name, falling back to {@code fallback} when blank.
     */
    public static String stateOrDefault(String raw, String fallback) {
        String state = normalize(raw);
        if (state.isEmpty()) {
            state = normalize(fallback);
        }
        return state.isEmpty() ? WorkflowStates.DRAFT : state;
    }

    public static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }

    /**
     * Lookup key for a transition leaving {@code from}.
     */
    public static String transitionKey(String transitionName, String from) {
        return normalize(transitionName) + KEY_SEPARATOR + normalize(from);
    }
}
