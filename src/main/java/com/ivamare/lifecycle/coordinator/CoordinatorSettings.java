package com.ivamare.lifecycle.coordinator;

/**
 * Per-family coordinator switches.
 *
 * @param workflowCheck Run lifecycle operations through the workflow engine
 * @param rejectStaleBaseVersion Reject drafts based on an outdated version (otherwise only warn)
 * @param workflowEntityType Workflow definition to use; blank means the family key
 */
public record CoordinatorSettings(
    boolean workflowCheck,
    boolean rejectStaleBaseVersion,
    String workflowEntityType
) {
    public static CoordinatorSettings defaults() {
        return new CoordinatorSettings(true, true, null);
    }
}
