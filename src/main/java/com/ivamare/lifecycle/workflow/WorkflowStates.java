package com.ivamare.lifecycle.workflow;

/**
 * Well-known workflow state names.
 */
public final class WorkflowStates {

    public static final String DRAFT = "draft";
    public static final String REVIEW = "review";
    public static final String APPROVED = "approved";
    public static final String SCHEDULED = "scheduled";
    public static final String PUBLISHED = "published";
    public static final String ARCHIVED = "archived";

    private WorkflowStates() {
    }
}
