package com.ivamare.lifecycle.workflow;

import java.util.List;

import static com.ivamare.lifecycle.workflow.WorkflowStates.APPROVED;
import static com.ivamare.lifecycle.workflow.WorkflowStates.ARCHIVED;
import static com.ivamare.lifecycle.workflow.WorkflowStates.DRAFT;
import static com.ivamare.lifecycle.workflow.WorkflowStates.PUBLISHED;
import static com.ivamare.lifecycle.workflow.WorkflowStates.REVIEW;
import static com.ivamare.lifecycle.workflow.WorkflowStates.SCHEDULED;

/**
 * Built-in editorial workflow shared by content, pages and blocks.
 *
 * <pre>
 * draft --submit_review--> review --approve--> approved --publish--> published
 *   |                        |                    |                     |
 *   |                        +--reject--> draft   +--request_changes--> review
 *   +--publish--> published                                             |
 *   +--schedule--> scheduled --publish--> published                     +--unpublish--> draft
 *   +--archive--> archived --restore--> draft          published --archive--> archived
 * </pre>
 */
public final class DefaultWorkflows {

    private DefaultWorkflows() {
    }

    /**
     * The editorial workflow for the given entity type.
     */
    public static WorkflowDefinition editorial(String entityType) {
        return new WorkflowDefinition(
            entityType,
            DRAFT,
            List.of(
                WorkflowStateDefinition.of(DRAFT, "Draft content awaiting validation"),
                WorkflowStateDefinition.of(REVIEW, "Under editorial review"),
                WorkflowStateDefinition.of(APPROVED, "Approved and ready to publish"),
                WorkflowStateDefinition.of(SCHEDULED, "Scheduled to publish at a future time"),
                WorkflowStateDefinition.of(PUBLISHED, "Published and visible"),
                WorkflowStateDefinition.of(ARCHIVED, "Archived and hidden")
            ),
            List.of(
                WorkflowTransition.of("submit_review", DRAFT, REVIEW),
                WorkflowTransition.of("approve", REVIEW, APPROVED),
                WorkflowTransition.of("reject", REVIEW, DRAFT),
                WorkflowTransition.of("request_changes", APPROVED, REVIEW),
                WorkflowTransition.of("publish", APPROVED, PUBLISHED),
                WorkflowTransition.of("publish", DRAFT, PUBLISHED),
                WorkflowTransition.of("publish", SCHEDULED, PUBLISHED),
                WorkflowTransition.of("unpublish", PUBLISHED, DRAFT),
                WorkflowTransition.of("archive", DRAFT, ARCHIVED),
                WorkflowTransition.of("archive", PUBLISHED, ARCHIVED),
                WorkflowTransition.of("restore", ARCHIVED, DRAFT),
                WorkflowTransition.of("schedule", DRAFT, SCHEDULED),
                WorkflowTransition.of("schedule", APPROVED, SCHEDULED),
                WorkflowTransition.of("cancel_schedule", SCHEDULED, DRAFT)
            )
        );
    }
}
