package com.ivamare.lifecycle.workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorkflowIdentifiers")
class WorkflowIdentifiersTest {

    @Test
    @DisplayName("should trim and lower-case")
    void shouldTrimAndLowerCase() {
        assertEquals("published", WorkflowIdentifiers.normalize("  PUBLISHED "));
        assertEquals("", WorkflowIdentifiers.normalize(null));
    }

    @Test
    @DisplayName("should fall back to draft when no state is known")
    void shouldFallBackToDraft() {
        assertEquals("review", WorkflowIdentifiers.stateOrDefault("", "Review"));
        assertEquals("draft", WorkflowIdentifiers.stateOrDefault(null, null));
        assertEquals("archived", WorkflowIdentifiers.stateOrDefault("Archived", "draft"));
    }

    @Test
    @DisplayName("should build name::from keys")
    void shouldBuildTransitionKeys() {
        assertEquals("publish::draft", WorkflowIdentifiers.transitionKey("Publish", " draft"));
    }
}
