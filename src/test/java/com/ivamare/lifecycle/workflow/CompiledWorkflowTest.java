package com.ivamare.lifecycle.workflow;

import com.ivamare.lifecycle.exception.InvalidTransitionException;
import com.ivamare.lifecycle.exception.InvalidWorkflowDefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CompiledWorkflow")
class CompiledWorkflowTest {

    private static WorkflowDefinition definition(List<WorkflowStateDefinition> states,
                                                 List<WorkflowTransition> transitions) {
        return new WorkflowDefinition("Page", null, states, transitions);
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("should normalize identifiers")
        void shouldNormalizeIdentifiers() {
            CompiledWorkflow workflow = CompiledWorkflow.compile(definition(
                List.of(WorkflowStateDefinition.of(" Draft "), WorkflowStateDefinition.of("REVIEW")),
                List.of(WorkflowTransition.of(" Submit ", "DRAFT", "Review"))
            ));

            assertEquals("page", workflow.entityType());
            assertEquals("draft", workflow.initialState());
            assertTrue(workflow.hasState("review"));
            WorkflowTransition submit = workflow.lookup("submit", "draft").orElseThrow();
            assertEquals("draft", submit.from());
            assertEquals("review", submit.to());
        }

        @Test
        @DisplayName("should reject blank entity type")
        void shouldRejectBlankEntityType() {
            var definition = new WorkflowDefinition("  ", null, List.of(WorkflowStateDefinition.of("draft")), List.of());

            assertThrows(IllegalArgumentException.class, () -> CompiledWorkflow.compile(definition));
        }

        @Test
        @DisplayName("should reject definition without states")
        void shouldRejectDefinitionWithoutStates() {
            assertThrows(InvalidWorkflowDefinitionException.class,
                () -> CompiledWorkflow.compile(definition(List.of(), List.of())));
        }

        @Test
        @DisplayName("should reject duplicate states")
        void shouldRejectDuplicateStates() {
            var ex = assertThrows(InvalidWorkflowDefinitionException.class, () -> CompiledWorkflow.compile(definition(
                List.of(WorkflowStateDefinition.of("draft"), WorkflowStateDefinition.of("DRAFT")),
                List.of()
            )));

            assertTrue(ex.getMessage().contains("duplicate state draft"));
        }

        @Test
        @DisplayName("should reject transitions to undeclared states")
        void shouldRejectTransitionsToUndeclaredStates() {
            assertThrows(InvalidWorkflowDefinitionException.class, () -> CompiledWorkflow.compile(definition(
                List.of(WorkflowStateDefinition.of("draft")),
                List.of(WorkflowTransition.of("publish", "draft", "published"))
            )));
        }

        @Test
        @DisplayName("should reject duplicate name and source")
        void shouldRejectDuplicateNameAndSource() {
            assertThrows(InvalidWorkflowDefinitionException.class, () -> CompiledWorkflow.compile(definition(
                List.of(WorkflowStateDefinition.of("draft"), WorkflowStateDefinition.of("review"),
                    WorkflowStateDefinition.of("published")),
                List.of(
                    WorkflowTransition.of("advance", "draft", "review"),
                    WorkflowTransition.of("Advance", "draft", "published")
                )
            )));
        }

        @Test
        @DisplayName("should allow the same name from different states")
        void shouldAllowSameNameFromDifferentStates() {
            CompiledWorkflow workflow = CompiledWorkflow.compile(DefaultWorkflows.editorial("page"));

            assertEquals("published", workflow.lookup("publish", "draft").orElseThrow().to());
            assertEquals("published", workflow.lookup("publish", "scheduled").orElseThrow().to());
            assertEquals(14, workflow.definition().transitions().size());
        }

        @Test
        @DisplayName("should reject undeclared initial state")
        void shouldRejectUndeclaredInitialState() {
            var definition = new WorkflowDefinition("page", "pending",
                List.of(WorkflowStateDefinition.of("draft")), List.of());

            assertThrows(InvalidWorkflowDefinitionException.class, () -> CompiledWorkflow.compile(definition));
        }

        @Test
        @DisplayName("should reject transitions leaving a terminal state")
        void shouldRejectTransitionsLeavingTerminalState() {
            assertThrows(InvalidWorkflowDefinitionException.class, () -> CompiledWorkflow.compile(definition(
                List.of(WorkflowStateDefinition.of("draft"), WorkflowStateDefinition.terminal("deleted", null)),
                List.of(WorkflowTransition.of("undelete", "deleted", "draft"))
            )));
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        private final CompiledWorkflow workflow = CompiledWorkflow.compile(new WorkflowDefinition(
            "page", "draft",
            List.of(WorkflowStateDefinition.of("draft"), WorkflowStateDefinition.of("review"),
                WorkflowStateDefinition.terminal("deleted", "Gone")),
            List.of(WorkflowTransition.of("submit", "draft", "review"),
                WorkflowTransition.of("delete", "draft", "deleted"))
        ));

        private TransitionInput input(String current, String name, String target) {
            return new TransitionInput(UUID.randomUUID(), "page", current, name, target, null, null)
                .normalized("page", "draft");
        }

        @Test
        @DisplayName("should resolve by name")
        void shouldResolveByName() {
            assertEquals("review", workflow.resolve(input("draft", "submit", null)).to());
        }

        @Test
        @DisplayName("should resolve by target state")
        void shouldResolveByTargetState() {
            assertEquals("submit", workflow.resolve(input("draft", null, "Review")).name());
        }

        @Test
        @DisplayName("should treat blank current state as initial state")
        void shouldTreatBlankCurrentStateAsInitial() {
            assertEquals("submit", workflow.resolve(input(" ", "submit", null)).name());
        }

        @Test
        @DisplayName("should fail for unknown transition")
        void shouldFailForUnknownTransition() {
            var ex = assertThrows(InvalidTransitionException.class,
                () -> workflow.resolve(input("review", "submit", null)));

            assertEquals("review", ex.getFromState());
            assertEquals("submit", ex.getRequested());
        }

        @Test
        @DisplayName("should fail from terminal state")
        void shouldFailFromTerminalState() {
            var ex = assertThrows(InvalidTransitionException.class,
                () -> workflow.resolve(input("deleted", null, "draft")));

            assertTrue(ex.getMessage().contains("terminal"));
        }

        @Test
        @DisplayName("should detect no-op requests")
        void shouldDetectNoOpRequests() {
            assertTrue(CompiledWorkflow.isNoOp(input("draft", null, null)));
            assertTrue(CompiledWorkflow.isNoOp(input("draft", "", "DRAFT")));
            assertFalse(CompiledWorkflow.isNoOp(input("draft", "submit", null)));
            assertFalse(CompiledWorkflow.isNoOp(input("draft", null, "review")));
        }
    }
}
