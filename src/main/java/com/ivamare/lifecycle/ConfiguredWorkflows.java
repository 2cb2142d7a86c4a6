package com.ivamare.lifecycle;

import com.ivamare.lifecycle.exception.InvalidWorkflowDefinitionException;
import com.ivamare.lifecycle.workflow.CompiledWorkflow;
import com.ivamare.lifecycle.workflow.WorkflowDefinition;
import com.ivamare.lifecycle.workflow.WorkflowIdentifiers;
import com.ivamare.lifecycle.workflow.WorkflowStateDefinition;
import com.ivamare.lifecycle.workflow.WorkflowTransition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns {@code lifecycle.workflow.definitions} into validated workflow definitions.
 */
final class ConfiguredWorkflows {

    private ConfiguredWorkflows() {
    }

    /**
     * Compile configured definitions.
     *
     * @param configured Definitions from configuration
     * @return Normalized definitions in configuration order
     * @throws InvalidWorkflowDefinitionException if a definition is invalid or an entity type repeats
     */
    static List<WorkflowDefinition> compile(List<LifecycleProperties.DefinitionProperties> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<WorkflowDefinition> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < configured.size(); i++) {
            LifecycleProperties.DefinitionProperties props = configured.get(i);
            String entity = WorkflowIdentifiers.normalize(props.getEntity());
            if (entity.isEmpty()) {
                throw new InvalidWorkflowDefinitionException(
                    "lifecycle.workflow.definitions[" + i + "]: entity is required");
            }
            if (!seen.add(entity)) {
                throw new InvalidWorkflowDefinitionException(
                    "lifecycle.workflow.definitions[" + i + "]: duplicate definition for " + entity);
            }
            result.add(CompiledWorkflow.compile(toDefinition(entity, props)).definition());
        }
        return result;
    }

    private static WorkflowDefinition toDefinition(String entity, LifecycleProperties.DefinitionProperties props) {
        List<WorkflowStateDefinition> states = new ArrayList<>();
        String initial = props.getInitialState();
        for (LifecycleProperties.StateProperties state : props.getStates()) {
            states.add(new WorkflowStateDefinition(state.getName(), state.getDescription(), state.isTerminal()));
            if (state.isInitial()) {
                if (!WorkflowIdentifiers.isBlank(initial)
                        && !WorkflowIdentifiers.normalize(initial).equals(WorkflowIdentifiers.normalize(state.getName()))) {
                    throw new InvalidWorkflowDefinitionException(
                        "Workflow " + entity + ": initial state declared as both " + initial + " and " + state.getName());
                }
                initial = state.getName();
            }
        }

        List<WorkflowTransition> transitions = new ArrayList<>();
        for (LifecycleProperties.TransitionProperties transition : props.getTransitions()) {
            transitions.add(new WorkflowTransition(
                transition.getName(),
                transition.getDescription(),
                transition.getFrom(),
                transition.getTo(),
                transition.getGuard()));
        }
        return new WorkflowDefinition(entity, initial, states, transitions);
    }
}
