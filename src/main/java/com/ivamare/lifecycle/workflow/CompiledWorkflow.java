package com.ivamare.lifecycle.workflow;

import com.ivamare.lifecycle.exception.InvalidTransitionException;
import com.ivamare.lifecycle.exception.InvalidWorkflowDefinitionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, normalized workflow with its transition index.
 *
 * <p>Instances are immutable. Transitions are indexed by {@code name::from}
 * and grouped by source state in declaration order.
 */
public final class CompiledWorkflow {

    private final WorkflowDefinition definition;
    private final Map<String, WorkflowTransition> transitionsByKey;
    private final Map<String, List<WorkflowTransition>> transitionsByState;
    private final Set<String> states;
    private final Set<String> terminalStates;

    private CompiledWorkflow(WorkflowDefinition definition,
                             Map<String, WorkflowTransition> transitionsByKey,
                             Map<String, List<WorkflowTransition>> transitionsByState,
                             Set<String> states,
                             Set<String> terminalStates) {
        this.definition = definition;
        this.transitionsByKey = transitionsByKey;
        this.transitionsByState = transitionsByState;
        this.states = states;
        this.terminalStates = terminalStates;
    }

    /**
     * Validate and normalize a definition.
     *
     * @param definition Raw definition
     * @return Compiled workflow
     * @throws IllegalArgumentException if the entity type is blank
     * @throws InvalidWorkflowDefinitionException if states or transitions are inconsistent
     */
    public static CompiledWorkflow compile(WorkflowDefinition definition) {
        if (definition == null || WorkflowIdentifiers.isBlank(definition.entityType())) {
            throw new IllegalArgumentException("Workflow entity type is required");
        }
        String entityType = WorkflowIdentifiers.normalize(definition.entityType());
        if (definition.states().isEmpty()) {
            throw new InvalidWorkflowDefinitionException(
                "Workflow " + entityType + " requires at least one state");
        }

        List<WorkflowStateDefinition> normalizedStates = new ArrayList<>();
        Set<String> states = new LinkedHashSet<>();
        Set<String> terminalStates = new HashSet<>();
        for (int i = 0; i < definition.states().size(); i++) {
            WorkflowStateDefinition state = definition.states().get(i);
            String name = WorkflowIdentifiers.normalize(state.name());
            if (name.isEmpty()) {
                throw new InvalidWorkflowDefinitionException(
                    "Workflow " + entityType + ": state name required at index " + i);
            }
            if (!states.add(name)) {
                throw new InvalidWorkflowDefinitionException(
                    "Workflow " + entityType + ": duplicate state " + name);
            }
            if (state.terminal()) {
                terminalStates.add(name);
            }
            normalizedStates.add(new WorkflowStateDefinition(name, trimToNull(state.description()), state.terminal()));
        }

        String initial = WorkflowIdentifiers.normalize(definition.initialState());
        if (initial.isEmpty()) {
            initial = normalizedStates.get(0).name();
        } else if (!states.contains(initial)) {
            throw new InvalidWorkflowDefinitionException(
                "Workflow " + entityType + ": initial state " + initial + " is not declared");
        }

        Map<String, WorkflowTransition> byKey = new HashMap<>();
        Map<String, List<WorkflowTransition>> byState = new LinkedHashMap<>();
        List<WorkflowTransition> normalizedTransitions = new ArrayList<>();
        for (int i = 0; i < definition.transitions().size(); i++) {
            WorkflowTransition raw = definition.transitions().get(i);
            String name = WorkflowIdentifiers.normalize(raw.name());
            if (name.isEmpty()) {
                throw new InvalidWorkflowDefinitionException(
                    "Workflow " + entityType + ": transition name required at index " + i);
            }
            String from = WorkflowIdentifiers.normalize(raw.from());
            String to = WorkflowIdentifiers.normalize(raw.to());
            if (!states.contains(from) || !states.contains(to)) {
                throw new InvalidWorkflowDefinitionException(
                    "Workflow " + entityType + ": transition " + name
                        + " references unknown state (" + raw.from() + " -> " + raw.to() + ")");
            }
            if (terminalStates.contains(from) && !from.equals(to)) {
                throw new InvalidWorkflowDefinitionException(
                    "Workflow " + entityType + ": terminal state " + from + " cannot have transition " + name);
            }
            WorkflowTransition transition = new WorkflowTransition(
                name, trimToNull(raw.description()), from, to, trimToNull(raw.guard()));
            if (byKey.putIfAbsent(transition.key(), transition) != null) {
                throw new InvalidWorkflowDefinitionException(
                    "Workflow " + entityType + ": duplicate transition " + name + " from " + from);
            }
            byState.computeIfAbsent(from, k -> new ArrayList<>()).add(transition);
            normalizedTransitions.add(transition);
        }
        byState.replaceAll((state, list) -> List.copyOf(list));

        WorkflowDefinition normalized = new WorkflowDefinition(entityType, initial, normalizedStates, normalizedTransitions);
        return new CompiledWorkflow(normalized, Map.copyOf(byKey), byState, Set.copyOf(states), Set.copyOf(terminalStates));
    }

    public WorkflowDefinition definition() {
        return definition;
    }

    public String entityType() {
        return definition.entityType();
    }

    public String initialState() {
        return definition.initialState();
    }

    public boolean hasState(String state) {
        return states.contains(WorkflowIdentifiers.normalize(state));
    }

    public boolean isTerminal(String state) {
        return terminalStates.contains(WorkflowIdentifiers.normalize(state));
    }

    /**
     * Canonical state, or the initial state when blank.
     */
    public String resolveState(String raw) {
        return WorkflowIdentifiers.stateOrDefault(raw, definition.initialState());
    }

    /**
     * Transitions leaving a state, in declaration order.
     */
    public List<WorkflowTransition> transitionsFrom(String state) {
        return transitionsByState.getOrDefault(resolveState(state), List.of());
    }

    /**
     * Find a transition by name and source state.
     */
    public Optional<WorkflowTransition> lookup(String transitionName, String from) {
        return Optional.ofNullable(transitionsByKey.get(WorkflowIdentifiers.transitionKey(transitionName, from)));
    }

    /**
     * Find the first transition from {@code from} whose target is {@code to}.
     */
    public Optional<WorkflowTransition> lookupByStates(String from, String to) {
        String target = WorkflowIdentifiers.normalize(to);
        return transitionsFrom(from).stream()
            .filter(candidate -> candidate.to().equals(target))
            .findFirst();
    }

    /**
     * Resolve the transition selected by a normalized request.
     *
     * <p>Callers must handle the no-op case before calling this method; the
     * transition index is always consulted here.
     *
     * @param input Input already in canonical form
     * @return The matching transition
     * @throws InvalidTransitionException if the current state is terminal or nothing matches
     */
    public WorkflowTransition resolve(TransitionInput input) {
        String current = input.currentState();
        String name = input.transitionName();
        String target = input.targetState();
        String requested = name.isEmpty() ? target : name;

        if (isTerminal(current)) {
            throw new InvalidTransitionException(entityType(), current, requested,
                "State '" + current + "' is terminal for " + entityType());
        }

        Optional<WorkflowTransition> match = name.isEmpty()
            ? lookupByStates(current, target)
            : lookup(name, current);
        return match.orElseThrow(() -> new InvalidTransitionException(entityType(), current, requested));
    }

    /**
     * Whether the request should short-circuit without touching the transition index.
     *
     * @param input Input already in canonical form
     */
    public static boolean isNoOp(TransitionInput input) {
        return input.transitionName().isEmpty()
            && (input.targetState().isEmpty() || input.targetState().equals(input.currentState()));
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
