package com.ivamare.lifecycle.workflow.impl;

import com.ivamare.lifecycle.exception.UnknownEntityTypeException;
import com.ivamare.lifecycle.workflow.CompiledWorkflow;
import com.ivamare.lifecycle.workflow.TransitionInput;
import com.ivamare.lifecycle.workflow.TransitionQuery;
import com.ivamare.lifecycle.workflow.TransitionResult;
import com.ivamare.lifecycle.workflow.WorkflowDefinition;
import com.ivamare.lifecycle.workflow.WorkflowEngine;
import com.ivamare.lifecycle.workflow.WorkflowIdentifiers;
import com.ivamare.lifecycle.workflow.WorkflowTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory workflow engine executing deterministic state transitions.
 *
 * <p>Guards are not evaluated here; wrap the engine in a
 * {@link com.ivamare.lifecycle.workflow.guard.GuardedWorkflowEngine} to enforce them.
 */
public class SimpleWorkflowEngine implements WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(SimpleWorkflowEngine.class);

    private final Map<String, CompiledWorkflow> definitions = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public SimpleWorkflowEngine() {
        this(Clock.systemUTC());
    }

    public SimpleWorkflowEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void registerWorkflow(WorkflowDefinition definition) {
        CompiledWorkflow compiled = CompiledWorkflow.compile(definition);
        lock.writeLock().lock();
        try {
            CompiledWorkflow previous = definitions.put(compiled.entityType(), compiled);
            log.debug("{} workflow for {} ({} states, {} transitions)",
                previous == null ? "Registered" : "Replaced",
                compiled.entityType(),
                compiled.definition().states().size(),
                compiled.definition().transitions().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public TransitionResult transition(TransitionInput input) {
        if (input == null || input.entityId() == null) {
            throw new IllegalArgumentException("Transition requires an entity id");
        }
        CompiledWorkflow workflow = definitionFor(input.entityType());
        TransitionInput normalized = input.normalized(workflow.entityType(), workflow.initialState());

        if (CompiledWorkflow.isNoOp(normalized)) {
            return TransitionResult.noOp(normalized, clock.instant());
        }

        WorkflowTransition transition = workflow.resolve(normalized);
        log.debug("Transition {} {} {} -> {} (entityId={})",
            workflow.entityType(), transition.name(), transition.from(), transition.to(), input.entityId());

        return new TransitionResult(
            normalized.entityId(),
            workflow.entityType(),
            transition.name(),
            normalized.currentState(),
            transition.to(),
            clock.instant(),
            normalized.actorId(),
            normalized.metadata(),
            List.of(),
            List.of()
        );
    }

    @Override
    public List<WorkflowTransition> availableTransitions(TransitionQuery query) {
        CompiledWorkflow workflow = definitionFor(query.entityType());
        return workflow.transitionsFrom(query.state());
    }

    @Override
    public Optional<WorkflowDefinition> findDefinition(String entityType) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(definitions.get(WorkflowIdentifiers.normalize(entityType)))
                .map(CompiledWorkflow::definition);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> registeredEntityTypes() {
        lock.readLock().lock();
        try {
            return definitions.keySet().stream().sorted().toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    private CompiledWorkflow definitionFor(String entityType) {
        String key = WorkflowIdentifiers.normalize(entityType);
        lock.readLock().lock();
        try {
            CompiledWorkflow workflow = definitions.get(key);
            if (workflow == null) {
                throw new UnknownEntityTypeException(key);
            }
            return workflow;
        } finally {
            lock.readLock().unlock();
        }
    }
}
