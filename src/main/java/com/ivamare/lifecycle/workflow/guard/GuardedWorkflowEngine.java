package com.ivamare.lifecycle.workflow.guard;

import com.ivamare.lifecycle.exception.GuardRejectedException;
import com.ivamare.lifecycle.exception.TransitionActionException;
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
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Wraps a workflow engine with guard authorization and post-transition actions.
 *
 * <p>For each transition:
 * <ol>
 *   <li>identifiers are normalized and the transition is resolved against this
 *       adapter's own copy of the definition;</li>
 *   <li>a non-blank guard is passed to the {@link WorkflowAuthorizer}; a rejection
 *       aborts before the wrapped engine is called;</li>
 *   <li>the wrapped engine runs the transition;</li>
 *   <li>the action registered for {@code entityType::transitionName} (if any)
 *       appends events and notifications and merges metadata into the result.</li>
 * </ol>
 */
public class GuardedWorkflowEngine implements WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(GuardedWorkflowEngine.class);

    private final WorkflowEngine delegate;
    private final WorkflowAuthorizer authorizer;
    private final ActionRegistry actionRegistry;
    private final Clock clock;

    private final Map<String, CompiledWorkflow> definitions = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @param delegate Engine running the transitions
     * @param authorizer Guard authorizer (nullable; guarded transitions then fail)
     * @param actionRegistry Action registry (nullable; no actions run)
     * @param clock Clock for results the adapter produces itself
     */
    public GuardedWorkflowEngine(WorkflowEngine delegate,
                                 WorkflowAuthorizer authorizer,
                                 ActionRegistry actionRegistry,
                                 Clock clock) {
        if (delegate == null) {
            throw new IllegalArgumentException("Wrapped workflow engine is required");
        }
        this.delegate = delegate;
        this.authorizer = authorizer;
        this.actionRegistry = actionRegistry;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public void registerWorkflow(WorkflowDefinition definition) {
        CompiledWorkflow compiled = CompiledWorkflow.compile(definition);
        lock.writeLock().lock();
        try {
            delegate.registerWorkflow(compiled.definition());
            definitions.put(compiled.entityType(), compiled);
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
        TransitionInput bound = normalized.resolvedTo(transition);

        if (transition.hasGuard()) {
            authorize(bound, transition.guard());
        }

        TransitionResult result = normalizeResult(delegate.transition(bound), bound);
        return applyAction(bound, result);
    }

    @Override
    public List<WorkflowTransition> availableTransitions(TransitionQuery query) {
        CompiledWorkflow workflow = definitionFor(query.entityType());
        TransitionQuery normalized = new TransitionQuery(
            workflow.entityType(), workflow.resolveState(query.state()), query.context());
        return delegate.availableTransitions(normalized).stream()
            .map(t -> new WorkflowTransition(
                WorkflowIdentifiers.normalize(t.name()),
                t.description(),
                WorkflowIdentifiers.normalize(t.from()),
                WorkflowIdentifiers.normalize(t.to()),
                t.guard()))
            .toList();
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

    private void authorize(TransitionInput input, String guard) {
        if (authorizer == null) {
            throw new IllegalStateException("Transition " + input.entityType() + "::" + input.transitionName()
                + " is guarded by '" + guard + "' but no authorizer is configured");
        }
        try {
            authorizer.authorizeTransition(input, guard);
        } catch (GuardRejectedException e) {
            log.debug("Guard {} rejected {}::{} for actor {}",
                guard, input.entityType(), input.transitionName(), input.actorId());
            throw e;
        } catch (RuntimeException e) {
            log.debug("Guard {} rejected {}::{} for actor {}: {}",
                guard, input.entityType(), input.transitionName(), input.actorId(), e.getMessage());
            throw new GuardRejectedException(guard, input.actorId(), e);
        }
    }

    private TransitionResult applyAction(TransitionInput input, TransitionResult result) {
        if (actionRegistry == null) {
            return result;
        }
        Optional<TransitionAction> action = actionRegistry.resolve(input.entityType(), input.transitionName());
        if (action.isEmpty()) {
            return result;
        }

        String actionKey = input.entityType() + "::" + input.transitionName();
        ActionOutput output;
        try {
            output = action.get().execute(new ActionInput(input, result));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new TransitionActionException(actionKey, e);
        }

        if (output == null || output.isEmpty()) {
            return result;
        }
        log.debug("Action {} added {} event(s), {} notification(s), {} metadata key(s)",
            actionKey, output.events().size(), output.notifications().size(), output.metadata().size());
        return result.withAdditions(output.events(), output.notifications(), output.metadata());
    }

    /**
     * Fill gaps left by the wrapped engine and force canonical identifiers.
     */
    private TransitionResult normalizeResult(TransitionResult result, TransitionInput input) {
        if (result == null) {
            return new TransitionResult(input.entityId(), input.entityType(), input.transitionName(),
                input.currentState(), input.targetState(), clock.instant(), input.actorId(),
                input.metadata(), List.of(), List.of());
        }
        String transitionName = result.transitionName().isEmpty()
            ? input.transitionName() : WorkflowIdentifiers.normalize(result.transitionName());
        String from = WorkflowIdentifiers.stateOrDefault(result.fromState(), input.currentState());
        String to = WorkflowIdentifiers.stateOrDefault(result.toState(), input.targetState());
        Instant completedAt = result.completedAt() != null ? result.completedAt() : clock.instant();
        Map<String, Object> metadata = result.metadata().isEmpty() ? input.metadata() : result.metadata();
        return new TransitionResult(
            input.entityId(), input.entityType(), transitionName, from, to, completedAt,
            result.actorId() != null ? result.actorId() : input.actorId(),
            metadata, result.events(), result.notifications()
        );
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
