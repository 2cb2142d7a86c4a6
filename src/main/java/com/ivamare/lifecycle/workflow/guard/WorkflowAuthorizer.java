package com.ivamare.lifecycle.workflow.guard;

import com.ivamare.lifecycle.exception.GuardRejectedException;
import com.ivamare.lifecycle.workflow.TransitionInput;

/**
 * Evaluates guard expressions attached to workflow transitions.
 *
 * <p>Returning normally authorizes the transition. Throwing rejects it; any
 * runtime exception other than {@link GuardRejectedException} is wrapped into one.
 */
@FunctionalInterface
public interface WorkflowAuthorizer {

    /**
     * Authorize a guarded transition.
     *
     * @param input Transition request in canonical form, bound to the resolved transition
     * @param guard Guard expression declared on the transition
     * @throws GuardRejectedException if the actor may not run the transition
     */
    void authorizeTransition(TransitionInput input, String guard);
}
