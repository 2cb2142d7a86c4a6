package com.ivamare.lifecycle.workflow.guard;

/**
 * Side effect bound to a workflow transition, run after the transition succeeds.
 *
 * <p>Runtime exceptions propagate to the caller unchanged; checked exceptions
 * are wrapped in {@link com.ivamare.lifecycle.exception.TransitionActionException}.
 */
@FunctionalInterface
public interface TransitionAction {

    /**
     * Run the action.
     *
     * @param input Transition request and result
     * @return Events, notifications and metadata to add to the result (may be null)
     * @throws Exception on failure
     */
    ActionOutput execute(ActionInput input) throws Exception;
}
