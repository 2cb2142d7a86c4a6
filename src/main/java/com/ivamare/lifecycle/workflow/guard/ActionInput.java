package com.ivamare.lifecycle.workflow.guard;

import com.ivamare.lifecycle.workflow.TransitionInput;
import com.ivamare.lifecycle.workflow.TransitionResult;

/**
 * Context handed to a transition action.
 *
 * @param transition Canonical transition request
 * @param result Result produced by the wrapped engine
 */
public record ActionInput(
    TransitionInput transition,
    TransitionResult result
) {}
