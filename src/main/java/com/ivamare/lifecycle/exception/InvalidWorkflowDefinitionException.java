package com.ivamare.lifecycle.exception;

/**
 * Thrown when a workflow definition fails validation during compilation.
 */
public class InvalidWorkflowDefinitionException extends LifecycleException {

    public InvalidWorkflowDefinitionException(String message) {
        super(message);
    }
}
