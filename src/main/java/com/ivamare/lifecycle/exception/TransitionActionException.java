package com.ivamare.lifecycle.exception;

/**
 * Wraps a checked failure raised by a transition action hook.
 */
public class TransitionActionException extends LifecycleException {

    private final String actionKey;

    public TransitionActionException(String actionKey, Throwable cause) {
        super("Action " + actionKey + " failed: " + cause.getMessage(), cause);
        this.actionKey = actionKey;
    }

    public String getActionKey() {
        return actionKey;
    }
}
