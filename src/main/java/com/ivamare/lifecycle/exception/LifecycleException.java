package com.ivamare.lifecycle.exception;

/**
 * Base exception for all lifecycle engine errors.
 */
public class LifecycleException extends RuntimeException {

    public LifecycleException(String message) {
        super(message);
    }

    public LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
