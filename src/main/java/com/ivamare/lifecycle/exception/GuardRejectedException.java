package com.ivamare.lifecycle.exception;

import java.util.UUID;

/**
 * Thrown when the authorizer blocks a guarded transition.
 *
 * <p>Not retryable for the same actor. A different actor may pass the guard.
 */
public class GuardRejectedException extends LifecycleException {

    private final String guard;
    private final UUID actorId;

    public GuardRejectedException(String guard, UUID actorId, String reason) {
        super("Transition blocked by guard '" + guard + "'" + (reason != null ? ": " + reason : ""));
        this.guard = guard;
        this.actorId = actorId;
    }

    public GuardRejectedException(String guard, UUID actorId, Throwable cause) {
        super("Transition blocked by guard '" + guard + "': " + cause.getMessage(), cause);
        this.guard = guard;
        this.actorId = actorId;
    }

    public String getGuard() {
        return guard;
    }

    public UUID getActorId() {
        return actorId;
    }
}
