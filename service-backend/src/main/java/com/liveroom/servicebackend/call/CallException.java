package com.liveroom.servicebackend.call;

/**
 * Unchecked exception carrying a {@link CallError}. Used inside the core and at the
 * boundaries to external collaborators; {@link CallOrchestrator} turns it into a
 * {@link CallResult}.
 */
public class CallException extends RuntimeException {
    private final CallError error;

    public CallException(CallError error, String message) {
        super(message);
        this.error = error;
    }

    public CallException(CallError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public CallError error() {
        return error;
    }
}
