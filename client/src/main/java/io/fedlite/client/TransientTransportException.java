package io.fedlite.client;

import io.grpc.StatusRuntimeException;

/**
 * A retryable status kept coming back until the configured attempt cap ran
 * out. Never raised with the default, unbounded retry policy.
 */
public final class TransientTransportException extends TransportException {

    private final int attempts;

    public TransientTransportException(String target, StatusRuntimeException cause, int attempts) {
        super("gRPC call to " + target + " still failing after " + attempts + " attempts", cause.getStatus(), cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
