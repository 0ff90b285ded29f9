package io.fedlite.client;

import io.grpc.StatusRuntimeException;

/**
 * The aggregator rejected this client's credentials or identity
 * ({@code UNAUTHENTICATED}). Always surfaced immediately, never retried.
 */
public final class AuthenticationFailureException extends TransportException {

    public AuthenticationFailureException(String target, StatusRuntimeException cause) {
        super("Aggregator at " + target + " rejected authentication", cause.getStatus(), cause);
    }
}
