package io.fedlite.client;

import io.grpc.StatusRuntimeException;

/**
 * Transport failure on an interactive path (connectivity check, admin
 * operations, trained model retrieval). These paths never retry; the
 * embedding application decides whether to terminate.
 */
public final class UnhandledTransportException extends TransportException {

    public UnhandledTransportException(String target, StatusRuntimeException cause) {
        super("gRPC Error from " + target, cause.getStatus(), cause);
    }
}
