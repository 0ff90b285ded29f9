package io.fedlite.client.transport;

import io.grpc.ManagedChannel;

/**
 * Opens transport channels to the aggregator.
 * <p>
 * Implementations are stateless beyond their own configuration; every call
 * returns a new channel owned by the caller.
 */
@FunctionalInterface
public interface ChannelFactory {

    /**
     * @throws io.fedlite.client.TransportConfigException when TLS credential
     *         material is missing, unreadable or unusable
     */
    ManagedChannel open(Endpoint endpoint, SecurityConfig security);
}
