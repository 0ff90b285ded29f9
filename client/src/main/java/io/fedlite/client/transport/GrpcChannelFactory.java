// file: client/src/main/java/io/fedlite/client/transport/GrpcChannelFactory.java
package io.fedlite.client.transport;

import io.fedlite.client.TransportConfigException;
import io.fedlite.core.events.ClientEvents;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * Production {@link ChannelFactory} built on grpc-java channel credentials.
 *
 * Modes:
 *  - plaintext: reports an insecure-channel event on every open, never fails.
 *  - TLS:       trusts the configured root certificate and, unless client
 *               auth is disabled, presents the client certificate + key.
 *
 * Channel options mirror what the aggregator expects for large tensors:
 * big inbound message and metadata limits.
 */
public final class GrpcChannelFactory implements ChannelFactory {

    public static final int DEFAULT_MAX_MESSAGE_BYTES = 128 * 1024 * 1024;
    public static final int DEFAULT_MAX_METADATA_BYTES = 32 * 1024 * 1024;

    private final ClientEvents events;
    private final int maxMessageBytes;
    private final int maxMetadataBytes;

    public GrpcChannelFactory(ClientEvents events) {
        this(events, DEFAULT_MAX_MESSAGE_BYTES, DEFAULT_MAX_METADATA_BYTES);
    }

    public GrpcChannelFactory(ClientEvents events, int maxMessageBytes, int maxMetadataBytes) {
        if (maxMessageBytes <= 0 || maxMetadataBytes <= 0) {
            throw new IllegalArgumentException("message and metadata limits must be > 0");
        }
        this.events = Objects.requireNonNull(events, "events");
        this.maxMessageBytes = maxMessageBytes;
        this.maxMetadataBytes = maxMetadataBytes;
    }

    @Override
    public ManagedChannel open(Endpoint endpoint, SecurityConfig security) {
        String target = endpoint.target();

        ChannelCredentials credentials;
        if (!security.tls()) {
            events.insecureChannel(target);
            credentials = InsecureChannelCredentials.create();
        } else {
            credentials = tlsCredentials(target, security);
        }

        try {
            return Grpc.newChannelBuilder(target, credentials)
                    .maxInboundMessageSize(maxMessageBytes)
                    .maxInboundMetadataSize(maxMetadataBytes)
                    .build();
        } catch (RuntimeException e) {
            if (!security.tls()) {
                throw e;
            }
            // Netty parses the PEM material while building the channel.
            throw new TransportConfigException("TLS credentials for " + target + " could not be used", e);
        }
    }

    private ChannelCredentials tlsCredentials(String target, SecurityConfig security) {
        byte[] root = read("root certificate", security.rootCertificate(), target);

        TlsChannelCredentials.Builder builder = TlsChannelCredentials.newBuilder();
        try {
            builder.trustManager(new ByteArrayInputStream(root));

            if (security.disableClientAuth()) {
                events.clientAuthDisabled(target);
            } else {
                byte[] key = read("private key", security.privateKey(), target);
                byte[] cert = read("certificate", security.certificate(), target);
                builder.keyManager(new ByteArrayInputStream(cert), new ByteArrayInputStream(key));
            }
        } catch (IOException e) {
            throw new TransportConfigException("Failed to load TLS credentials for " + target, e);
        }
        return builder.build();
    }

    private static byte[] read(String what, CredentialSource source, String target) {
        if (source == null) {
            throw new TransportConfigException("TLS channel to " + target + " requires a " + what);
        }
        try {
            byte[] bytes = source.read();
            if (bytes.length == 0) {
                throw new TransportConfigException(what + " at " + source.describe() + " is empty");
            }
            return bytes;
        } catch (IOException e) {
            throw new TransportConfigException("Cannot read " + what + " from " + source.describe(), e);
        }
    }
}
