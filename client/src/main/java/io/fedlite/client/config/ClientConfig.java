// file: client/src/main/java/io/fedlite/client/config/ClientConfig.java
package io.fedlite.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fedlite.client.transport.CredentialSource;
import io.fedlite.client.transport.Endpoint;
import io.fedlite.client.transport.GrpcChannelFactory;
import io.fedlite.client.transport.ResendPolicy;
import io.fedlite.client.transport.RetryPolicy;
import io.fedlite.client.transport.SecurityConfig;
import io.fedlite.core.FederationIdentity;
import io.fedlite.core.stream.ChunkedPayload;
import io.grpc.Status;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Everything an {@link io.fedlite.client.AggregatorClient} is fixed to at
 * construction.
 *
 * Supports:
 *  - aggregatorAddress/Port:  where the aggregator listens
 *  - tls, disableClientAuth:  security posture
 *  - rootCertificate, certificate, privateKey: PEM file paths (TLS only)
 *  - aggregatorUuid, federationUuid, singleColCertCommonName: identities
 *    checked on every response header
 *  - reconnectInterval:       constant backoff between transient retries
 *  - retryableStatuses:       statuses retried with backoff (empty = all)
 *  - resendStatuses:          statuses the facade resends without backoff
 *  - maxAttempts:             cap for both retry layers, 0 = unbounded
 *  - maxStreamChunkBytes:     frame size for streamed task results
 *  - maxMessageBytes:         inbound gRPC message limit
 */
public record ClientConfig(
        String aggregatorAddress,
        int aggregatorPort,
        boolean tls,
        boolean disableClientAuth,
        String rootCertificate,
        String certificate,
        String privateKey,
        String aggregatorUuid,
        String federationUuid,
        String singleColCertCommonName,
        Duration reconnectInterval,
        Set<Status.Code> retryableStatuses,
        Set<Status.Code> resendStatuses,
        int maxAttempts,
        int maxStreamChunkBytes,
        int maxMessageBytes
) {

    public ClientConfig {
        Objects.requireNonNull(aggregatorAddress, "aggregatorAddress");
        Objects.requireNonNull(aggregatorUuid, "aggregatorUuid");
        Objects.requireNonNull(federationUuid, "federationUuid");
        Objects.requireNonNull(reconnectInterval, "reconnectInterval");
        if (aggregatorAddress.isBlank()) throw new IllegalArgumentException("aggregatorAddress must not be blank");
        if (aggregatorPort <= 0 || aggregatorPort > 65535) throw new IllegalArgumentException("aggregatorPort out of range");
        if (reconnectInterval.isNegative()) throw new IllegalArgumentException("reconnectInterval must be >= 0");
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        if (maxStreamChunkBytes <= 0) throw new IllegalArgumentException("maxStreamChunkBytes must be > 0");
        if (maxMessageBytes <= 0) throw new IllegalArgumentException("maxMessageBytes must be > 0");
        retryableStatuses = Set.copyOf(retryableStatuses);
        resendStatuses = Set.copyOf(resendStatuses);
    }

    public static ClientConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonClientConfig cfg = mapper.readValue(path.toFile(), JsonClientConfig.class);
            return new ClientConfig(
                    cfg.aggregatorAddress,
                    cfg.aggregatorPort,
                    cfg.tls,
                    cfg.disableClientAuth,
                    cfg.rootCertificate,
                    cfg.certificate,
                    cfg.privateKey,
                    cfg.aggregatorUuid,
                    cfg.federationUuid,
                    cfg.singleColCertCommonName,
                    Duration.ofSeconds(cfg.clientReconnectInterval),
                    parseCodes(cfg.retryableStatuses),
                    parseCodes(cfg.resendStatuses),
                    cfg.maxAttempts,
                    cfg.maxStreamChunkBytes,
                    cfg.maxMessageBytes
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ClientConfig from " + path, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Endpoint endpoint() {
        return new Endpoint(aggregatorAddress, aggregatorPort);
    }

    public SecurityConfig security() {
        return new SecurityConfig(
                tls,
                source(rootCertificate),
                source(certificate),
                source(privateKey),
                disableClientAuth
        );
    }

    public FederationIdentity identity() {
        return new FederationIdentity(aggregatorUuid, federationUuid, singleColCertCommonName);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryableStatuses, maxAttempts);
    }

    public ResendPolicy resendPolicy() {
        return new ResendPolicy(resendStatuses, maxAttempts);
    }

    private static CredentialSource source(String path) {
        return path == null || path.isBlank() ? null : CredentialSource.ofPath(Path.of(path));
    }

    private static Set<Status.Code> parseCodes(Collection<String> names) {
        EnumSet<Status.Code> codes = EnumSet.noneOf(Status.Code.class);
        if (names != null) {
            for (String name : names) {
                try {
                    codes.add(Status.Code.valueOf(name.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown gRPC status code: " + name, e);
                }
            }
        }
        return codes;
    }

    /** Fluent construction with the same defaults as the JSON form. */
    public static final class Builder {
        private String aggregatorAddress = "localhost";
        private int aggregatorPort = 50051;
        private boolean tls = true;
        private boolean disableClientAuth;
        private String rootCertificate;
        private String certificate;
        private String privateKey;
        private String aggregatorUuid;
        private String federationUuid;
        private String singleColCertCommonName;
        private Duration reconnectInterval = Duration.ofSeconds(1);
        private Set<Status.Code> retryableStatuses = Set.of(Status.Code.UNAVAILABLE);
        private Set<Status.Code> resendStatuses = Set.of(Status.Code.UNKNOWN);
        private int maxAttempts;
        private int maxStreamChunkBytes = ChunkedPayload.DEFAULT_MAX_CHUNK_BYTES;
        private int maxMessageBytes = GrpcChannelFactory.DEFAULT_MAX_MESSAGE_BYTES;

        private Builder() {
        }

        public Builder aggregator(String address, int port) {
            this.aggregatorAddress = address;
            this.aggregatorPort = port;
            return this;
        }

        public Builder plaintext() {
            this.tls = false;
            return this;
        }

        public Builder mutualTls(String rootCertificate, String certificate, String privateKey) {
            this.tls = true;
            this.disableClientAuth = false;
            this.rootCertificate = rootCertificate;
            this.certificate = certificate;
            this.privateKey = privateKey;
            return this;
        }

        public Builder serverAuthOnly(String rootCertificate) {
            this.tls = true;
            this.disableClientAuth = true;
            this.rootCertificate = rootCertificate;
            return this;
        }

        public Builder identity(String aggregatorUuid, String federationUuid, String singleColCertCommonName) {
            this.aggregatorUuid = aggregatorUuid;
            this.federationUuid = federationUuid;
            this.singleColCertCommonName = singleColCertCommonName;
            return this;
        }

        public Builder reconnectInterval(Duration reconnectInterval) {
            this.reconnectInterval = reconnectInterval;
            return this;
        }

        public Builder retryableStatuses(Set<Status.Code> codes) {
            this.retryableStatuses = codes;
            return this;
        }

        public Builder resendStatuses(Set<Status.Code> codes) {
            this.resendStatuses = codes;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder maxStreamChunkBytes(int maxStreamChunkBytes) {
            this.maxStreamChunkBytes = maxStreamChunkBytes;
            return this;
        }

        public Builder maxMessageBytes(int maxMessageBytes) {
            this.maxMessageBytes = maxMessageBytes;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                    aggregatorAddress,
                    aggregatorPort,
                    tls,
                    disableClientAuth,
                    rootCertificate,
                    certificate,
                    privateKey,
                    aggregatorUuid,
                    federationUuid,
                    singleColCertCommonName,
                    reconnectInterval,
                    retryableStatuses,
                    resendStatuses,
                    maxAttempts,
                    maxStreamChunkBytes,
                    maxMessageBytes
            );
        }
    }
}
