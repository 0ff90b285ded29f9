package io.fedlite.client.transport;

import java.util.Objects;

/**
 * Aggregator address. Immutable after client construction.
 */
public record Endpoint(String host, int port) {

    public Endpoint {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
    }

    /** gRPC target string, "host:port". */
    public String target() {
        return host + ":" + port;
    }
}
