// file: client/src/main/java/io/fedlite/client/transport/ConnectionLifecycle.java
package io.fedlite.client.transport;

import io.fedlite.core.events.ClientEvents;
import io.grpc.ManagedChannel;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the client's channel and frames every operation with a fresh one.
 *
 * Guarantees:
 *  - a channel is opened at construction
 *  - run(body): discard the current channel, open a new one, run the body
 *    against it, close it afterwards whatever the outcome
 *  - closing is idempotent; reconnect() twice in a row never fails
 *  - the connect -> body -> disconnect span holds a lock, so concurrent
 *    operations on one instance run one after another
 */
public final class ConnectionLifecycle implements AutoCloseable {

    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final Endpoint endpoint;
    private final SecurityConfig security;
    private final ChannelFactory factory;
    private final ClientEvents events;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private ManagedChannel channel;

    public ConnectionLifecycle(
            Endpoint endpoint,
            SecurityConfig security,
            ChannelFactory factory,
            ClientEvents events
    ) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.security = Objects.requireNonNull(security, "security");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.events = Objects.requireNonNull(events, "events");
        this.channel = factory.open(endpoint, security);
    }

    public String target() {
        return endpoint.target();
    }

    /**
     * Run {@code body} against a channel opened just for it.
     */
    public <R> R run(Function<ManagedChannel, R> body) {
        lock.lock();
        try {
            reconnect();
            try {
                return body.apply(channel);
            } finally {
                disconnect();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Close the current channel (if still open) and open a new one. */
    public void reconnect() {
        lock.lock();
        try {
            disconnect();
            channel = factory.open(endpoint, security);
            events.connecting(endpoint.target());
        } finally {
            lock.unlock();
        }
    }

    public void disconnect() {
        lock.lock();
        try {
            events.disconnecting(endpoint.target());
            shutdown(channel);
        } finally {
            lock.unlock();
        }
    }

    /** Channel currently held; closed between operations. */
    public ManagedChannel currentChannel() {
        lock.lock();
        try {
            return channel;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    private static void shutdown(ManagedChannel ch) {
        if (ch.isShutdown()) {
            return;
        }
        ch.shutdown();
        try {
            if (!ch.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                ch.shutdownNow();
            }
        } catch (InterruptedException e) {
            ch.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
