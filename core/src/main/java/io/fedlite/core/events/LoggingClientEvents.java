// file: core/src/main/java/io/fedlite/core/events/LoggingClientEvents.java
package io.fedlite.core.events;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * java.util.logging backed {@link ClientEvents}.
 *
 * Levels:
 *  - WARNING: insecure channel, client auth disabled
 *  - INFO:    reconnect attempts, transient retries, resends
 *  - FINE:    connect / disconnect
 *  - SEVERE:  fatal transport errors
 *
 * Each client gets its own instance; the logger name can be set per client
 * so several clients in one JVM stay distinguishable.
 */
public final class LoggingClientEvents implements ClientEvents {

    private final Logger log;

    public LoggingClientEvents() {
        this(Logger.getLogger(LoggingClientEvents.class.getName()));
    }

    public LoggingClientEvents(Logger log) {
        this.log = log;
    }

    @Override
    public void insecureChannel(String target) {
        log.log(Level.WARNING, "gRPC is running on insecure channel with TLS disabled (target=" + target + ")");
    }

    @Override
    public void clientAuthDisabled(String target) {
        log.log(Level.WARNING, "Client-side authentication is disabled (target=" + target + ")");
    }

    @Override
    public void reconnectAttempt(String target, int attempt) {
        log.log(Level.INFO, String.format("Attempting to connect to aggregator at %s (attempt=%d)", target, attempt));
    }

    @Override
    public void transientRetry(String target, String statusCode, int attempt) {
        log.log(Level.INFO, String.format("Response code: %s from %s, retrying (attempt=%d)", statusCode, target, attempt));
    }

    @Override
    public void resend(String target, String statusCode, int attempt) {
        log.log(Level.INFO, String.format(
                "Attempting to resend data request to aggregator at %s after %s (attempt=%d)",
                target, statusCode, attempt));
    }

    @Override
    public void connecting(String target) {
        log.log(Level.FINE, "Connecting to gRPC at " + target);
    }

    @Override
    public void disconnecting(String target) {
        log.log(Level.FINE, "Disconnecting from gRPC server at " + target);
    }

    @Override
    public void fatalTransportError(String target, String statusCode, String detail) {
        log.log(Level.SEVERE, String.format("gRPC Error: %s. Details: %s (target=%s)", statusCode, detail, target));
    }
}
