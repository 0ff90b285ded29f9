package io.fedlite.core.events;

/**
 * Observability hook for one client instance.
 *
 * Every event a client emits goes through here, so tests can count events
 * and embedders can route them to their own logging or metrics backend.
 * Status codes are passed by name to keep this interface transport-neutral.
 */
public interface ClientEvents {

    /** A channel is being opened without TLS. */
    void insecureChannel(String target);

    /** A TLS channel is being opened without a client certificate. */
    void clientAuthDisabled(String target);

    /** A backoff pause is about to start before reconnecting. */
    void reconnectAttempt(String target, int attempt);

    /** A call failed with a retryable status and will be resent after a pause. */
    void transientRetry(String target, String statusCode, int attempt);

    /** The facade is resending a request after a status in its resend set. */
    void resend(String target, String statusCode, int attempt);

    void connecting(String target);

    void disconnecting(String target);

    /** A transport failure ended a call on a path that never retries. */
    void fatalTransportError(String target, String statusCode, String detail);
}
