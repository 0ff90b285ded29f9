package io.fedlite.client;

/**
 * Credential material needed to open a TLS channel is missing, unreadable or
 * unusable. Raised when the channel is opened; never retried.
 */
public final class TransportConfigException extends AggregatorClientException {

    public TransportConfigException(String message) {
        super(message);
    }

    public TransportConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
