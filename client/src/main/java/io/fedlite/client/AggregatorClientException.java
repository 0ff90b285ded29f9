package io.fedlite.client;

/**
 * Root of every failure the aggregator client reports to its caller.
 */
public class AggregatorClientException extends RuntimeException {

    public AggregatorClientException(String message) {
        super(message);
    }

    public AggregatorClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
