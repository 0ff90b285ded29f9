package io.fedlite.client;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * A gRPC call to the aggregator failed with a status this client does not
 * absorb. Carries the status code and description of the underlying failure.
 */
public class TransportException extends AggregatorClientException {

    private final Status.Code code;
    private final String detail;

    public TransportException(String target, StatusRuntimeException cause) {
        this("gRPC call to " + target + " failed", cause.getStatus(), cause);
    }

    protected TransportException(String message, Status status, Throwable cause) {
        super(message + ": " + status.getCode()
                + (status.getDescription() == null ? "" : " (" + status.getDescription() + ")"),
                cause);
        this.code = status.getCode();
        this.detail = status.getDescription();
    }

    public Status.Code code() {
        return code;
    }

    /** Status description sent by the peer, may be null. */
    public String detail() {
        return detail;
    }
}
