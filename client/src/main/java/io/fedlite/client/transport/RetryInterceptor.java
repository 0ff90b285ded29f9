// file: client/src/main/java/io/fedlite/client/transport/RetryInterceptor.java
package io.fedlite.client.transport;

import io.fedlite.client.AggregatorClientException;
import io.fedlite.client.TransientTransportException;
import io.fedlite.core.backoff.BackoffPolicy;
import io.fedlite.core.events.ClientEvents;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resends calls that fail with a transient status.
 *
 * Both call shapes go through the same loop:
 *  - unary:    one request, one response
 *  - streamed: a list of frames, one response; the full list is resent
 *
 * Per attempt:
 *  - success                  -> return the response
 *  - status not retryable     -> rethrow the StatusRuntimeException untouched
 *  - retryable, budget left   -> report, BackoffPolicy.pause(attempt), resend
 *  - retryable, cap reached   -> TransientTransportException
 *
 * With the default policy there is no cap, so a retryable failure is resent
 * until the transport recovers.
 */
public final class RetryInterceptor {

    private final RetryPolicy policy;
    private final BackoffPolicy backoff;
    private final String target;
    private final ClientEvents events;

    public RetryInterceptor(RetryPolicy policy, BackoffPolicy backoff, String target, ClientEvents events) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.target = Objects.requireNonNull(target, "target");
        this.events = Objects.requireNonNull(events, "events");
    }

    public <Req, Resp> Resp unary(UnaryCall<Req, Resp> call, Req request) {
        return intercept(() -> call.invoke(request));
    }

    public <Req, Resp> Resp streamed(StreamedCall<Req, Resp> call, List<Req> frames) {
        List<Req> snapshot = List.copyOf(frames);
        return intercept(() -> call.invoke(snapshot));
    }

    private <R> R intercept(Supplier<R> attempt) {
        for (int n = 1; ; n++) {
            try {
                return attempt.get();
            } catch (StatusRuntimeException e) {
                Status.Code code = e.getStatus().getCode();
                if (!policy.isRetryable(code)) {
                    throw e;
                }
                if (policy.exhausted(n)) {
                    throw new TransientTransportException(target, e, n);
                }
                events.transientRetry(target, code.name(), n);
                pause(n);
            }
        }
    }

    private void pause(int attempt) {
        try {
            backoff.pause(attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AggregatorClientException("Interrupted while waiting to reconnect to " + target, e);
        }
    }
}
