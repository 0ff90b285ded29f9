package io.fedlite.client.transport;

import io.fedlite.client.AuthenticationFailureException;
import io.fedlite.client.TransientTransportException;
import io.fedlite.client.TransportException;
import io.fedlite.core.events.ClientEvents;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Facade-level resend loop, independent of {@link RetryInterceptor}.
 *
 * Whatever the inner retry layer lets through lands here:
 *  - UNAUTHENTICATED          -> AuthenticationFailureException, at once
 *  - code in the resend set   -> resend the whole request, no pause
 *  - anything else            -> TransportException
 *
 * Failures that are not gRPC statuses (header mismatches, config errors)
 * pass straight through.
 */
public final class ResendOnReconnection {

    private final ResendPolicy policy;
    private final String target;
    private final ClientEvents events;

    public ResendOnReconnection(ResendPolicy policy, String target, ClientEvents events) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.target = Objects.requireNonNull(target, "target");
        this.events = Objects.requireNonNull(events, "events");
    }

    public <R> R call(Supplier<R> request) {
        for (int attempt = 1; ; attempt++) {
            try {
                return request.get();
            } catch (StatusRuntimeException e) {
                Status.Code code = e.getStatus().getCode();
                if (code == Status.Code.UNAUTHENTICATED) {
                    throw new AuthenticationFailureException(target, e);
                }
                if (!policy.shouldResend(code)) {
                    throw new TransportException(target, e);
                }
                if (policy.exhausted(attempt)) {
                    throw new TransientTransportException(target, e, attempt);
                }
                events.resend(target, code.name(), attempt);
            }
        }
    }
}
