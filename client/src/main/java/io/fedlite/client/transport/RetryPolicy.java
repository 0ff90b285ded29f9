package io.fedlite.client.transport;

import io.grpc.Status;

import java.util.Set;

/**
 * Which statuses the {@link RetryInterceptor} treats as transient.
 *
 * Semantics:
 *  - non-empty set: only listed codes are retried, everything else
 *    propagates untouched on the first attempt
 *  - empty set:     every failure is retried
 *  - UNAUTHENTICATED is never retried, whatever the set contains
 *  - maxAttempts:   total attempts per call, 0 means unbounded
 *
 * @param retryableCodes transient status codes
 * @param maxAttempts    attempt cap, 0 for none
 */
public record RetryPolicy(Set<Status.Code> retryableCodes, int maxAttempts) {

    public RetryPolicy {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        retryableCodes = Set.copyOf(retryableCodes);
    }

    /** Retry UNAVAILABLE forever. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(Set.of(Status.Code.UNAVAILABLE), 0);
    }

    public boolean isRetryable(Status.Code code) {
        if (code == Status.Code.UNAUTHENTICATED) {
            return false;
        }
        return retryableCodes.isEmpty() || retryableCodes.contains(code);
    }

    /** True when {@code attempt} failed attempts leave no budget for another. */
    public boolean exhausted(int attempt) {
        return maxAttempts > 0 && attempt >= maxAttempts;
    }
}
