package io.fedlite.client.transport;

import io.grpc.Status;

import java.util.EnumSet;
import java.util.Set;

/**
 * Statuses on which the facade silently resends a whole request.
 * {@code UNAUTHENTICATED} is never resent, whatever the set contains.
 *
 * @param resendCodes codes that trigger a resend
 * @param maxAttempts total attempts per call, 0 means unbounded
 */
public record ResendPolicy(Set<Status.Code> resendCodes, int maxAttempts) {

    public ResendPolicy {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        EnumSet<Status.Code> codes = EnumSet.noneOf(Status.Code.class);
        codes.addAll(resendCodes);
        codes.remove(Status.Code.UNAUTHENTICATED);
        resendCodes = Set.copyOf(codes);
    }

    /** Resend on UNKNOWN forever. */
    public static ResendPolicy defaults() {
        return new ResendPolicy(Set.of(Status.Code.UNKNOWN), 0);
    }

    public boolean shouldResend(Status.Code code) {
        return resendCodes.contains(code);
    }

    public boolean exhausted(int attempt) {
        return maxAttempts > 0 && attempt >= maxAttempts;
    }
}
