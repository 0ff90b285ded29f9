// file: core/src/main/java/io/fedlite/core/backoff/ExponentialBackoff.java
package io.fedlite.core.backoff;

import io.fedlite.core.events.ClientEvents;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Exponential backoff with an upper bound and optional full jitter.
 *
 * Semantics:
 *  - delay(attempt) = min(max, initial * multiplier^(attempt - 1))
 *  - with jitter, the actual sleep is uniform in [0, delay(attempt)]
 *
 * Drop-in replacement for {@link ConstantBackoff}; clients only see the
 * {@link BackoffPolicy} interface.
 */
public final class ExponentialBackoff implements BackoffPolicy {

    private final Duration initial;
    private final double multiplier;
    private final Duration max;
    private final Random jitter; // null => no jitter
    private final String target;
    private final ClientEvents events;
    private final Sleeper sleeper;

    public ExponentialBackoff(
            Duration initial,
            double multiplier,
            Duration max,
            Random jitter,
            String target,
            ClientEvents events,
            Sleeper sleeper
    ) {
        if (initial == null || initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial must be > 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (max == null || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max must be >= initial");
        }
        this.initial = initial;
        this.multiplier = multiplier;
        this.max = max;
        this.jitter = jitter;
        this.target = Objects.requireNonNull(target, "target");
        this.events = Objects.requireNonNull(events, "events");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** Un-jittered delay for the given 1-based attempt. */
    public Duration delay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double millis = initial.toMillis() * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(millis) || millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }

    @Override
    public void pause(int attempt) throws InterruptedException {
        events.reconnectAttempt(target, attempt);
        Duration d = delay(attempt);
        if (jitter != null) {
            d = Duration.ofMillis((long) (jitter.nextDouble() * d.toMillis()));
        }
        sleeper.sleep(d);
    }
}
