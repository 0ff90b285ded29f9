package io.fedlite.core.backoff;

import io.fedlite.core.events.ClientEvents;

import java.time.Duration;
import java.util.Objects;

/**
 * Sleeps for the same interval before every retry. Default policy.
 */
public final class ConstantBackoff implements BackoffPolicy {

    private final Duration interval;
    private final String target;
    private final ClientEvents events;
    private final Sleeper sleeper;

    public ConstantBackoff(Duration interval, String target, ClientEvents events) {
        this(interval, target, events, Sleeper.system());
    }

    public ConstantBackoff(Duration interval, String target, ClientEvents events, Sleeper sleeper) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }
        this.interval = interval;
        this.target = Objects.requireNonNull(target, "target");
        this.events = Objects.requireNonNull(events, "events");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void pause(int attempt) throws InterruptedException {
        events.reconnectAttempt(target, attempt);
        sleeper.sleep(interval);
    }
}
