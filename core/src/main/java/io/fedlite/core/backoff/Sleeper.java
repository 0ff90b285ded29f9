package io.fedlite.core.backoff;

import java.time.Duration;

/**
 * Blocking pause used by backoff policies. Tests swap in a recording
 * implementation so retries never sleep for real.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}
