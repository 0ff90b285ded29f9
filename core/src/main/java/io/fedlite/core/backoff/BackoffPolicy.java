package io.fedlite.core.backoff;

/**
 * Pacing strategy invoked between retry attempts.
 *
 * Contract:
 *  - pause(attempt) blocks the calling thread for the policy's interval.
 *  - Before sleeping, it reports a reconnect attempt for its target.
 *  - attempt is 1-based and counts the pauses taken for the current call;
 *    stateless policies may ignore it.
 */
public interface BackoffPolicy {

    void pause(int attempt) throws InterruptedException;
}
