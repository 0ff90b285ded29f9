package io.fedlite.client.transport;

import io.fedlite.client.AggregatorClientException;
import io.fedlite.client.RecordingEvents;
import io.fedlite.client.TransientTransportException;
import io.fedlite.core.backoff.ConstantBackoff;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Retry loop semantics, exercised without any transport.
 */
class RetryInterceptorTest {

    private final RecordingEvents events = new RecordingEvents();
    private final List<Duration> sleeps = new ArrayList<>();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void retryable_status_n_times_means_n_backoff_waits() {
        var call = new ScriptedCall<String>(Status.UNAVAILABLE, Status.UNAVAILABLE);

        String result = interceptor(RetryPolicy.defaults()).unary(call, "req");

        assertEquals("ok:req", result);
        assertEquals(2, sleeps.size());
        assertEquals(3, call.invocations);
    }

    @Test
    void non_retryable_status_propagates_untouched_without_waiting() {
        var call = new ScriptedCall<String>(Status.PERMISSION_DENIED);

        var e = assertThrows(StatusRuntimeException.class,
                () -> interceptor(RetryPolicy.defaults()).unary(call, "req"));

        assertEquals(Status.Code.PERMISSION_DENIED, e.getStatus().getCode());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, call.invocations);
    }

    @Test
    void empty_retry_set_retries_every_status() {
        var call = new ScriptedCall<String>(Status.INTERNAL, Status.DATA_LOSS, Status.UNAVAILABLE);

        String result = interceptor(new RetryPolicy(Set.of(), 0)).unary(call, "req");

        assertEquals("ok:req", result);
        assertEquals(3, sleeps.size());
    }

    @Test
    void unauthenticated_is_never_retried_even_with_empty_retry_set() {
        var call = new ScriptedCall<String>(Status.UNAUTHENTICATED, Status.UNAUTHENTICATED);

        var e = assertThrows(StatusRuntimeException.class,
                () -> interceptor(new RetryPolicy(Set.of(), 3)).unary(call, "req"));

        assertEquals(Status.Code.UNAUTHENTICATED, e.getStatus().getCode());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, call.invocations);
    }

    @Test
    void unauthenticated_is_never_retried_even_when_listed() {
        var policy = new RetryPolicy(Set.of(Status.Code.UNAVAILABLE, Status.Code.UNAUTHENTICATED), 0);
        var call = new ScriptedCall<String>(Status.UNAUTHENTICATED);

        assertFalse(policy.isRetryable(Status.Code.UNAUTHENTICATED));
        assertThrows(StatusRuntimeException.class, () -> interceptor(policy).unary(call, "req"));
        assertTrue(sleeps.isEmpty());
        assertEquals(1, call.invocations);
    }

    @Test
    void streamed_call_resends_all_frames_each_attempt() {
        List<List<String>> seen = new ArrayList<>();
        Deque<Status> failures = new ArrayDeque<>(List.of(Status.UNAVAILABLE));
        StreamedCall<String, Integer> call = frames -> {
            seen.add(frames);
            Status s = failures.poll();
            if (s != null) throw s.asRuntimeException();
            return frames.size();
        };

        int result = interceptor(RetryPolicy.defaults()).streamed(call, List.of("a", "b", "c"));

        assertEquals(3, result);
        assertEquals(List.of(List.of("a", "b", "c"), List.of("a", "b", "c")), seen);
        assertEquals(1, sleeps.size());
    }

    @Test
    void attempt_cap_raises_transient_failure() {
        var call = new ScriptedCall<String>(Status.UNAVAILABLE, Status.UNAVAILABLE, Status.UNAVAILABLE);

        var e = assertThrows(TransientTransportException.class,
                () -> interceptor(new RetryPolicy(Set.of(Status.Code.UNAVAILABLE), 3)).unary(call, "req"));

        assertEquals(3, e.attempts());
        assertEquals(Status.Code.UNAVAILABLE, e.code());
        assertEquals(2, sleeps.size());
    }

    @Test
    void interrupted_backoff_restores_flag_and_fails() {
        var backoff = new ConstantBackoff(Duration.ofSeconds(1), "t", events, d -> {
            throw new InterruptedException();
        });
        var interceptor = new RetryInterceptor(RetryPolicy.defaults(), backoff, "t", events);

        assertThrows(AggregatorClientException.class,
                () -> interceptor.unary(new ScriptedCall<String>(Status.UNAVAILABLE), "req"));
        assertTrue(Thread.currentThread().isInterrupted());
    }

    private RetryInterceptor interceptor(RetryPolicy policy) {
        var backoff = new ConstantBackoff(Duration.ofSeconds(1), "agg:50051", events, sleeps::add);
        return new RetryInterceptor(policy, backoff, "agg:50051", events);
    }

    /** Fails with the scripted statuses, then answers "ok:" + request. */
    private static final class ScriptedCall<Req> implements UnaryCall<Req, String> {
        private final Deque<Status> failures;
        int invocations;

        ScriptedCall(Status... failures) {
            this.failures = new ArrayDeque<>(List.of(failures));
        }

        @Override
        public String invoke(Req request) {
            invocations++;
            Status s = failures.poll();
            if (s != null) {
                throw s.asRuntimeException();
            }
            return "ok:" + request;
        }
    }
}
