// file: client/src/main/java/io/fedlite/client/transport/StreamedCall.java
package io.fedlite.client.transport;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * A sequence of frames in, one response out (client streaming).
 * <p>
 * The frame list is fully materialised so a retry can send it again from the
 * start. Failures surface as {@link io.grpc.StatusRuntimeException}, the same
 * way blocking unary calls report them.
 */
@FunctionalInterface
public interface StreamedCall<Req, Resp> {

    Resp invoke(List<Req> frames);

    /**
     * Adapts an async-stub client-streaming method, e.g.
     * {@code asyncStub::sendLocalTaskResults}, into a blocking call.
     */
    static <Req, Resp> StreamedCall<Req, Resp> clientStreaming(
            Function<StreamObserver<Resp>, StreamObserver<Req>> method
    ) {
        return frames -> {
            CompletableFuture<Resp> result = new CompletableFuture<>();
            StreamObserver<Req> requests = method.apply(new StreamObserver<>() {
                private Resp response;

                @Override
                public void onNext(Resp value) {
                    response = value;
                }

                @Override
                public void onError(Throwable t) {
                    result.completeExceptionally(t);
                }

                @Override
                public void onCompleted() {
                    if (response == null) {
                        result.completeExceptionally(Status.INTERNAL
                                .withDescription("stream completed without a response")
                                .asRuntimeException());
                    } else {
                        result.complete(response);
                    }
                }
            });

            try {
                for (Req frame : frames) {
                    requests.onNext(frame);
                }
                requests.onCompleted();
            } catch (RuntimeException e) {
                requests.onError(e);
                throw e;
            }

            try {
                return result.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw Status.CANCELLED
                        .withDescription("interrupted while waiting for stream response")
                        .withCause(e)
                        .asRuntimeException();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof StatusRuntimeException sre) {
                    throw sre;
                }
                throw Status.fromThrowable(e.getCause()).asRuntimeException();
            }
        };
    }
}
