// file: client/src/main/java/io/fedlite/client/AggregatorClient.java
package io.fedlite.client;

import io.fedlite.client.codec.DataStreams;
import io.fedlite.client.codec.ModelCodec;
import io.fedlite.client.codec.NoCompressionModelCodec;
import io.fedlite.client.config.ClientConfig;
import io.fedlite.client.transport.ChannelFactory;
import io.fedlite.client.transport.ConnectionLifecycle;
import io.fedlite.client.transport.GrpcChannelFactory;
import io.fedlite.client.transport.ResendOnReconnection;
import io.fedlite.client.transport.RetryInterceptor;
import io.fedlite.client.transport.StreamedCall;
import io.fedlite.core.HeaderValidator;
import io.fedlite.core.backoff.BackoffPolicy;
import io.fedlite.core.backoff.ConstantBackoff;
import io.fedlite.core.events.ClientEvents;
import io.fedlite.core.events.LoggingClientEvents;
import io.fedlite.core.tensor.TensorData;
import io.fedlite.protocols.AggregatorGrpc;
import io.fedlite.protocols.AggregatorProto;
import io.fedlite.protocols.ModelAdminGrpc;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Client a collaborator (or an admin) uses to talk to its aggregator.
 *
 * Worker operations (getTasks, getAggregatedTensor, sendLocalTaskResults)
 * are resilient:
 *   lifecycle( resend( retry( call ) ) ) -> validate header
 *  - transient statuses are retried with backoff by {@link RetryInterceptor}
 *  - UNKNOWN is resent by {@link ResendOnReconnection}
 *  - UNAUTHENTICATED and header mismatches reach the caller at once
 *
 * Interactive operations (connectivity check, admin calls, trained model
 * retrieval) never retry: any transport failure becomes an
 * {@link UnhandledTransportException} after a fatal-error event.
 *
 * Every operation runs against a channel opened for it and closed after it.
 * One instance serialises its operations; use one per worker thread for
 * parallelism.
 */
public final class AggregatorClient implements AutoCloseable {

    private final ConnectionLifecycle lifecycle;
    private final RetryInterceptor retry;
    private final ResendOnReconnection resender;
    private final HeaderValidator headers;
    private final ModelCodec codec;
    private final ClientEvents events;
    private final int maxStreamChunkBytes;

    /**
     * Production constructor: gRPC channels, JUL logging, constant backoff.
     */
    public AggregatorClient(ClientConfig config) {
        this(config, new LoggingClientEvents());
    }

    private AggregatorClient(ClientConfig config, ClientEvents events) {
        this(
                config,
                new GrpcChannelFactory(events, config.maxMessageBytes(), GrpcChannelFactory.DEFAULT_MAX_METADATA_BYTES),
                events,
                new ConstantBackoff(config.reconnectInterval(), config.endpoint().target(), events),
                new NoCompressionModelCodec()
        );
    }

    /**
     * Fully injected constructor (custom transports, backoff, codec, tests).
     */
    public AggregatorClient(
            ClientConfig config,
            ChannelFactory channelFactory,
            ClientEvents events,
            BackoffPolicy backoff,
            ModelCodec codec
    ) {
        Objects.requireNonNull(config, "config");
        this.events = Objects.requireNonNull(events, "events");
        this.codec = Objects.requireNonNull(codec, "codec");
        String target = config.endpoint().target();

        this.headers = new HeaderValidator(config.identity());
        this.retry = new RetryInterceptor(config.retryPolicy(), backoff, target, events);
        this.resender = new ResendOnReconnection(config.resendPolicy(), target, events);
        this.maxStreamChunkBytes = config.maxStreamChunkBytes();
        this.lifecycle = new ConnectionLifecycle(config.endpoint(), config.security(), channelFactory, events);
    }

    // ---------- worker operations ----------

    public TaskAssignment getTasks(String collaboratorName) {
        return resilient(channel -> {
            var stub = AggregatorGrpc.newBlockingStub(channel);
            var request = AggregatorProto.GetTasksRequest.newBuilder()
                    .setHeader(header(collaboratorName))
                    .build();

            var response = retry.unary(stub::getTasks, request);
            validate(response.getHeader(), collaboratorName);

            return new TaskAssignment(
                    response.getTasksList(),
                    response.getRoundNumber(),
                    response.getSleepTime(),
                    response.getQuit()
            );
        });
    }

    public AggregatorProto.NamedTensor getAggregatedTensor(
            String collaboratorName,
            String tensorName,
            int roundNumber,
            boolean report,
            List<String> tags,
            boolean requireLossless
    ) {
        return resilient(channel -> {
            var stub = AggregatorGrpc.newBlockingStub(channel);
            var request = AggregatorProto.GetAggregatedTensorRequest.newBuilder()
                    .setHeader(header(collaboratorName))
                    .setTensorName(tensorName)
                    .setRoundNumber(roundNumber)
                    .setReport(report)
                    .addAllTags(tags)
                    .setRequireLossless(requireLossless)
                    .build();

            var response = retry.unary(stub::getAggregatedTensor, request);
            validate(response.getHeader(), collaboratorName);
            return response.getTensor();
        });
    }

    /**
     * Stream a round's results to the aggregator. The request is serialized
     * and cut into frames of at most {@code maxStreamChunkBytes}; the
     * aggregator answers once for the whole stream.
     */
    public void sendLocalTaskResults(
            String collaboratorName,
            int roundNumber,
            String taskName,
            int dataSize,
            List<AggregatorProto.NamedTensor> namedTensors
    ) {
        resilient(channel -> {
            var stub = AggregatorGrpc.newStub(channel);
            var request = AggregatorProto.TaskResults.newBuilder()
                    .setHeader(header(collaboratorName))
                    .setRoundNumber(roundNumber)
                    .setTaskName(taskName)
                    .setDataSize(dataSize)
                    .addAllTensors(namedTensors)
                    .build();

            List<AggregatorProto.DataStream> frames = DataStreams.toFrames(request, maxStreamChunkBytes);
            var response = retry.streamed(StreamedCall.clientStreaming(stub::sendLocalTaskResults), frames);
            validate(response.getHeader(), collaboratorName);
            return null;
        });
    }

    // ---------- interactive operations ----------

    /** Can this collaborator reach the aggregator at all? */
    public void connectivityCheck(String collaboratorName) {
        interactive(channel -> {
            var response = AggregatorGrpc.newBlockingStub(channel).connectivityCheck(
                    AggregatorProto.ConnectivityCheckRequest.newBuilder()
                            .setHeader(header(collaboratorName))
                            .build());
            validate(response.getHeader(), collaboratorName);
            return null;
        });
    }

    public void addCollaborator(String adminName, String collaboratorLabel, String collaboratorCn) {
        interactive(channel -> {
            var response = AggregatorGrpc.newBlockingStub(channel).addCollaborator(
                    AggregatorProto.AddCollaboratorRequest.newBuilder()
                            .setHeader(header(adminName))
                            .setCollaboratorLabel(collaboratorLabel)
                            .setCollaboratorCn(collaboratorCn)
                            .build());
            validate(response.getHeader(), adminName);
            return null;
        });
    }

    public void removeCollaborator(String adminName, String collaboratorLabel, String collaboratorCn) {
        interactive(channel -> {
            var response = AggregatorGrpc.newBlockingStub(channel).removeCollaborator(
                    AggregatorProto.RemoveCollaboratorRequest.newBuilder()
                            .setHeader(header(adminName))
                            .setCollaboratorLabel(collaboratorLabel)
                            .setCollaboratorCn(collaboratorCn)
                            .build());
            validate(response.getHeader(), adminName);
            return null;
        });
    }

    public ExperimentStatus getExperimentStatus(String adminName) {
        return interactive(channel -> {
            var response = AggregatorGrpc.newBlockingStub(channel).getExperimentStatus(
                    AggregatorProto.GetExperimentStatusRequest.newBuilder()
                            .setHeader(header(adminName))
                            .build());
            validate(response.getHeader(), adminName);
            return ExperimentStatus.fromProto(response);
        });
    }

    public void setStragglerCutoffTime(String adminName, int timeoutInSeconds) {
        interactive(channel -> {
            var response = AggregatorGrpc.newBlockingStub(channel).setStragglerCutoffTime(
                    AggregatorProto.SetStragglerCutoffTimeRequest.newBuilder()
                            .setHeader(header(adminName))
                            .setTimeoutInSeconds(timeoutInSeconds)
                            .build());
            validate(response.getHeader(), adminName);
            return null;
        });
    }

    /**
     * Download a trained model and decode it with this client's codec.
     * <p>
     * Goes to the separate ModelAdmin service, whose messages carry no
     * identity header, so nothing is stamped or validated here.
     */
    public Map<String, TensorData> getTrainedModel(String experimentName, ModelType modelType) {
        return interactive(channel -> {
            var request = AggregatorProto.GetTrainedModelRequest.newBuilder()
                    .setExperimentName(experimentName)
                    .setModelType(modelType == ModelType.LAST
                            ? AggregatorProto.GetTrainedModelRequest.ModelType.LAST_MODEL
                            : AggregatorProto.GetTrainedModelRequest.ModelType.BEST_MODEL)
                    .build();
            var response = ModelAdminGrpc.newBlockingStub(channel).getTrainedModel(request);
            return codec.deconstruct(response.getModelProto());
        });
    }

    // ---------- channel lifecycle ----------

    /** Drop the current channel and open a new one. */
    public void reconnect() {
        lifecycle.reconnect();
    }

    public void disconnect() {
        lifecycle.disconnect();
    }

    @Override
    public void close() {
        lifecycle.close();
    }

    // ---------- internals ----------

    private <R> R resilient(Function<ManagedChannel, R> body) {
        return lifecycle.run(channel -> resender.call(() -> body.apply(channel)));
    }

    private <R> R interactive(Function<ManagedChannel, R> body) {
        return failFast(() -> lifecycle.run(body));
    }

    private <R> R failFast(Supplier<R> call) {
        try {
            return call.get();
        } catch (StatusRuntimeException e) {
            events.fatalTransportError(
                    lifecycle.target(),
                    e.getStatus().getCode().name(),
                    e.getStatus().getDescription()
            );
            throw new UnhandledTransportException(lifecycle.target(), e);
        }
    }

    private AggregatorProto.MessageHeader header(String callerName) {
        return ProtoHeaders.toProto(headers.stamp(callerName));
    }

    private void validate(AggregatorProto.MessageHeader header, String callerName) {
        headers.validate(ProtoHeaders.fromProto(header), callerName);
    }
}
