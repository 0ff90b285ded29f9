package io.fedlite.client;

import io.fedlite.client.codec.NoCompressionModelCodec;
import io.fedlite.client.config.ClientConfig;
import io.fedlite.client.transport.ChannelFactory;
import io.fedlite.core.HeaderMismatchException;
import io.fedlite.core.backoff.ConstantBackoff;
import io.fedlite.core.tensor.TensorData;
import io.fedlite.protocols.AggregatorProto;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behavior of AggregatorClient against an in-process aggregator:
 *  - header stamping and validation on every headed call
 *  - retry with backoff, resend, and fail-fast paths
 *  - chunked streaming of task results
 *  - one fresh channel per operation
 */
class AggregatorClientTest {

    private static final String AGG = "agg-uuid";
    private static final String FED = "fed-uuid";

    private FakeAggregator aggregator;
    private FakeModelAdmin modelAdmin;
    private Server server;
    private String serverName;
    private RecordingEvents events;
    private List<Duration> sleeps;
    private List<ManagedChannel> opened;

    @BeforeEach
    void start() throws IOException {
        serverName = InProcessServerBuilder.generateName();
        aggregator = new FakeAggregator();
        modelAdmin = new FakeModelAdmin();
        server = InProcessServerBuilder
                .forName(serverName)
                .directExecutor()
                .addService(aggregator)
                .addService(modelAdmin)
                .build()
                .start();
        events = new RecordingEvents();
        sleeps = new ArrayList<>();
        opened = new ArrayList<>();
    }

    @AfterEach
    void stop() {
        server.shutdownNow();
    }

    @Test
    void get_tasks_returns_exactly_what_the_aggregator_sent() {
        try (var client = client(config().build())) {
            TaskAssignment tasks = client.getTasks("collab-1");

            assertEquals(new TaskAssignment(List.of("train", "validate"), 3, 0, false), tasks);
            assertTrue(sleeps.isEmpty());
        }
    }

    @Test
    void unavailable_n_times_then_success_waits_exactly_n_times() {
        aggregator.failNext(Status.UNAVAILABLE, Status.UNAVAILABLE, Status.UNAVAILABLE);

        try (var client = client(config().build())) {
            TaskAssignment tasks = client.getTasks("collab-1");

            assertEquals(List.of("train", "validate"), tasks.tasks());
            assertEquals(3, sleeps.size());
            assertEquals(3, events.count("reconnect"));
            assertEquals(3, events.count("retry"));
            assertEquals(4, aggregator.calls.get());
        }
    }

    @Test
    void authentication_failure_is_raised_without_any_backoff() {
        aggregator.failNext(Status.UNAUTHENTICATED.withDescription("bad cert"));
        var cfg = config()
                .retryableStatuses(Set.of(Status.Code.UNAVAILABLE, Status.Code.INTERNAL))
                .build();

        try (var client = client(cfg)) {
            var e = assertThrows(AuthenticationFailureException.class, () ->
                    client.getAggregatedTensor("collab-1", "conv1.weight", 3, false, List.of("model"), true));

            assertEquals(Status.Code.UNAUTHENTICATED, e.code());
            assertEquals("bad cert", e.detail());
            assertTrue(sleeps.isEmpty());
            assertEquals(1, aggregator.calls.get());
        }
    }

    @Test
    void authentication_failure_wins_over_a_retry_everything_policy() {
        aggregator.failNext(Status.UNAUTHENTICATED, Status.UNAUTHENTICATED, Status.UNAUTHENTICATED);
        var cfg = config()
                .retryableStatuses(Set.of())
                .maxAttempts(3)
                .build();

        try (var client = client(cfg)) {
            var e = assertThrows(AuthenticationFailureException.class, () -> client.getTasks("collab-1"));

            assertEquals(Status.Code.UNAUTHENTICATED, e.code());
            assertTrue(sleeps.isEmpty());
            assertEquals(1, aggregator.calls.get());
            assertEquals(0, events.count("retry"));
        }
    }

    @Test
    void unknown_status_is_resent_without_backoff() {
        aggregator.failNext(Status.UNKNOWN);

        try (var client = client(config().build())) {
            assertEquals(3, client.getTasks("collab-1").roundNumber());
            assertTrue(sleeps.isEmpty());
            assertEquals(1, events.count("resend"));
        }
    }

    @Test
    void non_retryable_status_propagates_on_first_attempt() {
        aggregator.failNext(Status.INVALID_ARGUMENT.withDescription("no such round"));

        try (var client = client(config().build())) {
            var e = assertThrows(TransportException.class, () -> client.getTasks("collab-1"));

            assertEquals(Status.Code.INVALID_ARGUMENT, e.code());
            assertEquals(1, aggregator.calls.get());
            assertTrue(sleeps.isEmpty());
        }
    }

    @Test
    void attempt_cap_turns_endless_unavailable_into_transient_failure() {
        aggregator.failNext(Status.UNAVAILABLE, Status.UNAVAILABLE, Status.UNAVAILABLE);

        try (var client = client(config().maxAttempts(2).build())) {
            var e = assertThrows(TransientTransportException.class, () -> client.getTasks("collab-1"));

            assertEquals(2, e.attempts());
            assertEquals(1, sleeps.size());
        }
    }

    @Test
    void response_header_mismatch_is_fatal_and_not_retried() {
        aggregator.headerTweak = h -> h.toBuilder().setFederationUuid("other-federation").build();

        try (var client = client(config().build())) {
            var e = assertThrows(HeaderMismatchException.class, () -> client.getTasks("collab-1"));

            assertEquals(HeaderMismatchException.Field.FEDERATION_UUID, e.field());
            assertEquals(1, aggregator.calls.get());
        }
    }

    @Test
    void common_name_is_stamped_and_checked_when_configured() {
        try (var client = client(config().identity(AGG, FED, "shared-cn").build())) {
            assertDoesNotThrow(() -> client.getTasks("collab-1"));
        }

        aggregator.headerTweak = h -> h.toBuilder().setSingleColCertCommonName("").build();
        try (var client = client(config().identity(AGG, FED, "shared-cn").build())) {
            var e = assertThrows(HeaderMismatchException.class, () -> client.getTasks("collab-1"));
            assertEquals(HeaderMismatchException.Field.COMMON_NAME, e.field());
        }
    }

    @Test
    void get_aggregated_tensor_returns_payload() {
        var codec = new NoCompressionModelCodec();
        aggregator.tensor = codec.encode("ignored", TensorData.vector(1f, 2f, 3f));

        try (var client = client(config().build())) {
            AggregatorProto.NamedTensor t =
                    client.getAggregatedTensor("collab-1", "fc.bias", 3, false, List.of("model"), true);

            assertEquals("fc.bias", t.getName());
            assertEquals(TensorData.vector(1f, 2f, 3f), codec.decode(t));
        }
    }

    @Test
    void large_task_results_are_chunked_and_reassembled_into_the_original_request() {
        var codec = new NoCompressionModelCodec();
        List<AggregatorProto.NamedTensor> tensors = List.of(
                codec.encode("conv1.weight", new TensorData(new int[]{10, 25}, new float[250])),
                codec.encode("conv1.bias", TensorData.vector(0.5f, -0.5f))
        );

        try (var client = client(config().maxStreamChunkBytes(64).build())) {
            client.sendLocalTaskResults("collab-1", 3, "train", 600, tensors);
        }

        AggregatorProto.TaskResults expected = AggregatorProto.TaskResults.newBuilder()
                .setHeader(AggregatorProto.MessageHeader.newBuilder()
                        .setSender("collab-1")
                        .setReceiver(AGG)
                        .setFederationUuid(FED)
                        .setSingleColCertCommonName(""))
                .setRoundNumber(3)
                .setTaskName("train")
                .setDataSize(600)
                .addAllTensors(tensors)
                .build();

        assertEquals(1, aggregator.receivedResults.size());
        assertEquals(expected, aggregator.receivedResults.get(0));
        assertTrue(aggregator.receivedFrameCounts.get(0) > 1, "payload should span several frames");
    }

    @Test
    void streamed_call_is_resent_whole_after_unavailable() {
        aggregator.failNext(Status.UNAVAILABLE);
        var codec = new NoCompressionModelCodec();

        try (var client = client(config().maxStreamChunkBytes(32).build())) {
            client.sendLocalTaskResults("collab-1", 1, "train", 10,
                    List.of(codec.encode("w", TensorData.vector(1f, 2f, 3f, 4f))));
        }

        assertEquals(1, sleeps.size());
        assertEquals(1, aggregator.receivedResults.size());
        assertEquals("train", aggregator.receivedResults.get(0).getTaskName());
    }

    @Test
    void connectivity_check_succeeds_when_reachable() {
        try (var client = client(config().build())) {
            assertDoesNotThrow(() -> client.connectivityCheck("collab-1"));
        }
    }

    @Test
    void connectivity_check_failure_is_terminal_and_never_retried() {
        aggregator.failNext(Status.UNAVAILABLE.withDescription("connection refused"));

        try (var client = client(config().build())) {
            var e = assertThrows(UnhandledTransportException.class, () -> client.connectivityCheck("collab-1"));

            assertEquals(Status.Code.UNAVAILABLE, e.code());
            assertTrue(sleeps.isEmpty());
            assertEquals(1, aggregator.calls.get());
            assertEquals(List.of("fatal:UNAVAILABLE:connection refused"),
                    events.events.stream().filter(s -> s.startsWith("fatal:")).toList());
        }
    }

    @Test
    void admin_operations_reach_the_aggregator() {
        try (var client = client(config().build())) {
            client.addCollaborator("admin", "collab-9", "collab-9.example");
            client.removeCollaborator("admin", "collab-2", "collab-2.example");
            client.setStragglerCutoffTime("admin", 120);
        }

        assertEquals(List.of(
                "add collab-9 collab-9.example",
                "remove collab-2 collab-2.example",
                "cutoff 120"
        ), aggregator.adminLog);
    }

    @Test
    void experiment_status_is_decoded() {
        try (var client = client(config().build())) {
            ExperimentStatus status = client.getExperimentStatus("admin");

            assertEquals("mnist", status.experimentName());
            assertEquals("IN_PROGRESS", status.state());
            assertEquals(3, status.currentRound());
            assertEquals(10, status.roundsToTrain());
            assertEquals(List.of(new ExperimentStatus.Collaborator("collab-1", "collab-1.example", true)),
                    status.collaborators());
        }
    }

    @Test
    void admin_failure_is_terminal_even_for_retryable_status() {
        aggregator.failNext(Status.UNAVAILABLE);

        try (var client = client(config().build())) {
            assertThrows(UnhandledTransportException.class, () -> client.setStragglerCutoffTime("admin", 30));
            assertTrue(sleeps.isEmpty());
            assertEquals(1, events.count("fatal"));
        }
    }

    @Test
    void admin_header_mismatch_is_not_mistaken_for_transport_failure() {
        aggregator.headerTweak = h -> h.toBuilder().setSender("impostor").build();

        try (var client = client(config().build())) {
            var e = assertThrows(HeaderMismatchException.class, () -> client.getExperimentStatus("admin"));
            assertEquals(HeaderMismatchException.Field.SENDER, e.field());
            assertEquals(0, events.count("fatal"));
        }
    }

    @Test
    void trained_model_is_decoded_through_the_codec() {
        var codec = new NoCompressionModelCodec();
        modelAdmin.model = AggregatorProto.ModelProto.newBuilder()
                .addTensors(codec.encode("fc.weight", new TensorData(new int[]{2, 2}, new float[]{1f, 2f, 3f, 4f})))
                .addTensors(codec.encode("fc.bias", TensorData.vector(0.1f, 0.2f)))
                .build();

        try (var client = client(config().build())) {
            Map<String, TensorData> model = client.getTrainedModel("mnist", ModelType.LAST);

            assertEquals(List.of("fc.weight", "fc.bias"), List.copyOf(model.keySet()));
            assertEquals(new TensorData(new int[]{2, 2}, new float[]{1f, 2f, 3f, 4f}), model.get("fc.weight"));
            assertEquals(AggregatorProto.GetTrainedModelRequest.ModelType.LAST_MODEL,
                    modelAdmin.requests.get(0).getModelType());
        }
    }

    @Test
    void every_operation_gets_a_fresh_channel_that_is_closed_afterwards() {
        try (var client = client(config().build())) {
            client.getTasks("collab-1");
            client.connectivityCheck("collab-1");

            // one channel from construction, one per operation
            assertEquals(3, opened.size());
            assertTrue(opened.stream().allMatch(ManagedChannel::isShutdown));
        }
    }

    @Test
    void reconnect_twice_in_a_row_never_fails() {
        try (var client = client(config().build())) {
            assertDoesNotThrow(() -> {
                client.reconnect();
                client.reconnect();
                client.disconnect();
                client.disconnect();
            });
        }
    }

    // ---------- helpers ----------

    private ClientConfig.Builder config() {
        return ClientConfig.builder()
                .aggregator("localhost", 50051)
                .plaintext()
                .identity(AGG, FED, null);
    }

    private AggregatorClient client(ClientConfig config) {
        ChannelFactory inProcess = (endpoint, security) -> {
            ManagedChannel ch = InProcessChannelBuilder.forName(serverName).directExecutor().build();
            opened.add(ch);
            return ch;
        };
        var backoff = new ConstantBackoff(Duration.ofSeconds(1), "localhost:50051", events, sleeps::add);
        return new AggregatorClient(config, inProcess, events, backoff, new NoCompressionModelCodec());
    }
}
