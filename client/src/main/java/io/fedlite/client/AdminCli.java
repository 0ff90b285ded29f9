// file: client/src/main/java/io/fedlite/client/AdminCli.java
package io.fedlite.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.fedlite.client.config.ClientConfig;
import io.fedlite.core.tensor.TensorData;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Interactive CLI for administering a running aggregator.
 *
 * Usage:
 *   fedlite-admin --config client.json [--name admin] ping
 *   fedlite-admin --config client.json [--name admin] add-collaborator <label> <cn>
 *   fedlite-admin --config client.json [--name admin] remove-collaborator <label> <cn>
 *   fedlite-admin --config client.json [--name admin] status
 *   fedlite-admin --config client.json [--name admin] straggler-cutoff <seconds>
 *   fedlite-admin --config client.json trained-model <experiment> [best|last]
 *
 * Exit codes: 0 success, 1 usage or transport failure, 2 anything else.
 */
public final class AdminCli {

    private static final String DEFAULT_NAME = "admin";
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final AggregatorClient client;
    private final String name;
    private final PrintStream out;

    private AdminCli(AggregatorClient client, String name, PrintStream out) {
        this.client = client;
        this.name = name;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, AggregatorClient::new));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Function<ClientConfig, AggregatorClient> clients) {
        try {
            String configPath = null;
            String name = DEFAULT_NAME;
            List<String> rest = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--config", "-c" -> {
                        ensureValue(args, i);
                        configPath = args[++i];
                    }
                    case "--name", "-n" -> {
                        ensureValue(args, i);
                        name = args[++i];
                    }
                    case "--help", "-h" -> {
                        out.println(usage());
                        return 0;
                    }
                    default -> rest.add(args[i]);
                }
            }

            if (configPath == null) {
                throw new CliException("missing --config");
            }
            if (rest.isEmpty()) {
                throw new CliException("missing command");
            }

            ClientConfig config = ClientConfig.fromJsonFile(Path.of(configPath));
            try (AggregatorClient client = clients.apply(config)) {
                new AdminCli(client, name, out).dispatch(rest.get(0), rest.subList(1, rest.size()));
            }
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            return 1;
        } catch (TransportException e) {
            err.println("gRPC Error: " + e.code() + ". Details: " + e.detail());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private void dispatch(String cmd, List<String> params) throws JsonProcessingException {
        switch (cmd) {
            case "ping" -> {
                expect(params, 0, "ping takes no arguments");
                client.connectivityCheck(name);
                out.println("OK");
            }
            case "add-collaborator" -> {
                expect(params, 2, "add-collaborator requires <label> <cn>");
                client.addCollaborator(name, params.get(0), params.get(1));
                out.println("OK");
            }
            case "remove-collaborator" -> {
                expect(params, 2, "remove-collaborator requires <label> <cn>");
                client.removeCollaborator(name, params.get(0), params.get(1));
                out.println("OK");
            }
            case "status" -> {
                expect(params, 0, "status takes no arguments");
                out.println(JSON.writeValueAsString(client.getExperimentStatus(name)));
            }
            case "straggler-cutoff" -> {
                expect(params, 1, "straggler-cutoff requires <seconds>");
                client.setStragglerCutoffTime(name, parseSeconds(params.get(0)));
                out.println("OK");
            }
            case "trained-model" -> {
                if (params.isEmpty() || params.size() > 2) {
                    throw new CliException("trained-model requires <experiment> [best|last]");
                }
                ModelType type = params.size() == 2 ? parseModelType(params.get(1)) : ModelType.BEST;
                Map<String, TensorData> model = client.getTrainedModel(params.get(0), type);
                model.forEach((tensor, data) -> out.println(tensor + " " + Arrays.toString(data.shape())));
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private static void expect(List<String> params, int count, String msg) {
        if (params.size() != count) {
            throw new CliException(msg);
        }
    }

    private static int parseSeconds(String s) {
        try {
            int seconds = Integer.parseInt(s);
            if (seconds < 0) {
                throw new CliException("seconds must be >= 0");
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new CliException("invalid seconds: " + s);
        }
    }

    private static ModelType parseModelType(String s) {
        return switch (s) {
            case "best" -> ModelType.BEST;
            case "last" -> ModelType.LAST;
            default -> throw new CliException("model type must be best or last: " + s);
        };
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("missing value for option: " + args[i]);
        }
    }

    private static String usage() {
        return """
                Usage:
                  fedlite-admin --config <file> [--name <admin>] ping
                  fedlite-admin --config <file> [--name <admin>] add-collaborator <label> <cn>
                  fedlite-admin --config <file> [--name <admin>] remove-collaborator <label> <cn>
                  fedlite-admin --config <file> [--name <admin>] status
                  fedlite-admin --config <file> [--name <admin>] straggler-cutoff <seconds>
                  fedlite-admin --config <file> trained-model <experiment> [best|last]
                """;
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
