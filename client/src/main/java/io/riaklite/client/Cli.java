// file: client/src/main/java/io/riaklite/client/Cli.java
package io.riaklite.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.riaklite.core.RiakException;
import io.riaklite.core.mapreduce.MapReduceResult;
import io.riaklite.core.mapreduce.PhaseOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Map;
import java.util.logging.LogManager;

/**
 * Simple CLI for poking at a running Riak node over HTTP.
 *
 * Usage:
 *   riak-cli [options] ping
 *   riak-cli [options] buckets
 *   riak-cli [options] mapred <bucket> <map-fn> [<reduce-fn>]
 *   riak-cli [options] search <bucket> <query> [<map-fn>]
 *
 * Examples:
 *   riak-cli --host riak-1 ping
 *   riak-cli mapred users Riak.mapValuesJson Riak.reduceSum
 *   riak-cli search users "name:al*"
 *
 * Options are the flags understood by {@link ClientConfig#parseArgs(String[])}.
 */
public final class Cli {

    private static final String DEFAULT_SEARCH_MAP = "Riak.mapValuesJson";

    private final RiakClient client;
    private final PrintStream out;

    Cli(RiakClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        configureLogging();
        try {
            Map.Entry<ClientConfig, String[]> parsed = parseOrExit(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            Cli cli = new Cli(new RiakClient(parsed.getKey()), System.out);
            System.exit(cli.execute(rest));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (RiakException e) {
            System.err.println("riak error: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    // Bundled logging.properties unless the caller points JUL somewhere else.
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("warning: could not load logging.properties: " + e.getMessage());
        }
    }

    private static Map.Entry<ClientConfig, String[]> parseOrExit(String[] args) {
        try {
            return ClientConfig.parseArgs(args);
        } catch (IllegalArgumentException e) {
            usageAndExit(e.getMessage());
            throw e; // unreachable
        }
    }

    /**
     * Run one command.
     *
     * @return process exit code
     * @throws CliException on a usage error
     */
    int execute(String[] rest) {
        String cmd = rest[0];
        switch (cmd) {
            case "ping" -> {
                requireArgs(rest, 1, 1, "ping takes no arguments");
                boolean alive = client.isAlive();
                out.println(alive ? "OK" : "DOWN");
                return alive ? 0 : 3;
            }
            case "buckets" -> {
                requireArgs(rest, 1, 1, "buckets takes no arguments");
                for (Bucket b : client.buckets()) {
                    out.println(b.name());
                }
                return 0;
            }
            case "mapred" -> {
                requireArgs(rest, 3, 4, "mapred requires <bucket> <map-fn> [<reduce-fn>]");
                MapReduceJob job = client.addInput(rest[1]).map(rest[2], PhaseOptions.none());
                if (rest.length == 4) {
                    job.reduce(rest[3], PhaseOptions.none());
                }
                print(job.run());
                return 0;
            }
            case "search" -> {
                requireArgs(rest, 3, 4, "search requires <bucket> <query> [<map-fn>]");
                String mapFn = rest.length == 4 ? rest[3] : DEFAULT_SEARCH_MAP;
                print(client.addSearchPhase(rest[1], rest[2]).map(mapFn, PhaseOptions.none()).run());
                return 0;
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private void print(MapReduceResult result) {
        for (JsonNode v : result.values()) {
            out.println(v.toString());
        }
    }

    private static void requireArgs(String[] rest, int min, int max, String msg) {
        if (rest.length < min || rest.length > max) {
            throw new CliException(msg);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  riak-cli [options] ping
                  riak-cli [options] buckets
                  riak-cli [options] mapred <bucket> <map-fn> [<reduce-fn>]
                  riak-cli [options] search <bucket> <query> [<map-fn>]

                Options:
                  --config, -c  <path>   JSON client config
                  --host,   -H  <host>   (default: 127.0.0.1)
                  --port,   -p  <port>   (default: 8098)
                  --prefix <p>, --mapred-prefix <p>, --scheme http|https
                  --client-id <id>, --r <n>, --w <n>, --dw <n>
                  --keystore <path>, --keystore-password <pw>
                  --user <user>, --password <pw>, --timeout-ms <millis>
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
