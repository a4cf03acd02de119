package io.riaklite.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.riaklite.client.dto.JsonClientConfig;
import io.riaklite.core.Quorum;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Connection settings for one Riak node's HTTP interface.
 * <p>
 * Supports:
 *  - host, port, scheme:  where the node listens (default http://127.0.0.1:8098)
 *  - urlPrefix:           key/value resource prefix (default "riak")
 *  - mapReducePrefix:     Map/Reduce resource prefix (default "mapred")
 *  - clientId:            sent as X-Riak-ClientId; random when not given
 *  - defaultR/W/DW:       quorum defaults (2)
 *  - tls:                 PKCS12 key store (and optional trust store) for https
 *  - basicAuth:           user/password sent on every request
 *  - requestTimeout:      HTTP timeout when a call does not pass its own
 * <p>
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()}.
 */
public record ClientConfig(
        String host,
        int port,
        String urlPrefix,
        String mapReducePrefix,
        String scheme,
        String clientId,
        int defaultR,
        int defaultW,
        int defaultDW,
        Tls tls,
        BasicAuth basicAuth,
        Duration requestTimeout
) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8098;
    public static final String DEFAULT_PREFIX = "riak";
    public static final String DEFAULT_MAPRED_PREFIX = "mapred";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    public record Tls(
            Path keyStorePath,
            String keyStorePassword,
            Path trustStorePath,
            String trustStorePassword
    ) {
        public Tls {
            Objects.requireNonNull(keyStorePath, "keyStorePath");
        }
    }

    public record BasicAuth(String user, String password) {
        public BasicAuth {
            Objects.requireNonNull(user, "user");
            Objects.requireNonNull(password, "password");
        }
    }

    public ClientConfig {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
        scheme = scheme == null ? "http" : scheme.toLowerCase();
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("scheme must be http or https, got " + scheme);
        }
        if (tls != null && !scheme.equals("https")) {
            throw new IllegalArgumentException("a TLS key store requires the https scheme");
        }
        urlPrefix = trimSlashes(urlPrefix == null ? DEFAULT_PREFIX : urlPrefix);
        mapReducePrefix = trimSlashes(mapReducePrefix == null ? DEFAULT_MAPRED_PREFIX : mapReducePrefix);
        clientId = clientId == null || clientId.isBlank() ? randomClientId() : clientId;
        Quorum.requirePositive("R", defaultR);
        Quorum.requirePositive("W", defaultW);
        Quorum.requirePositive("DW", defaultDW);
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
    }

    /** All defaults, with a fresh random client id. */
    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .urlPrefix(urlPrefix)
                .mapReducePrefix(mapReducePrefix)
                .scheme(scheme)
                .clientId(clientId)
                .defaultR(defaultR)
                .defaultW(defaultW)
                .defaultDW(defaultDW)
                .tls(tls)
                .basicAuth(basicAuth)
                .requestTimeout(requestTimeout);
    }

    /** {@code scheme://host:port}, no trailing slash. */
    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }

    static String randomClientId() {
        return "java_" + Integer.toString(ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE), 36);
    }

    private static String trimSlashes(String s) {
        String out = s.strip();
        while (out.startsWith("/")) out = out.substring(1);
        while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
        return out;
    }

    // ---------- loading ----------

    /**
     * Load a configuration from a JSON file (see {@link JsonClientConfig}).
     *
     * @throws IllegalArgumentException if the file cannot be read or holds invalid values
     */
    public static ClientConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonClientConfig cfg = mapper.readValue(path.toFile(), JsonClientConfig.class);
            return builder().apply(cfg).build();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load client config from " + path, e);
        }
    }

    /**
     * Parse option flags, all of which must be consumed.
     *
     * @see #parseArgs(String[])
     */
    public static ClientConfig fromArgs(String[] args) {
        Map.Entry<ClientConfig, String[]> parsed = parseArgs(args);
        if (parsed.getValue().length > 0) {
            throw new IllegalArgumentException("Unexpected argument: " + parsed.getValue()[0]);
        }
        return parsed.getKey();
    }

    /**
     * Small CLI parser. Consumes leading option flags and returns the config
     * together with the remaining (non-option) arguments.
     * <p>
     * Supported flags:
     *   --config,  -c  <path>     JSON config file, applied before the other flags
     *   --host,    -H  <host>
     *   --port,    -p  <port>
     *   --prefix       <prefix>
     *   --mapred-prefix <prefix>
     *   --scheme       http|https
     *   --client-id    <id>
     *   --r / --w / --dw <n>
     *   --keystore     <path>     PKCS12 client key store
     *   --keystore-password <pw>
     *   --user         <user>     basic auth user
     *   --password     <pw>       basic auth password
     *   --timeout-ms   <millis>
     */
    public static Map.Entry<ClientConfig, String[]> parseArgs(String[] args) {
        Builder b = builder();
        String keyStore = null;
        String keyStorePassword = null;
        String user = null;
        String password = null;

        // a JSON file is the base layer, so it has to be read first wherever it appears
        // among the options; every option takes exactly one value
        for (int j = 0; j + 1 < args.length && args[j].startsWith("-"); j += 2) {
            if (args[j].equals("--config") || args[j].equals("-c")) {
                b = fromJsonFile(Path.of(args[j + 1])).toBuilder();
            }
        }

        int i = 0;
        for (; i < args.length && args[i].startsWith("-"); i++) {
            switch (args[i]) {
                case "--config", "-c" -> value(args, i++);
                case "--host", "-H" -> b.host(value(args, i++));
                case "--port", "-p" -> b.port(intValue(args, i++));
                case "--prefix" -> b.urlPrefix(value(args, i++));
                case "--mapred-prefix" -> b.mapReducePrefix(value(args, i++));
                case "--scheme" -> b.scheme(value(args, i++));
                case "--client-id" -> b.clientId(value(args, i++));
                case "--r" -> b.defaultR(intValue(args, i++));
                case "--w" -> b.defaultW(intValue(args, i++));
                case "--dw" -> b.defaultDW(intValue(args, i++));
                case "--keystore" -> keyStore = value(args, i++);
                case "--keystore-password" -> keyStorePassword = value(args, i++);
                case "--user" -> user = value(args, i++);
                case "--password" -> password = value(args, i++);
                case "--timeout-ms" -> b.requestTimeout(Duration.ofMillis(intValue(args, i++)));
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (keyStore != null) {
            b.tls(new Tls(Path.of(keyStore), keyStorePassword, null, null));
        }
        if (user != null) {
            b.basicAuth(new BasicAuth(user, password == null ? "" : password));
        }
        return Map.entry(b.build(), Arrays.copyOfRange(args, i, args.length));
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int intValue(String[] args, int i) {
        String v = value(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + args[i] + ": " + v, e);
        }
    }

    // ---------- builder ----------

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String urlPrefix = DEFAULT_PREFIX;
        private String mapReducePrefix = DEFAULT_MAPRED_PREFIX;
        private String scheme = "http";
        private String clientId;
        private int defaultR = Quorum.DEFAULT_R;
        private int defaultW = Quorum.DEFAULT_W;
        private int defaultDW = Quorum.DEFAULT_DW;
        private Tls tls;
        private BasicAuth basicAuth;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

        private Builder() {
        }

        public Builder host(String host) { this.host = host; return this; }

        public Builder port(int port) { this.port = port; return this; }

        public Builder urlPrefix(String urlPrefix) { this.urlPrefix = urlPrefix; return this; }

        public Builder mapReducePrefix(String prefix) { this.mapReducePrefix = prefix; return this; }

        public Builder scheme(String scheme) { this.scheme = scheme; return this; }

        public Builder clientId(String clientId) { this.clientId = clientId; return this; }

        public Builder defaultR(int r) { this.defaultR = r; return this; }

        public Builder defaultW(int w) { this.defaultW = w; return this; }

        public Builder defaultDW(int dw) { this.defaultDW = dw; return this; }

        public Builder tls(Tls tls) { this.tls = tls; return this; }

        public Builder basicAuth(BasicAuth basicAuth) { this.basicAuth = basicAuth; return this; }

        public Builder requestTimeout(Duration timeout) { this.requestTimeout = timeout; return this; }

        Builder apply(JsonClientConfig cfg) {
            if (cfg.host != null) host = cfg.host;
            if (cfg.port != null) port = cfg.port;
            if (cfg.prefix != null) urlPrefix = cfg.prefix;
            if (cfg.mapredPrefix != null) mapReducePrefix = cfg.mapredPrefix;
            if (cfg.scheme != null) scheme = cfg.scheme;
            if (cfg.clientId != null) clientId = cfg.clientId;
            if (cfg.r != null) defaultR = cfg.r;
            if (cfg.w != null) defaultW = cfg.w;
            if (cfg.dw != null) defaultDW = cfg.dw;
            if (cfg.keyStore != null) {
                tls = new Tls(
                        Path.of(cfg.keyStore),
                        cfg.keyStorePassword,
                        cfg.trustStore == null ? null : Path.of(cfg.trustStore),
                        cfg.trustStorePassword
                );
            }
            if (cfg.username != null) {
                basicAuth = new BasicAuth(cfg.username, cfg.password == null ? "" : cfg.password);
            }
            if (cfg.requestTimeoutMillis != null) requestTimeout = Duration.ofMillis(cfg.requestTimeoutMillis);
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                    host,
                    port,
                    urlPrefix,
                    mapReducePrefix,
                    scheme,
                    clientId,
                    defaultR,
                    defaultW,
                    defaultDW,
                    tls,
                    basicAuth,
                    requestTimeout
            );
        }
    }
}
