package io.riaklite.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.riaklite.client.dto.BucketListResponse;
import io.riaklite.client.transport.HttpResult;
import io.riaklite.client.transport.HttpTransport;
import io.riaklite.client.transport.RestPaths;
import io.riaklite.client.transport.Transport;
import io.riaklite.core.Quorum;
import io.riaklite.core.RiakProtocolException;
import io.riaklite.core.RiakTransportException;
import io.riaklite.core.mapreduce.MapReduceFunction;
import io.riaklite.core.mapreduce.MapReduceQuery;
import io.riaklite.core.mapreduce.MapReduceResult;
import io.riaklite.core.mapreduce.PhaseOptions;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for talking to one Riak node over HTTP.
 * <p>
 * Responsibilities:
 *  - Hold connection settings ({@link ClientConfig}) and the current
 *    quorum defaults and client id.
 *  - Hand out {@link Bucket} proxies and list buckets.
 *  - Check liveness.
 *  - Start Map/Reduce jobs and submit them through the {@link Transport}.
 * <p>
 * Setters return {@code this}, so they chain:
 * <pre>
 *   client.setR(3).setW(3).setDW(1);
 * </pre>
 * A client can be shared between threads for requests; the setters are not
 * meant to race with requests in flight.
 */
public final class RiakClient {
    private static final Logger log = Logger.getLogger(RiakClient.class.getName());

    static final String CLIENT_ID_HEADER = "X-Riak-ClientId";

    private final ClientConfig config;
    private final RestPaths paths;
    private final Transport transport;
    private final ObjectMapper json = new ObjectMapper();

    private volatile int r;
    private volatile int w;
    private volatile int dw;
    private volatile String clientId;

    /** Client for http://127.0.0.1:8098 with default prefixes. */
    public RiakClient() {
        this(ClientConfig.defaults());
    }

    public RiakClient(ClientConfig config) {
        this(config, new HttpTransport(config));
    }

    /**
     * Full ctor: lets callers (and tests) plug in their own {@link Transport}.
     */
    public RiakClient(ClientConfig config, Transport transport) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.paths = new RestPaths(config);
        this.r = config.defaultR();
        this.w = config.defaultW();
        this.dw = config.defaultDW();
        this.clientId = config.clientId();
    }

    public ClientConfig config() {
        return config;
    }

    public RestPaths paths() {
        return paths;
    }

    // ---------- quorum + identity ----------

    /** R used by reads that pass no R and whose bucket sets none. Default 2. */
    public int getR() {
        return r;
    }

    public RiakClient setR(int r) {
        this.r = Quorum.requirePositive("R", r);
        return this;
    }

    /** W used by writes that pass no W and whose bucket sets none. Default 2. */
    public int getW() {
        return w;
    }

    public RiakClient setW(int w) {
        this.w = Quorum.requirePositive("W", w);
        return this;
    }

    /** DW used by writes that pass no DW and whose bucket sets none. Default 2. */
    public int getDW() {
        return dw;
    }

    public RiakClient setDW(int dw) {
        this.dw = Quorum.requirePositive("DW", dw);
        return this;
    }

    public String getClientId() {
        return clientId;
    }

    /**
     * Replace the client id sent with every request. Riak uses it to build
     * vector clocks, so two clients should not share one.
     */
    public RiakClient setClientId(String clientId) {
        Objects.requireNonNull(clientId, "clientId");
        if (clientId.isBlank()) throw new IllegalArgumentException("clientId must not be blank");
        this.clientId = clientId;
        return this;
    }

    // ---------- buckets ----------

    /**
     * Buckets always exist in Riak, so this never talks to the node and never
     * checks that the bucket holds anything.
     */
    public Bucket bucket(String name) {
        return new Bucket(this, name);
    }

    /**
     * List every bucket the node knows about ({@code GET /{prefix}?buckets=true}).
     * Expensive on a real cluster: it walks all keys.
     *
     * @throws RiakTransportException if the node cannot be reached or answers non-2xx
     * @throws RiakProtocolException  on malformed JSON or a blank bucket name
     */
    public List<Bucket> buckets() {
        URI uri = paths.rest(null, null, Map.of("buckets", "true"));
        HttpResult resp = transport.request("GET", uri, null, headers(), null);
        if (!resp.isSuccess()) {
            throw new RiakTransportException("bucket listing failed (" + resp.status() + ")", resp.status(), resp.body());
        }

        BucketListResponse dto;
        try {
            dto = json.readValue(resp.body(), BucketListResponse.class);
        } catch (JsonProcessingException e) {
            throw new RiakProtocolException("bucket listing is not valid JSON", e);
        }
        if (dto == null || dto.buckets == null) {
            throw new RiakProtocolException("bucket listing has no \"buckets\" field", resp.status(), resp.body());
        }

        List<Bucket> out = new ArrayList<>(dto.buckets.size());
        for (String name : dto.buckets) {
            if (name == null || name.isBlank()) {
                throw new RiakProtocolException("bucket listing has a blank name", resp.status(), resp.body());
            }
            out.add(bucket(name));
        }
        return out;
    }

    /**
     * @return true iff {@code GET /ping} answers 200 with body {@code OK};
     *         any other answer, or no answer at all, is false
     */
    public boolean isAlive() {
        try {
            HttpResult resp = transport.request("GET", paths.ping(), null, headers(), null);
            return resp.status() == 200 && "OK".equals(resp.body());
        } catch (RiakTransportException e) {
            log.log(Level.FINE, "ping to " + config.baseUrl() + " failed", e);
            return false;
        }
    }

    // ---------- Map/Reduce ----------

    /** An empty job bound to this client. */
    public MapReduceJob mapReduce() {
        return new MapReduceJob(this);
    }

    /** New job over a whole bucket. */
    public MapReduceJob addInput(String bucket) {
        return mapReduce().add(bucket);
    }

    /** New job over one object. */
    public MapReduceJob addInput(String bucket, String key) {
        return mapReduce().add(bucket, key);
    }

    /** New job starting with a map phase. */
    public MapReduceJob addMapPhase(MapReduceFunction function, PhaseOptions options) {
        return mapReduce().map(function, options);
    }

    /** New job starting with a reduce phase. */
    public MapReduceJob addReducePhase(MapReduceFunction function, PhaseOptions options) {
        return mapReduce().reduce(function, options);
    }

    /** New job starting with a link phase; null bucket or tag match anything. */
    public MapReduceJob addLinkPhase(String bucket, String tag, boolean keep) {
        return mapReduce().link(bucket, tag, keep);
    }

    /**
     * New job whose inputs are the results of a Riak Search query.
     * Fails on the node unless Riak Search is enabled there.
     */
    public MapReduceJob addSearchPhase(String bucket, String query) {
        return mapReduce().search(bucket, query);
    }

    /** New job whose inputs are the keys matching an exact secondary-index value. */
    public MapReduceJob addIndexInput(String bucket, String index, String key) {
        return mapReduce().index(bucket, index, key);
    }

    /** New job whose inputs are the keys within a secondary-index range. */
    public MapReduceJob addIndexInput(String bucket, String index, String start, String end) {
        return mapReduce().index(bucket, index, start, end);
    }

    /**
     * POST a finished query to the Map/Reduce resource and decode the answer.
     *
     * @param timeout server-side job timeout, also used (plus a grace second)
     *                as the HTTP timeout; null for the config default
     */
    MapReduceResult submit(MapReduceQuery query, Duration timeout) {
        String body = encode(query);
        Map<String, String> headers = Map.of(
                CLIENT_ID_HEADER, clientId,
                "Content-Type", "application/json",
                "Accept", "application/json"
        );
        Duration httpTimeout = timeout == null ? null : timeout.plusSeconds(1);

        log.log(Level.FINE, () -> "submitting Map/Reduce job " + body);
        HttpResult resp = transport.request("POST", paths.mapReduce(), body, headers, httpTimeout);
        if (!resp.isSuccess()) {
            throw new RiakTransportException("Map/Reduce job failed (" + resp.status() + ")", resp.status(), resp.body());
        }
        return MapReduceResult.parse(json, resp.body(), query);
    }

    private String encode(MapReduceQuery query) {
        try {
            return json.writeValueAsString(query.toJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode Map/Reduce job", e);
        }
    }

    private Map<String, String> headers() {
        return Map.of(CLIENT_ID_HEADER, clientId);
    }

    @Override
    public String toString() {
        return "RiakClient{" + config.baseUrl() + ", clientId=" + clientId + "}";
    }
}
