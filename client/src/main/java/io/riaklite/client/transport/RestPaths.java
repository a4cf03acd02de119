package io.riaklite.client.transport;

import io.riaklite.client.ClientConfig;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds resource URIs for a node from a {@link ClientConfig}.
 * <p>
 * Path layout:
 *   - {scheme}://{host}:{port}/{prefix}[/{bucket}[/{key}]][?params]   key/value resources
 *   - {scheme}://{host}:{port}/{mapredPrefix}                         Map/Reduce
 *   - {scheme}://{host}:{port}/ping                                   liveness
 * <p>
 * Bucket and key segments, and query parameters, are URL-encoded.
 */
public final class RestPaths {

    private final ClientConfig config;

    public RestPaths(ClientConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public URI rest() {
        return rest(null, null, Map.of());
    }

    /**
     * @param bucket optional bucket name; required when {@code key} is given
     * @param key    optional key
     * @param params query parameters, in iteration order; may be empty
     */
    public URI rest(String bucket, String key, Map<String, String> params) {
        if (key != null && bucket == null) {
            throw new IllegalArgumentException("a key needs a bucket");
        }
        StringBuilder sb = new StringBuilder(config.baseUrl()).append('/').append(config.urlPrefix());
        if (bucket != null) {
            sb.append('/').append(encode(bucket));
        }
        if (key != null) {
            sb.append('/').append(encode(key));
        }
        if (params != null && !params.isEmpty()) {
            StringJoiner q = new StringJoiner("&", "?", "");
            params.forEach((k, v) -> q.add(encode(k) + "=" + encode(v)));
            sb.append(q);
        }
        return URI.create(sb.toString());
    }

    public URI mapReduce() {
        return URI.create(config.baseUrl() + "/" + config.mapReducePrefix());
    }

    public URI ping() {
        return URI.create(config.baseUrl() + "/ping");
    }

    // URLEncoder is form encoding; Riak expects %20 for spaces in path segments
    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
