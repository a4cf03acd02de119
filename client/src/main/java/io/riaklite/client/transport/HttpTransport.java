package io.riaklite.client.transport;

import io.riaklite.client.ClientConfig;
import io.riaklite.core.RiakTransportException;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Transport} backed by {@link HttpClient}.
 * <p>
 * Adds to every request:
 *  - Authorization: Basic ..., when the config carries credentials.
 * <p>
 * With https and a configured key store, the client presents the PKCS12 key
 * store's certificate; the trust store defaults to the JVM's.
 */
public final class HttpTransport implements Transport {

    private final HttpClient http;
    private final String authorization; // null when no basic auth is configured
    private final Duration defaultTimeout;

    public HttpTransport(ClientConfig config) {
        Objects.requireNonNull(config, "config");
        this.http = buildClient(config);
        this.authorization = config.basicAuth() == null ? null : basic(config.basicAuth());
        this.defaultTimeout = config.requestTimeout();
    }

    @Override
    public HttpResult request(String method, URI uri, String body, Map<String, String> headers, Duration timeout) {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri)
                .timeout(timeout != null ? timeout : defaultTimeout)
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (headers != null) {
            headers.forEach(b::header);
        }
        if (authorization != null) {
            b.header("Authorization", authorization);
        }

        long start = System.nanoTime();
        try {
            HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            RequestLogger.logRequest(method, uri, resp.statusCode(), elapsedMillis(start));
            return new HttpResult(resp.statusCode(), resp.body());
        } catch (IOException e) {
            RequestLogger.logFailure(method, uri, elapsedMillis(start), e);
            throw new RiakTransportException(method + " " + uri + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            RequestLogger.logFailure(method, uri, elapsedMillis(start), e);
            throw new RiakTransportException(method + " " + uri + " interrupted", e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String basic(ClientConfig.BasicAuth auth) {
        String raw = auth.user() + ":" + auth.password();
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static HttpClient buildClient(ClientConfig config) {
        // Riak's HTTP interface speaks HTTP/1.1 only
        HttpClient.Builder b = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.requestTimeout());
        if (config.tls() != null) {
            b.sslContext(sslContext(config.tls()));
        }
        return b.build();
    }

    static SSLContext sslContext(ClientConfig.Tls tls) {
        try {
            KeyStore keys = load(tls.keyStorePath(), tls.keyStorePassword());
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keys, chars(tls.keyStorePassword()));

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(tls.trustStorePath() == null
                    ? null
                    : load(tls.trustStorePath(), tls.trustStorePassword()));

            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(kmf.getKeyManagers(), tmf.getTrustManagers(), null);
            return ctx;
        } catch (IOException | GeneralSecurityException e) {
            throw new RiakTransportException("Failed to set up TLS from " + tls.keyStorePath(), e);
        }
    }

    private static KeyStore load(Path path, String password) throws IOException, GeneralSecurityException {
        KeyStore ks = KeyStore.getInstance("PKCS12");
        try (InputStream in = Files.newInputStream(path)) {
            ks.load(in, chars(password));
        }
        return ks;
    }

    private static char[] chars(String password) {
        return password == null ? new char[0] : password.toCharArray();
    }
}
