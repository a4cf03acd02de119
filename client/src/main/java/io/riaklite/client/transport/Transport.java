package io.riaklite.client.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Performs HTTP requests against a Riak node.
 * <p>
 * Implementations:
 *  - HttpTransport uses java.net.http.HttpClient.
 *  - tests can plug in a recording stub.
 * <p>
 * All calls are synchronous: they block until the response arrives or the
 * timeout elapses. Nothing is retried.
 */
public interface Transport {

    /**
     * Send one request.
     *
     * @param method  GET, POST, PUT or DELETE
     * @param uri     absolute URI, usually from {@link RestPaths}
     * @param body    request body, or null for none
     * @param headers extra request headers; may be empty
     * @param timeout per-request timeout, or null for the transport default
     * @return status and body, whatever the status code
     * @throws io.riaklite.core.RiakTransportException on connection failure, timeout,
     *         TLS failure or interruption
     */
    HttpResult request(String method, URI uri, String body, Map<String, String> headers, Duration timeout);
}
