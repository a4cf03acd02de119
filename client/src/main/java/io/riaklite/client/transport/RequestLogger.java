package io.riaklite.client.transport;

import java.net.URI;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimal hook for request-level logging.
 *
 * Responsibilities:
 *  - Central place to log method/URI/status and latency of calls to Riak.
 *  - Can later be swapped for a metrics backend.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP exchange.
     *
     * @param method      HTTP method
     * @param uri         request URI
     * @param status      HTTP status code returned by the node
     * @param totalMillis wall-clock latency of the exchange
     */
    public static void logRequest(String method, URI uri, int status, long totalMillis) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms)",
                method,
                uri,
                status,
                totalMillis
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    /**
     * Log an exchange that never produced a response.
     *
     * @param error the transport failure (connection, timeout, TLS)
     */
    public static void logFailure(String method, URI uri, long totalMillis, Throwable error) {
        String msg = String.format(
                "HTTP %s %s -> failed (total=%dms)",
                method,
                uri,
                totalMillis
        );
        log.log(Level.WARNING, msg, error);
    }
}
