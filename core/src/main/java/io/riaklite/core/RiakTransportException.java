package io.riaklite.core;

/**
 * The HTTP exchange with the Riak node failed: connection refused, timeout,
 * TLS handshake failure, interruption, or a non-2xx status.
 * <p>
 * When the failure came from a status code, {@link #status()} and
 * {@link #body()} carry the raw response; otherwise status is -1.
 */
public class RiakTransportException extends RiakException {

    private final int status;
    private final String body;

    public RiakTransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.body = null;
    }

    public RiakTransportException(String message, int status, String body) {
        super(message);
        this.status = status;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }
}
