// file: core/src/main/java/io/riaklite/core/RiakProtocolException.java
package io.riaklite.core;

/**
 * The node answered with a 2xx status, but not with what we expected:
 * a non-JSON body, or JSON of the wrong shape.
 * <p>
 * {@link #status()} and {@link #body()} carry the raw response when it is
 * known; otherwise status is -1.
 */
public class RiakProtocolException extends RiakException {

    private final int status;
    private final String body;

    public RiakProtocolException(String message) {
        this(message, -1, null, null);
    }

    public RiakProtocolException(String message, Throwable cause) {
        this(message, -1, null, cause);
    }

    public RiakProtocolException(String message, int status, String body) {
        this(message, status, body, null);
    }

    private RiakProtocolException(String message, int status, String body, Throwable cause) {
        super(message, cause);
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
