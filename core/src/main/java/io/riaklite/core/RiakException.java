package io.riaklite.core;

/**
 * Base type for every failure raised by the Riak client.
 * Unchecked: callers decide where to handle transport and protocol errors.
 */
public class RiakException extends RuntimeException {

    public RiakException(String message) {
        super(message);
    }

    public RiakException(String message, Throwable cause) {
        super(message, cause);
    }
}
