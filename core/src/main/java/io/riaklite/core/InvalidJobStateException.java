package io.riaklite.core;

/**
 * A Map/Reduce job was used in a state that does not allow the call:
 * mutated after it ran, run without phases, or given conflicting inputs.
 */
public class InvalidJobStateException extends IllegalStateException {

    public InvalidJobStateException(String message) {
        super(message);
    }
}
