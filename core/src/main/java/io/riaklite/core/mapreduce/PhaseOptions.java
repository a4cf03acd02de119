package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Per-phase options for map and reduce phases.
 *
 * @param keep whether the phase's output is returned to the client
 * @param arg  optional static argument handed to the phase function; may be null
 */
public record PhaseOptions(boolean keep, JsonNode arg) {

    private static final PhaseOptions NONE = new PhaseOptions(false, null);
    private static final PhaseOptions KEEP = new PhaseOptions(true, null);

    public static PhaseOptions none() {
        return NONE;
    }

    public static PhaseOptions kept() {
        return KEEP;
    }

    public PhaseOptions withKeep(boolean keep) {
        return new PhaseOptions(keep, arg);
    }

    public PhaseOptions withArg(JsonNode arg) {
        return new PhaseOptions(keep, arg);
    }
}
