package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable Map/Reduce job document, ready to POST to the Map/Reduce resource:
 * <pre>
 *   {
 *     "inputs":  ...,
 *     "query":   [ {"map": {...}}, {"reduce": {...}} ],
 *     "timeout": 60000
 *   }
 * </pre>
 * Phase order is kept exactly as given. {@code timeout} is optional.
 */
public record MapReduceQuery(
        MapReduceInput inputs,
        List<MapReducePhase> phases,
        Duration timeout
) {
    public MapReduceQuery {
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(phases, "phases");
        if (phases.isEmpty()) throw new IllegalArgumentException("a query needs at least one phase");
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        phases = List.copyOf(phases);
    }

    /**
     * Build a query where at least one phase is kept: if the caller kept none,
     * the last phase is kept so the job returns something.
     */
    public static MapReduceQuery of(MapReduceInput inputs, List<MapReducePhase> phases, Duration timeout) {
        Objects.requireNonNull(phases, "phases");
        boolean anyKept = phases.stream().anyMatch(MapReducePhase::keep);
        if (anyKept || phases.isEmpty()) {
            return new MapReduceQuery(inputs, phases, timeout);
        }
        List<MapReducePhase> adjusted = new ArrayList<>(phases);
        int last = adjusted.size() - 1;
        adjusted.set(last, adjusted.get(last).withKeep(true));
        return new MapReduceQuery(inputs, adjusted, timeout);
    }

    /** Indexes (into {@link #phases()}) of the phases whose output comes back to the client. */
    public List<Integer> keptPhaseIndexes() {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < phases.size(); i++) {
            if (phases.get(i).keep()) kept.add(i);
        }
        return kept;
    }

    public ObjectNode toJson() {
        ObjectNode job = JsonNodeFactory.instance.objectNode();
        job.set("inputs", inputs.toJson());
        ArrayNode query = job.putArray("query");
        for (MapReducePhase p : phases) {
            query.add(p.toJson());
        }
        if (timeout != null) {
            job.put("timeout", timeout.toMillis());
        }
        return job;
    }
}
