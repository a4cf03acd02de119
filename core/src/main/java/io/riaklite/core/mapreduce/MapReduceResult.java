package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.riaklite.core.RiakLink;
import io.riaklite.core.RiakProtocolException;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoded response of a Map/Reduce job, one {@link PhaseResult} per kept phase.
 * <p>
 * Response shapes accepted:
 *  - one kept phase:  {@code [v1, v2, ...]}, the values of that phase;
 *  - k kept phases:   {@code [[...], [...], ...]}, exactly k arrays in phase order.
 */
public final class MapReduceResult {

    private final List<PhaseResult> phases;

    public MapReduceResult(List<PhaseResult> phases) {
        this.phases = List.copyOf(phases);
    }

    /**
     * Parse a raw response body against the query that produced it.
     *
     * @throws RiakProtocolException if the body is not JSON or does not match the kept phases
     */
    public static MapReduceResult parse(ObjectMapper mapper, String body, MapReduceQuery query) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new RiakProtocolException("Map/Reduce response is not valid JSON", e);
        }
        return parse(root, query);
    }

    public static MapReduceResult parse(JsonNode root, MapReduceQuery query) {
        if (root == null || !root.isArray()) {
            throw new RiakProtocolException("Map/Reduce response must be a JSON array, got "
                    + (root == null || root.isMissingNode() ? "nothing" : root.getNodeType()));
        }

        List<Integer> kept = query.keptPhaseIndexes();
        if (kept.isEmpty()) {
            throw new IllegalArgumentException("query keeps no phase; build it with MapReduceQuery.of");
        }
        List<PhaseResult> out = new ArrayList<>(kept.size());

        if (kept.size() == 1) {
            int idx = kept.get(0);
            out.add(new PhaseResult(idx, query.phases().get(idx).kind(), elements(root)));
            return new MapReduceResult(out);
        }

        if (root.size() != kept.size()) {
            throw new RiakProtocolException("expected results for " + kept.size()
                    + " kept phases, got " + root.size() + " entries");
        }
        for (int i = 0; i < kept.size(); i++) {
            JsonNode perPhase = root.get(i);
            int idx = kept.get(i);
            if (!perPhase.isArray()) {
                throw new RiakProtocolException("results for phase " + idx + " must be a JSON array");
            }
            out.add(new PhaseResult(idx, query.phases().get(idx).kind(), elements(perPhase)));
        }
        return new MapReduceResult(out);
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> values = new ArrayList<>(array.size());
        array.forEach(values::add);
        return values;
    }

    public List<PhaseResult> phases() {
        return phases;
    }

    public int size() {
        return phases.size();
    }

    /** Values of the last kept phase. */
    public List<JsonNode> values() {
        return last().values();
    }

    /**
     * Values of the last kept phase as links.
     *
     * @throws IllegalStateException if the last kept phase is not a link phase
     */
    public List<RiakLink> links() {
        PhaseResult last = last();
        if (!"link".equals(last.kind())) {
            throw new IllegalStateException("last kept phase is a " + last.kind() + " phase, not a link phase");
        }
        return last.asLinks();
    }

    private PhaseResult last() {
        return phases.get(phases.size() - 1);
    }

    @Override
    public String toString() {
        return "MapReduceResult" + phases;
    }
}
