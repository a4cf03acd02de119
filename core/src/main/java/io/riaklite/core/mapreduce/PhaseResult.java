package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.JsonNode;
import io.riaklite.core.RiakLink;
import io.riaklite.core.RiakProtocolException;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one kept phase.
 *
 * @param phaseIndex position of the phase in the job's query
 * @param kind       "map", "reduce" or "link"
 * @param values     decoded values in the order the node returned them
 */
public record PhaseResult(int phaseIndex, String kind, List<JsonNode> values) {

    public PhaseResult {
        values = List.copyOf(values);
    }

    public int size() {
        return values.size();
    }

    /**
     * Decode the values as link triples {@code [bucket, key, tag]}.
     *
     * @throws RiakProtocolException if a value is not a 2 or 3 element array with
     *                               a non-blank bucket and a key
     */
    public List<RiakLink> asLinks() {
        List<RiakLink> links = new ArrayList<>(values.size());
        for (JsonNode v : values) {
            if (!v.isArray() || v.size() < 2 || v.size() > 3) {
                throw new RiakProtocolException("phase " + phaseIndex + ": expected link triple, got " + v);
            }
            List<String> triple = new ArrayList<>(3);
            for (JsonNode part : v) {
                triple.add(part.isNull() ? null : part.asText());
            }
            if (triple.get(0) == null || triple.get(0).isBlank() || triple.get(1) == null) {
                throw new RiakProtocolException("phase " + phaseIndex + ": invalid link " + v);
            }
            links.add(RiakLink.fromTriple(triple));
        }
        return links;
    }
}
