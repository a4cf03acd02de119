package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.riaklite.core.RiakLink;
import io.riaklite.core.RiakProtocolException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decoding of Map/Reduce responses against the kept phases of the query.
 */
class MapReduceResultTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static MapReducePhase map(boolean keep) {
        return new MapReducePhase.Map(MapReduceFunction.of("Riak.mapValuesJson"), new PhaseOptions(keep, null));
    }

    private static MapReducePhase reduce(boolean keep) {
        return new MapReducePhase.Reduce(MapReduceFunction.of("Riak.reduceSum"), new PhaseOptions(keep, null));
    }

    private static MapReduceQuery query(MapReducePhase... phases) {
        return MapReduceQuery.of(new MapReduceInput.BucketInput("b"), List.of(phases), null);
    }

    @Test
    void single_kept_phase_takes_the_whole_array() {
        var q = query(map(false), reduce(false));

        var result = MapReduceResult.parse(MAPPER, "[1, 2, 3]", q);

        assertEquals(1, result.size());
        assertEquals(1, result.phases().get(0).phaseIndex());
        assertEquals("reduce", result.phases().get(0).kind());
        assertEquals(3, result.values().size());
        assertEquals(2, result.values().get(1).asInt());
    }

    @Test
    void one_result_set_per_kept_phase() {
        var q = query(map(true), map(false), reduce(true));

        var result = MapReduceResult.parse(MAPPER, "[[\"a\", \"b\"], [42]]", q);

        assertEquals(q.keptPhaseIndexes().size(), result.size());
        assertEquals(0, result.phases().get(0).phaseIndex());
        assertEquals(2, result.phases().get(0).size());
        assertEquals(2, result.phases().get(1).phaseIndex());
        assertEquals(42, result.values().get(0).asInt());
    }

    @Test
    void wrong_number_of_result_sets_is_a_protocol_error() {
        var q = query(map(true), reduce(true));

        assertThrows(RiakProtocolException.class, () -> MapReduceResult.parse(MAPPER, "[[1]]", q));
        assertThrows(RiakProtocolException.class, () -> MapReduceResult.parse(MAPPER, "[1, 2]", q));
    }

    @Test
    void non_json_and_non_array_bodies_are_protocol_errors() {
        var q = query(map(false));

        assertThrows(RiakProtocolException.class, () -> MapReduceResult.parse(MAPPER, "<html>oops</html>", q));
        assertThrows(RiakProtocolException.class, () -> MapReduceResult.parse(MAPPER, "{\"error\": \"x\"}", q));
        assertThrows(RiakProtocolException.class, () -> MapReduceResult.parse(MAPPER, "", q));
    }

    @Test
    void link_results_decode_to_links() {
        var q = query(map(false), new MapReducePhase.Link("people", "friend", false));

        var result = MapReduceResult.parse(MAPPER,
                "[[\"people\", \"bob\", \"friend\"], [\"people\", \"carol\", \"friend\"]]", q);

        assertEquals(List.of(
                new RiakLink("people", "bob", "friend"),
                new RiakLink("people", "carol", "friend")
        ), result.links());
    }

    @Test
    void malformed_link_triple_is_a_protocol_error() {
        var q = query(new MapReducePhase.Link(null, null, true));

        var result = MapReduceResult.parse(MAPPER, "[[\"people\"]]", q);

        assertThrows(RiakProtocolException.class, result::links);
    }

    @Test
    void link_with_null_key_or_blank_bucket_is_a_protocol_error() {
        var q = query(new MapReducePhase.Link(null, null, true));

        var nullKey = MapReduceResult.parse(MAPPER, "[[\"people\", null, \"friend\"]]", q);
        assertThrows(RiakProtocolException.class, nullKey::links);

        var blankBucket = MapReduceResult.parse(MAPPER, "[[\" \", \"bob\"]]", q);
        assertThrows(RiakProtocolException.class, blankBucket::links);

        var noTag = MapReduceResult.parse(MAPPER, "[[\"people\", \"bob\", null]]", q);
        assertNull(noTag.links().get(0).tag());
    }

    @Test
    void links_on_a_non_link_phase_is_rejected() {
        var result = MapReduceResult.parse(MAPPER, "[1]", query(map(true)));

        assertThrows(IllegalStateException.class, result::links);
    }
}
