package io.riaklite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.riaklite.core.InvalidJobStateException;
import io.riaklite.core.RiakLink;
import io.riaklite.core.RiakProtocolException;
import io.riaklite.core.RiakTransportException;
import io.riaklite.core.mapreduce.KeyFilter;
import io.riaklite.core.mapreduce.MapReduceFunction;
import io.riaklite.core.mapreduce.MapReduceResult;
import io.riaklite.core.mapreduce.PhaseOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Map/Reduce job builder: lifecycle, input exclusivity, and what goes over the wire.
 */
class MapReduceJobTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RecordingTransport transport = new RecordingTransport();
    private final RiakClient client = new RiakClient(
            ClientConfig.builder().host("localhost").mapReducePrefix("/mapred/").clientId("mr-test").build(),
            transport
    );

    private JsonNode sentJob() throws Exception {
        return MAPPER.readTree(transport.lastCall().body());
    }

    @Test
    void job_without_phases_cannot_run() {
        var job = client.addInput("users");

        assertThrows(InvalidJobStateException.class, job::run);
        assertTrue(transport.calls().isEmpty(), "nothing should be sent");
    }

    @Test
    void job_without_inputs_cannot_run() {
        var job = client.mapReduce().map("Riak.mapValuesJson");

        assertThrows(InvalidJobStateException.class, job::run);
    }

    @Test
    void state_moves_from_empty_to_accumulating_to_finalized() {
        transport.respond(200, "[]");
        var job = client.mapReduce().add("users");
        assertEquals(MapReduceJob.State.EMPTY, job.state());

        job.map("Riak.mapValuesJson");
        assertEquals(MapReduceJob.State.ACCUMULATING, job.state());

        job.run();
        assertEquals(MapReduceJob.State.FINALIZED, job.state());
    }

    @Test
    void phases_are_sent_in_insertion_order() throws Exception {
        transport.respond(200, "[6]");

        client.addInput("nums")
                .map(MapReduceFunction.of("f1"), PhaseOptions.none())
                .reduce(MapReduceFunction.of("f2"), PhaseOptions.none())
                .run();

        var call = transport.lastCall();
        assertEquals("POST", call.method());
        assertEquals("http://localhost:8098/mapred", call.uri().toString());
        assertEquals("application/json", call.headers().get("Content-Type"));
        assertEquals("mr-test", call.headers().get(RiakClient.CLIENT_ID_HEADER));

        JsonNode query = sentJob().get("query");
        assertEquals(2, query.size());
        assertEquals("f1", query.get(0).get("map").get("name").asText());
        assertEquals("f2", query.get(1).get("reduce").get("name").asText());
        assertFalse(query.get(0).get("map").get("keep").asBoolean());
        assertTrue(query.get(1).get("reduce").get("keep").asBoolean(), "last phase kept by default");
        assertEquals("nums", sentJob().get("inputs").asText());
    }

    @Test
    void every_mutator_fails_after_run() {
        transport.respond(200, "[]");
        var job = client.addInput("users").map("Riak.mapValuesJson");
        job.run();

        assertThrows(InvalidJobStateException.class, () -> job.map("Riak.mapValues"));
        assertThrows(InvalidJobStateException.class, () -> job.reduce("Riak.reduceSum"));
        assertThrows(InvalidJobStateException.class, job::link);
        assertThrows(InvalidJobStateException.class, () -> job.add("other"));
        assertThrows(InvalidJobStateException.class, () -> job.search("users", "q"));
        assertThrows(InvalidJobStateException.class, () -> job.keyFilter(KeyFilter.eq("x")));
        assertThrows(InvalidJobStateException.class, job::run);
        assertEquals(1, transport.calls().size());
    }

    @Test
    void failed_run_still_finalizes() {
        var job = client.addInput("users").map("Riak.mapValuesJson");

        assertThrows(RiakTransportException.class, job::run);
        assertEquals(MapReduceJob.State.FINALIZED, job.state());
        assertThrows(InvalidJobStateException.class, job::run);
    }

    @Test
    void result_has_one_entry_per_kept_phase() {
        transport.respond(200, "[[\"alice\", \"bob\"], [2]]");

        MapReduceResult result = client.addInput("users")
                .map("Riak.mapValuesJson", PhaseOptions.kept())
                .reduce("Riak.reduceSum", PhaseOptions.kept())
                .run();

        assertEquals(2, result.size());
        assertEquals(2, result.phases().get(0).size());
        assertEquals(2, result.values().get(0).asInt());
    }

    @Test
    void only_final_phase_kept_gives_one_result() {
        transport.respond(200, "[1, 2, 3]");

        MapReduceResult result = client.addInput("users")
                .map("Riak.mapValuesJson")
                .map("Riak.mapValues")
                .reduce("Riak.reduceSort")
                .run();

        assertEquals(1, result.size());
        assertEquals(3, result.values().size());
    }

    @Test
    void error_status_surfaces_as_transport_error() {
        transport.respond(500, "{\"error\": \"map_reduce_error\"}");
        var job = client.addInput("users").map("Riak.mapValuesJson");

        var e = assertThrows(RiakTransportException.class, job::run);
        assertEquals(500, e.status());
        assertTrue(e.body().contains("map_reduce_error"));
    }

    @Test
    void non_json_body_surfaces_as_protocol_error() {
        transport.respond(200, "<html>proxy error</html>");

        assertThrows(RiakProtocolException.class,
                () -> client.addInput("users").map("Riak.mapValuesJson").run());
    }

    @Test
    void timeout_goes_into_job_and_transport() throws Exception {
        transport.respond(200, "[]");

        client.addInput("users").map("Riak.mapValuesJson").run(Duration.ofSeconds(10));

        assertEquals(10_000L, sentJob().get("timeout").asLong());
        assertEquals(Duration.ofSeconds(11), transport.lastCall().timeout());
    }

    @Test
    void invalid_timeout_leaves_job_runnable() {
        transport.respond(200, "[]");
        var job = client.addInput("users").map("Riak.mapValuesJson");

        assertThrows(IllegalArgumentException.class, () -> job.run(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> job.run(Duration.ofSeconds(-1)));
        assertEquals(MapReduceJob.State.ACCUMULATING, job.state());
        assertTrue(transport.calls().isEmpty());

        job.run(Duration.ofSeconds(5));
        assertEquals(MapReduceJob.State.FINALIZED, job.state());
        assertEquals(1, transport.calls().size());
    }

    @Test
    void search_after_bucket_input_fails_fast() {
        var job = client.addInput("users");

        assertThrows(InvalidJobStateException.class, () -> job.search("users", "name:al*"));
        assertThrows(InvalidJobStateException.class, () -> job.add("users", "alice"));
    }

    @Test
    void keys_after_search_fail_fast_but_search_can_be_replaced() throws Exception {
        transport.respond(200, "[]");
        var job = client.addSearchPhase("users", "name:al*");

        assertThrows(InvalidJobStateException.class, () -> job.add("users", "alice"));
        assertThrows(InvalidJobStateException.class, () -> job.index("users", "age_int", "30"));

        job.search("users", "name:bo*").map("Riak.mapValuesJson").run();
        JsonNode inputs = sentJob().get("inputs");
        assertEquals("mapred_search", inputs.get("function").asText());
        assertEquals("name:bo*", inputs.get("arg").get(1).asText());
    }

    @Test
    void explicit_keys_accumulate() throws Exception {
        transport.respond(200, "[]");

        client.addInput("users", "alice")
                .add("users", "bob", JsonNodeFactory.instance.textNode("extra"))
                .add(new RiakLink("users", "carol", "friend"))
                .map("Riak.mapValuesJson")
                .run();

        JsonNode inputs = sentJob().get("inputs");
        assertEquals(3, inputs.size());
        assertEquals("alice", inputs.get(0).get(1).asText());
        assertEquals("extra", inputs.get(1).get(2).asText());
        assertEquals("carol", inputs.get(2).get(1).asText());
    }

    @Test
    void key_filters_need_a_bucket_input_and_combine() throws Exception {
        assertThrows(InvalidJobStateException.class,
                () -> client.addInput("users", "alice").keyFilter(KeyFilter.eq("x")));

        transport.respond(200, "[]");
        client.addInput("invoices")
                .keyFilter(KeyFilter.tokenize("-", 1), KeyFilter.eq("basho"))
                .keyFilterOr(KeyFilter.endsWith("2024"))
                .map("Riak.mapValuesJson")
                .run();

        JsonNode filters = sentJob().get("inputs").get("key_filters");
        assertEquals(1, filters.size());
        assertEquals("or", filters.get(0).get(0).asText());
        assertEquals(2, filters.get(0).get(1).size(), "left side keeps the first chain");
        assertEquals("ends_with", filters.get(0).get(2).get(0).get(0).asText());
    }

    @Test
    void link_results_are_exposed_as_links() {
        transport.respond(200, "[[\"people\", \"bob\", \"friend\"]]");

        MapReduceResult result = client.addInput("people", "alice")
                .link("people", "friend", false)
                .run();

        assertEquals(List.of(new RiakLink("people", "bob", "friend")), result.links());
    }

    @Test
    void bucket_helpers_build_jobs_bound_to_the_client() {
        Bucket b = client.bucket("users");

        assertEquals("users", b.mapReduce().inputs().toJson().asText());
        assertEquals("riak_search", b.search("age:30").inputs().toJson().get("module").asText());
    }

    @Test
    void to_query_does_not_finalize() {
        var job = client.addInput("users").map("Riak.mapValuesJson");

        var q = job.toQuery(null);

        assertEquals(1, q.phases().size());
        assertEquals(MapReduceJob.State.ACCUMULATING, job.state());
    }
}
