package io.riaklite.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.riaklite.core.InvalidJobStateException;
import io.riaklite.core.RiakLink;
import io.riaklite.core.mapreduce.KeyFilter;
import io.riaklite.core.mapreduce.MapReduceFunction;
import io.riaklite.core.mapreduce.MapReduceInput;
import io.riaklite.core.mapreduce.MapReduceInput.BucketInput;
import io.riaklite.core.mapreduce.MapReduceInput.BucketKey;
import io.riaklite.core.mapreduce.MapReduceInput.BucketKeyInputs;
import io.riaklite.core.mapreduce.MapReduceInput.IndexInput;
import io.riaklite.core.mapreduce.MapReduceInput.SearchInput;
import io.riaklite.core.mapreduce.MapReducePhase;
import io.riaklite.core.mapreduce.MapReduceQuery;
import io.riaklite.core.mapreduce.MapReduceResult;
import io.riaklite.core.mapreduce.PhaseOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builder for one Map/Reduce job, bound to the {@link RiakClient} that runs it.
 * <p>
 * Lifecycle:
 * <pre>
 *   EMPTY --add phase--> ACCUMULATING --run()--> FINALIZED
 * </pre>
 * Every mutator returns {@code this}. Once {@link #run()} has been called
 * (successfully or not) the job is FINALIZED and every further mutator, or
 * another run, throws {@link InvalidJobStateException}.
 * <p>
 * Inputs come in four kinds (whole bucket, explicit keys, search, secondary
 * index). Only one kind may be set on a job; switching kinds fails fast.
 * Setting the same kind again replaces it, except explicit keys, which append.
 * <p>
 * Not thread safe: a job belongs to the caller that builds it.
 */
public final class MapReduceJob {

    public enum State { EMPTY, ACCUMULATING, FINALIZED }

    private final RiakClient client;
    private final List<MapReducePhase> phases = new ArrayList<>();
    private final List<BucketKey> keys = new ArrayList<>();
    private MapReduceInput inputs; // null until set; BucketKeyInputs is rebuilt from keys
    private State state = State.EMPTY;

    MapReduceJob(RiakClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public State state() {
        return state;
    }

    /** Phases in execution order (read-only view). */
    public List<MapReducePhase> phases() {
        return Collections.unmodifiableList(phases);
    }

    /** Current inputs, or null if none were set. */
    public MapReduceInput inputs() {
        return inputs;
    }

    // ---------- inputs ----------

    /** Run over every object in {@code bucket}. Replaces an earlier whole-bucket input. */
    public MapReduceJob add(String bucket) {
        ensureMutable();
        requireInputKind(BucketInput.class, "a whole bucket");
        inputs = new BucketInput(bucket);
        return this;
    }

    public MapReduceJob add(Bucket bucket) {
        return add(bucket.name());
    }

    /** Add one object to the explicit input list. */
    public MapReduceJob add(String bucket, String key) {
        return add(bucket, key, null);
    }

    /**
     * Add one object to the explicit input list.
     *
     * @param keyData passed to the first phase alongside the object; may be null
     */
    public MapReduceJob add(String bucket, String key, JsonNode keyData) {
        ensureMutable();
        requireInputKind(BucketKeyInputs.class, "explicit keys");
        keys.add(new BucketKey(bucket, key, keyData));
        inputs = new BucketKeyInputs(keys);
        return this;
    }

    /** Add the object a link points at. */
    public MapReduceJob add(RiakLink link) {
        return add(link.bucket(), link.key());
    }

    /** Run over the objects a Riak Search query matches. Replaces an earlier search. */
    public MapReduceJob search(String bucket, String query) {
        ensureMutable();
        requireInputKind(SearchInput.class, "a search query");
        inputs = new SearchInput(bucket, query);
        return this;
    }

    /** Run over the objects whose secondary index equals {@code key}. */
    public MapReduceJob index(String bucket, String index, String key) {
        ensureMutable();
        requireInputKind(IndexInput.class, "a secondary index query");
        inputs = IndexInput.exact(bucket, index, key);
        return this;
    }

    /** Run over the objects whose secondary index lies in {@code [start, end]}. */
    public MapReduceJob index(String bucket, String index, String start, String end) {
        ensureMutable();
        requireInputKind(IndexInput.class, "a secondary index query");
        inputs = IndexInput.range(bucket, index, start, end);
        return this;
    }

    // ---------- key filters ----------

    /** Same as {@link #keyFilterAnd}. */
    public MapReduceJob keyFilter(KeyFilter... filters) {
        return keyFilterAnd(filters);
    }

    /** AND the filters with whatever filters are already set. */
    public MapReduceJob keyFilterAnd(KeyFilter... filters) {
        return keyFilterOperator("and", filters);
    }

    /** OR the filters with whatever filters are already set. */
    public MapReduceJob keyFilterOr(KeyFilter... filters) {
        return keyFilterOperator("or", filters);
    }

    /**
     * The first call sets the filter chain; later calls combine the existing
     * chain with the new one: {@code [[operator, existing, new]]}.
     */
    public MapReduceJob keyFilterOperator(String operator, KeyFilter... filters) {
        ensureMutable();
        if (!(inputs instanceof BucketInput bucketInput)) {
            throw new InvalidJobStateException("key filters need a whole-bucket input");
        }
        if (filters.length == 0) {
            throw new IllegalArgumentException("at least one key filter is required");
        }
        List<KeyFilter> added = Arrays.asList(filters);
        List<KeyFilter> existing = bucketInput.keyFilters();
        List<KeyFilter> combined = existing.isEmpty()
                ? added
                : List.of(KeyFilter.combine(operator, existing, added));
        inputs = bucketInput.withKeyFilters(combined);
        return this;
    }

    // ---------- phases ----------

    public MapReduceJob addPhase(MapReducePhase phase) {
        ensureMutable();
        phases.add(Objects.requireNonNull(phase, "phase"));
        state = State.ACCUMULATING;
        return this;
    }

    /** Map phase with a named JavaScript function or JavaScript source. */
    public MapReduceJob map(String function) {
        return map(MapReduceFunction.of(function), PhaseOptions.none());
    }

    public MapReduceJob map(String function, PhaseOptions options) {
        return map(MapReduceFunction.of(function), options);
    }

    public MapReduceJob map(MapReduceFunction function, PhaseOptions options) {
        return addPhase(new MapReducePhase.Map(function, options));
    }

    /** Reduce phase with a named JavaScript function or JavaScript source. */
    public MapReduceJob reduce(String function) {
        return reduce(MapReduceFunction.of(function), PhaseOptions.none());
    }

    public MapReduceJob reduce(String function, PhaseOptions options) {
        return reduce(MapReduceFunction.of(function), options);
    }

    public MapReduceJob reduce(MapReduceFunction function, PhaseOptions options) {
        return addPhase(new MapReducePhase.Reduce(function, options));
    }

    /** Follow every link. */
    public MapReduceJob link() {
        return link(null, null, false);
    }

    /** Follow links into {@code bucket}, any tag. */
    public MapReduceJob link(String bucket) {
        return link(bucket, null, false);
    }

    /** Follow links; null bucket or tag match anything. */
    public MapReduceJob link(String bucket, String tag, boolean keep) {
        return addPhase(new MapReducePhase.Link(bucket, tag, keep));
    }

    // ---------- execution ----------

    public MapReduceResult run() {
        return run(null);
    }

    /**
     * Submit the job and wait for its result.
     *
     * @param timeout server-side timeout for the job; null for Riak's default
     * @throws InvalidJobStateException if the job already ran, has no phases or no inputs
     * @throws IllegalArgumentException if {@code timeout} is zero or negative; the job stays usable
     * @throws io.riaklite.core.RiakTransportException if the node cannot be reached or answers non-2xx
     * @throws io.riaklite.core.RiakProtocolException  on a malformed result
     */
    public MapReduceResult run(Duration timeout) {
        ensureMutable();
        if (phases.isEmpty()) {
            throw new InvalidJobStateException("cannot run a Map/Reduce job without phases");
        }
        if (inputs == null) {
            throw new InvalidJobStateException("cannot run a Map/Reduce job without inputs");
        }
        MapReduceQuery query = MapReduceQuery.of(inputs, phases, timeout);
        state = State.FINALIZED;
        return client.submit(query, timeout);
    }

    /** The job document {@link #run(Duration)} would send, without sending it. */
    public MapReduceQuery toQuery(Duration timeout) {
        if (phases.isEmpty() || inputs == null) {
            throw new InvalidJobStateException("a Map/Reduce job needs inputs and at least one phase");
        }
        return MapReduceQuery.of(inputs, phases, timeout);
    }

    private void ensureMutable() {
        if (state == State.FINALIZED) {
            throw new InvalidJobStateException("Map/Reduce job already ran; build a new one");
        }
    }

    private void requireInputKind(Class<? extends MapReduceInput> kind, String what) {
        if (inputs != null && !kind.isInstance(inputs)) {
            throw new InvalidJobStateException(
                    "job already has " + describe(inputs) + " input; cannot also use " + what);
        }
    }

    private static String describe(MapReduceInput input) {
        if (input instanceof BucketInput) return "a whole-bucket";
        if (input instanceof BucketKeyInputs) return "an explicit-key";
        if (input instanceof SearchInput) return "a search";
        return "a secondary-index";
    }
}
