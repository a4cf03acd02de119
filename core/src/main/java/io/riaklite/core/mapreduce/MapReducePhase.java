// file: core/src/main/java/io/riaklite/core/mapreduce/MapReducePhase.java
package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One step of a Map/Reduce query.
 * <p>
 * Wire shape (one element of the {@code "query"} array):
 * <pre>
 *   {"map":    {"language": "javascript", "name": "Riak.mapValuesJson", "keep": false, "arg": ...}}
 *   {"reduce": {"language": "erlang", "module": "riak_kv_mapreduce", "function": "reduce_sort", "keep": true}}
 *   {"link":   {"bucket": "people", "tag": "friend", "keep": false}}
 * </pre>
 * {@code "arg"} is only written when present.
 */
public sealed interface MapReducePhase {

    /** Wildcard accepted by link phases for bucket and tag. */
    String ANY = "_";

    boolean keep();

    /** Same phase with the keep flag replaced. */
    MapReducePhase withKeep(boolean keep);

    /** Key of the phase object in the query array ("map", "reduce", "link"). */
    String kind();

    /** Body of the phase object, without the enclosing kind key. */
    ObjectNode body();

    default ObjectNode toJson() {
        ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
        wrapper.set(kind(), body());
        return wrapper;
    }

    record Map(MapReduceFunction function, PhaseOptions options) implements MapReducePhase {
        public Map {
            Objects.requireNonNull(function, "function");
            options = options == null ? PhaseOptions.none() : options;
        }

        @Override public boolean keep() { return options.keep(); }

        @Override
        public Map withKeep(boolean keep) {
            return new Map(function, options.withKeep(keep));
        }

        @Override public String kind() { return "map"; }

        @Override
        public ObjectNode body() {
            return functionBody(function, options);
        }
    }

    record Reduce(MapReduceFunction function, PhaseOptions options) implements MapReducePhase {
        public Reduce {
            Objects.requireNonNull(function, "function");
            options = options == null ? PhaseOptions.none() : options;
        }

        @Override public boolean keep() { return options.keep(); }

        @Override
        public Reduce withKeep(boolean keep) {
            return new Reduce(function, options.withKeep(keep));
        }

        @Override public String kind() { return "reduce"; }

        @Override
        public ObjectNode body() {
            return functionBody(function, options);
        }
    }

    record Link(String bucket, String tag, boolean keep) implements MapReducePhase {
        public Link {
            bucket = bucket == null || bucket.isBlank() ? ANY : bucket;
            tag = tag == null || tag.isBlank() ? ANY : tag;
        }

        @Override
        public Link withKeep(boolean keep) {
            return new Link(bucket, tag, keep);
        }

        @Override public String kind() { return "link"; }

        @Override
        public ObjectNode body() {
            ObjectNode n = JsonNodeFactory.instance.objectNode();
            n.put("bucket", bucket);
            n.put("tag", tag);
            n.put("keep", keep);
            return n;
        }
    }

    private static ObjectNode functionBody(MapReduceFunction function, PhaseOptions options) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        function.writeTo(n);
        n.put("keep", options.keep());
        if (options.arg() != null) {
            n.set("arg", options.arg());
        }
        return n;
    }
}
