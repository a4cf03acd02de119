package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * The function a map or reduce phase runs on the Riak node.
 * <p>
 * Three shapes are understood by Riak:
 *  - a named JavaScript function, e.g. {@code Riak.mapValuesJson};
 *  - inline JavaScript source, e.g. {@code function(v) { return [v]; }};
 *  - an Erlang module/function pair, e.g. {@code riak_kv_mapreduce:reduce_sort}.
 */
public sealed interface MapReduceFunction {

    /** Write the language and function fields into a phase object. */
    void writeTo(ObjectNode phase);

    /**
     * Interpret a plain string: anything containing {@code '{'} is JavaScript
     * source, anything else a named JavaScript function.
     */
    static MapReduceFunction of(String function) {
        Objects.requireNonNull(function, "function");
        if (function.isBlank()) throw new IllegalArgumentException("function must not be blank");
        return function.contains("{")
                ? new JavascriptSource(function)
                : new JavascriptNamed(function);
    }

    static MapReduceFunction erlang(String module, String function) {
        return new Erlang(module, function);
    }

    record JavascriptNamed(String name) implements MapReduceFunction {
        public JavascriptNamed {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public void writeTo(ObjectNode phase) {
            phase.put("language", "javascript");
            phase.put("name", name);
        }
    }

    record JavascriptSource(String source) implements MapReduceFunction {
        public JavascriptSource {
            Objects.requireNonNull(source, "source");
        }

        @Override
        public void writeTo(ObjectNode phase) {
            phase.put("language", "javascript");
            phase.put("source", source);
        }
    }

    record Erlang(String module, String function) implements MapReduceFunction {
        public Erlang {
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(function, "function");
            if (module.isBlank() || function.isBlank()) {
                throw new IllegalArgumentException("erlang module and function must not be blank");
            }
        }

        @Override
        public void writeTo(ObjectNode phase) {
            phase.put("language", "erlang");
            phase.put("module", module);
            phase.put("function", function);
        }
    }
}
