package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * What a Map/Reduce job runs over: the {@code "inputs"} member of the job document.
 * <pre>
 *   whole bucket:      "people"
 *   bucket + filters:  {"bucket": "people", "key_filters": [["ends_with", "-2024"]]}
 *   explicit keys:     [["people", "alice"], ["people", "bob", {"weight": 2}]]
 *   search:            {"module": "riak_search", "function": "mapred_search", "arg": ["people", "name:al*"]}
 *   secondary index:   {"bucket": "people", "index": "age_int", "start": 18, "end": 30}
 * </pre>
 */
public sealed interface MapReduceInput {

    JsonNode toJson();

    record BucketInput(String bucket, List<KeyFilter> keyFilters) implements MapReduceInput {
        public BucketInput {
            requireBucket(bucket);
            keyFilters = keyFilters == null ? List.of() : List.copyOf(keyFilters);
        }

        public BucketInput(String bucket) {
            this(bucket, List.of());
        }

        public BucketInput withKeyFilters(List<KeyFilter> filters) {
            return new BucketInput(bucket, filters);
        }

        @Override
        public JsonNode toJson() {
            if (keyFilters.isEmpty()) {
                return JsonNodeFactory.instance.textNode(bucket);
            }
            ObjectNode n = JsonNodeFactory.instance.objectNode();
            n.put("bucket", bucket);
            n.set("key_filters", KeyFilter.toJson(keyFilters));
            return n;
        }
    }

    /** One explicit object: bucket, key and optional key data handed to the first phase. */
    record BucketKey(String bucket, String key, JsonNode keyData) {
        public BucketKey {
            requireBucket(bucket);
            Objects.requireNonNull(key, "key");
        }
    }

    record BucketKeyInputs(List<BucketKey> keys) implements MapReduceInput {
        public BucketKeyInputs {
            keys = List.copyOf(keys);
        }

        @Override
        public JsonNode toJson() {
            ArrayNode a = JsonNodeFactory.instance.arrayNode();
            for (BucketKey k : keys) {
                ArrayNode entry = a.addArray().add(k.bucket()).add(k.key());
                if (k.keyData() != null) {
                    entry.add(k.keyData());
                }
            }
            return a;
        }
    }

    record SearchInput(String bucket, String query) implements MapReduceInput {
        public SearchInput {
            requireBucket(bucket);
            Objects.requireNonNull(query, "query");
        }

        @Override
        public JsonNode toJson() {
            ObjectNode n = JsonNodeFactory.instance.objectNode();
            n.put("module", "riak_search");
            n.put("function", "mapred_search");
            n.putArray("arg").add(bucket).add(query);
            return n;
        }
    }

    /**
     * Secondary-index query: either an exact {@code key} or a {@code start..end} range.
     * Exactly one of the two shapes must be given.
     */
    record IndexInput(String bucket, String index, String key, String start, String end) implements MapReduceInput {

        private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");

        public IndexInput {
            requireBucket(bucket);
            Objects.requireNonNull(index, "index");
            boolean exact = key != null;
            boolean range = start != null && end != null;
            if (exact == range) {
                throw new IllegalArgumentException("index input needs either a key or a start/end range");
            }
        }

        public static IndexInput exact(String bucket, String index, String key) {
            return new IndexInput(bucket, index, key, null, null);
        }

        public static IndexInput range(String bucket, String index, String start, String end) {
            return new IndexInput(bucket, index, null, start, end);
        }

        @Override
        public JsonNode toJson() {
            ObjectNode n = JsonNodeFactory.instance.objectNode();
            n.put("bucket", bucket);
            n.put("index", index);
            if (key != null) {
                putIndexValue(n, "key", key);
            } else {
                putIndexValue(n, "start", start);
                putIndexValue(n, "end", end);
            }
            return n;
        }

        // Integer indexes ("*_int") take numeric bounds.
        private void putIndexValue(ObjectNode n, String field, String value) {
            if (index.endsWith("_int") && INTEGER.matcher(value).matches()) {
                n.put(field, Long.parseLong(value));
            } else {
                n.put(field, value);
            }
        }
    }

    private static void requireBucket(String bucket) {
        Objects.requireNonNull(bucket, "bucket");
        if (bucket.isBlank()) throw new IllegalArgumentException("bucket must not be blank");
    }
}
