package io.riaklite.core;

import java.util.List;
import java.util.Objects;

/**
 * A link between two Riak objects: target bucket, target key and the tag
 * attached to the link.
 * <p>
 * Link phases return their results as JSON triples
 * {@code ["bucket", "key", "tag"]}; see {@link #fromTriple(List)}.
 */
public record RiakLink(
        String bucket,
        String key,
        String tag
) {
    public RiakLink {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(key, "key");
        if (bucket.isBlank()) throw new IllegalArgumentException("bucket must not be blank");
    }

    /** Build a link from a decoded {@code [bucket, key]} or {@code [bucket, key, tag]} triple. */
    public static RiakLink fromTriple(List<String> triple) {
        if (triple == null || triple.size() < 2 || triple.size() > 3) {
            throw new IllegalArgumentException("link must be [bucket, key] or [bucket, key, tag], got " + triple);
        }
        String tag = triple.size() == 3 ? triple.get(2) : null;
        return new RiakLink(triple.get(0), triple.get(1), tag);
    }
}
