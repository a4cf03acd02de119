package io.riaklite.client;

import io.riaklite.core.Quorum;

import java.util.Objects;

/**
 * Proxy for a server-side bucket. Creating one never talks to the node.
 * <p>
 * A bucket may override the client's quorum defaults. Resolution order for
 * R (and likewise W, DW):
 *  1. the value passed to the call, if any;
 *  2. the bucket's own override, if set;
 *  3. the client's current default.
 */
public final class Bucket {

    private final RiakClient client; // back-reference, not owned
    private final String name;

    private Integer r;
    private Integer w;
    private Integer dw;

    Bucket(RiakClient client, String name) {
        this.client = Objects.requireNonNull(client, "client");
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("bucket name must not be blank");
        this.name = name;
    }

    public String name() {
        return name;
    }

    public RiakClient client() {
        return client;
    }

    public int getR() {
        return getR(null);
    }

    public int getR(Integer explicit) {
        return resolve(explicit, r, client.getR());
    }

    public Bucket setR(int r) {
        this.r = Quorum.requirePositive("R", r);
        return this;
    }

    public int getW() {
        return getW(null);
    }

    public int getW(Integer explicit) {
        return resolve(explicit, w, client.getW());
    }

    public Bucket setW(int w) {
        this.w = Quorum.requirePositive("W", w);
        return this;
    }

    public int getDW() {
        return getDW(null);
    }

    public int getDW(Integer explicit) {
        return resolve(explicit, dw, client.getDW());
    }

    public Bucket setDW(int dw) {
        this.dw = Quorum.requirePositive("DW", dw);
        return this;
    }

    private static int resolve(Integer explicit, Integer override, int clientDefault) {
        if (explicit != null) return Quorum.requirePositive("quorum", explicit);
        if (override != null) return override;
        return clientDefault;
    }

    /** A Map/Reduce job over every object in this bucket. */
    public MapReduceJob mapReduce() {
        return client.mapReduce().add(name);
    }

    /** A Map/Reduce job over the results of a search in this bucket. */
    public MapReduceJob search(String query) {
        return client.mapReduce().search(name, query);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bucket b)) return false;
        return client == b.client && name.equals(b.name);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(client) + name.hashCode();
    }

    @Override
    public String toString() {
        return "Bucket{" + name + "}";
    }
}
