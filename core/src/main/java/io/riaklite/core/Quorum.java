package io.riaklite.core;

/**
 * Riak quorum values (R, W, DW).
 * <p>
 * R: replicas that must answer a read.
 * W: replicas that must acknowledge a write.
 * DW: replicas that must durably persist a write.
 */
public final class Quorum {

    public static final int DEFAULT_R = 2;
    public static final int DEFAULT_W = 2;
    public static final int DEFAULT_DW = 2;

    private Quorum() {
        // constants
    }

    /** @return {@code value} if positive, otherwise throws. */
    public static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
        return value;
    }
}
