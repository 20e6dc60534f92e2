package ai.bombbuster.solver;

import java.util.Arrays;

/**
 * Copies consumed per value rank. Used for the deck, partial sums of hands and hand signatures.
 */
public final class ResourceVector {
    private final int[] counts;
    private final int hash;

    private ResourceVector(int[] counts) {
        this.counts = counts;
        this.hash = Arrays.hashCode(counts);
    }

    public static ResourceVector of(int... counts) {
        return new ResourceVector(counts.clone());
    }

    public static ResourceVector zero(int length) {
        return new ResourceVector(new int[length]);
    }

    public int length() {
        return counts.length;
    }

    public int get(int rank) {
        return counts[rank];
    }

    /** Sum of all coordinates. */
    public int total() {
        int sum = 0;
        for (int count : counts) {
            sum += count;
        }
        return sum;
    }

    /** Componentwise sum, or {@code null} if any coordinate would exceed {@code cap}. */
    public ResourceVector plusWithin(ResourceVector other, ResourceVector cap) {
        int[] sum = new int[counts.length];
        for (int i = 0; i < counts.length; i++) {
            sum[i] = counts[i] + other.counts[i];
            if (sum[i] > cap.counts[i]) {
                return null;
            }
        }
        return new ResourceVector(sum);
    }

    /** Componentwise difference, or {@code null} if any coordinate would go negative. */
    public ResourceVector minus(ResourceVector other) {
        int[] diff = new int[counts.length];
        for (int i = 0; i < counts.length; i++) {
            diff[i] = counts[i] - other.counts[i];
            if (diff[i] < 0) {
                return null;
            }
        }
        return new ResourceVector(diff);
    }

    /** Whether every coordinate is at most the matching one of {@code cap}. */
    public boolean fitsWithin(ResourceVector cap) {
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > cap.counts[i]) {
                return false;
            }
        }
        return true;
    }

    public int[] toArray() {
        return counts.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceVector other)) {
            return false;
        }
        return hash == other.hash && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(counts);
    }
}
