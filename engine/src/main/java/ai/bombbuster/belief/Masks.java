package ai.bombbuster.belief;

/**
 * Rank mask helpers.
 */
final class Masks {

    private Masks() {
    }

    static long bit(int rank) {
        return 1L << rank;
    }

    static int lowest(long mask) {
        return Long.numberOfTrailingZeros(mask);
    }

    static int highest(long mask) {
        return 63 - Long.numberOfLeadingZeros(mask);
    }

    /** Ranks {@code 0..rank} inclusive. */
    static long atMost(int rank) {
        return rank >= 63 ? -1L : (1L << (rank + 1)) - 1;
    }

    /** Ranks {@code rank..63} inclusive. */
    static long atLeast(int rank) {
        return -1L << rank;
    }

    static boolean isSingleton(long mask) {
        return mask != 0 && (mask & (mask - 1)) == 0;
    }
}
