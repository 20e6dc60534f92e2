package ai.bombbuster.game;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The globally known wire values of one game together with their copy counts.
 * <p>
 * Values are kept in ascending order and addressed by <em>rank</em> (index into that order).
 * Every candidate set in the engine is a {@code long} bit mask over ranks, so a domain may hold
 * at most {@value #MAX_VALUES} distinct values. Non-integer tie-breaker values (e.g. {@code 6.5})
 * are allowed and sort between their integer neighbours.
 */
public final class ValueDomain {
    public static final int MAX_VALUES = 64;

    private final double[] values;
    private final int[] copies;
    private final int deckSize;

    /**
     * Builds a domain from a value → copy-count distribution.
     *
     * @param distribution copies per value; must be non-empty with positive counts
     * @throws IllegalArgumentException if the distribution is empty, too large, or has a non-positive count
     */
    public ValueDomain(Map<Double, Integer> distribution) {
        Objects.requireNonNull(distribution, "distribution");
        if (distribution.isEmpty()) {
            throw new IllegalArgumentException("Value distribution must not be empty");
        }
        if (distribution.size() > MAX_VALUES) {
            throw new IllegalArgumentException("At most " + MAX_VALUES + " distinct values are supported, got "
                    + distribution.size());
        }
        TreeMap<Double, Integer> sorted = new TreeMap<>(distribution);
        values = new double[sorted.size()];
        copies = new int[sorted.size()];
        int rank = 0;
        int total = 0;
        for (Map.Entry<Double, Integer> entry : sorted.entrySet()) {
            Double value = Objects.requireNonNull(entry.getKey(), "value");
            Integer count = entry.getValue();
            if (value.isNaN() || value.isInfinite()) {
                throw new IllegalArgumentException("Value must be finite: " + value);
            }
            if (count == null || count <= 0) {
                throw new IllegalArgumentException("Value " + format(value) + " must have a positive copy count, got "
                        + count);
            }
            values[rank] = value;
            copies[rank] = count;
            total += count;
            rank++;
        }
        deckSize = total;
    }

    /** Number of distinct values. */
    public int size() {
        return values.length;
    }

    public double value(int rank) {
        return values[rank];
    }

    public int copies(int rank) {
        return copies[rank];
    }

    /**
     * Returns the rank of a value, or {@code -1} when the value is not part of this domain.
     */
    public int rankOf(double value) {
        int rank = Arrays.binarySearch(values, value);
        return rank >= 0 ? rank : -1;
    }

    public boolean contains(double value) {
        return rankOf(value) >= 0;
    }

    /**
     * Returns the rank of a value, failing when the value is unknown.
     *
     * @throws IllegalArgumentException if the value is not in the domain
     */
    public int requireRank(double value) {
        int rank = rankOf(value);
        if (rank < 0) {
            throw new IllegalArgumentException("Value " + format(value) + " is not in the value domain " + this);
        }
        return rank;
    }

    public int copiesOf(double value) {
        return copies[requireRank(value)];
    }

    /** Total number of wires in the game (sum of all copies). */
    public int deckSize() {
        return deckSize;
    }

    /** Mask with one bit per value, i.e. "anything is possible". */
    public long fullMask() {
        return values.length == 64 ? -1L : (1L << values.length) - 1;
    }

    /** Mask of every value whose total copy count equals {@code copyCount}. */
    public long maskWithCopies(int copyCount) {
        long mask = 0L;
        for (int rank = 0; rank < copies.length; rank++) {
            if (copies[rank] == copyCount) {
                mask |= 1L << rank;
            }
        }
        return mask;
    }

    /** Copy counts indexed by rank; a fresh array each call. */
    public int[] deckVector() {
        return copies.clone();
    }

    /** Ascending list of values. */
    public List<Double> values() {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return Collections.unmodifiableList(list);
    }

    /** Values contained in a rank mask, ascending. */
    public List<Double> valuesOf(long mask) {
        List<Double> list = new ArrayList<>(Long.bitCount(mask));
        long remaining = mask;
        while (remaining != 0) {
            int rank = Long.numberOfTrailingZeros(remaining);
            list.add(values[rank]);
            remaining &= remaining - 1;
        }
        return list;
    }

    /**
     * Formats a value the way it is shown in logs and persisted JSON: integral values without a
     * fraction ({@code 3}), tie-breakers with one ({@code 6.5}).
     */
    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Parses a compact distribution such as {@code "1:2,2:3,6.5:1"}.
     *
     * @throws IllegalArgumentException on malformed input
     */
    public static ValueDomain parse(String text) {
        Objects.requireNonNull(text, "text");
        Map<Double, Integer> distribution = new TreeMap<>();
        for (String part : text.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] pieces = trimmed.split(":");
            if (pieces.length != 2) {
                throw new IllegalArgumentException("Expected value:copies but got '" + trimmed + "'");
            }
            try {
                double value = Double.parseDouble(pieces[0].trim());
                int count = Integer.parseInt(pieces[1].trim());
                if (distribution.put(value, count) != null) {
                    throw new IllegalArgumentException("Duplicate value " + format(value) + " in '" + text + "'");
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed distribution entry '" + trimmed + "'", e);
            }
        }
        return new ValueDomain(distribution);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueDomain)) {
            return false;
        }
        ValueDomain other = (ValueDomain) o;
        return Arrays.equals(values, other.values) && Arrays.equals(copies, other.copies);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Arrays.hashCode(copies);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int rank = 0; rank < values.length; rank++) {
            if (rank > 0) {
                sb.append(", ");
            }
            sb.append(format(values[rank])).append(':').append(copies[rank]);
        }
        return sb.append('}').toString();
    }
}
