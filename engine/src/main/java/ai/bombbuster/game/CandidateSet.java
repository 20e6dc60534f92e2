package ai.bombbuster.game;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * The values still possible at one hand slot.
 * <p>
 * An immutable view over a rank bit mask of a {@link ValueDomain}. Instances are handed out by
 * read-only queries; the live grid keeps raw masks.
 * <ul>
 *   <li><b>Pinned:</b> exactly one value remains (revealed or deduced).</li>
 *   <li><b>Empty:</b> the state is contradictory; filters never produce this on their own.</li>
 * </ul>
 */
public final class CandidateSet implements Iterable<Double> {
    private final ValueDomain domain;
    private final long mask;

    public CandidateSet(ValueDomain domain, long mask) {
        this.domain = Objects.requireNonNull(domain, "domain");
        if ((mask & ~domain.fullMask()) != 0) {
            throw new IllegalArgumentException("Mask has bits outside the value domain");
        }
        this.mask = mask;
    }

    /** Candidate set holding exactly the given values. */
    public static CandidateSet of(ValueDomain domain, double... values) {
        long mask = 0L;
        for (double value : values) {
            mask |= 1L << domain.requireRank(value);
        }
        return new CandidateSet(domain, mask);
    }

    public long mask() {
        return mask;
    }

    public int size() {
        return Long.bitCount(mask);
    }

    public boolean isEmpty() {
        return mask == 0L;
    }

    public boolean isPinned() {
        return Long.bitCount(mask) == 1;
    }

    public boolean contains(double value) {
        int rank = domain.rankOf(value);
        return rank >= 0 && (mask & (1L << rank)) != 0;
    }

    /**
     * Returns the only remaining value.
     *
     * @throws IllegalStateException if the set is not pinned
     */
    public double pinnedValue() {
        if (!isPinned()) {
            throw new IllegalStateException("Candidate set " + this + " is not pinned");
        }
        return domain.value(Long.numberOfTrailingZeros(mask));
    }

    /** Smallest candidate; the set must not be empty. */
    public double min() {
        requireNonEmpty();
        return domain.value(Long.numberOfTrailingZeros(mask));
    }

    /** Largest candidate; the set must not be empty. */
    public double max() {
        requireNonEmpty();
        return domain.value(63 - Long.numberOfLeadingZeros(mask));
    }

    /** Candidates in ascending order. */
    public List<Double> values() {
        return domain.valuesOf(mask);
    }

    @Override
    public Iterator<Double> iterator() {
        return values().iterator();
    }

    private void requireNonEmpty() {
        if (mask == 0L) {
            throw new IllegalStateException("Candidate set is empty");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CandidateSet)) {
            return false;
        }
        CandidateSet other = (CandidateSet) o;
        return mask == other.mask && domain.equals(other.domain);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(mask);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (double value : values()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(ValueDomain.format(value));
            first = false;
        }
        return sb.append('}').toString();
    }
}
