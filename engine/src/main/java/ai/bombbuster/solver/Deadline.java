package ai.bombbuster.solver;

import java.time.Duration;

/**
 * A wall-clock budget shared by every phase of one solve.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /** Deadline {@code budget} from now; a zero or negative budget means "no deadline". */
    public static Deadline after(Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return NONE;
        }
        long now = System.nanoTime();
        long nanos = budget.toNanos();
        return new Deadline(Long.MAX_VALUE - now < nanos ? Long.MAX_VALUE : now + nanos);
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isUnbounded() {
        return deadlineNanos == Long.MAX_VALUE;
    }

    public long remainingMillis() {
        if (isUnbounded()) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    public boolean isExpired() {
        return !isUnbounded() && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * @throws SolverTimeoutException if the budget is spent
     */
    public void check(String phase) {
        if (isExpired()) {
            throw new SolverTimeoutException(phase);
        }
    }
}
