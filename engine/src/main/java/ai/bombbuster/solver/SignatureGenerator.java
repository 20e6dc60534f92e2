package ai.bombbuster.solver;

import java.util.HashSet;
import java.util.Set;

/**
 * Enumerates every sorted hand a player can hold and returns it as a resource vector.
 * <p>
 * The search fills slots left to right with non-decreasing ranks taken from each slot's mask,
 * never exceeding the deck's copies of a rank and honouring adjacent equal/different links.
 * Branches are cut as soon as the per-rank floors ({@code minCounts}) can no longer be met:
 * either too few slots remain, or a rank with an unmet floor has already been passed.
 * <p>
 * Sorted hands and count vectors are in one-to-one correspondence, so the signature set is
 * exactly the set of valid hands.
 */
public final class SignatureGenerator {
    private static final int DEADLINE_CHECK_INTERVAL = 4096;

    private final PlayerProblem problem;
    private final Deadline deadline;
    private final int limit;
    private final int[] hand;
    private final int[] counts;
    private final Set<ResourceVector> signatures = new HashSet<>();
    private int unmetFloor;
    private long visited;

    private SignatureGenerator(PlayerProblem problem, Deadline deadline, int limit) {
        this.problem = problem;
        this.deadline = deadline;
        this.limit = limit;
        this.hand = new int[problem.handSize()];
        this.counts = new int[problem.ranks()];
        for (int rank = 0; rank < problem.ranks(); rank++) {
            unmetFloor += problem.minCount(rank);
        }
    }

    /**
     * Generates all signatures of a player.
     *
     * @throws SolverTimeoutException if the deadline passes mid-search
     */
    public static Set<ResourceVector> generate(PlayerProblem problem, Deadline deadline) {
        return generate(problem, deadline, Integer.MAX_VALUE);
    }

    /**
     * Generates signatures, stopping once more than {@code limit} were found. A result larger than
     * {@code limit} therefore means "too many to enumerate" and is incomplete.
     *
     * @throws SolverTimeoutException if the deadline passes mid-search
     */
    public static Set<ResourceVector> generate(PlayerProblem problem, Deadline deadline, int limit) {
        SignatureGenerator generator = new SignatureGenerator(problem, deadline, limit);
        generator.fill(0, 0);
        return generator.signatures;
    }

    private boolean fill(int position, int minRank) {
        if (++visited % DEADLINE_CHECK_INTERVAL == 0) {
            deadline.check("signature generation for player " + problem.player());
        }
        if (position == hand.length) {
            if (unmetFloor == 0) {
                signatures.add(ResourceVector.of(counts));
            }
            return signatures.size() <= limit;
        }
        if (unmetFloor > hand.length - position) {
            return true;
        }
        int lowestUnmet = lowestUnmetRank(minRank);
        long mask = problem.slotMask(position) & (-1L << minRank);
        while (mask != 0) {
            int rank = Long.numberOfTrailingZeros(mask);
            mask &= mask - 1;
            if (lowestUnmet >= 0 && rank > lowestUnmet) {
                // Passing a rank whose floor is unmet can never be repaired.
                break;
            }
            if (counts[rank] >= problem.deckCount(rank) || !linkAllows(position, rank)) {
                continue;
            }
            hand[position] = rank;
            boolean coversFloor = counts[rank] < problem.minCount(rank);
            counts[rank]++;
            if (coversFloor) {
                unmetFloor--;
            }
            boolean keepGoing = fill(position + 1, rank);
            counts[rank]--;
            if (coversFloor) {
                unmetFloor++;
            }
            if (!keepGoing) {
                return false;
            }
        }
        return true;
    }

    private int lowestUnmetRank(int fromRank) {
        for (int rank = fromRank; rank < counts.length; rank++) {
            if (counts[rank] < problem.minCount(rank)) {
                return rank;
            }
        }
        return -1;
    }

    private boolean linkAllows(int position, int rank) {
        if (position == 0) {
            return true;
        }
        byte link = problem.linkToPrevious(position);
        if (link == PlayerProblem.EQUAL_TO_PREVIOUS) {
            return hand[position - 1] == rank;
        }
        if (link == PlayerProblem.DIFFERENT_FROM_PREVIOUS) {
            return hand[position - 1] != rank;
        }
        return true;
    }
}
