package ai.bombbuster.solver;

import ai.bombbuster.game.AdjacentConstraint;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of everything that decides one player's signature set: slot masks, adjacent
 * constraints, per-value floors and the deck.
 * <p>
 * Equality is content equality, which makes the snapshot its own signature-cache key. Copy-count
 * constraints are expected to be folded into {@code slotMasks} already.
 */
public final class PlayerProblem {
    static final byte NO_LINK = 0;
    static final byte EQUAL_TO_PREVIOUS = 1;
    static final byte DIFFERENT_FROM_PREVIOUS = 2;

    private final int player;
    private final long[] slotMasks;
    private final byte[] linkToPrevious;
    private final int[] minCounts;
    private final int[] deck;
    private final int hash;

    /**
     * @param player player id (part of the cache key)
     * @param slotMasks candidate rank mask per slot
     * @param adjacent adjacent-slot constraints of this player
     * @param minCounts lower bound on the copies of each rank in the hand
     * @param deck copies of each rank in the game
     */
    public PlayerProblem(int player, long[] slotMasks, List<AdjacentConstraint> adjacent, int[] minCounts,
                         int[] deck) {
        Objects.requireNonNull(adjacent, "adjacent");
        if (minCounts.length != deck.length) {
            throw new IllegalArgumentException("minCounts and deck must have the same length");
        }
        this.player = player;
        this.slotMasks = slotMasks.clone();
        this.linkToPrevious = new byte[slotMasks.length];
        for (AdjacentConstraint constraint : adjacent) {
            if (constraint.right() >= slotMasks.length) {
                throw new IllegalArgumentException("Adjacent constraint " + constraint + " is outside the hand");
            }
            linkToPrevious[constraint.right()] = constraint.equal() ? EQUAL_TO_PREVIOUS : DIFFERENT_FROM_PREVIOUS;
        }
        this.minCounts = minCounts.clone();
        this.deck = deck.clone();
        int h = player;
        h = 31 * h + Arrays.hashCode(this.slotMasks);
        h = 31 * h + Arrays.hashCode(linkToPrevious);
        h = 31 * h + Arrays.hashCode(this.minCounts);
        h = 31 * h + Arrays.hashCode(this.deck);
        this.hash = h;
    }

    public int player() {
        return player;
    }

    public int handSize() {
        return slotMasks.length;
    }

    public int ranks() {
        return deck.length;
    }

    long slotMask(int position) {
        return slotMasks[position];
    }

    byte linkToPrevious(int position) {
        return linkToPrevious[position];
    }

    int minCount(int rank) {
        return minCounts[rank];
    }

    int deckCount(int rank) {
        return deck[rank];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlayerProblem other)) {
            return false;
        }
        return hash == other.hash
                && player == other.player
                && Arrays.equals(slotMasks, other.slotMasks)
                && Arrays.equals(linkToPrevious, other.linkToPrevious)
                && Arrays.equals(minCounts, other.minCounts)
                && Arrays.equals(deck, other.deck);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "PlayerProblem{player=" + player + ", slots=" + slotMasks.length + ", minCounts="
                + Arrays.toString(minCounts) + '}';
    }
}
