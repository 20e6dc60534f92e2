package ai.bombbuster.belief;

import ai.bombbuster.game.ValueTracker;

/**
 * Existence and threshold reasoning per player.
 * <p>
 * The copies of a value that can still be in a player's hand are the value's uncertain copies,
 * one more if the player is known to hold an unplaced copy, and the player's own pinned copies.
 * <ul>
 *   <li><b>Existence:</b> none available removes the value from the whole hand.</li>
 *   <li><b>Descending threshold:</b> walking values from high to low, a value at slot {@code i}
 *       needs every later slot filled by values at least as large; slots before
 *       {@code handSize - (copies of this value and above)} are ruled out.</li>
 *   <li><b>Ascending threshold:</b> the mirror image for low values and late slots.</li>
 * </ul>
 */
class ThresholdFilter implements BeliefFilter {

    @Override
    public String name() {
        return "threshold";
    }

    @Override
    public boolean apply(BeliefState state) {
        boolean changed = false;
        int handSize = state.handSize();
        int ranks = state.domain().size();
        for (int player = 0; player < state.players(); player++) {
            if (player == state.owner()) {
                continue;
            }
            int[] available = new int[ranks];
            for (int rank = 0; rank < ranks; rank++) {
                ValueTracker tracker = state.tracker(rank);
                available[rank] = Math.max(0, tracker.uncertain())
                        + (tracker.isCalled(player) ? 1 : 0)
                        + tracker.pinnedCount(player);
                if (available[rank] == 0) {
                    changed |= removeFrom(state, player, rank, 0, handSize);
                }
            }

            int threshold = handSize;
            for (int rank = ranks - 1; rank >= 0; rank--) {
                if (available[rank] == 0) {
                    continue;
                }
                threshold -= available[rank];
                if (threshold > 0 && threshold < handSize) {
                    changed |= removeFrom(state, player, rank, 0, threshold);
                }
            }

            threshold = 0;
            for (int rank = 0; rank < ranks; rank++) {
                if (available[rank] == 0) {
                    continue;
                }
                threshold += available[rank];
                if (threshold > 0 && threshold < handSize) {
                    changed |= removeFrom(state, player, rank, threshold, handSize);
                }
            }
        }
        return changed;
    }

    private static boolean removeFrom(BeliefState state, int player, int rank, int from, int to) {
        boolean changed = false;
        long without = ~Masks.bit(rank);
        for (int pos = from; pos < to; pos++) {
            changed |= state.narrow(player, pos, without);
        }
        return changed;
    }
}
