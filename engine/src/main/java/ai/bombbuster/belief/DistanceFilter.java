package ai.bombbuster.belief;

import ai.bombbuster.game.ValueTracker;

/**
 * Copies of one value in a sorted hand are contiguous. If a player holds at most {@code k} copies
 * and some are already pinned, the rest must lie within {@code k} slots of those anchors.
 * <p>
 * Anchors are the player's tracked slots for the value plus any singleton slot holding it. The
 * window is the anchor count plus the value's uncertain copies, plus one when the player is known
 * to hold an unplaced copy. The value survives only on slots covered by some window of that size
 * containing every anchor.
 */
class DistanceFilter implements BeliefFilter {

    @Override
    public String name() {
        return "distance";
    }

    @Override
    public boolean apply(BeliefState state) {
        boolean changed = false;
        int handSize = state.handSize();
        for (int player = 0; player < state.players(); player++) {
            if (player == state.owner()) {
                continue;
            }
            for (int rank = 0; rank < state.domain().size(); rank++) {
                ValueTracker tracker = state.tracker(rank);
                long bit = Masks.bit(rank);
                int anchors = 0;
                int lo = handSize;
                int hi = -1;
                for (int pos = 0; pos < handSize; pos++) {
                    boolean pinned = state.mask(player, pos) == bit
                            || tracker.isRevealed(player, pos)
                            || tracker.isCertain(player, pos);
                    if (pinned) {
                        anchors++;
                        lo = Math.min(lo, pos);
                        hi = Math.max(hi, pos);
                    }
                }
                if (anchors == 0) {
                    continue;
                }
                int window = anchors + Math.max(0, tracker.uncertain()) + (tracker.isCalled(player) ? 1 : 0);
                if (window >= handSize || hi - lo + 1 > window) {
                    continue;
                }
                int firstStart = Math.max(0, hi - window + 1);
                int lastEnd = Math.min(handSize - 1, lo + window - 1);
                long without = ~bit;
                for (int pos = 0; pos < handSize; pos++) {
                    if (pos < firstStart || pos > lastEnd) {
                        changed |= state.narrow(player, pos, without);
                    }
                }
            }
        }
        return changed;
    }
}
