package ai.bombbuster.belief;

import ai.bombbuster.game.AdjacentConstraint;
import ai.bombbuster.game.CopyCountConstraint;

/**
 * Enforces signalled slot constraints locally.
 * <ul>
 *   <li>Copy-count: the slot keeps only values with that many copies in the game.</li>
 *   <li>Adjacent equal: both slots keep the intersection of their candidates.</li>
 *   <li>Adjacent different: in a sorted hand this means strictly increasing, so the left slot
 *       stays below the right slot's maximum and the right slot above the left slot's minimum.</li>
 * </ul>
 */
class SlotConstraintFilter implements BeliefFilter {

    @Override
    public String name() {
        return "slot-constraints";
    }

    @Override
    public boolean apply(BeliefState state) {
        boolean changed = false;
        for (int player = 0; player < state.players(); player++) {
            for (CopyCountConstraint constraint : state.copyCountConstraints(player)) {
                changed |= state.narrow(player, constraint.position(),
                        state.domain().maskWithCopies(constraint.copyCount()));
            }
            for (AdjacentConstraint constraint : state.adjacentConstraints(player)) {
                long left = state.mask(player, constraint.left());
                long right = state.mask(player, constraint.right());
                if (left == 0 || right == 0) {
                    continue;
                }
                if (constraint.equal()) {
                    long both = left & right;
                    changed |= state.narrow(player, constraint.left(), both);
                    changed |= state.narrow(player, constraint.right(), both);
                } else {
                    int highestRight = Masks.highest(right);
                    changed |= state.narrow(player, constraint.left(),
                            highestRight == 0 ? 0L : Masks.atMost(highestRight - 1));
                    int lowestLeft = Masks.lowest(state.mask(player, constraint.left()));
                    changed |= state.narrow(player, constraint.right(),
                            lowestLeft >= 63 ? 0L : Masks.atLeast(lowestLeft + 1));
                }
            }
        }
        return changed;
    }
}
