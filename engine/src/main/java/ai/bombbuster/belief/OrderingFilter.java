package ai.bombbuster.belief;

/**
 * Hands are sorted, so the largest candidate of a slot bounds every slot to its left and the
 * smallest candidate bounds every slot to its right.
 */
class OrderingFilter implements BeliefFilter {

    @Override
    public String name() {
        return "ordering";
    }

    @Override
    public boolean apply(BeliefState state) {
        boolean changed = false;
        int handSize = state.handSize();
        for (int player = 0; player < state.players(); player++) {
            long bound = -1L;
            for (int pos = handSize - 1; pos >= 0; pos--) {
                changed |= state.narrow(player, pos, bound);
                long mask = state.mask(player, pos);
                if (mask != 0) {
                    bound = Masks.atMost(Masks.highest(mask));
                }
            }
            bound = -1L;
            for (int pos = 0; pos < handSize; pos++) {
                changed |= state.narrow(player, pos, bound);
                long mask = state.mask(player, pos);
                if (mask != 0) {
                    bound = Masks.atLeast(Masks.lowest(mask));
                }
            }
        }
        return changed;
    }
}
