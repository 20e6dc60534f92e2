package ai.bombbuster.belief;

import ai.bombbuster.game.ValueDomain;

/**
 * Hidden-subset elimination across every slot of every hand.
 * <p>
 * If exactly {@code H} slots can hold any value of a combination {@code S} with {@code |S| = H},
 * and at least {@code H} copies of {@code S} are certainly dealt, those slots hold nothing but
 * values of {@code S}. When the whole deck is dealt the copy condition always holds.
 * <p>
 * Combinations are built depth first in ascending rank order. The number of slots touching a
 * combination only grows as values are added, so a branch stops once it touches more slots than
 * the largest combination examined. {@code subsetMaxSize} caps that size explicitly.
 */
class SubsetCardinalityFilter implements BeliefFilter {
    private final int subsetMaxSize;

    SubsetCardinalityFilter(int subsetMaxSize) {
        this.subsetMaxSize = subsetMaxSize;
    }

    @Override
    public String name() {
        return "subset";
    }

    @Override
    public boolean apply(BeliefState state) {
        int players = state.players();
        int handSize = state.handSize();
        long union = 0L;
        for (int player = 0; player < players; player++) {
            for (int pos = 0; pos < handSize; pos++) {
                union |= state.mask(player, pos);
            }
        }
        int distinct = Long.bitCount(union);
        if (distinct <= 2) {
            return false;
        }
        int maxSize = distinct - 1;
        if (subsetMaxSize > 0) {
            maxSize = Math.min(maxSize, subsetMaxSize);
        }
        if (maxSize < 2) {
            return false;
        }
        Search search = new Search(state, maxSize);
        search.extend(0L, 0, 0, union);
        return search.changed;
    }

    private static final class Search {
        private final BeliefState state;
        private final ValueDomain domain;
        private final int maxSize;
        private final int undealt;
        private boolean changed;

        Search(BeliefState state, int maxSize) {
            this.state = state;
            this.domain = state.domain();
            this.maxSize = maxSize;
            this.undealt = state.config().undealt();
        }

        void extend(long combination, int size, int copies, long remaining) {
            long candidates = remaining;
            while (candidates != 0) {
                int rank = Masks.lowest(candidates);
                candidates &= candidates - 1;
                long next = combination | Masks.bit(rank);
                int nextSize = size + 1;
                int nextCopies = copies + domain.copies(rank);
                int touching = countTouching(next);
                if (touching > maxSize) {
                    continue;
                }
                if (nextSize >= 2 && touching == nextSize && nextCopies - undealt >= nextSize) {
                    restrictTouching(next);
                }
                if (nextSize < maxSize) {
                    extend(next, nextSize, nextCopies, candidates);
                }
            }
        }

        private int countTouching(long combination) {
            int count = 0;
            for (int player = 0; player < state.players(); player++) {
                for (int pos = 0; pos < state.handSize(); pos++) {
                    if ((state.mask(player, pos) & combination) != 0) {
                        count++;
                    }
                }
            }
            return count;
        }

        private void restrictTouching(long combination) {
            for (int player = 0; player < state.players(); player++) {
                for (int pos = 0; pos < state.handSize(); pos++) {
                    if ((state.mask(player, pos) & combination) != 0) {
                        changed |= state.narrow(player, pos, combination);
                    }
                }
            }
        }
    }
}
