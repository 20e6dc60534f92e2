package ai.bombbuster.belief;

import static org.junit.jupiter.api.Assertions.*;

import ai.bombbuster.game.AdjacentConstraint;
import ai.bombbuster.game.CandidateSet;
import ai.bombbuster.game.CopyCountConstraint;
import ai.bombbuster.game.GameConfig;
import ai.bombbuster.game.ValueDomain;
import ai.bombbuster.game.ValueTracker;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Each local filter applied once to a hand-built grid.
 *
 * <p>Grids are loaded through {@link BeliefState#restore}, which runs no filter, so every test
 * observes exactly one filter's effect.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>orderingBoundsNeighbours</b> - A pinned middle slot caps the left and floors the right</li>
 *   <li><b>distanceKeepsCopiesNearAnchor</b> - Remaining copies of a value sit next to the pinned one</li>
 *   <li><b>distanceWithNoCopiesLeftIsolatesAnchor</b> - An exhausted value stays only at its anchor</li>
 *   <li><b>thresholdCutsByCumulativeCopies</b> - Few high copies keep high values out of early slots and vice versa</li>
 *   <li><b>existenceRemovesExhaustedValue</b> - A value with no copy left for a player leaves the whole hand</li>
 *   <li><b>hiddenPairClaimsItsSlots</b> - Two values confined to two slots push everything else out</li>
 *   <li><b>hiddenPairIgnoredWhenCopiesMayBeUndealt</b> - Undealt wires can absorb the pair</li>
 *   <li><b>subsetCapDisablesSmallCombinations</b> - A cap below 2 turns the filter off</li>
 *   <li><b>adjacentEqualIntersects</b> - Equal neighbours share their candidates</li>
 *   <li><b>adjacentDifferentIsStrict</b> - Different neighbours in a sorted hand strictly increase</li>
 *   <li><b>copyCountNarrowsSlot</b> - Only values with the signalled copy count remain</li>
 * </ul>
 */
class BeliefFiltersTest {

    /**
     * Two-player state; the observer (player 0) has {@code ownHand} pinned and tracked, player 1
     * gets {@code other}.
     */
    private static BeliefState grid(String distribution, int handSize, double[] ownHand, CandidateSet[] other,
                                    List<ValueTracker> extraTrackers) {
        ValueDomain domain = ValueDomain.parse(distribution);
        GameConfig config = new GameConfig(domain, 2, handSize, false);
        List<CandidateSet> own = new ArrayList<>();
        List<ValueTracker> trackers = new ArrayList<>();
        for (int rank = 0; rank < domain.size(); rank++) {
            trackers.add(new ValueTracker(domain.value(rank), domain.copies(rank)));
        }
        for (int pos = 0; pos < handSize; pos++) {
            own.add(CandidateSet.of(domain, ownHand[pos]));
            trackers.get(domain.rankOf(ownHand[pos])).addCertain(0, pos);
        }
        for (ValueTracker extra : extraTrackers) {
            trackers.set(domain.rankOf(extra.getValue()), extra);
        }
        return BeliefState.restore(config, 0, List.of(own, List.of(other)), trackers, Map.of(), Map.of(),
                FilterSettings.DEFAULTS, null);
    }

    private static CandidateSet[] slots(ValueDomain domain, double[]... values) {
        CandidateSet[] sets = new CandidateSet[values.length];
        for (int i = 0; i < values.length; i++) {
            sets[i] = CandidateSet.of(domain, values[i]);
        }
        return sets;
    }

    private static CandidateSet set(BeliefState state, double... values) {
        return CandidateSet.of(state.getConfig().getDomain(), values);
    }

    @Test
    void orderingBoundsNeighbours() {
        ValueDomain domain = ValueDomain.parse("1:4,2:4,3:4,4:4");
        double[] all = {1, 2, 3, 4};
        BeliefState state = grid("1:4,2:4,3:4,4:4", 4, new double[] {1, 2, 3, 4},
                slots(domain, all, new double[] {3}, all, all), List.of());

        assertTrue(new OrderingFilter().apply(state));

        assertEquals(set(state, 1, 2, 3), state.candidates(1, 0));
        assertEquals(set(state, 3), state.candidates(1, 1));
        assertEquals(set(state, 3, 4), state.candidates(1, 2));
        assertEquals(set(state, 3, 4), state.candidates(1, 3));
        assertFalse(new OrderingFilter().apply(state), "second pass finds nothing new");
    }

    @Test
    void distanceKeepsCopiesNearAnchor() {
        String distribution = "1:2,2:2,3:2,4:2,5:2,6:2";
        ValueDomain domain = ValueDomain.parse(distribution);
        double[] all = {1, 2, 3, 4, 5, 6};
        ValueTracker fives = new ValueTracker(5, 2);
        fives.addRevealed(1, 4);
        BeliefState state = grid(distribution, 6, new double[] {1, 2, 3, 4, 6, 6},
                slots(domain, all, all, all, all, new double[] {5}, all), List.of(fives));

        assertTrue(new DistanceFilter().apply(state));

        for (int pos = 0; pos < 3; pos++) {
            assertFalse(state.candidates(1, pos).contains(5), "slot " + pos + " is too far from the anchor");
        }
        assertTrue(state.candidates(1, 3).contains(5));
        assertTrue(state.candidates(1, 5).contains(5));
    }

    @Test
    void distanceWithNoCopiesLeftIsolatesAnchor() {
        String distribution = "1:2,2:2,3:2,4:2,5:2,6:2";
        ValueDomain domain = ValueDomain.parse(distribution);
        double[] all = {1, 2, 3, 4, 5, 6};
        ValueTracker fives = new ValueTracker(5, 2);
        fives.addRevealed(1, 4);
        fives.addCertain(0, 4);
        BeliefState state = grid(distribution, 6, new double[] {1, 2, 3, 4, 5, 6},
                slots(domain, all, all, all, all, new double[] {5}, all), List.of(fives));

        new DistanceFilter().apply(state);

        assertFalse(state.candidates(1, 3).contains(5));
        assertFalse(state.candidates(1, 5).contains(5));
        assertEquals(set(state, 5), state.candidates(1, 4));
    }

    @Test
    void thresholdCutsByCumulativeCopies() {
        String distribution = "1:1,2:1,3:4,4:4";
        ValueDomain domain = ValueDomain.parse(distribution);
        double[] all = {1, 2, 3, 4};
        BeliefState state = grid(distribution, 4, new double[] {3, 3, 4, 4},
                slots(domain, all, all, all, all), List.of());

        assertTrue(new ThresholdFilter().apply(state));

        // Two 4s left: a 4 needs every later slot to be a 4 as well.
        assertEquals(set(state, 1, 2, 3), state.candidates(1, 0));
        assertEquals(set(state, 2, 3), state.candidates(1, 1));
        assertEquals(set(state, 3, 4), state.candidates(1, 2));
        assertEquals(set(state, 3, 4), state.candidates(1, 3));
    }

    @Test
    void existenceRemovesExhaustedValue() {
        String distribution = "1:2,2:2,3:2,4:2";
        ValueDomain domain = ValueDomain.parse(distribution);
        double[] all = {1, 2, 3, 4};
        BeliefState state = grid(distribution, 3, new double[] {1, 1, 2},
                slots(domain, all, all, all), List.of());

        new ThresholdFilter().apply(state);

        for (int pos = 0; pos < 3; pos++) {
            assertFalse(state.candidates(1, pos).contains(1));
        }
    }

    @Test
    void hiddenPairClaimsItsSlots() {
        String distribution = "1:1,2:1,3:1,4:1,5:1,6:1,7:1,8:1";
        ValueDomain domain = ValueDomain.parse(distribution);
        BeliefState state = grid(distribution, 4, new double[] {3, 4, 7, 8},
                slots(domain, new double[] {1, 2, 5}, new double[] {1, 2, 6}, new double[] {5, 6},
                        new double[] {5, 6}), List.of());

        assertTrue(new SubsetCardinalityFilter(0).apply(state));

        assertEquals(set(state, 1, 2), state.candidates(1, 0));
        assertEquals(set(state, 1, 2), state.candidates(1, 1));
        assertEquals(set(state, 5, 6), state.candidates(1, 2));
    }

    @Test
    void hiddenPairIgnoredWhenCopiesMayBeUndealt() {
        String distribution = "1:1,2:1,3:1,4:1,5:1,6:1,7:1,8:1,9:1";
        ValueDomain domain = ValueDomain.parse(distribution);
        BeliefState state = grid(distribution, 4, new double[] {3, 4, 7, 8},
                slots(domain, new double[] {1, 2, 5}, new double[] {1, 2, 6}, new double[] {5, 6, 9},
                        new double[] {5, 6, 9}), List.of());

        assertFalse(new SubsetCardinalityFilter(0).apply(state));
        assertEquals(set(state, 1, 2, 5), state.candidates(1, 0));
    }

    @Test
    void subsetCapDisablesSmallCombinations() {
        String distribution = "1:1,2:1,3:1,4:1,5:1,6:1,7:1,8:1";
        ValueDomain domain = ValueDomain.parse(distribution);
        BeliefState state = grid(distribution, 4, new double[] {3, 4, 7, 8},
                slots(domain, new double[] {1, 2, 5}, new double[] {1, 2, 6}, new double[] {5, 6},
                        new double[] {5, 6}), List.of());

        assertFalse(new SubsetCardinalityFilter(1).apply(state));
        assertTrue(new SubsetCardinalityFilter(2).apply(state));
    }

    @Test
    void adjacentEqualIntersects() {
        String distribution = "1:4,2:4,3:4";
        ValueDomain domain = ValueDomain.parse(distribution);
        BeliefState state = grid(distribution, 2, new double[] {1, 3},
                slots(domain, new double[] {1, 2}, new double[] {2, 3}), List.of());
        state.adjacentConstraints(1).add(new AdjacentConstraint(0, 1, true));

        assertTrue(new SlotConstraintFilter().apply(state));

        assertEquals(set(state, 2), state.candidates(1, 0));
        assertEquals(set(state, 2), state.candidates(1, 1));
    }

    @Test
    void adjacentDifferentIsStrict() {
        String distribution = "1:4,2:4,3:4";
        ValueDomain domain = ValueDomain.parse(distribution);
        BeliefState state = grid(distribution, 2, new double[] {1, 3},
                slots(domain, new double[] {2, 3}, new double[] {2, 3}), List.of());
        state.adjacentConstraints(1).add(new AdjacentConstraint(0, 1, false));

        new SlotConstraintFilter().apply(state);

        assertEquals(set(state, 2), state.candidates(1, 0));
        assertEquals(set(state, 3), state.candidates(1, 1));
    }

    @Test
    void copyCountNarrowsSlot() {
        String distribution = "1:2,2:3,3:2";
        ValueDomain domain = ValueDomain.parse(distribution);
        double[] all = {1, 2, 3};
        BeliefState state = grid(distribution, 2, new double[] {1, 2}, slots(domain, all, all), List.of());
        state.copyCountConstraints(1).add(new CopyCountConstraint(1, 2));

        new SlotConstraintFilter().apply(state);

        assertEquals(set(state, 1, 3), state.candidates(1, 1));
        assertEquals(set(state, 1, 2, 3), state.candidates(1, 0));
    }
}
