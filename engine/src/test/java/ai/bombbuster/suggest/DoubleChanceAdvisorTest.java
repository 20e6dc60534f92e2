package ai.bombbuster.suggest;

import static org.junit.jupiter.api.Assertions.*;

import ai.bombbuster.action.SignalRecord;
import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.unit.helpers.GameSetup;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Double-chance odds on a two-player game with two wires left undealt.
 * <p>
 * The observer holds 1 2 4; the other hand is three of {1, 2, 3, 3, 4}, which leaves seven
 * sorted hands. Four of them hold a 2 in one of the first two slots.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>countsHandsExactly</b> - Small hand spaces are enumerated</li>
 *   <li><b>approximatesLargeHandSpaces</b> - Above the cap the slots are treated as independent</li>
 *   <li><b>ranksOpenPairs</b> - Only unrevealed slot pairs that may hold the value are ranked</li>
 *   <li><b>pairsWithOnePinnedSlotAreRanked</b> - A signalled wire still pairs with an open neighbour</li>
 *   <li><b>approximationIsNeverCertain</b> - Independent odds stay below one even next to a pinned hit</li>
 *   <li><b>rejectsSamePosition</b> - A double chance needs two wires</li>
 * </ul>
 */
class DoubleChanceAdvisorTest {

    private static BeliefState state() {
        return GameSetup.newGame("1:2,2:2,3:2,4:2").players(2).handSize(3).observer(0, 1, 2, 4).build();
    }

    @Test
    void countsHandsExactly() {
        DoubleChanceEstimate estimate = new DoubleChanceAdvisor().estimate(state(), 1, 0, 1, 2);

        assertTrue(estimate.exact());
        assertEquals(7, estimate.handsConsidered());
        assertEquals(4.0 / 7.0, estimate.probability(), 1e-9);
        assertFalse(estimate.isCertain());
    }

    @Test
    void approximatesLargeHandSpaces() {
        BeliefState state = state();
        assertEquals(3, state.candidates(1, 0).size());
        assertEquals(2, state.candidates(1, 1).size());

        DoubleChanceEstimate estimate = new DoubleChanceAdvisor(1).estimate(state, 1, 0, 1, 2);

        assertFalse(estimate.exact());
        assertEquals(0, estimate.handsConsidered());
        assertEquals(1.0 / 3 + 1.0 / 2 - 1.0 / 6, estimate.probability(), 1e-9);
    }

    @Test
    void ranksOpenPairs() {
        List<DoubleChanceEstimate> ranked = new DoubleChanceAdvisor().rank(state());

        assertEquals(1, ranked.size());
        DoubleChanceEstimate only = ranked.get(0);
        assertEquals(2.0, only.value());
        assertEquals(0, only.position1());
        assertEquals(1, only.position2());
    }

    /** The other hand is three of {1, 2, 2, 3, 3, 4} with a 2 signalled in the middle. */
    private static BeliefState signalledState() {
        return GameSetup.newGame("1:2,2:3,3:2,4:2").players(2).handSize(3).observer(0, 1, 2, 4)
                .then(new SignalRecord(1, 2, 1))
                .build();
    }

    @Test
    void pairsWithOnePinnedSlotAreRanked() {
        BeliefState state = signalledState();
        assertEquals(1, state.candidates(1, 1).size());

        List<DoubleChanceEstimate> ranked = new DoubleChanceAdvisor().rank(state);

        assertEquals(3, ranked.size());
        assertTrue(ranked.stream().allMatch(estimate -> estimate.value() == 2.0));
        DoubleChanceEstimate best = ranked.get(0);
        assertTrue(best.position1() == 1 || best.position2() == 1);
        assertTrue(best.isCertain());
    }

    @Test
    void approximationIsNeverCertain() {
        DoubleChanceEstimate estimate = new DoubleChanceAdvisor(1).estimate(signalledState(), 1, 0, 1, 2);

        assertFalse(estimate.exact());
        assertTrue(estimate.probability() < 1.0);
        assertFalse(estimate.isCertain());
    }

    @Test
    void rejectsSamePosition() {
        assertThrows(IllegalArgumentException.class, () -> new DoubleChanceAdvisor().estimate(state(), 1, 2, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> new DoubleChanceAdvisor(0));
    }
}
