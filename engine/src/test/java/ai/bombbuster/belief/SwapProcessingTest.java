package ai.bombbuster.belief;

import static org.junit.jupiter.api.Assertions.*;

import ai.bombbuster.action.CopyCountSignalRecord;
import ai.bombbuster.action.SignalRecord;
import ai.bombbuster.action.SwapRecord;
import ai.bombbuster.game.CandidateSet;
import ai.bombbuster.game.CopyCountConstraint;
import ai.bombbuster.unit.helpers.GameSetup;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Wire exchanges between two players.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>remapMovesWireForward</b> - Giving away a low wire and receiving a high one shifts the middle left</li>
 *   <li><b>remapMovesWireBackward</b> - Receiving a low wire shifts the middle right</li>
 *   <li><b>observerSwapPinsReceivedWire</b> - The observer's new hand is pinned and trackers follow both wires</li>
 *   <li><b>thirdPartySwapCarriesKnowledge</b> - A signalled wire keeps its value in the receiving hand</li>
 *   <li><b>swapRemapsSlotConstraints</b> - Constraints on the given wire are dropped, others are re-indexed</li>
 *   <li><b>landingPositionClosesTheGap</b> - Insertion points past the given wire shift down by one</li>
 *   <li><b>receivedWireSortsIntoReceiverHand</b> - A received 3 lands between the receiver's 2 and 4</li>
 *   <li><b>givenWireSortsIntoPartnerHand</b> - The giver sees their own new hand and the partner keeps the given wire's value</li>
 * </ul>
 */
class SwapProcessingTest {

    @Test
    void remapMovesWireForward() {
        int[] expected = {0, 3, 1, 2, 4};
        for (int old = 0; old < expected.length; old++) {
            assertEquals(expected[old], SwapRemap.remap(old, 1, 3), "slot " + old);
        }
    }

    @Test
    void remapMovesWireBackward() {
        int[] expected = {0, 2, 3, 1, 4};
        for (int old = 0; old < expected.length; old++) {
            assertEquals(expected[old], SwapRemap.remap(old, 3, 1), "slot " + old);
        }
        assertEquals(2, SwapRemap.remap(2, 2, 2));
    }

    @Test
    void observerSwapPinsReceivedWire() {
        BeliefState state = GameSetup.newGame("1:2,2:2,3:2,4:2,5:2,6:2").players(2)
                .observer(0, 1, 2, 3, 4, 5, 6)
                .then(new SwapRecord(0, 1, 0, 5, 6, 0, 6.0, null))
                .build();

        double[] mine = {2, 3, 4, 5, 6, 6};
        double[] theirs = {1, 1, 2, 3, 4, 5};
        for (int pos = 0; pos < 6; pos++) {
            assertEquals(mine[pos], state.candidates(0, pos).pinnedValue(), "P0 slot " + pos);
            assertEquals(theirs[pos], state.candidates(1, pos).pinnedValue(), "P1 slot " + pos);
        }
        assertTrue(state.tracker(1).isCertain(1, 0));
        assertTrue(state.tracker(1).isCertain(1, 1));
        assertFalse(state.tracker(1).isCertain(0, 0));
        assertTrue(state.tracker(6).isCertain(0, 4));
        assertTrue(state.tracker(6).isCertain(0, 5));
        assertEquals(List.of(2.0, 3.0, 4.0, 5.0, 6.0), state.playableValues());
        assertTrue(state.isConsistent());
    }

    @Test
    void thirdPartySwapCarriesKnowledge() {
        BeliefState state = GameSetup.newGame("1:3,2:3,3:3,4:3").players(3)
                .observer(0, 1, 2, 3, 4)
                .then(new SignalRecord(1, 1, 0))
                .then(new SwapRecord(1, 2, 0, 3, 4, 0, null, null))
                .build();

        assertEquals(CandidateSet.of(state.getConfig().getDomain(), 1), state.candidates(2, 0));
        assertTrue(state.tracker(1).isCertain(2, 0));
        assertFalse(state.tracker(1).isCertain(1, 0));
        assertEquals(1, state.tracker(1).uncertain());
    }

    @Test
    void swapRemapsSlotConstraints() {
        BeliefState state = GameSetup.newGame("1:3,2:3,3:3,4:3").players(3)
                .observer(0, 1, 2, 3, 4)
                .then(new CopyCountSignalRecord(1, 0, 3))
                .then(new CopyCountSignalRecord(1, 2, 3))
                .then(new SwapRecord(1, 2, 0, 3, 4, 0, null, null))
                .build();

        assertEquals(List.of(new CopyCountConstraint(1, 3)), state.getCopyCountConstraints().get(1));
        assertFalse(state.getCopyCountConstraints().containsKey(2));
    }

    @Test
    void landingPositionClosesTheGap() {
        assertEquals(2, SwapRecord.landingPosition(1, 3));
        assertEquals(1, SwapRecord.landingPosition(1, 2));
        assertEquals(1, SwapRecord.landingPosition(1, 1));
        assertEquals(0, SwapRecord.landingPosition(1, 0));
        assertEquals(4, SwapRecord.landingPosition(0, 5));
    }

    @Test
    void receivedWireSortsIntoReceiverHand() {
        BeliefState state = GameSetup.newGame("1:2,2:2,3:1,4:2,5:3").players(2)
                .observer(1, 1, 2, 2, 4, 5)
                .then(new SwapRecord(0, 1, 1, 1, 2, 3, null, 3.0))
                .build();

        double[] mine = {1, 2, 3, 4, 5};
        for (int pos = 0; pos < mine.length; pos++) {
            assertEquals(mine[pos], state.candidates(1, pos).pinnedValue(), "P1 slot " + pos);
        }
        assertEquals(CandidateSet.of(state.getConfig().getDomain(), 2), state.candidates(0, 1));
        assertTrue(state.tracker(3).isCertain(1, 2));
        assertTrue(state.tracker(2).isCertain(0, 1));
        assertTrue(state.tracker(2).isCertain(1, 1));
        assertTrue(state.isConsistent());
    }

    @Test
    void givenWireSortsIntoPartnerHand() {
        BeliefState state = GameSetup.newGame("1:2,2:2,3:1,4:2,5:3").players(2)
                .observer(0, 1, 3, 4, 5, 5)
                .then(new SwapRecord(0, 1, 1, 1, 2, 3, 2.0, null))
                .build();

        double[] mine = {1, 2, 4, 5, 5};
        for (int pos = 0; pos < mine.length; pos++) {
            assertEquals(mine[pos], state.candidates(0, pos).pinnedValue(), "P0 slot " + pos);
        }
        assertEquals(CandidateSet.of(state.getConfig().getDomain(), 3), state.candidates(1, 2));
        assertTrue(state.tracker(3).isCertain(1, 2));
        assertTrue(state.isConsistent());
    }
}
