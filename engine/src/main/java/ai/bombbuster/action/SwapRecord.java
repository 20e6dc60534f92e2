package ai.bombbuster.action;

/**
 * Two players exchanged one wire each.
 * <p>
 * Player 1 gives the wire at {@code initPosition1} to player 2, who inserts it into their sorted
 * hand, and vice versa. A final position is the insertion point in the receiving hand while the
 * given wire still holds its slot, so it ranges over {@code [0, handSize]}; once that slot is
 * closed the received wire sits at {@link #landingPosition1()} / {@link #landingPosition2()}.
 * A received value is only known to the player who received it; for everyone else it is
 * {@code null}.
 */
public record SwapRecord(int player1, int player2,
                         int initPosition1, int initPosition2,
                         int finalPosition1, int finalPosition2,
                         Double receivedValue1, Double receivedValue2) implements ActionRecord {

    @Override
    public int actor() {
        return player1;
    }

    /** Index of player 1's received wire in their finished hand. */
    public int landingPosition1() {
        return landingPosition(initPosition1, finalPosition1);
    }

    /** Index of player 2's received wire in their finished hand. */
    public int landingPosition2() {
        return landingPosition(initPosition2, finalPosition2);
    }

    /**
     * Converts an insertion point counted with the given wire still in place into an index of
     * the finished hand.
     */
    public static int landingPosition(int initPosition, int finalPosition) {
        return finalPosition - 1 >= initPosition ? finalPosition - 1 : finalPosition;
    }
}
