package ai.bombbuster.action;

/**
 * A player announced that a value is absent from their hand, or from one slot when
 * {@code position} is given.
 */
public record NotPresentRecord(int player, double value, Integer position) implements ActionRecord {

    public static NotPresentRecord inHand(int player, double value) {
        return new NotPresentRecord(player, value, null);
    }

    @Override
    public int actor() {
        return player;
    }
}
