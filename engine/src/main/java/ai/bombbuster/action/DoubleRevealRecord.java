package ai.bombbuster.action;

/**
 * A player revealed the last two copies of a value from their own hand at once.
 */
public record DoubleRevealRecord(int player, double value, int position1, int position2) implements ActionRecord {

    @Override
    public int actor() {
        return player;
    }
}
