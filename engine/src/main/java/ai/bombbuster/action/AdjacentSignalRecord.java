package ai.bombbuster.action;

/**
 * A player told the table whether two neighbouring wires carry the same value.
 */
public record AdjacentSignalRecord(int player, int position1, int position2, boolean equal) implements ActionRecord {

    @Override
    public int actor() {
        return player;
    }
}
