package ai.bombbuster.action;

/**
 * A player told the table that the wire at {@code position} has a value of which exactly
 * {@code copyCount} copies exist in the whole game.
 */
public record CopyCountSignalRecord(int player, int position, int copyCount) implements ActionRecord {

    @Override
    public int actor() {
        return player;
    }
}
