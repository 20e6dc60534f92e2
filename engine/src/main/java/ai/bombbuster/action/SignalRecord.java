package ai.bombbuster.action;

/**
 * A player told the table which value sits at one of their slots. The slot becomes known but is
 * not publicly revealed.
 */
public record SignalRecord(int player, double value, int position) implements ActionRecord {

    @Override
    public int actor() {
        return player;
    }
}
