package ai.bombbuster.action;

/**
 * A player announced holding at least one copy of a value, position unknown.
 */
public record HasValueRecord(int player, double value) implements ActionRecord {

    @Override
    public int actor() {
        return player;
    }
}
