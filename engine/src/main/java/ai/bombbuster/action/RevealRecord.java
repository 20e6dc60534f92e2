package ai.bombbuster.action;

/**
 * A wire was turned face up outside a call (for example by a special equipment card).
 */
public record RevealRecord(int player, double value, int position) implements ActionRecord {

    @Override
    public int actor() {
        return player;
    }
}
