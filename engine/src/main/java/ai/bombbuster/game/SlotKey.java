package ai.bombbuster.game;

/**
 * One hand slot: a player and a position in that player's sorted hand.
 */
public record SlotKey(int player, int position) implements Comparable<SlotKey> {

    public SlotKey {
        if (player < 0 || position < 0) {
            throw new IllegalArgumentException("Slot coordinates must be non-negative: (" + player + ", " + position + ")");
        }
    }

    @Override
    public int compareTo(SlotKey other) {
        int byPlayer = Integer.compare(player, other.player);
        return byPlayer != 0 ? byPlayer : Integer.compare(position, other.position);
    }

    @Override
    public String toString() {
        return "P" + player + "[" + position + "]";
    }
}
