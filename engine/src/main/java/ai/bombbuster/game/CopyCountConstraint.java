package ai.bombbuster.game;

/**
 * The wire at {@code position} carries a value with exactly {@code copyCount} copies in the game.
 */
public record CopyCountConstraint(int position, int copyCount) {

    public CopyCountConstraint {
        if (position < 0 || copyCount < 1) {
            throw new IllegalArgumentException("Invalid copy-count constraint at " + position + ": " + copyCount);
        }
    }

    /** Same constraint at another slot. */
    public CopyCountConstraint at(int newPosition) {
        return new CopyCountConstraint(newPosition, copyCount);
    }
}
