package ai.bombbuster.game;

/**
 * Two neighbouring wires of one hand carry equal (or different) values.
 * <p>
 * Positions are normalized so that {@code left + 1 == right}.
 */
public record AdjacentConstraint(int left, int right, boolean equal) {

    public AdjacentConstraint {
        if (left < 0 || right != left + 1) {
            throw new IllegalArgumentException("Adjacent constraint needs neighbouring positions, got "
                    + left + " and " + right);
        }
    }

    /** Builds the constraint from two neighbouring positions in either order. */
    public static AdjacentConstraint between(int position1, int position2, boolean equal) {
        return new AdjacentConstraint(Math.min(position1, position2), Math.max(position1, position2), equal);
    }

    /** Whether a pair of value ranks at {@code (left, right)} satisfies this constraint. */
    public boolean allows(int leftRank, int rightRank) {
        return equal == (leftRank == rightRank);
    }
}
