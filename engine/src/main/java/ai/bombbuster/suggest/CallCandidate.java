package ai.bombbuster.suggest;

/**
 * A call the observer could make: name {@code value} on {@code target}'s wire at {@code position}.
 */
public record CallCandidate(int target, int position, double value) {
}
