package ai.bombbuster.suggest;

/**
 * Probability that at least one of two slots of {@code target} holds {@code value}.
 *
 * @param target player pointed at
 * @param position1 first slot
 * @param position2 second slot
 * @param value called value
 * @param probability chance of at least one hit
 * @param exact {@code true} when counted over every valid hand, {@code false} for the
 *              independence approximation {@code p1 + p2 - p1 * p2}, which overstates the chance
 *              whenever the two slots are correlated
 * @param handsConsidered valid hands counted (0 for the approximation)
 */
public record DoubleChanceEstimate(int target, int position1, int position2, double value, double probability,
                                   boolean exact, int handsConsidered) {

    /** Only an exact count can promise a hit. */
    public boolean isCertain() {
        return exact && probability >= 1.0;
    }
}
