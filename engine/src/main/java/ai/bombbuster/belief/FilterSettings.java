package ai.bombbuster.belief;

/**
 * Tuning of the local filter loop.
 *
 * @param maxIterations cap on fixed-point passes before giving up with a warning
 * @param subsetMaxSize largest value combination the subset filter examines; {@code 0} means no cap
 */
public record FilterSettings(int maxIterations, int subsetMaxSize) {
    public static final FilterSettings DEFAULTS = new FilterSettings(100, 0);

    public FilterSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        if (subsetMaxSize < 0) {
            throw new IllegalArgumentException("subsetMaxSize must not be negative, got " + subsetMaxSize);
        }
    }
}
