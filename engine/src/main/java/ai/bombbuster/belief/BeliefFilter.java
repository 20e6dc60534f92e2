package ai.bombbuster.belief;

/**
 * One local deduction rule. Filters only ever narrow candidate sets, never empty one, and report
 * whether they changed anything so the caller can iterate to a fixed point.
 */
interface BeliefFilter {

    /** Short name used in debug logs. */
    String name();

    /** Applies the rule once; returns {@code true} if any candidate set shrank. */
    boolean apply(BeliefState state);
}
