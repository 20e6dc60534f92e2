package ai.bombbuster.solver;

/**
 * The shared wall-clock budget of one global solve ran out.
 */
public class SolverTimeoutException extends SolverException {
    private final String phase;

    public SolverTimeoutException(String phase) {
        super("Global solver exceeded its deadline during " + phase);
        this.phase = phase;
    }

    /** Phase that was running when the budget ran out. */
    public String getPhase() {
        return phase;
    }
}
