package ai.bombbuster.solver;

/**
 * The global solver could not produce an answer this round (worker failure, interruption).
 * Callers keep the local deductions and carry on.
 */
public class SolverException extends RuntimeException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
