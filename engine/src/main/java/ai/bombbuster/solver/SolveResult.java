package ai.bombbuster.solver;

import java.util.List;
import java.util.Set;

/**
 * Outcome of a global solve.
 * <p>
 * When {@link #consistent()} is {@code true}, {@code domains[player][position]} holds the exact
 * set of ranks that occur at that slot in some globally valid deal (already intersected with the
 * input masks), and {@code validSignatures} the per-player signatures that take part in such a
 * deal. On a contradiction both are {@code null} and the caller must leave its grid unchanged.
 */
public record SolveResult(boolean consistent, long[][] domains, List<Set<ResourceVector>> validSignatures) {

    static SolveResult contradiction() {
        return new SolveResult(false, null, null);
    }
}
