package ai.bombbuster.solver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact multiset-consistency check over all hands at once.
 * <p>
 * The local filters reason about one player or one value at a time. This solver answers the
 * global question: which value can sit at each slot in <em>some</em> deal that respects every
 * slot mask, every hand's sortedness and constraints, and the deck's copy counts.
 * <ol>
 *   <li><b>Signatures:</b> every valid hand of each player as a count vector (parallel across
 *       players, cached).</li>
 *   <li><b>Forward pass:</b> {@code Alpha[i]} = count vectors reachable by players {@code 0..i-1}
 *       without exceeding the deck.</li>
 *   <li><b>Backward pass:</b> {@code Beta[i]} = the same for players {@code i..N-1}.</li>
 *   <li><b>Projection:</b> a signature {@code s} of player {@code p} survives iff
 *       {@code deck - s} splits into {@code Alpha[p] + Beta[p+1]}; survivors are expanded back
 *       into sorted hands to rebuild each slot's mask.</li>
 * </ol>
 * When not every wire is dealt, "splits into" relaxes to {@code a + s + b <= deck}.
 * <p>
 * A contradiction is logged and reported through {@link SolveResult#consistent()}; it is never
 * thrown. The shared deadline is checked in every phase and raises {@link SolverTimeoutException}.
 */
public class GlobalConsistencySolver {
    private static final Logger log = LoggerFactory.getLogger(GlobalConsistencySolver.class);

    private final Duration timeout;
    private final SolverWorkerPool pool;
    private final SignatureCache cache;

    /**
     * @param timeout wall-clock budget per solve; zero disables the deadline
     * @param pool workers for signature generation, or {@code null} to run sequentially
     * @param cache signature cache shared with clones
     */
    public GlobalConsistencySolver(Duration timeout, SolverWorkerPool pool, SignatureCache cache) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.pool = pool;
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    /**
     * Same budget and cache, no workers. Used inside simulations that already run on the pool.
     */
    public GlobalConsistencySolver sequential() {
        return pool == null ? this : new GlobalConsistencySolver(timeout, null, cache);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public SignatureCache getCache() {
        return cache;
    }

    public boolean isParallel() {
        return pool != null;
    }

    /**
     * Solves one input under a fresh deadline.
     *
     * @throws SolverTimeoutException if the budget runs out
     * @throws SolverException if a worker fails
     */
    public SolveResult solve(SolverInput input) {
        return solve(input, Deadline.after(timeout));
    }

    /**
     * Solves one input under the given deadline.
     *
     * @throws SolverTimeoutException if the budget runs out
     * @throws SolverException if a worker fails
     */
    public SolveResult solve(SolverInput input, Deadline deadline) {
        Objects.requireNonNull(input, "input");
        long start = System.nanoTime();
        List<PlayerProblem> problems = input.players();
        int n = problems.size();

        List<Set<ResourceVector>> signatures = generateSignatures(problems, deadline);
        for (int p = 0; p < n; p++) {
            if (signatures.get(p).isEmpty()) {
                log.warn("Global contradiction: player {} has no valid hand", problems.get(p).player());
                return SolveResult.contradiction();
            }
        }

        ResourceVector deck = input.deck();
        List<Set<ResourceVector>> alpha = forwardPass(signatures, deck, deadline);
        Set<ResourceVector> reached = alpha.get(n);
        boolean fullyDealt = input.fullyDealt();
        if (fullyDealt ? !reached.contains(deck) : reached.isEmpty()) {
            log.warn("Global contradiction: the deck {} cannot be split into valid hands", deck);
            return SolveResult.contradiction();
        }
        List<Set<ResourceVector>> beta = backwardPass(signatures, deck, deadline);

        long[][] domains = new long[n][input.handSize()];
        List<Set<ResourceVector>> valid = new ArrayList<>(n);
        for (int p = 0; p < n; p++) {
            deadline.check("projection");
            Set<ResourceVector> survivors = new HashSet<>();
            for (ResourceVector signature : signatures.get(p)) {
                boolean splits = fullyDealt
                        ? splitsExactly(deck, signature, alpha.get(p), beta.get(p + 1))
                        : fitsSomewhere(deck, signature, alpha.get(p), beta.get(p + 1), deadline);
                if (splits) {
                    survivors.add(signature);
                    expandInto(signature, domains[p]);
                }
            }
            if (survivors.isEmpty()) {
                log.warn("Global contradiction: no signature of player {} completes a deal", problems.get(p).player());
                return SolveResult.contradiction();
            }
            PlayerProblem problem = problems.get(p);
            for (int pos = 0; pos < domains[p].length; pos++) {
                domains[p][pos] &= problem.slotMask(pos);
                if (domains[p][pos] == 0L) {
                    log.error("Projection emptied slot {} of player {}; discarding global result", pos,
                            problem.player());
                    return SolveResult.contradiction();
                }
            }
            valid.add(survivors);
        }

        if (log.isDebugEnabled()) {
            int[] counts = new int[n];
            for (int p = 0; p < n; p++) {
                counts[p] = valid.get(p).size();
            }
            log.debug("Global solve finished in {} ms; valid signatures per player {}",
                    (System.nanoTime() - start) / 1_000_000L, Arrays.toString(counts));
        }
        return new SolveResult(true, domains, valid);
    }

    private List<Set<ResourceVector>> generateSignatures(List<PlayerProblem> problems, Deadline deadline) {
        List<Set<ResourceVector>> result = new ArrayList<>(problems.size());
        if (pool == null || problems.size() < 2) {
            for (PlayerProblem problem : problems) {
                result.add(signaturesFor(problem, deadline));
            }
            return result;
        }
        List<Future<Set<ResourceVector>>> futures = new ArrayList<>(problems.size());
        for (PlayerProblem problem : problems) {
            futures.add(pool.submit(() -> signaturesFor(problem, deadline)));
        }
        try {
            for (Future<Set<ResourceVector>> future : futures) {
                long remaining = deadline.remainingMillis();
                result.add(deadline.isUnbounded() ? future.get() : future.get(remaining, TimeUnit.MILLISECONDS));
            }
            return result;
        } catch (TimeoutException e) {
            throw new SolverTimeoutException("signature generation");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SolverException solverException) {
                throw solverException;
            }
            throw new SolverException("Signature worker failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("Interrupted while waiting for signature workers", e);
        } finally {
            for (Future<Set<ResourceVector>> future : futures) {
                future.cancel(true);
            }
        }
    }

    private Set<ResourceVector> signaturesFor(PlayerProblem problem, Deadline deadline) {
        Set<ResourceVector> cached = cache.get(problem);
        if (cached != null) {
            return cached;
        }
        Set<ResourceVector> generated = SignatureGenerator.generate(problem, deadline);
        cache.put(problem, generated);
        if (log.isTraceEnabled()) {
            log.trace("Player {} has {} signatures", problem.player(), generated.size());
        }
        return generated;
    }

    private static List<Set<ResourceVector>> forwardPass(List<Set<ResourceVector>> signatures, ResourceVector deck,
                                                         Deadline deadline) {
        int n = signatures.size();
        List<Set<ResourceVector>> alpha = new ArrayList<>(n + 1);
        alpha.add(Set.of(ResourceVector.zero(deck.length())));
        for (int i = 0; i < n; i++) {
            alpha.add(extend(alpha.get(i), signatures.get(i), deck, deadline, "forward pass"));
        }
        return alpha;
    }

    private static List<Set<ResourceVector>> backwardPass(List<Set<ResourceVector>> signatures, ResourceVector deck,
                                                          Deadline deadline) {
        int n = signatures.size();
        List<Set<ResourceVector>> beta = new ArrayList<>(n + 1);
        for (int i = 0; i <= n; i++) {
            beta.add(null);
        }
        beta.set(n, Set.of(ResourceVector.zero(deck.length())));
        for (int i = n - 1; i >= 0; i--) {
            beta.set(i, extend(beta.get(i + 1), signatures.get(i), deck, deadline, "backward pass"));
        }
        return beta;
    }

    private static Set<ResourceVector> extend(Set<ResourceVector> partials, Set<ResourceVector> signatures,
                                              ResourceVector deck, Deadline deadline, String phase) {
        Set<ResourceVector> next = new HashSet<>();
        for (ResourceVector partial : partials) {
            deadline.check(phase);
            for (ResourceVector signature : signatures) {
                ResourceVector sum = partial.plusWithin(signature, deck);
                if (sum != null) {
                    next.add(sum);
                }
            }
        }
        return next;
    }

    private static boolean splitsExactly(ResourceVector deck, ResourceVector signature,
                                         Set<ResourceVector> before, Set<ResourceVector> after) {
        ResourceVector remainder = deck.minus(signature);
        if (remainder == null) {
            return false;
        }
        Set<ResourceVector> smaller = before.size() <= after.size() ? before : after;
        Set<ResourceVector> larger = smaller == before ? after : before;
        for (ResourceVector part : smaller) {
            ResourceVector rest = remainder.minus(part);
            if (rest != null && larger.contains(rest)) {
                return true;
            }
        }
        return false;
    }

    private static boolean fitsSomewhere(ResourceVector deck, ResourceVector signature,
                                         Set<ResourceVector> before, Set<ResourceVector> after, Deadline deadline) {
        for (ResourceVector part : before) {
            ResourceVector withSignature = part.plusWithin(signature, deck);
            if (withSignature == null) {
                continue;
            }
            deadline.check("projection");
            for (ResourceVector rest : after) {
                if (withSignature.plusWithin(rest, deck) != null) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Sorted hands fill each rank's copies into consecutive slots. */
    private static void expandInto(ResourceVector signature, long[] slotMasks) {
        int position = 0;
        for (int rank = 0; rank < signature.length(); rank++) {
            for (int copy = 0; copy < signature.get(rank); copy++) {
                slotMasks[position++] |= 1L << rank;
            }
        }
    }
}
