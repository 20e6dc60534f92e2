package ai.bombbuster.suggest;

import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.game.CandidateSet;
import ai.bombbuster.game.ValueDomain;
import ai.bombbuster.solver.GlobalConsistencySolver;
import ai.bombbuster.solver.SolverException;
import ai.bombbuster.solver.SolverWorkerPool;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recommends the call that is expected to remove the most uncertainty from the table.
 * <p>
 * For every call the owner could truthfully make (a playable own value, an unrevealed slot of
 * another player whose candidates include the value and number at most {@code maxUncertainty}):
 * <ol>
 *   <li>{@code p = 1 / |candidates|}.</li>
 *   <li>On a copy, pin the slot to the value, propagate, measure entropy {@code H_success}.</li>
 *   <li>On another copy, remove the value, propagate, measure {@code H_failure}.</li>
 *   <li>{@code gain = H_now - (p * H_success + (1 - p) * H_failure)}.</li>
 * </ol>
 * Calls are evaluated independently, so they fan out on the worker pool when one is given. Each
 * task works on its own copy with a sequential solver. Results are collected in evaluation order
 * and sorted stably, which makes the parallel and sequential paths return identical rankings.
 */
public class EntropySuggester {
    private static final Logger log = LoggerFactory.getLogger(EntropySuggester.class);
    public static final int DEFAULT_MAX_UNCERTAINTY = 3;

    private final int maxUncertainty;
    private final SolverWorkerPool pool;

    /**
     * @param maxUncertainty largest candidate set worth simulating
     * @param pool workers for simulations, or {@code null} to run sequentially
     */
    public EntropySuggester(int maxUncertainty, SolverWorkerPool pool) {
        if (maxUncertainty < 1) {
            throw new IllegalArgumentException("maxUncertainty must be positive, got " + maxUncertainty);
        }
        this.maxUncertainty = maxUncertainty;
        this.pool = pool;
    }

    public EntropySuggester() {
        this(DEFAULT_MAX_UNCERTAINTY, null);
    }

    /** Suggests a call, in parallel when a pool is available. The state is not modified. */
    public SuggestionReport suggest(BeliefState state) {
        return pool == null ? suggestSequential(state) : run(state, true);
    }

    /** Suggests a call on the calling thread only. */
    public SuggestionReport suggestSequential(BeliefState state) {
        return run(state, false);
    }

    /** Calls worth simulating, in evaluation order (target, position, value ascending). */
    public List<CallCandidate> candidates(BeliefState state) {
        Objects.requireNonNull(state, "state");
        List<CallCandidate> candidates = new ArrayList<>();
        List<Double> playable = state.playableValues();
        int players = state.getConfig().getPlayers();
        int handSize = state.getConfig().getHandSize();
        for (int target = 0; target < players; target++) {
            if (target == state.getOwner()) {
                continue;
            }
            for (int pos = 0; pos < handSize; pos++) {
                if (state.isRevealed(target, pos)) {
                    continue;
                }
                CandidateSet slot = state.candidates(target, pos);
                if (slot.isEmpty() || slot.size() > maxUncertainty) {
                    continue;
                }
                for (double value : playable) {
                    if (slot.contains(value)) {
                        candidates.add(new CallCandidate(target, pos, value));
                    }
                }
            }
        }
        return candidates;
    }

    /** Simulates both outcomes of one call on copies of {@code state}. */
    public CallSuggestion evaluate(BeliefState state, CallCandidate call, double currentEntropy) {
        GlobalConsistencySolver solver = state.getSolver();
        GlobalConsistencySolver simulationSolver = solver == null ? null : solver.sequential();
        int size = state.candidates(call.target(), call.position()).size();
        double pSuccess = 1.0 / size;

        BeliefState success = state.copyWith(simulationSolver);
        success.assume(call.target(), call.position(), call.value());
        double hSuccess = BeliefStatistics.systemEntropy(success);

        BeliefState failure = state.copyWith(simulationSolver);
        failure.assumeNot(call.target(), call.position(), call.value());
        double hFailure = BeliefStatistics.systemEntropy(failure);

        double expected = pSuccess * hSuccess + (1.0 - pSuccess) * hFailure;
        return new CallSuggestion(call, pSuccess, hSuccess, hFailure, expected, currentEntropy - expected);
    }

    private SuggestionReport run(BeliefState state, boolean parallel) {
        long start = System.nanoTime();
        double currentEntropy = BeliefStatistics.systemEntropy(state);
        List<CallCandidate> candidates = candidates(state);
        List<CallSuggestion> results = parallel
                ? evaluateParallel(state, candidates, currentEntropy)
                : evaluateSequential(state, candidates, currentEntropy);
        List<CallSuggestion> ranked = new ArrayList<>(results);
        ranked.sort(Comparator.comparingDouble(CallSuggestion::informationGain).reversed());
        CallSuggestion best = ranked.isEmpty() ? null : ranked.get(0);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (best != null) {
            log.info("Best call for player {}: P{}[{}] = {} (gain {} bits, p={}, {} candidates, {} ms)",
                    state.getOwner(), best.call().target(), best.call().position(),
                    ValueDomain.format(best.call().value()),
                    String.format("%.3f", best.informationGain()), String.format("%.2f", best.successProbability()),
                    candidates.size(), elapsed.toMillis());
        } else {
            log.info("No call to suggest for player {}", state.getOwner());
        }
        return new SuggestionReport(best, currentEntropy, ranked, candidates.size(), elapsed);
    }

    private List<CallSuggestion> evaluateSequential(BeliefState state, List<CallCandidate> candidates,
                                                    double currentEntropy) {
        List<CallSuggestion> results = new ArrayList<>(candidates.size());
        for (CallCandidate call : candidates) {
            results.add(evaluate(state, call, currentEntropy));
        }
        return results;
    }

    private List<CallSuggestion> evaluateParallel(BeliefState state, List<CallCandidate> candidates,
                                                  double currentEntropy) {
        List<Future<CallSuggestion>> futures = new ArrayList<>(candidates.size());
        for (CallCandidate call : candidates) {
            BeliefState snapshot = state.copy();
            futures.add(pool.submit(() -> evaluate(snapshot, call, currentEntropy)));
        }
        List<CallSuggestion> results = new ArrayList<>(candidates.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.warn("Simulation of {} failed on a worker; re-running it on the calling thread",
                        candidates.get(i), e.getCause());
                results.add(evaluate(state, candidates.get(i), currentEntropy));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (Future<CallSuggestion> future : futures) {
                    future.cancel(true);
                }
                throw new SolverException("Interrupted while waiting for call simulations", e);
            }
        }
        return results;
    }
}
