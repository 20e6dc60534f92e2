package ai.bombbuster.suggest;

import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.game.CandidateSet;
import ai.bombbuster.solver.Deadline;
import ai.bombbuster.solver.PlayerProblem;
import ai.bombbuster.solver.ResourceVector;
import ai.bombbuster.solver.SignatureGenerator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Odds for a "double chance" call, where the caller points at two wires of one player and wins
 * if either holds the value.
 * <p>
 * When the target has at most {@code maxHands} valid hands, every hand counts once and the
 * probability is exact. Beyond that the slots are treated as independent; the result is an
 * approximation that is never reported as certain.
 */
public class DoubleChanceAdvisor {
    private static final Logger log = LoggerFactory.getLogger(DoubleChanceAdvisor.class);
    public static final int DEFAULT_MAX_HANDS = 1_000_000;

    private final int maxHands;

    public DoubleChanceAdvisor(int maxHands) {
        if (maxHands < 1) {
            throw new IllegalArgumentException("maxHands must be positive, got " + maxHands);
        }
        this.maxHands = maxHands;
    }

    public DoubleChanceAdvisor() {
        this(DEFAULT_MAX_HANDS);
    }

    /**
     * Estimates the chance that {@code target} holds {@code value} at {@code position1} or
     * {@code position2}.
     */
    public DoubleChanceEstimate estimate(BeliefState state, int target, int position1, int position2, double value) {
        if (position1 == position2) {
            throw new IllegalArgumentException("Double chance needs two distinct positions");
        }
        int rank = state.getConfig().getDomain().requireRank(value);
        PlayerProblem problem = state.toSolverInput().players().get(target);
        Set<ResourceVector> hands = SignatureGenerator.generate(problem, Deadline.none(), maxHands);
        if (hands.size() > maxHands) {
            if (log.isDebugEnabled()) {
                log.debug("Player {} has more than {} valid hands; approximating double chance", target, maxHands);
            }
            return approximate(state, target, position1, position2, value);
        }
        int hits = 0;
        for (ResourceVector hand : hands) {
            if (rankAt(hand, position1) == rank || rankAt(hand, position2) == rank) {
                hits++;
            }
        }
        double probability = hands.isEmpty() ? 0.0 : (double) hits / hands.size();
        return new DoubleChanceEstimate(target, position1, position2, value, probability, true, hands.size());
    }

    /**
     * Every double-chance call the owner could make on pairs of unrevealed slots that may hold the
     * value, most promising first. A pair is skipped only when both of its slots are pinned.
     */
    public List<DoubleChanceEstimate> rank(BeliefState state) {
        List<DoubleChanceEstimate> estimates = new ArrayList<>();
        int handSize = state.getConfig().getHandSize();
        for (double value : state.playableValues()) {
            for (int target = 0; target < state.getConfig().getPlayers(); target++) {
                if (target == state.getOwner()) {
                    continue;
                }
                for (int first = 0; first < handSize; first++) {
                    if (!isOpen(state, target, first, value)) {
                        continue;
                    }
                    for (int second = first + 1; second < handSize; second++) {
                        if (isOpen(state, target, second, value)
                                && !(isPinned(state, target, first) && isPinned(state, target, second))) {
                            estimates.add(estimate(state, target, first, second, value));
                        }
                    }
                }
            }
        }
        estimates.sort(Comparator.comparingDouble(DoubleChanceEstimate::probability).reversed());
        return estimates;
    }

    private static boolean isOpen(BeliefState state, int target, int position, double value) {
        CandidateSet candidates = state.candidates(target, position);
        return !state.isRevealed(target, position) && candidates.contains(value);
    }

    private static boolean isPinned(BeliefState state, int target, int position) {
        return state.candidates(target, position).size() == 1;
    }

    private static DoubleChanceEstimate approximate(BeliefState state, int target, int position1, int position2,
                                                    double value) {
        double p1 = slotProbability(state.candidates(target, position1), value);
        double p2 = slotProbability(state.candidates(target, position2), value);
        // an independence guess never reaches certainty
        double probability = Math.min(p1 + p2 - p1 * p2, Math.nextDown(1.0));
        return new DoubleChanceEstimate(target, position1, position2, value, probability, false, 0);
    }

    private static double slotProbability(CandidateSet candidates, double value) {
        return candidates.contains(value) ? 1.0 / candidates.size() : 0.0;
    }

    /** Rank at a position of the sorted hand described by {@code hand}. */
    private static int rankAt(ResourceVector hand, int position) {
        int seen = 0;
        for (int rank = 0; rank < hand.length(); rank++) {
            seen += hand.get(rank);
            if (position < seen) {
                return rank;
            }
        }
        return -1;
    }
}
