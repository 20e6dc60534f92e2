package ai.bombbuster.suggest;

import ai.bombbuster.belief.BeliefState;
import ai.bombbuster.game.CandidateSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only measurements of a belief state: Shannon entropy, per-player progress and the calls
 * that are currently available.
 * <p>
 * Entropy treats every candidate of a slot as equally likely, so a slot with {@code n}
 * candidates contributes {@code log2(n)} bits. Pinned slots contribute nothing.
 */
public final class BeliefStatistics {

    private BeliefStatistics() {
    }

    /**
     * Per-player progress.
     *
     * @param player player id
     * @param certain pinned slots
     * @param uncertain slots with several candidates
     * @param averagePossibilities mean candidate count over all slots
     * @param progressPercent share of pinned slots, 0-100
     * @param entropy bits of uncertainty left in the hand
     */
    public record PlayerSummary(int player, int certain, int uncertain, double averagePossibilities,
                                double progressPercent, double entropy) {
    }

    /**
     * Whole-table progress.
     *
     * @param players one summary per player
     * @param totalEntropy sum of all slot entropies
     * @param normalizedEntropy total entropy divided by the entropy of a fully unknown table
     * @param mostUncertainPlayer player with the highest entropy other than the owner, or {@code -1}
     */
    public record SystemSummary(List<PlayerSummary> players, double totalEntropy, double normalizedEntropy,
                                int mostUncertainPlayer) {
    }

    /**
     * A call the owner can make right now.
     *
     * @param call target slot and value
     * @param candidateCount size of the target slot's candidate set
     * @param probability success chance under uniform belief
     */
    public record CallOption(CallCandidate call, int candidateCount, double probability) {

        public boolean isCertain() {
            return candidateCount == 1;
        }
    }

    /** Calls split into sure hits and guesses (guesses sorted by increasing uncertainty). */
    public record CallOptions(List<CallOption> certain, List<CallOption> uncertain) {
    }

    public static double slotEntropy(CandidateSet candidates) {
        int size = candidates.size();
        return size > 1 ? log2(size) : 0.0;
    }

    public static double playerEntropy(BeliefState state, int player) {
        double entropy = 0.0;
        for (CandidateSet candidates : state.hand(player)) {
            entropy += slotEntropy(candidates);
        }
        return entropy;
    }

    /** Sum of slot entropies over every hand. */
    public static double systemEntropy(BeliefState state) {
        double entropy = 0.0;
        for (int player = 0; player < state.getConfig().getPlayers(); player++) {
            entropy += playerEntropy(state, player);
        }
        return entropy;
    }

    public static PlayerSummary summarize(BeliefState state, int player) {
        List<CandidateSet> hand = state.hand(player);
        int certain = 0;
        int total = 0;
        for (CandidateSet candidates : hand) {
            if (candidates.isPinned()) {
                certain++;
            }
            total += candidates.size();
        }
        int handSize = hand.size();
        return new PlayerSummary(player, certain, handSize - certain, (double) total / handSize,
                100.0 * certain / handSize, playerEntropy(state, player));
    }

    public static SystemSummary summarize(BeliefState state) {
        int players = state.getConfig().getPlayers();
        List<PlayerSummary> summaries = new ArrayList<>(players);
        double totalEntropy = 0.0;
        int mostUncertain = -1;
        double highest = 0.0;
        for (int player = 0; player < players; player++) {
            PlayerSummary summary = summarize(state, player);
            summaries.add(summary);
            totalEntropy += summary.entropy();
            if (player != state.getOwner() && summary.entropy() > highest) {
                highest = summary.entropy();
                mostUncertain = player;
            }
        }
        int unknownSlots = (players - 1) * state.getConfig().getHandSize();
        double maxEntropy = unknownSlots * log2(state.getConfig().getDomain().size());
        double normalized = maxEntropy > 0 ? totalEntropy / maxEntropy : 0.0;
        return new SystemSummary(summaries, totalEntropy, normalized, mostUncertain);
    }

    /**
     * Every call the owner can make: one option per unrevealed slot of another player and playable
     * value in that slot's candidates.
     */
    public static CallOptions callOptions(BeliefState state) {
        List<CallOption> certain = new ArrayList<>();
        List<CallOption> uncertain = new ArrayList<>();
        List<Double> playable = state.playableValues();
        for (int target = 0; target < state.getConfig().getPlayers(); target++) {
            if (target == state.getOwner()) {
                continue;
            }
            for (int pos = 0; pos < state.getConfig().getHandSize(); pos++) {
                if (state.isRevealed(target, pos)) {
                    continue;
                }
                CandidateSet candidates = state.candidates(target, pos);
                for (double value : playable) {
                    if (!candidates.contains(value)) {
                        continue;
                    }
                    CallOption option = new CallOption(new CallCandidate(target, pos, value), candidates.size(),
                            1.0 / candidates.size());
                    if (option.isCertain()) {
                        certain.add(option);
                    } else {
                        uncertain.add(option);
                    }
                }
            }
        }
        uncertain.sort(Comparator.comparingInt(CallOption::candidateCount));
        return new CallOptions(certain, uncertain);
    }

    static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }
}
