package ai.bombbuster.suggest;

import java.time.Duration;
import java.util.List;

/**
 * Result of an entropy-driven suggestion run.
 *
 * @param best highest information gain, or {@code null} when nothing could be called
 * @param currentEntropy system entropy before any call
 * @param ranked every evaluated call, best first (ties keep evaluation order)
 * @param candidatesAnalyzed number of simulated calls
 * @param elapsed wall-clock time spent
 */
public record SuggestionReport(CallSuggestion best, double currentEntropy, List<CallSuggestion> ranked,
                               int candidatesAnalyzed, Duration elapsed) {

    public SuggestionReport {
        ranked = List.copyOf(ranked);
    }

    public boolean hasSuggestion() {
        return best != null;
    }
}
