package ai.bombbuster.suggest;

/**
 * Simulated outcome of one call.
 *
 * @param call the simulated call
 * @param successProbability {@code 1 / |candidates|} under uniform belief
 * @param entropyOnSuccess system entropy after the call succeeds
 * @param entropyOnFailure system entropy after the call fails
 * @param expectedEntropy probability-weighted entropy after the call
 * @param informationGain current entropy minus expected entropy
 */
public record CallSuggestion(CallCandidate call, double successProbability, double entropyOnSuccess,
                             double entropyOnFailure, double expectedEntropy, double informationGain) {
}
