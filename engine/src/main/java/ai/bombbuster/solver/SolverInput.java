package ai.bombbuster.solver;

import java.util.List;

/**
 * One global solve: a problem per player (in player order) and the deck they share.
 */
public record SolverInput(List<PlayerProblem> players, ResourceVector deck, int handSize) {

    public SolverInput {
        players = List.copyOf(players);
        if (players.isEmpty()) {
            throw new IllegalArgumentException("At least one player is required");
        }
    }

    /** Whether every wire of the deck is in some hand. */
    public boolean fullyDealt() {
        return deck.total() == players.size() * handSize;
    }
}
